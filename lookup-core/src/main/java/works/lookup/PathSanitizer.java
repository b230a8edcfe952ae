package works.lookup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns untrusted names, namespaces and owners into strings that are safe
 * to use as a single path segment.
 * <p>
 * Sanitizing never fails. Parent-directory traversal ({@code ..}) and
 * current-directory ({@code .}) components are dropped along with their separators,
 * so {@code "../test.csv"} becomes {@code "test.csv"}. Any other components that
 * were separated by {@code /} or {@code \} are joined with {@code _} so the result
 * stays one segment. Everything else is left as it was, including
 * {@code ..} appearing inside a component (as in {@code "a..b"}).
 * An input that consists only of traversal yields the empty string.
 * Namespaces and owners then fall back to their defaults, while a lookup name
 * is rejected by {@link LookupPaths#fileName}.
 */
public final class PathSanitizer {
	private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");

	private PathSanitizer() { }

	public static String sanitize(String segment) {
		if (segment == null) {
			return "";
		}
		String withoutNul = segment.replace("\u0000", "");
		List<String> kept = new ArrayList<>();
		for (String component : SEPARATORS.split(withoutNul, -1)) {
			if (component.isEmpty() || component.equals(".") || component.equals("..")) {
				continue;
			}
			kept.add(component);
		}
		return String.join("_", kept);
	}
}
