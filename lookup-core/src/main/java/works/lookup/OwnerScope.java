package works.lookup;

/**
 * The one place where owner strings are normalized.
 * <p>
 * A blank owner, a whitespace-only owner, and the literal {@value #NOBODY}
 * all mean the global scope, which is spelled {@value #NOBODY} from here on.
 * Every component that accepts an owner goes through {@link #normalize}
 * so that resolution and backup addressing can't disagree.
 */
public final class OwnerScope {
	public static final String NOBODY = "nobody";

	private OwnerScope() { }

	/**
	 * @return {@value #NOBODY} for the global scope; otherwise the sanitized, trimmed owner.
	 */
	public static String normalize(String owner) {
		String sanitized = PathSanitizer.sanitize(owner).strip();
		if (sanitized.isEmpty() || sanitized.equals(NOBODY)) {
			return NOBODY;
		}
		return sanitized;
	}

	public static boolean isGlobal(String owner) {
		return NOBODY.equals(normalize(owner));
	}
}
