package works.lookup;

import org.jetbrains.annotations.Nullable;

/**
 * Identifies a lookup dataset as a caller sees it, independent of where it physically lives.
 *
 * @param name the lookup file or collection name
 * @param namespace the application context the request comes from; blank means the hosting application
 * @param owner the user context; blank, whitespace or {@value OwnerScope#NOBODY} mean the global scope
 * @param version a backup version to address instead of the live lookup, or null
 */
public record LookupReference(
	String name,
	String namespace,
	String owner,
	@Nullable String version
) {
	public static LookupReference of(String name, String namespace, String owner) {
		return new LookupReference(name, namespace, owner, null);
	}

	public LookupReference withVersion(String version) {
		return new LookupReference(name, namespace, owner, version);
	}

	public boolean isVersioned() {
		return isVersion(version);
	}

	/**
	 * Whether {@code version} still names something once sanitized.
	 */
	public static boolean isVersion(@Nullable String version) {
		return version != null && !PathSanitizer.sanitize(version).isBlank();
	}
}
