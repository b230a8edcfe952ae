package works.lookup.backup;

import org.jetbrains.annotations.Nullable;

/**
 * Mints backup version identifiers.
 */
public interface VersionGenerator {
	/**
	 * @param latest the greatest existing version for the lookup, by {@link VersionOrder}, or null if there are none
	 * @return a version that {@link VersionOrder} places after {@code latest}
	 */
	String next(@Nullable String latest);
}
