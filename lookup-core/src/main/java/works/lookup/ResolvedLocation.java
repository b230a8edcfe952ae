package works.lookup;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Where a lookup actually lives after the sharing rules have been applied.
 * The owning namespace can differ from the one that was requested:
 * a lookup asked for from {@code search} may belong to an app that {@code search} can see.
 *
 * @param physicalPath the lookup file
 * @param owningNamespace the application that owns it
 * @param owningOwner the owning user, or {@value OwnerScope#NOBODY} for a global lookup
 */
public record ResolvedLocation(
	Path physicalPath,
	String owningNamespace,
	String owningOwner
) {
	public ResolvedLocation {
		requireNonNull(physicalPath);
		requireNonNull(owningNamespace);
		owningOwner = OwnerScope.normalize(owningOwner);
	}

	public boolean isGlobal() {
		return OwnerScope.NOBODY.equals(owningOwner);
	}
}
