package works.lookup;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lookup.exceptions.NotFoundException;
import works.lookup.logging.MdcScope;
import works.lookup.metadata.MetadataOwnerResolver;
import works.lookup.metadata.MetadataService;
import works.lookup.metadata.ObjectOwner;
import works.lookup.metadata.OwnerResolver;

/**
 * Maps a {@link LookupReference} onto the file that holds it.
 * <p>
 * Inputs are sanitized and defaulted first: a blank namespace means the hosting app,
 * and a blank, whitespace-only or {@value OwnerScope#NOBODY} owner means the global scope.
 * The {@link OwnerResolver} then decides which application and user actually own the lookup,
 * and the path is built from <em>those</em>, not from the requested ones.
 * <p>
 * Nothing is cached; each call consults the resolver again.
 * Failures from the resolver propagate unchanged.
 */
public class LookupResolver {
	private final LookupPaths paths;
	private final OwnerResolver ownerResolver;

	public LookupResolver(LookupPaths paths, OwnerResolver ownerResolver) {
		this.paths = paths;
		this.ownerResolver = ownerResolver;
	}

	public static LookupResolver of(LookupEditorConfig config, MetadataService metadataService) {
		return new LookupResolver(new LookupPaths(config), new MetadataOwnerResolver(metadataService));
	}

	/**
	 * Determines the owning scope and the live file of a lookup.
	 *
	 * @throws NotFoundException if no visible lookup has that name
	 */
	public ResolvedLocation resolveLocation(String name, String namespace, String owner, Session session) {
		String cleanName = LookupPaths.fileName(name);
		String contextApp = paths.namespaceOrDefault(namespace);
		String contextUser = OwnerScope.normalize(owner);
		try (var __ = MdcScope.forLookup(cleanName, contextApp, contextUser)) {
			ObjectOwner objectOwner = ownerResolver.resolveOwner(cleanName, contextApp, contextUser, session);
			String owningApp = paths.namespaceOrDefault(objectOwner.namespace());
			Path file = paths.lookupFile(cleanName, owningApp, objectOwner.owner());
			LOGGER.debug("Resolved lookup \"{}\" to {}", cleanName, file);
			return new ResolvedLocation(file, owningApp, objectOwner.owner());
		}
	}

	/**
	 * Resolves a lookup to a physical path.
	 * <p>
	 * With a non-blank {@code version}, the path is redirected into the backup hierarchy:
	 * {@code <lookups dir>/lookup_file_backups/<requested namespace>/<resolved owner>/<name>/<version>}.
	 * With {@code wantBackupRoot} and no version, the result is the backup directory itself.
	 * Otherwise it's the live lookup file.
	 */
	public Path resolve(String name, String namespace, String owner, boolean wantBackupRoot, @Nullable String version, Session session) {
		ResolvedLocation location = resolveLocation(name, namespace, owner, session);
		boolean versioned = LookupReference.isVersion(version);
		if (!versioned && !wantBackupRoot) {
			return location.physicalPath();
		}
		Path backupDirectory = backupDirectory(location, name, namespace);
		if (versioned) {
			return backupDirectory.resolve(PathSanitizer.sanitize(version));
		} else {
			return backupDirectory;
		}
	}

	public Path resolve(LookupReference reference, Session session) {
		return resolve(reference.name(), reference.namespace(), reference.owner(), false, reference.version(), session);
	}

	/**
	 * The backup directory for a lookup that has already been resolved.
	 * Makes no metadata calls.
	 */
	public Path backupDirectory(ResolvedLocation location, String name, String requestedNamespace) {
		return paths.backupDirectory(location.physicalPath(), requestedNamespace, location.owningOwner(), name);
	}

	public LookupPaths paths() {
		return paths;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LookupResolver.class);
}
