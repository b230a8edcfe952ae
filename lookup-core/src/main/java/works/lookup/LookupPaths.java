package works.lookup;

import java.nio.file.Path;
import works.lookup.exceptions.NotFoundException;

/**
 * Builds physical paths from already-decided coordinates.
 * No metadata is consulted here; see {@link LookupResolver} for that.
 */
public final class LookupPaths {
	public static final String APPS = "apps";
	public static final String USERS = "users";
	public static final String LOOKUPS = "lookups";
	public static final String BACKUPS = "lookup_file_backups";

	private final Path etcDirectory;
	private final String hostingApp;

	public LookupPaths(LookupEditorConfig config) {
		config.validate();
		this.etcDirectory = config.etcDirectory();
		this.hostingApp = PathSanitizer.sanitize(config.hostingApp());
	}

	/**
	 * The sanitized namespace, or the hosting app if it comes out blank.
	 */
	public String namespaceOrDefault(String namespace) {
		String sanitized = PathSanitizer.sanitize(namespace).strip();
		return sanitized.isEmpty() ? hostingApp : sanitized;
	}

	/**
	 * The lookups directory of an application, either the shared one or a user's private one.
	 */
	public Path lookupsDirectory(String namespace, String owner) {
		String app = namespaceOrDefault(namespace);
		String user = OwnerScope.normalize(owner);
		if (OwnerScope.NOBODY.equals(user)) {
			return etcDirectory.resolve(APPS).resolve(app).resolve(LOOKUPS);
		} else {
			return etcDirectory.resolve(USERS).resolve(user).resolve(app).resolve(LOOKUPS);
		}
	}

	/**
	 * Where a lookup with these coordinates would live if it were created from scratch.
	 */
	public Path lookupFile(String name, String namespace, String owner) {
		return lookupsDirectory(namespace, owner).resolve(fileName(name));
	}

	/**
	 * The backups of a lookup sit next to the lookup itself, keyed by the namespace
	 * the backup was requested from and the owner it resolved to.
	 */
	public Path backupDirectory(Path resolvedLookupFile, String requestedNamespace, String resolvedOwner, String name) {
		Path lookupsDir = resolvedLookupFile.getParent();
		if (lookupsDir == null) {
			throw new IllegalArgumentException("Resolved lookup path has no parent: " + resolvedLookupFile);
		}
		return lookupsDir
			.resolve(BACKUPS)
			.resolve(namespaceOrDefault(requestedNamespace))
			.resolve(OwnerScope.normalize(resolvedOwner))
			.resolve(fileName(name));
	}

	/**
	 * The sanitized file name of a lookup.
	 *
	 * @throws NotFoundException if nothing is left of the name after sanitizing
	 */
	public static String fileName(String name) {
		String sanitized = PathSanitizer.sanitize(name);
		if (sanitized.isBlank()) {
			throw new NotFoundException("No lookup named \"" + name + "\"");
		}
		return sanitized;
	}

	public Path etcDirectory() {
		return etcDirectory;
	}

	public String hostingApp() {
		return hostingApp;
	}
}
