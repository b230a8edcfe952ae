package works.lookup;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lookup.backup.BackupStore;
import works.lookup.exceptions.InvalidInputException;
import works.lookup.exceptions.NotFoundException;
import works.lookup.logging.MdcScope;
import works.lookup.storage.LookupStorage;

/**
 * Reads and saves CSV lookup files, taking a backup before every overwrite
 * so that each change can be undone.
 */
public class LookupFileEditor {
	private final LookupResolver resolver;
	private final BackupStore backupStore;
	private final LookupStorage storage;

	public LookupFileEditor(LookupResolver resolver, BackupStore backupStore, LookupStorage storage) {
		this.resolver = resolver;
		this.backupStore = backupStore;
		this.storage = storage;
	}

	/**
	 * Reads the live lookup, or the backup named by {@link LookupReference#version()}.
	 *
	 * @throws NotFoundException if the lookup or the backup doesn't exist
	 */
	public byte[] read(LookupReference reference, Session session) throws IOException {
		Path file = resolver.resolve(reference, session);
		try {
			return storage.read(file);
		} catch (NoSuchFileException e) {
			throw new NotFoundException("No content for lookup " + reference, e);
		}
	}

	/**
	 * Replaces the content of a lookup.
	 * <p>
	 * An existing lookup is backed up first, at the location it resolved to.
	 * A lookup the Metadata Service doesn't know about is new, and is created
	 * at {@link LookupPaths#lookupFile} for the requested namespace and owner.
	 *
	 * @return the version of the backup taken of the previous content, if there was any
	 * @throws InvalidInputException if {@code reference} names a backup version
	 * @throws NotFoundException if nothing is left of the name after sanitizing
	 */
	public Optional<String> save(LookupReference reference, byte[] content, Session session) throws IOException {
		if (reference.isVersioned()) {
			throw new InvalidInputException("Backups can't be modified; remove the version to save lookup \"" + reference.name() + "\"");
		}
		String name = reference.name();
		LookupPaths.fileName(name);
		String namespace = reference.namespace();
		String owner = reference.owner();
		try (var __ = MdcScope.forLookup(PathSanitizer.sanitize(name), resolver.paths().namespaceOrDefault(namespace), OwnerScope.normalize(owner))) {
			ResolvedLocation location;
			try {
				location = resolver.resolveLocation(name, namespace, owner, session);
			} catch (NotFoundException e) {
				Path file = resolver.paths().lookupFile(name, namespace, owner);
				LOGGER.debug("Lookup is not known to the metadata service; creating it", e);
				storage.write(file, content);
				LOGGER.info("Created lookup {}", file);
				return Optional.empty();
			}

			Optional<String> backupVersion = Optional.empty();
			if (storage.exists(location.physicalPath())) {
				byte[] previous = storage.read(location.physicalPath());
				backupVersion = Optional.of(backupStore.createBackup(name, namespace, owner, previous, location, session));
			}
			storage.write(location.physicalPath(), content);
			LOGGER.info("Saved lookup {} (backup {})", location.physicalPath(), backupVersion.orElse("none"));
			return backupVersion;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LookupFileEditor.class);
}
