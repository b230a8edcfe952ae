package works.lookup.backup;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lookup.LookupEditorConfig;
import works.lookup.LookupResolver;
import works.lookup.PathSanitizer;
import works.lookup.ResolvedLocation;
import works.lookup.Session;
import works.lookup.exceptions.ConflictException;
import works.lookup.exceptions.NotFoundException;
import works.lookup.logging.MdcScope;
import works.lookup.storage.LookupStorage;

/**
 * Creates, lists and retrieves point-in-time snapshots of lookup files.
 * <p>
 * The backup directory of a lookup is a pure function of its resolved location
 * and the requested (name, namespace) pair, so repeated calls with the same inputs
 * and unchanged metadata address the same directory.
 * <p>
 * This class holds no locks. Concurrent {@link #createBackup} calls for the same lookup
 * rely on {@link LookupStorage#create} refusing to overwrite, and on the retry that follows.
 * Each method may block on the Metadata Service when it has to resolve the lookup first.
 */
public class BackupStore {
	private final LookupResolver resolver;
	private final LookupStorage storage;
	private final VersionGenerator versionGenerator;
	private final int maxBackups;
	private final int createAttempts;

	public BackupStore(LookupResolver resolver, LookupStorage storage, VersionGenerator versionGenerator, LookupEditorConfig config) {
		config.validate();
		this.resolver = resolver;
		this.storage = storage;
		this.versionGenerator = versionGenerator;
		this.maxBackups = config.maxBackups();
		this.createAttempts = config.backupCreateAttempts();
	}

	public static BackupStore of(LookupResolver resolver, LookupStorage storage, LookupEditorConfig config) {
		return new BackupStore(resolver, storage, new TimestampVersionGenerator(config.clock()), config);
	}

	/**
	 * @param resolved the lookup's location if the caller has already resolved it,
	 *                 in which case the Metadata Service isn't consulted again
	 * @return the directory holding the backups of the given lookup
	 */
	public Path backupDirectory(String name, String namespace, String owner, @Nullable ResolvedLocation resolved, Session session) {
		ResolvedLocation location = (resolved == null)
			? resolver.resolveLocation(name, namespace, owner, session)
			: resolved;
		return resolver.backupDirectory(location, name, namespace);
	}

	/**
	 * @return the backups of the given lookup, oldest first
	 */
	public List<BackupEntry> listBackups(String name, String namespace, String owner, Session session) throws IOException {
		ResolvedLocation location = resolver.resolveLocation(name, namespace, owner, session);
		return listBackups(location, resolver.backupDirectory(location, name, namespace));
	}

	/**
	 * @return the version identifiers of the given lookup's backups, oldest first
	 */
	public List<String> listVersions(String name, String namespace, String owner, Session session) throws IOException {
		List<String> result = new ArrayList<>();
		for (BackupEntry entry : listBackups(name, namespace, owner, session)) {
			result.add(entry.version());
		}
		return result;
	}

	public String createBackup(String name, String namespace, String owner, byte[] content, Session session) throws IOException {
		return createBackup(name, namespace, owner, content, null, session);
	}

	/**
	 * Stores {@code content} as a new backup under a version that sorts after every existing one.
	 * <p>
	 * If the minted version is taken by the time it's written,
	 * another is minted, up to the configured number of attempts.
	 *
	 * @param resolved as for {@link #backupDirectory}
	 * @return the new version
	 * @throws ConflictException if every attempt collided
	 */
	public String createBackup(String name, String namespace, String owner, byte[] content, @Nullable ResolvedLocation resolved, Session session) throws IOException {
		ResolvedLocation location = (resolved == null)
			? resolver.resolveLocation(name, namespace, owner, session)
			: resolved;
		Path directory = resolver.backupDirectory(location, name, namespace);
		try (var __ = MdcScope.forLookup(PathSanitizer.sanitize(name), location.owningNamespace(), location.owningOwner())) {
			List<BackupEntry> existing = listBackups(location, directory);
			String latest = existing.isEmpty() ? null : existing.get(existing.size() - 1).version();
			for (int attempt = 1; attempt <= createAttempts; attempt++) {
				String version = versionGenerator.next(latest);
				try {
					storage.create(directory.resolve(version), content);
				} catch (FileAlreadyExistsException e) {
					LOGGER.warn("Backup version {} already exists in {} (attempt {} of {})", version, directory, attempt, createAttempts);
					latest = version;
					continue;
				}
				LOGGER.info("Created backup {} of {}", version, location.physicalPath());
				pruneBackups(location, directory);
				return version;
			}
			throw new ConflictException("Unable to create a unique backup in " + directory + " after " + createAttempts + " attempts");
		}
	}

	/**
	 * @throws NotFoundException if the lookup has no backup with that version
	 */
	public byte[] retrieve(String name, String namespace, String owner, String version, Session session) throws IOException {
		String cleanVersion = PathSanitizer.sanitize(version);
		if (cleanVersion.isBlank()) {
			throw new NotFoundException("Backup version must not be blank");
		}
		Path file = backupDirectory(name, namespace, owner, null, session).resolve(cleanVersion);
		try {
			return storage.read(file);
		} catch (NoSuchFileException e) {
			throw new NotFoundException("No backup version " + cleanVersion + " of lookup \"" + name + "\"", e);
		}
	}

	private List<BackupEntry> listBackups(ResolvedLocation location, Path directory) throws IOException {
		List<String> versions = new ArrayList<>(storage.listChildren(directory));
		versions.sort(VersionOrder.INSTANCE);
		List<BackupEntry> result = new ArrayList<>(versions.size());
		for (String version : versions) {
			result.add(new BackupEntry(location, version, directory.resolve(version)));
		}
		return result;
	}

	/**
	 * Keeps only the newest {@code maxBackups} backups, if a limit is configured.
	 */
	private void pruneBackups(ResolvedLocation location, Path directory) throws IOException {
		if (maxBackups == 0) {
			return;
		}
		List<BackupEntry> entries = listBackups(location, directory);
		int excess = entries.size() - maxBackups;
		for (int i = 0; i < excess; i++) {
			storage.delete(entries.get(i).path());
		}
		if (excess > 0) {
			LOGGER.info("Pruned {} old backups of {}", excess, location.physicalPath());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BackupStore.class);
}
