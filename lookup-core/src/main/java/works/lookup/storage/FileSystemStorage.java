package works.lookup.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * {@link LookupStorage} on the local file system.
 * <p>
 * Content is first written to a hidden temporary file in the target directory
 * and then renamed into place. Hidden entries (names starting with {@code .})
 * are never reported by {@link #listChildren}, so a half-written file is invisible.
 * {@link #create} links the temporary file to the target instead of renaming it,
 * so that of several concurrent creators exactly one wins.
 */
public class FileSystemStorage implements LookupStorage {
	static final String TEMP_PREFIX = ".tmp-";

	@Override
	public byte[] read(Path path) throws IOException {
		return Files.readAllBytes(path);
	}

	@Override
	public void write(Path path, byte[] content) throws IOException {
		Path temp = writeTemp(path, content);
		try {
			Files.move(temp, path, ATOMIC_MOVE, REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			LOGGER.debug("Atomic move not supported for {}; falling back to plain replace", path, e);
			Files.move(temp, path, REPLACE_EXISTING);
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	@Override
	public void create(Path path, byte[] content) throws IOException {
		Path temp = writeTemp(path, content);
		try {
			// Linking fails atomically if the target is taken
			Files.createLink(path, temp);
		} catch (UnsupportedOperationException e) {
			LOGGER.debug("Hard links not supported for {}; falling back to plain move", path, e);
			Files.move(temp, path);
		} finally {
			Files.deleteIfExists(temp);
		}
	}

	@Override
	public List<String> listChildren(Path directory) throws IOException {
		List<String> result = new ArrayList<>();
		if (!Files.isDirectory(directory)) {
			return result;
		}
		try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
			for (Path entry : entries) {
				String name = entry.getFileName().toString();
				if (!name.startsWith(".")) {
					result.add(name);
				}
			}
		}
		return result;
	}

	@Override
	public boolean exists(Path path) {
		return Files.exists(path);
	}

	@Override
	public void delete(Path path) throws IOException {
		Files.deleteIfExists(path);
	}

	private static Path writeTemp(Path path, byte[] content) throws IOException {
		Path directory = path.toAbsolutePath().getParent();
		Files.createDirectories(directory);
		Path temp = Files.createTempFile(directory, TEMP_PREFIX, ".part");
		try {
			Files.write(temp, content);
		} catch (IOException | RuntimeException e) {
			Files.deleteIfExists(temp);
			throw e;
		}
		return temp;
	}

	@Override
	public String toString() {
		return "FileSystemStorage";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemStorage.class);
}
