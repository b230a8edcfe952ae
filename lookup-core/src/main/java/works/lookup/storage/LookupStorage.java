package works.lookup.storage;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * The durable layer under lookups and their backups.
 * <p>
 * Writes must be all-or-nothing: a reader, including {@link #listChildren},
 * never observes a partially written file.
 */
public interface LookupStorage {
	/**
	 * @throws NoSuchFileException if there's nothing at {@code path}
	 */
	byte[] read(Path path) throws IOException;

	/**
	 * Creates or replaces the file at {@code path}, creating parent directories as needed.
	 */
	void write(Path path, byte[] content) throws IOException;

	/**
	 * Like {@link #write} but refuses to replace an existing file.
	 *
	 * @throws FileAlreadyExistsException if {@code path} is already taken
	 */
	void create(Path path, byte[] content) throws IOException;

	/**
	 * @return the names of the visible entries directly under {@code directory},
	 * or an empty list if the directory doesn't exist. Order is unspecified.
	 */
	List<String> listChildren(Path directory) throws IOException;

	boolean exists(Path path);

	/**
	 * Deletes the file if it exists.
	 */
	void delete(Path path) throws IOException;
}
