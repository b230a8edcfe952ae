package works.lookup.backup;

import java.nio.file.Path;
import works.lookup.ResolvedLocation;

/**
 * One snapshot of a lookup.
 *
 * @param location the lookup the snapshot was taken of
 * @param version the snapshot's identifier within its backup directory
 * @param path the file holding the snapshot
 */
public record BackupEntry(
	ResolvedLocation location,
	String version,
	Path path
) { }
