package works.lookup;

import java.nio.file.Path;
import java.time.Clock;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class LookupEditorConfig {
	/**
	 * The {@code etc} directory under which {@code apps/} and {@code users/} live.
	 * All physical paths are built beneath it.
	 */
	Path etcDirectory;

	/**
	 * The application that hosts the editor. Used as the namespace
	 * whenever a request doesn't name one.
	 */
	@Default String hostingApp = "lookup_editor";

	/**
	 * The most backups to keep per lookup; older ones are pruned after each new backup.
	 * Zero keeps them all.
	 */
	@Default int maxBackups = 0;

	/**
	 * How many versions {@link works.lookup.backup.BackupStore#createBackup createBackup}
	 * will try before giving up on a collision.
	 */
	@Default int backupCreateAttempts = 3;

	@Default Clock clock = Clock.systemUTC();

	public void validate() {
		if (etcDirectory == null) {
			throw new IllegalArgumentException("etcDirectory is required");
		}
		if (PathSanitizer.sanitize(hostingApp).isBlank()) {
			throw new IllegalArgumentException("hostingApp must be a usable path segment: \"" + hostingApp + "\"");
		}
		if (maxBackups < 0) {
			throw new IllegalArgumentException("maxBackups must be >= 0");
		}
		if (backupCreateAttempts < 1) {
			throw new IllegalArgumentException("backupCreateAttempts must be >= 1");
		}
	}
}
