package works.lookup;

import java.time.Duration;
import org.jetbrains.annotations.Nullable;

/**
 * The credentials for one unit of work against the upstream services.
 * Concurrent callers must each use their own session.
 *
 * @param token the opaque credential passed along to the Metadata Service and document store
 * @param timeout how long a single upstream call may block, or null for the service's own default.
 *                Implementations that exceed it report {@link works.lookup.exceptions.ConnectionFailureException}.
 */
public record Session(String token, @Nullable Duration timeout) {
	public static Session of(String token) {
		return new Session(token, null);
	}

	@Override
	public String toString() {
		// Keep the credential out of logs
		return "Session{timeout=" + timeout + "}";
	}
}
