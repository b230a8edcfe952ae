package works.lookup.exceptions;

/**
 * Common supertype for the failures a lookup operation can report to its caller.
 * Callers that map failures onto a transport (HTTP status codes and the like)
 * can switch on the concrete subtype.
 */
public abstract class LookupException extends RuntimeException {
	protected LookupException(String message) {
		super(message);
	}

	protected LookupException(String message, Throwable cause) {
		super(message, cause);
	}
}
