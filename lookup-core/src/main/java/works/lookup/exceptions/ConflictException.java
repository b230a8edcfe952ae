package works.lookup.exceptions;

/**
 * A freshly minted backup version collided with an existing one, and the retries were exhausted.
 */
public class ConflictException extends LookupException {
	public ConflictException(String message) {
		super(message);
	}

	public ConflictException(String message, Throwable cause) {
		super(message, cause);
	}
}
