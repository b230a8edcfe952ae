package works.lookup.exceptions;

/**
 * An upstream service could not be reached, or the call exceeded its time limit.
 */
public class ConnectionFailureException extends LookupException {
	public ConnectionFailureException(String message) {
		super(message);
	}

	public ConnectionFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
