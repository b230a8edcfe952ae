package works.lookup.exceptions;

/**
 * Credentials were rejected by an upstream service.
 */
public class AuthFailureException extends LookupException {
	public AuthFailureException(String message) {
		super(message);
	}

	public AuthFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
