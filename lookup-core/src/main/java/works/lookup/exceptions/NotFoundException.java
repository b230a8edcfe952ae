package works.lookup.exceptions;

/**
 * No knowledge object matches under any visible scope, or the requested backup version does not exist.
 */
public class NotFoundException extends LookupException {
	public NotFoundException(String message) {
		super(message);
	}

	public NotFoundException(String message, Throwable cause) {
		super(message, cause);
	}
}
