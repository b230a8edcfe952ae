package works.lookup.exceptions;

/**
 * Input that can't be interpreted, such as a document key containing a literal {@code .}.
 */
public class InvalidInputException extends LookupException {
	public InvalidInputException(String message) {
		super(message);
	}

	public InvalidInputException(String message, Throwable cause) {
		super(message, cause);
	}
}
