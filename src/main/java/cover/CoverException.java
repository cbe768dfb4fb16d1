package cover;

/**
 * Base class of all errors raised while reading or transforming grammars.
 */
public class CoverException extends RuntimeException {

	public CoverException(String message) {
		super(message);
	}

	public CoverException(String message, Throwable cause) {
		super(message, cause);
	}
}
