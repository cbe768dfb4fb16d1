package cover;

/**
 * An error thrown after encountering a production text that doesn't follow the <pre>L[d]->RHS</pre> format
 */
public class MalformedProductionError extends CoverException {

	/**
	 * Offending production text
	 */
	public final String text;

	/**
	 * Zero based column of the first offending character
	 */
	public final int column;

	public MalformedProductionError(String text, int column, String message) {
		super(String.format("Error in \"%s\" at column %d: %s", text, column, message));
		this.text = text;
		this.column = column;
	}

	public MalformedProductionError(String text, int column, String message, Throwable cause) {
		super(String.format("Error in \"%s\" at column %d: %s", text, column, message), cause);
		this.text = text;
		this.column = column;
	}
}
