package cover;

/**
 * Thrown if a symbol, production or grammar violates the shape and alphabet rules
 * (e.g. a terminal inside a binary production).
 */
public class InvalidGrammarError extends CoverException {

	public InvalidGrammarError(String message) {
		super(message);
	}
}
