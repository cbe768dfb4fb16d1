package cover.grammar;

import java.util.List;

import cover.InvalidGrammarError;

/**
 * Form of the right hand side of a production
 */
public enum Shape {
	/** <pre>A -> ε</pre> */
	EPSILON,
	/** <pre>A -> a</pre> */
	TERMINAL,
	/** <pre>A -> B</pre> */
	UNIT,
	/** <pre>A -> BC</pre> */
	BINARY;

	/**
	 * Classifies a right hand side.
	 *
	 * @throws InvalidGrammarError if the right hand side is longer than two symbols or a binary right hand side
	 *                             contains a terminal
	 */
	public static Shape of(List<Symbol> right){
		switch (right.size()){
			case 0:
				return EPSILON;
			case 1:
				return right.get(0).isTerminal() ? TERMINAL : UNIT;
			case 2:
				if (right.get(0).isTerminal() || right.get(1).isTerminal()){
					throw new InvalidGrammarError(String.format("Binary right hand side %s%s may only contain non terminals",
							right.get(0), right.get(1)));
				}
				return BINARY;
			default:
				throw new InvalidGrammarError(String.format("Right hand side with %d symbols isn't supported, " +
						"at most two are allowed", right.size()));
		}
	}
}
