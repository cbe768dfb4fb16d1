package cover.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import cover.InvalidGrammarError;
import cover.util.Pair;

/**
 * A grammar production with a left and a right hand side and the number of edit operations (insertions,
 * deletions and substitutions) its usage costs.
 *
 * Productions are immutable, the shape of the right hand side is checked on construction.
 */
public class Production implements Serializable {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;

	/**
	 * Right hand side of the production, empty for epsilon productions
	 */
	public final List<Symbol> right;

	/**
	 * Number of edit operations, zero for productions of the base grammar
	 */
	public final int distance;

	public final Shape shape;

	public Production(NonTerminal left, List<Symbol> right, int distance) {
		if (left == null){
			throw new InvalidGrammarError("Production without left hand side");
		}
		if (distance < 0){
			throw new InvalidGrammarError(String.format("Negative distance %d for a production of %s", distance, left));
		}
		this.left = left;
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		this.distance = distance;
		this.shape = Shape.of(this.right);
	}

	public Production(NonTerminal left, int distance, Symbol... right) {
		this(left, Arrays.asList(right), distance);
	}

	/**
	 * Parses a production in the <pre>L[d]->RHS</pre> format.
	 *
	 * @see ProductionParser#parse(String)
	 */
	public static Production parse(String text){
		return ProductionParser.parse(text);
	}

	/** <pre>A -> a</pre> */
	public boolean isTerminal(){
		return shape == Shape.TERMINAL;
	}

	/** <pre>A -> ε</pre> */
	public boolean isEpsilon(){
		return shape == Shape.EPSILON;
	}

	/** <pre>A -> B</pre> */
	public boolean isUnit(){
		return shape == Shape.UNIT;
	}

	/** <pre>A -> BC</pre> */
	public boolean isBinary(){
		return shape == Shape.BINARY;
	}

	public Symbol first(){
		return right.get(0);
	}

	public Symbol second(){
		return right.get(1);
	}

	/**
	 * Identifies the rule independent of its distance, at most one production per key survives canonicalization.
	 */
	public Pair<NonTerminal, List<Symbol>> key(){
		return new Pair<>(left, right);
	}

	public boolean sameRule(Production other){
		return left.equals(other.left) && right.equals(other.right);
	}

	public Production withDistance(int distance){
		return new Production(left, right, distance);
	}

	public String formatRightSide(){
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : right) {
			builder.append(symbol);
		}
		return builder.toString();
	}

	/**
	 * Source format, e.g. <pre>A1->b</pre>, that {@link ProductionParser} reads back
	 */
	public String format(){
		return left.toString() + (distance == 0 ? "" : distance) + "->" + formatRightSide();
	}

	/**
	 * Diagnostic format, e.g. <pre>A->[1]b</pre> or <pre>A->epsilon</pre>
	 */
	@Override
	public String toString() {
		String str = left + "->";
		if (distance != 0){
			str += "[" + distance + "]";
		}
		return str + (isEpsilon() ? "epsilon" : formatRightSide());
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return distance == other.distance && sameRule(other);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right, distance);
	}
}
