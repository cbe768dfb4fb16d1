package cover.grammar;

import java.io.Serializable;
import java.util.*;

import cover.InvalidGrammarError;
import cover.util.Utils;

import static cover.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * The terminals form the alphabet that substitutions and insertions draw from. The non terminal set is only
 * informational, it always contains the non terminals of the productions.
 *
 * Use the GrammarBuilder to build a grammar instance properly.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar implements Serializable {

	private final ProductionSet productions;

	private final Set<Terminal> terminals;

	private final Set<NonTerminal> nonTerminals;

	private final NonTerminal start;

	/**
	 * Create a new Grammar object
	 *
	 * @param productions productions, the grammar works on a copy
	 * @param terminals alphabet, has to contain every terminal used in a production
	 * @param nonTerminals additional non terminals
	 * @param start start non terminal or null to use the left side of the first production
	 */
	public Grammar(ProductionSet productions, Collection<Terminal> terminals, Collection<NonTerminal> nonTerminals,
	               NonTerminal start) {
		this.productions = productions.copy();
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		Set<NonTerminal> nts = new LinkedHashSet<>(nonTerminals);
		nts.addAll(productions.nonTerminals());
		if (start == null && !productions.isEmpty()){
			start = productions.get(0).left;
		}
		if (start != null){
			nts.add(start);
		}
		this.nonTerminals = Collections.unmodifiableSet(nts);
		this.start = start;
		for (Terminal terminal : productions.terminals()) {
			if (!this.terminals.contains(terminal)){
				throw new InvalidGrammarError(String.format("Terminal %s isn't part of the alphabet {%s}", terminal,
						Utils.toString(", ", this.terminals)));
			}
		}
	}

	/**
	 * Same alphabet, non terminals and start symbol, but other productions
	 */
	public Grammar withProductions(ProductionSet productions){
		return new Grammar(productions, terminals, nonTerminals, start);
	}

	/**
	 * @return a copy of the productions
	 */
	public ProductionSet getProductions(){
		return productions.copy();
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	/**
	 * @return start non terminal, null for a grammar without productions
	 */
	public NonTerminal getStart(){
		return start;
	}

	/**
	 * Is every production of the form <pre>A -> BC</pre> or <pre>A -> a</pre>?
	 */
	public boolean isChomskyNormalForm(){
		return !productions.hasShape(Shape.EPSILON) && !productions.hasShape(Shape.UNIT);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions.asList(), "\n");
	}

	@Override
	public String toString() {
		return productions.format();
	}
}
