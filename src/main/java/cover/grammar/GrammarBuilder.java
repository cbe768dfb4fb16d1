package cover.grammar;

import java.util.*;

import cover.InvalidGrammarError;

/**
 * Allows the simple creation of grammars.
 *
 * <pre>
 *     new GrammarBuilder().add("S->AB", "A->a", "B->b").terminals("ab").toGrammar()
 * </pre>
 */
public class GrammarBuilder {

	private final ProductionSet productions = new ProductionSet();
	private Set<Terminal> alphabet = null;
	private final Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
	private NonTerminal start = null;

	/**
	 * Add productions in the source format
	 *
	 * @see ProductionParser#parse(String)
	 */
	public GrammarBuilder add(String... productions){
		for (Production production : ProductionParser.parseAll(productions)){
			add(production);
		}
		return this;
	}

	/**
	 * Add productions separated by commas, semicolons or white space
	 */
	public GrammarBuilder addAll(String grammarText){
		for (Production production : ProductionParser.parseGrammarText(grammarText)){
			add(production);
		}
		return this;
	}

	public GrammarBuilder add(Production production){
		productions.tryAdd(production);
		return this;
	}

	/**
	 * Sets the alphabet, by default it consists of the terminals used in the productions.
	 *
	 * @param letters lower case letters
	 */
	public GrammarBuilder terminals(String letters){
		return terminals(Terminal.alphabet(letters));
	}

	public GrammarBuilder terminals(Collection<Terminal> terminals){
		alphabet = new LinkedHashSet<>(terminals);
		return this;
	}

	/**
	 * Declares non terminals that might not be used in any production
	 *
	 * @param letters upper case letters
	 */
	public GrammarBuilder nonTerminals(String letters){
		for (char c : letters.toCharArray()){
			nonTerminals.add(NonTerminal.of(c));
		}
		return this;
	}

	public GrammarBuilder start(char nonTerminal){
		start = NonTerminal.of(nonTerminal);
		return this;
	}

	/**
	 * @throws InvalidGrammarError if a production uses a terminal that isn't part of an explicitly set alphabet
	 */
	public Grammar toGrammar(){
		Set<Terminal> terminals = alphabet == null ? productions.terminals() : alphabet;
		return new Grammar(productions, terminals, nonTerminals, start);
	}
}
