package cover.grammar;

import java.io.Serializable;

import cover.InvalidGrammarError;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Every symbol is a single character: lower case letters are terminals, upper case letters non terminals.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public final char name;

	Symbol(char name) {
		this.name = name;
	}

	/**
	 * Creates the terminal or non terminal that the case of the passed character implies.
	 */
	public static Symbol of(char name){
		if (Character.isUpperCase(name)){
			return NonTerminal.of(name);
		}
		if (Character.isLowerCase(name)){
			return Terminal.of(name);
		}
		throw new InvalidGrammarError(String.format("'%s' is neither a terminal nor a non terminal", name));
	}

	public abstract boolean isTerminal();

	@Override
	public int hashCode() {
		return isTerminal() ? -name - 1 : name + 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name == name;
	}

	@Override
	public int compareTo(Symbol o) {
		return Integer.compare(hashCode(), o.hashCode());
	}

	@Override
	public String toString() {
		return String.valueOf(name);
	}
}
