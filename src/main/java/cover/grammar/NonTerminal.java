package cover.grammar;

import cover.InvalidGrammarError;

/**
 * A non terminal symbol, an upper case letter
 */
public class NonTerminal extends Symbol {

	private NonTerminal(char name) {
		super(name);
	}

	public static NonTerminal of(char name){
		if (!Character.isUpperCase(name)){
			throw new InvalidGrammarError(String.format("Non terminal '%s' isn't an upper case letter", name));
		}
		return new NonTerminal(name);
	}

	@Override
	public boolean isTerminal() {
		return false;
	}
}
