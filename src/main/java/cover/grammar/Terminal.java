package cover.grammar;

import java.util.ArrayList;
import java.util.List;

import cover.InvalidGrammarError;

/**
 * A terminal symbol, a lower case letter
 */
public class Terminal extends Symbol {

	private Terminal(char name) {
		super(name);
	}

	public static Terminal of(char name){
		if (!Character.isLowerCase(name)){
			throw new InvalidGrammarError(String.format("Terminal '%s' isn't a lower case letter", name));
		}
		return new Terminal(name);
	}

	/**
	 * Terminals for each character of the passed string, e.g. <code>"ab"</code> gives [a, b]
	 */
	public static List<Terminal> alphabet(String letters){
		List<Terminal> terminals = new ArrayList<>();
		for (char c : letters.toCharArray()){
			Terminal terminal = of(c);
			if (!terminals.contains(terminal)){
				terminals.add(terminal);
			}
		}
		return terminals;
	}

	@Override
	public boolean isTerminal() {
		return true;
	}
}
