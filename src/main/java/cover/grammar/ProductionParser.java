package cover.grammar;

import java.util.ArrayList;
import java.util.List;

import cover.MalformedProductionError;

/**
 * Reads productions in the format <pre>L[d]->RHS</pre>:
 * <ul>
 *     <li><code>L</code> is a single upper case letter</li>
 *     <li><code>d</code> is an optional non negative distance (default 0)</li>
 *     <li><code>RHS</code> is empty (epsilon), a lower case letter, an upper case letter or two upper case letters</li>
 * </ul>
 * Examples: <code>S->AC</code>, <code>A->a</code>, <code>A1->b</code>, <code>A-></code>
 */
public class ProductionParser {

	public static final String ARROW = "->";

	private ProductionParser() {
	}

	/**
	 * Parses a single production, surrounding white space is ignored.
	 *
	 * @throws MalformedProductionError if the text isn't a valid production, columns are relative to the
	 *                                  trimmed text
	 */
	public static Production parse(String text){
		String str = text.trim();
		if (str.isEmpty()){
			throw new MalformedProductionError(str, 0, "empty production");
		}
		int arrowPos = str.indexOf(ARROW);
		if (arrowPos == -1){
			throw new MalformedProductionError(str, str.length(), String.format("missing \"%s\"", ARROW));
		}
		if (arrowPos == 0){
			throw new MalformedProductionError(str, 0, "missing left hand side");
		}
		char leftChar = str.charAt(0);
		if (!Character.isUpperCase(leftChar)){
			throw new MalformedProductionError(str, 0,
					String.format("left hand side '%s' isn't an upper case letter", leftChar));
		}
		int distance = parseDistance(str, 1, arrowPos);
		int rightStart = arrowPos + ARROW.length();
		String rightStr = str.substring(rightStart);
		if (rightStr.length() > 2){
			throw new MalformedProductionError(str, rightStart + 2,
					String.format("right hand side \"%s\" has more than two symbols", rightStr));
		}
		List<Symbol> right = new ArrayList<>();
		for (int i = 0; i < rightStr.length(); i++){
			char c = rightStr.charAt(i);
			if (Character.isUpperCase(c)){
				right.add(NonTerminal.of(c));
			} else if (Character.isLowerCase(c) && rightStr.length() == 1){
				right.add(Terminal.of(c));
			} else if (Character.isLowerCase(c)){
				throw new MalformedProductionError(str, rightStart + i,
						String.format("terminal '%s' in a binary right hand side", c));
			} else {
				throw new MalformedProductionError(str, rightStart + i,
						String.format("'%s' is neither a terminal nor a non terminal", c));
			}
		}
		return new Production(NonTerminal.of(leftChar), right, distance);
	}

	private static int parseDistance(String str, int start, int end){
		if (start == end){
			return 0;
		}
		for (int i = start; i < end; i++){
			if (!Character.isDigit(str.charAt(i))){
				throw new MalformedProductionError(str, i,
						String.format("invalid distance \"%s\"", str.substring(start, end)));
			}
		}
		try {
			return Integer.parseInt(str.substring(start, end));
		} catch (NumberFormatException e){
			throw new MalformedProductionError(str, start,
					String.format("distance \"%s\" is too large", str.substring(start, end)), e);
		}
	}

	public static List<Production> parseAll(String... texts){
		List<Production> productions = new ArrayList<>();
		for (String text : texts){
			productions.add(parse(text));
		}
		return productions;
	}

	/**
	 * Parses productions separated by commas, semicolons or white space, e.g. <code>"S->AB, A->a, B->"</code>
	 */
	public static List<Production> parseGrammarText(String text){
		List<Production> productions = new ArrayList<>();
		for (String part : text.split("[,;\\s]+")){
			if (!part.isEmpty()){
				productions.add(parse(part));
			}
		}
		return productions;
	}
}
