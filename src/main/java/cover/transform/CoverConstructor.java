package cover.transform;

import java.util.*;

import cover.Config;
import cover.InvalidGrammarError;
import cover.grammar.*;

import static cover.Config.LOG;

/**
 * Adds the error productions for insertions, deletions and substitutions.
 *
 * For the alphabet Σ it adds the insertion non terminals <pre>H -> HI | I</pre> and <pre>I -> a</pre> (distance 1)
 * for every <pre>a ∈ Σ</pre>. For every terminal production <pre>A -> a</pre> of the base grammar it adds
 * <ul>
 *     <li>substitutions <pre>A -> b</pre> for all <pre>b ∈ Σ, b ≠ a</pre> (distance 1)</li>
 *     <li>the deletion <pre>A -> ε</pre> (distance 1)</li>
 *     <li>the insertion hooks <pre>A -> HA</pre> and <pre>A -> AH</pre> (the errors are counted in H)</li>
 * </ul>
 * The result isn't in CNF anymore, as it contains epsilon productions.
 */
public class CoverConstructor implements Stage {

	/**
	 * Cost of a single insertion, deletion or substitution
	 */
	public static final int EDIT_COST = 1;

	private final List<Terminal> alphabet;
	private final char insertionName;
	private final char insertedTerminalName;

	/**
	 * Uses the configured names for the insertion non terminals
	 */
	public CoverConstructor(Collection<Terminal> alphabet) {
		this(alphabet, Config.insertionNonTerminal(), Config.insertedTerminalNonTerminal());
	}

	/**
	 * @param alphabet terminals used for substitutions and insertions
	 * @param insertionName preferred name of the non terminal H that derives runs of inserted terminals
	 * @param insertedTerminalName preferred name of the non terminal I that derives a single inserted terminal
	 */
	public CoverConstructor(Collection<Terminal> alphabet, char insertionName, char insertedTerminalName) {
		this.alphabet = new ArrayList<>(new LinkedHashSet<>(alphabet));
		this.insertionName = insertionName;
		this.insertedTerminalName = insertedTerminalName;
	}

	public static ProductionSet build(ProductionSet base, Collection<Terminal> alphabet){
		return new CoverConstructor(alphabet).apply(base);
	}

	@Override
	public String name() {
		return "Add cover productions";
	}

	@Override
	public ProductionSet apply(ProductionSet base) {
		Set<NonTerminal> used = new HashSet<>(base.nonTerminals());
		NonTerminal h = freshNonTerminal(insertionName, used);
		used.add(h);
		NonTerminal i = freshNonTerminal(insertedTerminalName, used);
		LOG.fine(() -> String.format("Insertion non terminals: %s, %s", h, i));

		ProductionSet result = base.copy();
		result.tryAdd(new Production(h, 0, h, i));
		result.tryAdd(new Production(h, 0, i));
		for (Terminal a : alphabet) {
			result.tryAdd(new Production(i, EDIT_COST, a));
		}
		for (Production production : base.ofShape(Shape.TERMINAL)) {
			NonTerminal left = production.left;
			for (Terminal b : alphabet) {
				if (!b.equals(production.first())){
					result.tryAdd(new Production(left, EDIT_COST, b));
				}
			}
			result.tryAdd(new Production(left, EDIT_COST));
			result.tryAdd(new Production(left, 0, h, left));
			result.tryAdd(new Production(left, 0, left, h));
		}
		LOG.fine(() -> String.format("%s: %d new productions", name(), result.size() - base.size()));
		return result;
	}

	/**
	 * Returns the preferred non terminal if it's unused, otherwise the next unused upper case letter
	 * (wrapping around after Z).
	 *
	 * @throws InvalidGrammarError if every upper case letter is used
	 */
	static NonTerminal freshNonTerminal(char preferred, Set<NonTerminal> used){
		NonTerminal start = NonTerminal.of(preferred);
		if (!used.contains(start)){
			return start;
		}
		int offset = Character.toUpperCase(preferred) - 'A';
		if (offset < 0 || offset >= 26){
			offset = 0;
		}
		for (int k = 0; k < 26; k++){
			NonTerminal candidate = NonTerminal.of((char)('A' + (offset + k) % 26));
			if (!used.contains(candidate)){
				return candidate;
			}
		}
		throw new InvalidGrammarError("No unused non terminal left for the insertion productions");
	}
}
