package cover.grammar;

import java.io.Serializable;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import cover.util.Pair;

import static cover.util.Utils.join;

/**
 * Ordered collection of productions that holds at most one production per (left, right) pair, the one with the
 * minimal distance.
 *
 * The transformation stages never modify the set they get, they {@link #copy()} it and modify the copy.
 */
public class ProductionSet implements Iterable<Production>, Serializable {

	private final List<Production> productions;

	/**
	 * Position of the production for each (left, right) pair in the list
	 */
	private final Map<Pair<NonTerminal, List<Symbol>>, Integer> positions;

	public ProductionSet() {
		this.productions = new ArrayList<>();
		this.positions = new HashMap<>();
	}

	/**
	 * Creates a set from the passed productions, duplicate rules are canonicalized via {@link #tryAdd(Production)}
	 */
	public ProductionSet(Collection<Production> productions) {
		this();
		for (Production production : productions) {
			tryAdd(production);
		}
	}

	public static ProductionSet of(String... productions){
		return new ProductionSet(ProductionParser.parseAll(productions));
	}

	public ProductionSet copy(){
		ProductionSet set = new ProductionSet();
		set.productions.addAll(productions);
		set.positions.putAll(positions);
		return set;
	}

	/**
	 * Adds the production unless a production for the same rule with a distance that isn't larger exists.
	 * A production for the same rule with a larger distance is replaced in place.
	 *
	 * @return true if the set changed
	 */
	public boolean tryAdd(Production production){
		Integer pos = positions.get(production.key());
		if (pos == null){
			positions.put(production.key(), productions.size());
			productions.add(production);
			return true;
		}
		if (productions.get(pos).distance <= production.distance){
			return false;
		}
		productions.set(pos, production);
		return true;
	}

	/**
	 * @return production for the passed rule or null if there is none
	 */
	public Production lookup(NonTerminal left, List<Symbol> right){
		Integer pos = positions.get(new Pair<>(left, right));
		return pos == null ? null : productions.get(pos);
	}

	/**
	 * @return the production <pre>left -> ε</pre> or null if there is none
	 */
	public Production epsilonProductionOf(NonTerminal left){
		return lookup(left, Collections.emptyList());
	}

	public boolean contains(Production production){
		return production.equals(lookup(production.left, production.right));
	}

	/**
	 * Removes all productions of the passed shape.
	 *
	 * @return number of removed productions
	 */
	public int removeShape(Shape shape){
		int oldSize = productions.size();
		productions.removeIf(p -> p.shape == shape);
		positions.clear();
		for (int i = 0; i < productions.size(); i++){
			positions.put(productions.get(i).key(), i);
		}
		return oldSize - productions.size();
	}

	public List<Production> ofShape(Shape shape){
		return productions.stream().filter(p -> p.shape == shape).collect(Collectors.toList());
	}

	public boolean hasShape(Shape shape){
		return productions.stream().anyMatch(p -> p.shape == shape);
	}

	/**
	 * Productions that have the passed non terminal on their left side, in insertion order
	 */
	public List<Production> productionsOf(NonTerminal left){
		return productions.stream().filter(p -> p.left.equals(left)).collect(Collectors.toList());
	}

	/**
	 * Productions of this set that aren't (with the same distance) in the other set.
	 */
	public List<Production> difference(ProductionSet other){
		return productions.stream().filter(p -> !other.contains(p)).collect(Collectors.toList());
	}

	/**
	 * Non terminals used on the left or right side of a production, in order of appearance
	 */
	public Set<NonTerminal> nonTerminals(){
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		for (Production production : productions) {
			nonTerminals.add(production.left);
			for (Symbol symbol : production.right) {
				if (!symbol.isTerminal()){
					nonTerminals.add((NonTerminal)symbol);
				}
			}
		}
		return nonTerminals;
	}

	/**
	 * Terminals used on the right side of a production, in order of appearance
	 */
	public Set<Terminal> terminals(){
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (Production production : productions) {
			if (production.isTerminal()){
				terminals.add((Terminal)production.first());
			}
		}
		return terminals;
	}

	public Production get(int index){
		return productions.get(index);
	}

	public int size(){
		return productions.size();
	}

	public boolean isEmpty(){
		return productions.isEmpty();
	}

	public List<Production> asList(){
		return Collections.unmodifiableList(productions);
	}

	public Stream<Production> stream(){
		return productions.stream();
	}

	@Override
	public Iterator<Production> iterator() {
		return asList().iterator();
	}

	/**
	 * Renders the productions in the source format, separated by commas
	 */
	public String format(){
		return productions.stream().map(Production::format).collect(Collectors.joining(", "));
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ProductionSet && ((ProductionSet)obj).productions.equals(productions);
	}

	@Override
	public int hashCode() {
		return productions.hashCode();
	}
}
