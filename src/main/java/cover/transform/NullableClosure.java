package cover.transform;

import cover.grammar.*;

import static cover.Config.LOG;

/**
 * Adds all derived epsilon productions: for <pre>A -> BC</pre> with <pre>B -> ε</pre> and <pre>C -> ε</pre>
 * it adds <pre>A -> ε</pre> with the summed distance of both epsilon productions, until nothing changes.
 */
public class NullableClosure implements Stage {

	public static ProductionSet compute(ProductionSet productions){
		return new NullableClosure().apply(productions);
	}

	@Override
	public String name() {
		return "Add nullable productions";
	}

	@Override
	public ProductionSet apply(ProductionSet productions) {
		ProductionSet result = productions.copy();
		boolean somethingChanged;
		int passes = 0;
		do {
			somethingChanged = false;
			passes++;
			for (int i = 0; i < result.size(); i++){
				Production production = result.get(i);
				if (!production.isBinary()){
					continue;
				}
				Production first = result.epsilonProductionOf((NonTerminal)production.first());
				Production second = result.epsilonProductionOf((NonTerminal)production.second());
				if (first != null && second != null){
					int distance = first.distance + second.distance;
					somethingChanged = result.tryAdd(new Production(production.left, distance)) || somethingChanged;
				}
			}
		} while (somethingChanged);
		int passCount = passes;
		LOG.finer(() -> String.format("%s: fix point after %d passes", name(), passCount));
		LOG.fine(() -> String.format("%s: %d new productions", name(), result.difference(productions).size()));
		return result;
	}
}
