package cover.transform;

import cover.grammar.*;

import static cover.Config.LOG;

/**
 * Adds all derived unit productions: for <pre>A -> B</pre> and <pre>B -> C</pre> with <pre>C ≠ A</pre> it adds
 * <pre>A -> C</pre> with the summed distance, until nothing changes.
 */
public class UnitClosure implements Stage {

	public static ProductionSet compute(ProductionSet productions){
		return new UnitClosure().apply(productions);
	}

	@Override
	public String name() {
		return "Add derived unit productions";
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
				Production unit = result.get(i);
				if (!unit.isUnit()){
					continue;
				}
				for (Production next : result.productionsOf((NonTerminal)unit.first())) {
					if (next.isUnit() && !next.first().equals(unit.left)){
						Production derived = new Production(unit.left, unit.distance + next.distance, next.first());
						somethingChanged = result.tryAdd(derived) || somethingChanged;
					}
				}
			}
		} while (somethingChanged);
		int passCount = passes;
		LOG.finer(() -> String.format("%s: fix point after %d passes", name(), passCount));
		LOG.fine(() -> String.format("%s: %d new productions", name(), result.difference(productions).size()));
		return result;
	}
}
