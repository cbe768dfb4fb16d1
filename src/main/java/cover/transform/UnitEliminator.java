package cover.transform;

import java.util.List;

import cover.grammar.*;

import static cover.Config.LOG;

/**
 * Removes all unit productions. For every <pre>A -> B</pre> and every terminal or binary production
 * <pre>B -> X</pre> it adds <pre>A -> X</pre> with the summed distance.
 *
 * Expects the unit closure to be computed already, a single pass suffices. The result is in CNF if the
 * input contains no epsilon productions.
 */
public class UnitEliminator implements Stage {

	public static ProductionSet run(ProductionSet productions){
		return new UnitEliminator().apply(productions);
	}

	@Override
	public String name() {
		return "Eliminate unit; new productions";
	}

	@Override
	public ProductionSet apply(ProductionSet productions) {
		ProductionSet result = productions.copy();
		List<Production> units = result.ofShape(Shape.UNIT);
		for (Production unit : units) {
			for (Production target : result.productionsOf((NonTerminal)unit.first())) {
				if (target.isTerminal() || target.isBinary()){
					result.tryAdd(new Production(unit.left, target.right, unit.distance + target.distance));
				}
			}
		}
		int removed = result.removeShape(Shape.UNIT);
		LOG.fine(() -> String.format("%s: %d new productions, removed %d unit productions", name(),
				result.difference(productions).size(), removed));
		return result;
	}
}
