package cover.transform;

import java.util.List;

import cover.grammar.*;

import static cover.Config.LOG;

/**
 * Removes all epsilon productions. For every <pre>P -> ε</pre> and every binary production <pre>C -> PB</pre>
 * or <pre>C -> BP</pre> it adds the unit production <pre>C -> B</pre>, charging the cost of the epsilon
 * production.
 *
 * Expects the nullable closure to be computed already, a single pass suffices.
 */
public class EpsilonEliminator implements Stage {

	public static ProductionSet run(ProductionSet productions){
		return new EpsilonEliminator().apply(productions);
	}

	@Override
	public String name() {
		return "Eliminate epsilon; new productions";
	}

	@Override
	public ProductionSet apply(ProductionSet productions) {
		ProductionSet result = productions.copy();
		List<Production> binaries = result.ofShape(Shape.BINARY);
		for (Production epsilon : result.ofShape(Shape.EPSILON)) {
			for (Production binary : binaries) {
				int distance = binary.distance + epsilon.distance;
				if (binary.first().equals(epsilon.left)){
					result.tryAdd(new Production(binary.left, distance, binary.second()));
				}
				if (binary.second().equals(epsilon.left)){
					result.tryAdd(new Production(binary.left, distance, binary.first()));
				}
			}
		}
		int removed = result.removeShape(Shape.EPSILON);
		LOG.fine(() -> String.format("%s: %d new productions, removed %d epsilon productions", name(),
				result.difference(productions).size(), removed));
		return result;
	}
}
