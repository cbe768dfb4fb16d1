package cover.transform;

import cover.grammar.ProductionSet;

/**
 * A step of the covering grammar construction.
 *
 * Implementations don't modify the passed set, they return a new one.
 */
public interface Stage {

	/**
	 * Heading used in reports, e.g. "Add nullable productions"
	 */
	String name();

	ProductionSet apply(ProductionSet productions);
}
