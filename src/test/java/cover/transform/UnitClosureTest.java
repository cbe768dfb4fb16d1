package cover.transform;

import org.junit.jupiter.api.Test;

import cover.grammar.ProductionSet;

import static cover.grammar.ProductionParser.parse;
import static cover.grammar.ProductionParser.parseAll;
import static org.junit.jupiter.api.Assertions.*;

public class UnitClosureTest {

	@Test
	public void testDistancesAreSummed(){
		ProductionSet result = UnitClosure.compute(ProductionSet.of("A2->B", "B3->C"));
		assertEquals(parseAll("A2->B", "B3->C", "A5->C"), result.asList());
	}

	@Test
	public void testChains(){
		ProductionSet result = UnitClosure.compute(ProductionSet.of("A->B", "B1->C", "C1->D", "D->d"));
		assertTrue(result.contains(parse("A2->D")));
		assertTrue(result.contains(parse("B2->D")));
	}

	@Test
	public void testNoSelfLoops(){
		ProductionSet input = ProductionSet.of("A->B", "B->A");
		assertEquals(input, UnitClosure.compute(input));
	}

	@Test
	public void testTightensExistingUnitProduction(){
		ProductionSet result = UnitClosure.compute(ProductionSet.of("A9->C", "A2->B", "B3->C"));
		assertEquals(parseAll("A5->C", "A2->B", "B3->C"), result.asList());
	}

	@Test
	public void testFixPointIsIdempotent(){
		ProductionSet once = UnitClosure.compute(ProductionSet.of("S1->A", "A->B", "B2->C", "C->S", "C1->A"));
		assertEquals(once, UnitClosure.compute(once));
	}
}
