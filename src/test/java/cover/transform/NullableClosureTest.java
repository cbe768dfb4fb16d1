package cover.transform;

import org.junit.jupiter.api.Test;

import cover.grammar.NonTerminal;
import cover.grammar.ProductionSet;

import static cover.grammar.ProductionParser.parseAll;
import static org.junit.jupiter.api.Assertions.*;

public class NullableClosureTest {

	@Test
	public void testSumsDistancesOfBothSides(){
		ProductionSet result = NullableClosure.compute(ProductionSet.of("S->AB", "A->", "B1->"));
		assertEquals(parseAll("S->AB", "A->", "B1->", "S1->"), result.asList());
	}

	@Test
	public void testDistanceOfBinaryProductionIsNotCharged(){
		ProductionSet result = NullableClosure.compute(ProductionSet.of("S1->AB", "A->", "B->"));
		assertEquals(0, result.epsilonProductionOf(NonTerminal.of('S')).distance);
	}

	@Test
	public void testNeedsSeveralPasses(){
		ProductionSet result = NullableClosure.compute(ProductionSet.of("S->AC", "C->AB", "A1->", "B2->"));
		assertEquals(3, result.epsilonProductionOf(NonTerminal.of('C')).distance);
		assertEquals(4, result.epsilonProductionOf(NonTerminal.of('S')).distance);
	}

	@Test
	public void testTightensExistingEpsilonProduction(){
		ProductionSet result = NullableClosure.compute(ProductionSet.of("A5->", "A->BB", "B1->"));
		assertEquals(parseAll("A2->", "A->BB", "B1->"), result.asList());
	}

	@Test
	public void testNotNullableIfOneSideIsNotNullable(){
		ProductionSet input = ProductionSet.of("S->AB", "A->", "B->b");
		assertEquals(input, NullableClosure.compute(input));
	}

	@Test
	public void testFixPointIsIdempotent(){
		ProductionSet once = NullableClosure.compute(ProductionSet.of("S->AC", "S->AB", "C->SB", "A1->", "B1->"));
		assertEquals(once, NullableClosure.compute(once));
	}

	@Test
	public void testInputIsNotModified(){
		ProductionSet input = ProductionSet.of("S->AB", "A->", "B->");
		NullableClosure.compute(input);
		assertEquals(3, input.size());
	}
}
