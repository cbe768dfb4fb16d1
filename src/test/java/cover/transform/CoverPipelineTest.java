package cover.transform;

import java.util.HashSet;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import cover.grammar.*;

import static cover.grammar.ProductionParser.parse;
import static cover.grammar.ProductionParser.parseAll;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the whole construction on the a^n b^n grammar
 */
public class CoverPipelineTest {

	static Grammar base;
	static CoverPipeline.Result result;

	@BeforeAll
	public static void setUp(){
		base = new GrammarBuilder().add("S->AC", "S->AB", "C->SB", "A->a", "B->b").terminals("ab").toGrammar();
		result = new CoverPipeline('H', 'I').run(base);
	}

	@Test
	public void testResultIsInChomskyNormalForm(){
		assertTrue(result.grammar.isChomskyNormalForm());
		assertFalse(result.stage(EpsilonEliminator.class).output.hasShape(Shape.EPSILON));
		assertFalse(result.stage(UnitEliminator.class).output.hasShape(Shape.UNIT));
	}

	@Test
	public void testBaseProductionsAreKept(){
		for (Production production : base.getProductions()) {
			assertTrue(result.grammar.getProductions().contains(production), production.toString());
		}
	}

	@Test
	public void testOneProductionPerRule(){
		ProductionSet productions = result.grammar.getProductions();
		assertEquals(productions.size(), new HashSet<>(productions.stream().map(Production::key).collect(Collectors.toList())).size());
	}

	@Test
	public void testNullableProductions(){
		assertEquals(parseAll("S2->", "C3->"), result.stage(NullableClosure.class).added());
	}

	@Test
	public void testEpsilonElimination(){
		StageResult stage = result.stage(EpsilonEliminator.class);
		assertEquals(parseAll("S1->C", "S1->B", "A1->H", "S1->A", "C1->S", "B1->H", "C2->B"), stage.added());
		assertEquals(parseAll("A1->", "B1->", "S2->", "C3->"), stage.removed());
	}

	@Test
	public void testDerivedUnitProductions(){
		StageResult stage = result.stage(UnitClosure.class);
		assertTrue(stage.added().containsAll(parseAll("S2->H", "S2->I", "A1->I", "B1->I", "C2->A", "C3->H", "C3->I")));
		assertTrue(stage.removed().isEmpty());
	}

	@Test
	public void testFinalProductions(){
		ProductionSet productions = result.grammar.getProductions();
		assertTrue(productions.contains(parse("S1->a")));
		assertTrue(productions.contains(parse("S1->b")));
		assertTrue(productions.contains(parse("H1->a")));
		assertTrue(productions.contains(parse("S1->HA")));
		assertTrue(productions.contains(parse("C1->AB")));
	}

	@ParameterizedTest
	@CsvSource({
			"ab, 0",
			"aabb, 0",
			"aaabbb, 0",
			"a, 1",
			"b, 1",
			"abb, 1",
			"aab, 1",
			"bab, 1",
			"ba, 2"
	})
	public void testMinimalDistance(String word, int distance){
		assertEquals(distance, WeightedCYK.distance(result.grammar, word));
	}

	@Test
	public void testEveryNonEmptyWordIsDerivable(){
		for (String word : WeightedCYK.words("ab", 6)) {
			assertNotEquals(WeightedCYK.UNREACHABLE, WeightedCYK.distance(result.grammar, word), word);
		}
		assertEquals(WeightedCYK.UNREACHABLE, WeightedCYK.distance(result.grammar, ""));
	}

	@Test
	public void testReport(){
		String report = result.report();
		assertTrue(report.startsWith("Original productions:\nS->AC\n"));
		assertTrue(report.contains("Add nullable productions:\nS->[2]epsilon\nC->[3]epsilon\n"));
		assertTrue(report.contains("Final grammar\n"));
	}

	@Test
	public void testBaseIsNotModified(){
		assertEquals(5, base.getProductions().size());
		assertTrue(base.isChomskyNormalForm());
	}
}
