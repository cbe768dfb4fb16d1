package cover.transform;

import java.util.*;

import org.junit.jupiter.api.Test;

import cover.InvalidGrammarError;
import cover.grammar.*;

import static cover.grammar.ProductionParser.parseAll;
import static org.junit.jupiter.api.Assertions.*;

public class CoverConstructorTest {

	@Test
	public void testSingleTerminalProduction(){
		ProductionSet cover = new CoverConstructor(Terminal.alphabet("ab"), 'H', 'I').apply(ProductionSet.of("A->a"));
		assertEquals(parseAll("A->a", "H->HI", "H->I", "I1->a", "I1->b", "A1->b", "A1->", "A->HA", "A->AH"),
				cover.asList());
	}

	@Test
	public void testErrorProductionsOfWeightedTerminalProductionCostOne(){
		ProductionSet cover = new CoverConstructor(Terminal.alphabet("ab"), 'H', 'I').apply(ProductionSet.of("A1->a"));
		assertEquals(parseAll("A1->a", "H->HI", "H->I", "I1->a", "I1->b", "A1->b", "A1->", "A->HA", "A->AH"),
				cover.asList());
	}

	@Test
	public void testBaseIsNotModified(){
		ProductionSet base = ProductionSet.of("S->AB", "A->a", "B->b");
		ProductionSet copy = base.copy();
		new CoverConstructor(Terminal.alphabet("ab"), 'H', 'I').apply(base);
		assertEquals(copy, base);
	}

	@Test
	public void testOnlyTerminalProductionsGetErrorProductions(){
		ProductionSet cover = new CoverConstructor(Terminal.alphabet("ab"), 'H', 'I')
				.apply(ProductionSet.of("S->AB", "A->a", "B->b"));
		assertTrue(cover.productionsOf(NonTerminal.of('S')).equals(parseAll("S->AB")));
		assertTrue(cover.contains(ProductionParser.parse("B1->a")));
		assertTrue(cover.contains(ProductionParser.parse("B1->")));
		assertTrue(cover.contains(ProductionParser.parse("B->BH")));
	}

	@Test
	public void testSubstitutionDoesNotOverrideCheaperProduction(){
		ProductionSet cover = new CoverConstructor(Terminal.alphabet("ab"), 'H', 'I')
				.apply(ProductionSet.of("A->a", "A->b"));
		assertTrue(cover.contains(ProductionParser.parse("A->a")));
		assertTrue(cover.contains(ProductionParser.parse("A->b")));
		assertEquals(1, cover.epsilonProductionOf(NonTerminal.of('A')).distance);
	}

	@Test
	public void testEmptyAlphabet(){
		ProductionSet cover = new CoverConstructor(Collections.emptyList(), 'H', 'I').apply(ProductionSet.of("A->a"));
		assertEquals(parseAll("A->a", "H->HI", "H->I", "A1->", "A->HA", "A->AH"), cover.asList());
	}

	@Test
	public void testInsertionNonTerminalsAreFresh(){
		ProductionSet cover = new CoverConstructor(Terminal.alphabet("a"), 'H', 'I').apply(ProductionSet.of("H->a"));
		assertEquals(parseAll("H->a", "I->IJ", "I->J", "J1->a", "H1->", "H->IH", "H->HI"), cover.asList());
	}

	@Test
	public void testFreshNonTerminalWrapsAround(){
		Set<NonTerminal> used = new HashSet<>();
		for (char c = 'B'; c <= 'Z'; c++){
			used.add(NonTerminal.of(c));
		}
		assertEquals(NonTerminal.of('A'), CoverConstructor.freshNonTerminal('Y', used));
		used.add(NonTerminal.of('A'));
		assertThrows(InvalidGrammarError.class, () -> CoverConstructor.freshNonTerminal('H', used));
	}
}
