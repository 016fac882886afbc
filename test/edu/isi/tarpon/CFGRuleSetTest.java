package edu.isi.tarpon;

import java.io.BufferedReader;
import java.io.File;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class CFGRuleSetTest {

	private static CFGRuleSet read(String text) throws Exception {
		return new CFGRuleSet(new BufferedReader(new StringReader(text)));
	}

	private static String fixture(String name) throws URISyntaxException {
		return new File(CFGRuleSetTest.class.getResource("/grammars/"+name).toURI()).getPath();
	}

	@Test
	public void testExpressionResource() throws Exception {
		CFGRuleSet cfg = CFGRuleSet.expression();
		assertEquals("E", cfg.getStartState());
		assertEquals(7, cfg.getNumRules());
		assertEquals(3, cfg.getNumStates());
		assertEquals(6, cfg.getNumTerminals());
		assertTrue(cfg.getTerminals().contains("id"));
		assertTrue(cfg.getTerminals().contains("("));
		assertEquals(3, cfg.getRulesOfType("F").size());
		assertTrue(cfg.getRulesOfType("G").isEmpty());
	}

	@Test
	public void testCommentsAndBlankLines() throws Exception {
		CFGRuleSet cfg = read("% header\n\n   \nS   % start\nS -> a S   % recurse\n% between\nS -> b\n");
		assertEquals("S", cfg.getStartState());
		assertEquals(2, cfg.getNumRules());
		assertEquals(Arrays.asList("a", "S"), cfg.getRules().get(0).getRHS());
		assertEquals("S -> b", cfg.getRules().get(1).toString());
	}

	@Test
	public void testEpsilonRule() throws Exception {
		CFGRuleSet cfg = read("S\nS -> *e*\nS -> x S\n");
		assertTrue(cfg.getRules().get(0).isEpsilon());
		assertEquals("S -> *e*", cfg.getRules().get(0).toString());
		assertEquals(1, cfg.getNumTerminals());
	}

	@Test(expected = DataFormatException.class)
	public void testMissingArrow() throws Exception {
		read("S\nS a b\n");
	}

	@Test(expected = DataFormatException.class)
	public void testEmptyRightSide() throws Exception {
		read("S\nS ->\n");
	}

	@Test(expected = DataFormatException.class)
	public void testEpsilonMustStandAlone() throws Exception {
		read("S\nS -> a *e*\n");
	}

	@Test(expected = DataFormatException.class)
	public void testNoStartSymbol() throws Exception {
		read("% nothing here\n\n");
	}

	@Test(expected = DataFormatException.class)
	public void testNoRules() throws Exception {
		read("S\n% no rules\n");
	}

	@Test
	public void testErrorNamesLine() throws Exception {
		try {
			read("S\nS -> a\n\nbroken\n");
			fail("read a broken rule");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage(), e.getMessage().startsWith("Line 4:"));
		}
	}

	@Test
	public void testNormalFormOfExpression() throws Exception {
		NormalFormGrammar g = CFGRuleSet.expression().toNormalForm();
		assertEquals(14, g.getNumProductions());
		assertEquals(NonTerminal.E, g.getStartSymbol());
	}

	@Test
	public void testNormalFormIgnoresRuleOrder() throws Exception {
		CFGRuleSet cfg = new CFGRuleSet(fixture("expression-reordered.cfg"));
		assertTrue(cfg.isSameGrammar(CFGRuleSet.expression()));
		assertEquals(14, cfg.toNormalForm().getNumProductions());
	}

	@Test(expected = ImproperConversionException.class)
	public void testNoNormalFormForOtherGrammars() throws Exception {
		new CFGRuleSet(fixture("balanced.cfg")).toNormalForm();
	}

	@Test(expected = ImproperConversionException.class)
	public void testNoNormalFormWithOtherStart() throws Exception {
		List<CFGRule> rules = new ArrayList<CFGRule>(CFGRuleSet.expression().getRules());
		new CFGRuleSet("T", rules).toNormalForm();
	}

	@Test
	public void testRuleEquality() throws Exception {
		assertEquals(new CFGRule("E -> E + T"), new CFGRule("E  ->   E +  T"));
		assertEquals(new CFGRule("E -> E + T"), new CFGRule("E", Arrays.asList("E", "+", "T")));
		assertFalse(new CFGRule("E -> T + E").equals(new CFGRule("E -> E + T")));
	}
}
