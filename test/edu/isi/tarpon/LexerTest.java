package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class LexerTest {

	private final Lexer lexer = new Lexer();

	private static List<TokenKind> kinds(List<Token> tokens) {
		List<TokenKind> ret = new ArrayList<TokenKind>();
		for (Token t : tokens)
			ret.add(t.getKind());
		return ret;
	}

	private static List<String> lexemes(List<Token> tokens) {
		List<String> ret = new ArrayList<String>();
		for (Token t : tokens)
			ret.add(t.getLexeme());
		return ret;
	}

	@Test
	public void testExpression() {
		List<Token> tokens = lexer.tokenize("a + 1 * ( b + 2 )");
		assertEquals("[(id, a), (+, +), (num, 1), (*, *), ((, (), (id, b), (+, +), (num, 2), (), ))]", tokens.toString());
	}

	@Test
	public void testNoSpacesNeeded() {
		List<Token> tokens = lexer.tokenize("x1*(y+22)");
		assertEquals("[x, 1, *, (, y, +, 22, )]", lexemes(tokens).toString());
	}

	@Test
	public void testSplitsAtLetterDigitBoundary() {
		List<Token> tokens = lexer.tokenize("identifier123");
		assertEquals(2, tokens.size());
		assertEquals(new Token(TokenKind.ID, "identifier"), tokens.get(0));
		assertEquals(new Token(TokenKind.NUM, "123"), tokens.get(1));
		// and the other way round
		assertEquals("[(num, 123), (id, abc)]", lexer.tokenize("123abc").toString());
	}

	@Test
	public void testInvalidCharactersDropped() {
		assertEquals("[(id, ab), (id, cd)]", lexer.tokenize("ab#cd").toString());
		assertEquals("[(num, 12), (num, 34)]", lexer.tokenize("12 # 34").toString());
		assertEquals("[(id, a), (+, +), (id, b)]", lexer.tokenize("a+#b").toString());
		assertTrue(lexer.tokenize("#$%&-").isEmpty());
	}

	@Test
	public void testOnlyAsciiLettersFold() {
		// dotted capital I and the kelvin sign lower-case to i and k outside ascii
		assertEquals("[(id, x)]", lexer.tokenize("\u0130x").toString());
		assertTrue(lexer.tokenize("\u212A").isEmpty());
		assertEquals("[(id, A), (id, b)]", lexer.tokenize("A\u00C9b").toString());
	}

	@Test
	public void testEmptyInput() {
		assertTrue(lexer.tokenize("").isEmpty());
		assertTrue(lexer.tokenize("   \t\n").isEmpty());
	}

	@Test
	public void testCaseInsensitiveLexemesKeepCase() {
		List<Token> tokens = lexer.tokenize("Foo+BAR");
		assertEquals("[Foo, +, BAR]", lexemes(tokens).toString());
		assertEquals(TokenKind.ID, tokens.get(0).getKind());
		assertEquals(TokenKind.ID, tokens.get(2).getKind());
	}

	@Test
	public void testOperatorsAreSingleTokens() {
		List<Token> tokens = lexer.tokenize("++)(");
		List<TokenKind> expected = new ArrayList<TokenKind>();
		expected.add(TokenKind.PLUS);
		expected.add(TokenKind.PLUS);
		expected.add(TokenKind.RPAREN);
		expected.add(TokenKind.LPAREN);
		assertEquals(expected, kinds(tokens));
	}

	@Test
	public void testLexerUsesMinimizedAutomaton() {
		assertEquals(4, lexer.getOriginalStateCount());
		assertEquals(4, lexer.getAutomaton().getNumStates());
		assertEquals("S0", lexer.getAutomaton().getStartState());
	}

	@Test
	public void testLongestMatchBacksUp() {
		// accepts "a" and "abc" but not "ab"
		Automaton abc = AutomatonFixtures.build("s", new String[] {"p", "r"}, "abc",
				"s a p", "p b q", "q c r");
		Lexer l = new Lexer(abc);
		assertEquals("[abc, a]", lexemes(l.tokenize("abcab")).toString());
		assertEquals("[a, abc]", lexemes(l.tokenize("aabc")).toString());
	}

	@Test
	public void testSymbolWithNoStartMoveIsSkipped() {
		// b is in the alphabet, but nothing starts with it
		Automaton a = AutomatonFixtures.build("s", new String[] {"p"}, "ab", "s a p", "p b p");
		Lexer l = new Lexer(a);
		assertEquals("[abbb, a]", lexemes(l.tokenize("babbba")).toString());
		assertEquals("[(id, abb)]", l.tokenize("bbabb").toString());
	}

	@Test
	public void testMinimizingCustomAutomatonShrinksIt() {
		// two equivalent accepting states
		Automaton a = AutomatonFixtures.build("s", new String[] {"p", "q"}, "ab",
				"s a p", "s b q", "p a p", "q a q");
		Lexer l = new Lexer(a);
		assertEquals(3, l.getOriginalStateCount());
		assertEquals(2, l.getAutomaton().getNumStates());
		assertEquals("[aa, ba, ba]", lexemes(l.tokenize("aababa")).toString());
	}
}
