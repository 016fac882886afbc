package edu.isi.tarpon;

// the nonterminals of the expression grammar in normal form. Binary
// productions only combine nonterminals, so each operator and parenthesis
// gets a nonterminal of its own (PLUS, TIMES, LPAREN, RPAREN) and the
// three-symbol rules are split with PLUS_T, TIMES_F and E_RPAREN.
public enum NonTerminal {
	E,
	PLUS_T,
	T,
	TIMES_F,
	F,
	E_RPAREN,
	PLUS,
	TIMES,
	LPAREN,
	RPAREN;

	// chart cells are bit masks over ordinals
	public long bit() { return 1L << ordinal(); }
}
