package edu.isi.tarpon;

// kinds of tokens the lexer produces. The label is the terminal symbol the
// grammar uses for the kind.
public enum TokenKind {
	ID("id"),
	NUM("num"),
	PLUS("+"),
	TIMES("*"),
	LPAREN("("),
	RPAREN(")");

	private final String label;
	TokenKind(String label) {
		this.label = label;
	}
	public String getLabel() { return label; }

	// true for kinds whose lexeme is always exactly the label
	public boolean isLiteral() {
		return this != ID && this != NUM;
	}

	/** the operator/punctuation kind spelled by lexeme, or null */
	public static TokenKind forLiteral(String lexeme) {
		for (TokenKind k : values()) {
			if (k.isLiteral() && k.label.equals(lexeme))
				return k;
		}
		return null;
	}
}
