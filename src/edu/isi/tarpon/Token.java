package edu.isi.tarpon;

// one lexed token: its kind and the exact text it matched
public final class Token {
	private final TokenKind kind;
	private final String lexeme;

	public Token(TokenKind kind, String lexeme) {
		if (kind == null || lexeme == null)
			throw new IllegalArgumentException("Token needs a kind and a lexeme");
		this.kind = kind;
		this.lexeme = lexeme;
	}

	public TokenKind getKind() { return kind; }
	public String getLexeme() { return lexeme; }

	public boolean equals(Object o) {
		if (!(o instanceof Token))
			return false;
		Token t = (Token)o;
		return kind == t.kind && lexeme.equals(t.lexeme);
	}

	public int hashCode() {
		return 31*kind.hashCode()+lexeme.hashCode();
	}

	public String toString() { return "("+kind.getLabel()+", "+lexeme+")"; }
}
