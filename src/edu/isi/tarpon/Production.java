package edu.isi.tarpon;

/**
 * One production of a normal-form grammar: A -&gt; a (terminal), A -&gt; B (unit),
 * A -&gt; B C (binary), or A -&gt; *e* (empty). Immutable.
 */
public final class Production {

	public enum Type { TERMINAL, UNIT, BINARY, EMPTY }

	private final NonTerminal lhs;
	private final Type type;
	private final TokenKind terminal;
	private final NonTerminal left;
	private final NonTerminal right;

	private Production(NonTerminal lhs, Type type, TokenKind terminal, NonTerminal left, NonTerminal right) {
		if (lhs == null)
			throw new IllegalArgumentException("Production needs a left side");
		this.lhs = lhs;
		this.type = type;
		this.terminal = terminal;
		this.left = left;
		this.right = right;
	}

	public static Production terminal(NonTerminal lhs, TokenKind t) {
		if (t == null)
			throw new IllegalArgumentException("Terminal production of "+lhs+" needs a terminal");
		return new Production(lhs, Type.TERMINAL, t, null, null);
	}
	public static Production unit(NonTerminal lhs, NonTerminal b) {
		if (b == null)
			throw new IllegalArgumentException("Unit production of "+lhs+" needs a nonterminal");
		return new Production(lhs, Type.UNIT, null, b, null);
	}
	public static Production binary(NonTerminal lhs, NonTerminal b, NonTerminal c) {
		if (b == null || c == null)
			throw new IllegalArgumentException("Binary production of "+lhs+" needs two nonterminals");
		return new Production(lhs, Type.BINARY, null, b, c);
	}
	public static Production empty(NonTerminal lhs) {
		return new Production(lhs, Type.EMPTY, null, null, null);
	}

	public NonTerminal getLHS() { return lhs; }
	public Type getType() { return type; }
	// only for TERMINAL
	public TokenKind getTerminal() { return terminal; }
	// the single nonterminal of UNIT, the first of BINARY
	public NonTerminal getLeft() { return left; }
	// second nonterminal of BINARY
	public NonTerminal getRight() { return right; }

	public boolean equals(Object o) {
		if (!(o instanceof Production))
			return false;
		Production p = (Production)o;
		return lhs == p.lhs && type == p.type && terminal == p.terminal && left == p.left && right == p.right;
	}

	public int hashCode() {
		int h = lhs.hashCode();
		h = 31*h + type.hashCode();
		h = 31*h + (terminal == null ? 0 : terminal.hashCode());
		h = 31*h + (left == null ? 0 : left.hashCode());
		h = 31*h + (right == null ? 0 : right.hashCode());
		return h;
	}

	public String toString() {
		switch (type) {
		case TERMINAL:
			return lhs+" -> "+terminal.getLabel();
		case UNIT:
			return lhs+" -> "+left;
		case BINARY:
			return lhs+" -> "+left+" "+right;
		default:
			return lhs+" -> *e*";
		}
	}
}
