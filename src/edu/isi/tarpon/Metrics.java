package edu.isi.tarpon;

// sizes and timings of one compile. Purely observational
public final class Metrics {
	private final int lexStates;
	private final int parseProductions;
	private final double lexTime;
	private final double parseTime;

	public Metrics(int lexStates, int parseProductions, double lexTime, double parseTime) {
		this.lexStates = lexStates;
		this.parseProductions = parseProductions;
		this.lexTime = lexTime;
		this.parseTime = parseTime;
	}

	/** states in the minimized lexer automaton */
	public int getLexStates() { return lexStates; }
	/** productions in the normal-form grammar */
	public int getParseProductions() { return parseProductions; }
	/** seconds spent tokenizing */
	public double getLexTime() { return lexTime; }
	/** seconds spent recognizing */
	public double getParseTime() { return parseTime; }

	public String toString() {
		return "lex_states="+lexStates+" parse_prods="+parseProductions+
			" lex_time="+Rounding.fixed(lexTime, 6)+" parse_time="+Rounding.fixed(parseTime, 6);
	}
}
