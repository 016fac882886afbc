package edu.isi.tarpon;

import java.io.IOException;
import java.util.List;

/**
 * Lexer then recognizer. Both are built once; compile() may be called any
 * number of times, from any number of threads.
 */
public class Compiler {
	private final Lexer lexer;
	private final CYKRecognizer parser;

	// expression lexer and the normal form of the bundled expression grammar
	public Compiler() {
		this(new Lexer(), new CYKRecognizer(expressionGrammar()));
	}

	public Compiler(Lexer l, CYKRecognizer p) {
		lexer = l;
		parser = p;
	}

	// the bundled grammar can only fail to load from a broken build
	private static NormalFormGrammar expressionGrammar() {
		try {
			return CFGRuleSet.expression().toNormalForm();
		}
		catch (IOException e) {
			throw new IllegalStateException("Couldn't read bundled expression grammar", e);
		}
		catch (DataFormatException e) {
			throw new IllegalStateException("Bundled expression grammar is malformed", e);
		}
		catch (ImproperConversionException e) {
			throw new IllegalStateException("Bundled expression grammar has no normal form", e);
		}
	}

	public Lexer getLexer() { return lexer; }
	public CYKRecognizer getRecognizer() { return parser; }

	public CompileResult compile(String source) {
		boolean debug = false;
		long preLex = System.nanoTime();
		List<Token> tokens = lexer.tokenize(source);
		long lexNanos = System.nanoTime() - preLex;
		Debug.dbtime(1, lexNanos, "tokenize");

		long preParse = System.nanoTime();
		boolean accepted = parser.recognize(tokens);
		long parseNanos = System.nanoTime() - preParse;
		Debug.dbtime(1, parseNanos, "recognize");

		Metrics m = new Metrics(lexer.getAutomaton().getNumStates(),
								parser.getGrammar().getNumProductions(),
								lexNanos/1.0e9,
								parseNanos/1.0e9);
		if (debug) Debug.debug(debug, tokens.size()+" tokens; "+(accepted ? "accepted" : "rejected")+"; "+m);
		return new CompileResult(tokens, accepted, m);
	}
}
