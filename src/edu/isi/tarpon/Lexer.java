package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Longest-match scanner. Drives a minimized automaton over the source,
 * restarting from the start state at each token. Input is lower-cased before
 * it is fed to the automaton, so scanning is case-insensitive for ascii; lexemes keep
 * their original case. Characters outside the alphabet, and characters no
 * token can start with, are skipped.
 * <p>
 * Holds no per-call state, so one lexer may be shared by several threads.
 */
public class Lexer {

	private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";
	private static final String DIGITS = "0123456789";
	private static final String OPERATORS = "+*()";

	private final Automaton dfa;
	private final int originalStates;

	// lexer for the expression language
	public Lexer() {
		this(expressionAutomaton());
	}

	/** minimizes the given automaton and scans with the result */
	public Lexer(Automaton unminimized) {
		originalStates = unminimized.getNumStates();
		dfa = unminimized.minimize();
	}

	/**
	 * The hand-built expression automaton: q0 is the start, letters lead to
	 * and loop in q1 (identifiers), digits lead to and loop in q2 (numbers),
	 * and each operator or parenthesis leads to q3. q1, q2 and q3 accept.
	 */
	public static Automaton expressionAutomaton() {
		Set<String> states = new HashSet<String>();
		states.add("q0");
		states.add("q1");
		states.add("q2");
		states.add("q3");
		Set<Character> alphabet = new HashSet<Character>();
		Map<String, Map<Character, String>> transitions = new HashMap<String, Map<Character, String>>();
		for (String s : states)
			transitions.put(s, new HashMap<Character, String>());
		for (char c : LETTERS.toCharArray()) {
			alphabet.add(c);
			transitions.get("q0").put(c, "q1");
			transitions.get("q1").put(c, "q1");
		}
		for (char d : DIGITS.toCharArray()) {
			alphabet.add(d);
			transitions.get("q0").put(d, "q2");
			transitions.get("q2").put(d, "q2");
		}
		for (char op : OPERATORS.toCharArray()) {
			alphabet.add(op);
			transitions.get("q0").put(op, "q3");
		}
		Set<String> accepting = new HashSet<String>();
		accepting.add("q1");
		accepting.add("q2");
		accepting.add("q3");
		return new Automaton(states, alphabet, transitions, "q0", accepting);
	}

	public Automaton getAutomaton() { return dfa; }
	public int getOriginalStateCount() { return originalStates; }

	public List<Token> tokenize(String source) {
		boolean debug = false;
		List<Token> tokens = new ArrayList<Token>();
		int len = source.length();
		int pos = 0;
		while (pos < len) {
			int state = dfa.getStartIndex();
			int startPos = pos;
			int lastAccept = -1;
			while (pos < len) {
				char c = source.charAt(pos);
				// only ascii letters fold
				if (c >= 'A' && c <= 'Z')
					c = (char)(c - 'A' + 'a');
				if (!dfa.inAlphabet(c))
					break;
				state = dfa.step(state, c);
				if (state == Automaton.NO_MOVE)
					break;
				if (dfa.isAccepting(state))
					lastAccept = pos;
				pos++;
			}
			if (lastAccept >= 0) {
				Token t = classify(source.substring(startPos, lastAccept+1));
				if (debug) Debug.debug(debug, "Token "+t+" at "+startPos);
				tokens.add(t);
				pos = lastAccept+1;
			}
			else {
				if (debug) Debug.debug(debug, "Skipping '"+source.charAt(startPos)+"' at "+startPos);
				pos = startPos+1;
			}
		}
		return tokens;
	}

	// literal operators first, then identifiers by their leading letter, numbers otherwise
	private static Token classify(String lexeme) {
		TokenKind lit = TokenKind.forLiteral(lexeme);
		if (lit != null)
			return new Token(lit, lexeme);
		if (Character.isLetter(lexeme.charAt(0)))
			return new Token(TokenKind.ID, lexeme);
		return new Token(TokenKind.NUM, lexeme);
	}
}
