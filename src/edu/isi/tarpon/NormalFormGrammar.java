package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar in normal form over {@link NonTerminal}: every production is
 * terminal, unit, binary or empty. Immutable; safe to share between parsers.
 * <p>
 * Lookups the recognizer needs are precomputed as arrays indexed by ordinal,
 * with sets of nonterminals kept as bit masks (see {@link NonTerminal#bit()}):
 * which nonterminals produce a terminal, which produce a pair B C, and which
 * reach a nonterminal through unit productions.
 */
public class NormalFormGrammar {

	private static final int NT = NonTerminal.values().length;
	static {
		if (NT > 64)
			throw new ExceptionInInitializerError("Too many nonterminals for long masks: "+NT);
	}

	private final NonTerminal start;
	private final List<Production> productions;
	// [lhs] -> productions in order
	private final Production[][] byLHS;
	// [token kind] -> {A | A -> t}
	private final long[] byTerminal;
	// [B][C] -> {A | A -> B C}
	private final long[][] byPair;
	// [B] -> {A | A =>* B by unit productions}, B included
	private final long[] unitClosure;

	public NormalFormGrammar(NonTerminal start, List<Production> prods) {
		boolean debug = false;
		if (start == null || prods == null)
			throw new IllegalArgumentException("Grammar needs a start symbol and productions");
		this.start = start;
		this.productions = Collections.unmodifiableList(new ArrayList<Production>(prods));

		ArrayList<ArrayList<Production>> lists = new ArrayList<ArrayList<Production>>();
		for (int i = 0; i < NT; i++)
			lists.add(new ArrayList<Production>());
		byTerminal = new long[TokenKind.values().length];
		byPair = new long[NT][NT];
		long[] unitParents = new long[NT];
		for (Production p : productions) {
			lists.get(p.getLHS().ordinal()).add(p);
			switch (p.getType()) {
			case TERMINAL:
				byTerminal[p.getTerminal().ordinal()] |= p.getLHS().bit();
				break;
			case UNIT:
				unitParents[p.getLeft().ordinal()] |= p.getLHS().bit();
				break;
			case BINARY:
				byPair[p.getLeft().ordinal()][p.getRight().ordinal()] |= p.getLHS().bit();
				break;
			default:
				// nullable marker; never fills a cell
				break;
			}
		}
		byLHS = new Production[NT][];
		for (int i = 0; i < NT; i++)
			byLHS[i] = lists.get(i).toArray(new Production[lists.get(i).size()]);

		// every nonterminal on a right side must be defined
		for (Production p : productions) {
			if (p.getLeft() != null && byLHS[p.getLeft().ordinal()].length == 0)
				throw new IllegalArgumentException(p+" uses "+p.getLeft()+", which has no productions");
			if (p.getRight() != null && byLHS[p.getRight().ordinal()].length == 0)
				throw new IllegalArgumentException(p+" uses "+p.getRight()+", which has no productions");
		}
		if (byLHS[start.ordinal()].length == 0)
			throw new IllegalArgumentException("Start symbol "+start+" has no productions");

		// reflexive, transitive closure of the unit productions
		unitClosure = new long[NT];
		for (int b = 0; b < NT; b++) {
			long reach = 1L << b;
			long frontier = reach;
			while (frontier != 0) {
				long next = 0;
				for (int x = 0; x < NT; x++)
					if ((frontier & (1L << x)) != 0)
						next |= unitParents[x];
				frontier = next & ~reach;
				reach |= next;
			}
			unitClosure[b] = reach;
		}
		if (debug) Debug.debug(debug, "Built grammar with "+productions.size()+" productions");
	}

	/**
	 * The expression grammar E -&gt; E + T | T, T -&gt; T * F | F, F -&gt; ( E ) | id | num
	 * in normal form. Fourteen productions.
	 */
	public static NormalFormGrammar expression() {
		List<Production> p = new ArrayList<Production>();
		p.add(Production.binary(NonTerminal.E, NonTerminal.E, NonTerminal.PLUS_T));
		p.add(Production.unit(NonTerminal.E, NonTerminal.T));
		p.add(Production.binary(NonTerminal.PLUS_T, NonTerminal.PLUS, NonTerminal.T));
		p.add(Production.binary(NonTerminal.T, NonTerminal.T, NonTerminal.TIMES_F));
		p.add(Production.unit(NonTerminal.T, NonTerminal.F));
		p.add(Production.binary(NonTerminal.TIMES_F, NonTerminal.TIMES, NonTerminal.F));
		p.add(Production.binary(NonTerminal.F, NonTerminal.LPAREN, NonTerminal.E_RPAREN));
		p.add(Production.terminal(NonTerminal.F, TokenKind.ID));
		p.add(Production.terminal(NonTerminal.F, TokenKind.NUM));
		p.add(Production.binary(NonTerminal.E_RPAREN, NonTerminal.E, NonTerminal.RPAREN));
		p.add(Production.terminal(NonTerminal.PLUS, TokenKind.PLUS));
		p.add(Production.terminal(NonTerminal.TIMES, TokenKind.TIMES));
		p.add(Production.terminal(NonTerminal.LPAREN, TokenKind.LPAREN));
		p.add(Production.terminal(NonTerminal.RPAREN, TokenKind.RPAREN));
		return new NormalFormGrammar(NonTerminal.E, p);
	}

	public NonTerminal getStartSymbol() { return start; }
	public List<Production> getProductions() { return productions; }
	public int getNumProductions() { return productions.size(); }

	public Production[] getProductions(NonTerminal lhs) {
		return byLHS[lhs.ordinal()].clone();
	}

	/** nonterminals with a production straight to t */
	public long terminalMask(TokenKind t) {
		return byTerminal[t.ordinal()];
	}

	/** nonterminals A with A -&gt; B C, by ordinal */
	public long pairMask(int b, int c) {
		return byPair[b][c];
	}

	/** the set plus everything reaching a member of it through unit productions */
	public long closeUnits(long mask) {
		long ret = mask;
		for (int b = 0; b < NT; b++)
			if ((mask & (1L << b)) != 0)
				ret |= unitClosure[b];
		return ret;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(start+"\n");
		for (Production p : productions)
			sb.append(p+"\n");
		return sb.toString();
	}
}
