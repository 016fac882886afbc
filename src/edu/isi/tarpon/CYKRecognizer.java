package edu.isi.tarpon;

import java.util.Date;
import java.util.List;

/**
 * Cocke-Younger-Kasami recognizer over a {@link NormalFormGrammar}. Decides
 * whether a token sequence is in the grammar's language; no tree is built and
 * no error position is reported. The whole chart is always filled, so parsing
 * is cubic in the number of tokens; callers bound the input length.
 * <p>
 * The chart is allocated per call, so one recognizer may be shared between
 * threads.
 */
public class CYKRecognizer {
	private final NormalFormGrammar grammar;

	public CYKRecognizer(NormalFormGrammar g) {
		if (g == null)
			throw new IllegalArgumentException("Recognizer needs a grammar");
		grammar = g;
	}

	public NormalFormGrammar getGrammar() { return grammar; }

	// accept iff the start symbol spans the whole sequence. The empty sequence is rejected
	public boolean recognize(List<Token> tokens) {
		int n = tokens.size();
		if (n == 0)
			return false;
		return buildChart(tokens).derives(grammar.getStartSymbol(), 0, n);
	}

	public CYKChart buildChart(List<Token> tokens) {
		boolean debug = false;
		Date preParseTime = new Date();
		int n = tokens.size();
		CYKChart chart = new CYKChart(n);
		// single tokens
		for (int i = 0; i < n; i++) {
			long cell = grammar.closeUnits(grammar.terminalMask(tokens.get(i).getKind()));
			chart.setMask(i, i+1, cell);
			if (debug) Debug.debug(debug, "["+i+","+(i+1)+"] "+chart.getCell(i, i+1));
		}
		// longer spans, shortest first
		for (int len = 2; len <= n; len++) {
			for (int i = 0; i+len <= n; i++) {
				int j = i+len;
				long cell = 0;
				for (int k = i+1; k < j; k++) {
					long left = chart.getMask(i, k);
					if (left == 0)
						continue;
					long right = chart.getMask(k, j);
					if (right == 0)
						continue;
					for (long l = left; l != 0; l &= l-1) {
						int b = Long.numberOfTrailingZeros(l);
						for (long r = right; r != 0; r &= r-1)
							cell |= grammar.pairMask(b, Long.numberOfTrailingZeros(r));
					}
				}
				cell = grammar.closeUnits(cell);
				chart.setMask(i, j, cell);
				if (debug && cell != 0) Debug.debug(debug, "["+i+","+j+"] "+chart.getCell(i, j));
			}
		}
		Debug.dbtime(3, preParseTime, "fill cyk chart");
		return chart;
	}
}
