package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// what compile() hands back: the tokens, the verdict, and the metrics
public final class CompileResult {
	private final List<Token> tokens;
	private final boolean accepted;
	private final Metrics metrics;

	public CompileResult(List<Token> tokens, boolean accepted, Metrics metrics) {
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
		this.accepted = accepted;
		this.metrics = metrics;
	}

	public List<Token> getTokens() { return tokens; }
	public boolean isAccepted() { return accepted; }
	public Metrics getMetrics() { return metrics; }
}
