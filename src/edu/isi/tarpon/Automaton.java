package edu.isi.tarpon;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import gnu.trove.impl.Constants;
import gnu.trove.map.hash.TCharIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;

// deterministic finite automaton over single characters. Immutable once built.
// states and symbols are given small integer indices so that the lexer and the
// minimizer can work on arrays; the string ids are only for the outside world.
// the transition function may be partial: a missing move is an implicit reject.
public class Automaton {

	/** marker in the transition table for "no move" */
	public static final int NO_MOVE = -1;

	// index -> state id
	private final String[] stateNames;
	private final TObjectIntHashMap<String> stateIndex;

	// index -> symbol, ascending
	private final char[] symbols;
	private final TCharIntHashMap symbolIndex;

	// [state][symbol] -> state, or NO_MOVE
	private final int[][] delta;
	private final int start;
	private final boolean[] accepting;

	/**
	 * Build an automaton from a hand-specified table. States are indexed in
	 * their natural string order. Any inconsistency between the pieces is a
	 * programming error and raises IllegalArgumentException.
	 *
	 * @param states all state ids
	 * @param alphabet all symbols
	 * @param transitions state -> (symbol -> state); states with no moves may be left out
	 * @param startState the start state, a member of states
	 * @param acceptingStates a subset of states
	 */
	public Automaton(Set<String> states,
					 Set<Character> alphabet,
					 Map<String, Map<Character, String>> transitions,
					 String startState,
					 Set<String> acceptingStates) {
		boolean debug = false;
		if (states == null || alphabet == null || transitions == null || acceptingStates == null)
			throw new IllegalArgumentException("Automaton pieces may not be null");
		TreeSet<String> sortedStates = new TreeSet<String>(states);
		stateNames = sortedStates.toArray(new String[sortedStates.size()]);
		stateIndex = newStateIndex(stateNames);

		TreeSet<Character> sortedSymbols = new TreeSet<Character>(alphabet);
		symbols = new char[sortedSymbols.size()];
		int si = 0;
		for (Character c : sortedSymbols)
			symbols[si++] = c.charValue();
		symbolIndex = newSymbolIndex(symbols);

		if (startState == null || !stateIndex.containsKey(startState))
			throw new IllegalArgumentException("Start state "+startState+" is not one of the states");
		start = stateIndex.get(startState);

		accepting = new boolean[stateNames.length];
		for (String s : acceptingStates) {
			if (!stateIndex.containsKey(s))
				throw new IllegalArgumentException("Accepting state "+s+" is not one of the states");
			accepting[stateIndex.get(s)] = true;
		}

		delta = new int[stateNames.length][symbols.length];
		for (int[] row : delta)
			Arrays.fill(row, NO_MOVE);
		for (Map.Entry<String, Map<Character, String>> row : transitions.entrySet()) {
			if (!stateIndex.containsKey(row.getKey()))
				throw new IllegalArgumentException("Transition from unknown state "+row.getKey());
			int from = stateIndex.get(row.getKey());
			if (row.getValue() == null)
				continue;
			for (Map.Entry<Character, String> move : row.getValue().entrySet()) {
				if (move.getKey() == null || !symbolIndex.containsKey(move.getKey().charValue()))
					throw new IllegalArgumentException("Transition from "+row.getKey()+" on "+move.getKey()+", which is not in the alphabet");
				if (!stateIndex.containsKey(move.getValue()))
					throw new IllegalArgumentException("Transition from "+row.getKey()+" on "+move.getKey()+" to unknown state "+move.getValue());
				delta[from][symbolIndex.get(move.getKey().charValue())] = stateIndex.get(move.getValue());
			}
		}
		if (debug) Debug.debug(debug, "Built "+toString());
	}

	// already-indexed form; used by the minimizer, which guarantees consistency
	Automaton(String[] names, char[] syms, int[][] table, int startIndex, boolean[] acc) {
		stateNames = names;
		stateIndex = newStateIndex(names);
		symbols = syms;
		symbolIndex = newSymbolIndex(syms);
		delta = table;
		start = startIndex;
		accepting = acc;
	}

	private static TObjectIntHashMap<String> newStateIndex(String[] names) {
		TObjectIntHashMap<String> idx = new TObjectIntHashMap<String>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, NO_MOVE);
		for (int i = 0; i < names.length; i++)
			idx.put(names[i], i);
		return idx;
	}

	private static TCharIntHashMap newSymbolIndex(char[] syms) {
		TCharIntHashMap idx = new TCharIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, (char)0, NO_MOVE);
		for (int i = 0; i < syms.length; i++)
			idx.put(syms[i], i);
		return idx;
	}

	/** Equivalent automaton with the fewest states. See {@link Minimizer}. */
	public Automaton minimize() {
		return Minimizer.minimize(this);
	}

	// accessors by id

	public String getStartState() { return stateNames[start]; }
	public int getNumStates() { return stateNames.length; }
	public int getNumSymbols() { return symbols.length; }

	public Set<String> getStates() {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(stateNames)));
	}

	public Set<Character> getAlphabet() {
		Set<Character> ret = new LinkedHashSet<Character>();
		for (char c : symbols)
			ret.add(c);
		return Collections.unmodifiableSet(ret);
	}

	public Set<String> getAcceptingStates() {
		Set<String> ret = new LinkedHashSet<String>();
		for (int i = 0; i < accepting.length; i++)
			if (accepting[i])
				ret.add(stateNames[i]);
		return Collections.unmodifiableSet(ret);
	}

	public int getNumTransitions() {
		int count = 0;
		for (int[] row : delta)
			for (int t : row)
				if (t != NO_MOVE)
					count++;
		return count;
	}

	public boolean inAlphabet(char c) {
		return symbolIndex.containsKey(c);
	}

	/**
	 * @return the state reached from state on symbol, or null if there is no
	 * move (including symbols outside the alphabet)
	 */
	public String step(String state, char symbol) {
		if (!stateIndex.containsKey(state))
			throw new IllegalArgumentException("Unknown state "+state);
		int next = step(stateIndex.get(state), symbol);
		return next == NO_MOVE ? null : stateNames[next];
	}

	public boolean isAccepting(String state) {
		if (!stateIndex.containsKey(state))
			throw new IllegalArgumentException("Unknown state "+state);
		return accepting[stateIndex.get(state)];
	}

	// run over a whole string. true if it ends in an accepting state
	public boolean accepts(String s) {
		int curr = start;
		for (int i = 0; i < s.length(); i++) {
			curr = step(curr, s.charAt(i));
			if (curr == NO_MOVE)
				return false;
		}
		return accepting[curr];
	}

	// accessors by index

	public int getStartIndex() { return start; }
	public String getStateName(int state) { return stateNames[state]; }
	public char getSymbol(int sym) { return symbols[sym]; }
	public boolean isAccepting(int state) { return accepting[state]; }

	/** index of the symbol, or NO_MOVE if it isn't in the alphabet */
	public int getSymbolIndex(char c) {
		return symbolIndex.get(c);
	}

	public int step(int state, char symbol) {
		int sym = symbolIndex.get(symbol);
		if (sym == NO_MOVE)
			return NO_MOVE;
		return delta[state][sym];
	}

	// target by symbol index
	public int getTarget(int state, int sym) {
		return delta[state][sym];
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append("states "+Arrays.toString(stateNames)+"; start "+stateNames[start]+"; accepting "+getAcceptingStates()+"\n");
		for (int s = 0; s < delta.length; s++) {
			for (int c = 0; c < symbols.length; c++) {
				if (delta[s][c] != NO_MOVE)
					sb.append("\t"+stateNames[s]+" -"+symbols[c]+"-> "+stateNames[delta[s][c]]+"\n");
			}
		}
		return sb.toString();
	}
}
