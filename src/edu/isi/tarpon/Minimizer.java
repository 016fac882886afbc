package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;
import gnu.trove.stack.array.TIntArrayStack;

/**
 * Hopcroft's partition refinement. Produces an automaton accepting the same
 * language with the fewest states.
 * <p>
 * A partial transition function is completed with one extra sink state before
 * refinement. Afterwards the block of states equivalent to the sink (states
 * that can never reach acceptance) is dropped and moves into it become "no
 * move" again, so the result is the minimal partial automaton. If the start
 * state itself is dead, the result is a single non-accepting state with no
 * moves.
 * <p>
 * Result states are named S0, S1, ... in order of the smallest original state
 * index in each block; that original state is the block's representative.
 */
public class Minimizer {

	public static Automaton minimize(Automaton a) {
		boolean debug = false;
		Date preMinTime = new Date();
		int n = a.getNumStates();
		int k = a.getNumSymbols();

		// complete with a sink if any move is missing
		boolean needsSink = false;
		for (int s = 0; s < n && !needsSink; s++)
			for (int c = 0; c < k; c++)
				if (a.getTarget(s, c) == Automaton.NO_MOVE) {
					needsSink = true;
					break;
				}
		int total = needsSink ? n+1 : n;
		int sink = needsSink ? n : -1;
		int[][] delta = new int[total][k];
		for (int s = 0; s < total; s++) {
			for (int c = 0; c < k; c++) {
				int t = s == sink ? Automaton.NO_MOVE : a.getTarget(s, c);
				delta[s][c] = t == Automaton.NO_MOVE ? sink : t;
			}
		}

		// reverse index: [symbol][target] -> sources
		TIntArrayList[][] preds = new TIntArrayList[k][total];
		for (int s = 0; s < total; s++) {
			for (int c = 0; c < k; c++) {
				int t = delta[s][c];
				if (preds[c][t] == null)
					preds[c][t] = new TIntArrayList();
				preds[c][t].add(s);
			}
		}

		// initial partition. empty blocks are never added
		BitSet acc = new BitSet(total);
		BitSet rej = new BitSet(total);
		for (int s = 0; s < total; s++) {
			if (s != sink && a.isAccepting(s))
				acc.set(s);
			else
				rej.set(s);
		}
		Partition p = new Partition(total);
		int accBlock = p.addBlock(acc);
		p.addBlock(rej);

		TIntArrayStack work = new TIntArrayStack();
		TIntHashSet inWork = new TIntHashSet();
		if (accBlock >= 0) {
			work.push(accBlock);
			inWork.add(accBlock);
		}

		int splits = 0;
		while (work.size() > 0) {
			int splitterBlock = work.pop();
			inWork.remove(splitterBlock);
			// the splitter may itself be split below; refine against a snapshot
			BitSet splitter = (BitSet)p.getBlock(splitterBlock).clone();
			for (int c = 0; c < k; c++) {
				BitSet x = new BitSet(total);
				for (int t = splitter.nextSetBit(0); t >= 0; t = splitter.nextSetBit(t+1)) {
					TIntArrayList src = preds[c][t];
					if (src == null)
						continue;
					for (int i = 0; i < src.size(); i++)
						x.set(src.get(i));
				}
				if (x.isEmpty())
					continue;
				// blocks that X touches, in order of first touch
				TIntArrayList touched = new TIntArrayList();
				TIntHashSet seen = new TIntHashSet();
				for (int s = x.nextSetBit(0); s >= 0; s = x.nextSetBit(s+1)) {
					int b = p.blockOf(s);
					if (seen.add(b))
						touched.add(b);
				}
				for (int i = 0; i < touched.size(); i++) {
					int y = touched.get(i);
					BitSet inter = (BitSet)p.getBlock(y).clone();
					inter.and(x);
					int ySize = p.size(y);
					int iSize = inter.cardinality();
					if (iSize == ySize)
						continue;
					// y keeps Y - X, nb gets X & Y
					int nb = p.split(y, inter);
					splits++;
					if (debug) Debug.debug(debug, "Split block "+y+" on "+a.getSymbol(c)+": "+p.getBlock(y)+" / "+p.getBlock(nb));
					if (inWork.contains(y)) {
						work.push(nb);
						inWork.add(nb);
					}
					else {
						int smaller = iSize <= ySize - iSize ? nb : y;
						work.push(smaller);
						inWork.add(smaller);
					}
				}
			}
		}
		if (debug) Debug.debug(debug, splits+" splits; "+p.getNumBlocks()+" blocks");

		// the block equivalent to the sink, if any: non-accepting and closed under every move
		int deadBlock = -1;
		for (int b = 0; b < p.getNumBlocks() && deadBlock < 0; b++) {
			int rep = p.getBlock(b).nextSetBit(0);
			if (rep != sink && a.isAccepting(rep))
				continue;
			boolean closed = true;
			for (int c = 0; c < k && closed; c++)
				if (p.blockOf(delta[rep][c]) != b)
					closed = false;
			if (closed)
				deadBlock = b;
		}

		if (deadBlock >= 0 && p.blockOf(a.getStartIndex()) == deadBlock) {
			if (debug) Debug.debug(debug, "Start state is dead; language is empty");
			Debug.dbtime(3, preMinTime, "minimize automaton");
			int[][] none = new int[1][k];
			for (int c = 0; c < k; c++)
				none[0][c] = Automaton.NO_MOVE;
			return new Automaton(new String[] {"S0"}, symbolsOf(a), none, 0, new boolean[1]);
		}

		// order surviving blocks by representative
		ArrayList<Integer> kept = new ArrayList<Integer>();
		for (int b = 0; b < p.getNumBlocks(); b++)
			if (b != deadBlock)
				kept.add(b);
		final Partition fp = p;
		Collections.sort(kept, new Comparator<Integer>() {
			public int compare(Integer l, Integer r) {
				return fp.getBlock(l).nextSetBit(0) - fp.getBlock(r).nextSetBit(0);
			}
		});
		int[] newIndex = new int[p.getNumBlocks()];
		for (int i = 0; i < newIndex.length; i++)
			newIndex[i] = Automaton.NO_MOVE;
		for (int i = 0; i < kept.size(); i++)
			newIndex[kept.get(i)] = i;

		String[] names = new String[kept.size()];
		boolean[] newAcc = new boolean[kept.size()];
		int[][] newDelta = new int[kept.size()][k];
		for (int i = 0; i < kept.size(); i++) {
			int b = kept.get(i);
			int rep = p.getBlock(b).nextSetBit(0);
			names[i] = "S"+i;
			newAcc[i] = a.isAccepting(rep);
			for (int c = 0; c < k; c++)
				newDelta[i][c] = newIndex[p.blockOf(delta[rep][c])];
		}
		int newStart = newIndex[p.blockOf(a.getStartIndex())];
		Automaton ret = new Automaton(names, symbolsOf(a), newDelta, newStart, newAcc);
		if (debug) Debug.debug(debug, "Minimized "+n+" states to "+ret.getNumStates());
		Debug.dbtime(3, preMinTime, "minimize automaton");
		return ret;
	}

	private static char[] symbolsOf(Automaton a) {
		char[] syms = new char[a.getNumSymbols()];
		for (int c = 0; c < syms.length; c++)
			syms[c] = a.getSymbol(c);
		return syms;
	}
}
