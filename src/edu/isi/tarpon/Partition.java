package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.BitSet;

// working set of the minimizer: disjoint, non-empty blocks of state indices.
// blocks live in an arena and are named by their position in it; a block keeps
// its index when it is split, and the split-off half gets a fresh one.
class Partition {
	private final ArrayList<BitSet> blocks;
	// state index -> block index; -1 until the state is placed
	private final int[] blockOf;

	Partition(int numStates) {
		blocks = new ArrayList<BitSet>();
		blockOf = new int[numStates];
		for (int i = 0; i < numStates; i++)
			blockOf[i] = -1;
	}

	/**
	 * Add a block of states that are in no block yet. Empty blocks are
	 * refused, and -1 is returned for them.
	 */
	int addBlock(BitSet members) {
		if (members.isEmpty())
			return -1;
		int b = blocks.size();
		for (int s = members.nextSetBit(0); s >= 0; s = members.nextSetBit(s+1)) {
			if (blockOf[s] != -1)
				throw new IllegalArgumentException("State "+s+" is already in block "+blockOf[s]);
			blockOf[s] = b;
		}
		blocks.add((BitSet)members.clone());
		return b;
	}

	int getNumBlocks() { return blocks.size(); }
	int getNumStates() { return blockOf.length; }
	int blockOf(int state) { return blockOf[state]; }
	int size(int block) { return blocks.get(block).cardinality(); }

	// read-only view; callers clone before modifying
	BitSet getBlock(int block) { return blocks.get(block); }

	/**
	 * Move the given states, all members of block, into a new block. Both
	 * halves must end up non-empty.
	 * @return index of the new block
	 */
	int split(int block, BitSet moved) {
		BitSet y = blocks.get(block);
		BitSet rest = (BitSet)y.clone();
		rest.andNot(moved);
		if (moved.isEmpty() || rest.isEmpty())
			throw new IllegalArgumentException("Split of block "+block+" would leave an empty half");
		int nb = blocks.size();
		BitSet half = (BitSet)moved.clone();
		for (int s = half.nextSetBit(0); s >= 0; s = half.nextSetBit(s+1)) {
			if (blockOf[s] != block)
				throw new IllegalArgumentException("State "+s+" is not in block "+block);
			blockOf[s] = nb;
		}
		blocks.set(block, rest);
		blocks.add(half);
		return nb;
	}

	public String toString() {
		return blocks.toString();
	}
}
