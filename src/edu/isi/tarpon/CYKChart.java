package edu.isi.tarpon;

import java.util.EnumSet;

// triangular table of a CYK parse. Cell (i,j), 0 <= i < j <= n, is the set of
// nonterminals deriving tokens i..j-1, stored as a bit mask over ordinals.
public class CYKChart {
	private final int n;
	// cells[i][j-i-1]
	private final long[][] cells;

	CYKChart(int length) {
		n = length;
		cells = new long[n][];
		for (int i = 0; i < n; i++)
			cells[i] = new long[n-i];
	}

	public int getLength() { return n; }

	public long getMask(int i, int j) {
		if (i < 0 || j > n || i >= j)
			throw new IndexOutOfBoundsException("No cell ("+i+","+j+") in chart of length "+n);
		return cells[i][j-i-1];
	}

	void setMask(int i, int j, long mask) {
		cells[i][j-i-1] = mask;
	}

	public EnumSet<NonTerminal> getCell(int i, int j) {
		long mask = getMask(i, j);
		EnumSet<NonTerminal> ret = EnumSet.noneOf(NonTerminal.class);
		for (NonTerminal nt : NonTerminal.values())
			if ((mask & nt.bit()) != 0)
				ret.add(nt);
		return ret;
	}

	public boolean derives(NonTerminal nt, int i, int j) {
		return (getMask(i, j) & nt.bit()) != 0;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (int len = 1; len <= n; len++)
			for (int i = 0; i+len <= n; i++)
				if (getMask(i, i+len) != 0)
					sb.append("["+i+","+(i+len)+"] "+getCell(i, i+len)+"\n");
		return sb.toString();
	}
}
