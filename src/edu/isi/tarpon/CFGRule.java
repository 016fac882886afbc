package edu.isi.tarpon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// CFG Rule. String lhs, list of String rhs symbols. An empty rhs is the epsilon rule.
public class CFGRule {

	/** how an empty right side is written in rule files */
	public static final String EPSILON = "*e*";

	private final String lhs;
	private final List<String> rhs;

	public CFGRule(String inlhs, List<String> inrhs) {
		lhs = inlhs;
		rhs = Collections.unmodifiableList(new ArrayList<String>(inrhs));
	}

	// separate left from right
	private static Pattern sidesPat = Pattern.compile("(\\S+)\\s*->\\s*(.*?)\\s*$");
	private static Pattern spacePat = Pattern.compile("\\s+");

	// create rule from text representation: lhs -> sym sym ...
	public CFGRule(String text) throws DataFormatException {
		boolean debug = false;
		if (debug) Debug.debug(debug, "CFGRule: Creating out of "+text);
		Matcher sidesMatch = sidesPat.matcher(text);
		if (!sidesMatch.matches())
			throw new DataFormatException("Incorrect rule format: "+text);
		if (sidesMatch.group(2).length() == 0)
			throw new DataFormatException("RHS appears to be empty in "+text+"; write "+EPSILON+" for an empty rule");
		lhs = sidesMatch.group(1);
		if (lhs.equals(EPSILON))
			throw new DataFormatException("LHS may not be "+EPSILON+" in "+text);
		if (debug) Debug.debug(debug, "LHS is "+sidesMatch.group(1)+" and RHS is "+sidesMatch.group(2));

		ArrayList<String> syms = new ArrayList<String>();
		String[] parts = spacePat.split(sidesMatch.group(2));
		if (!(parts.length == 1 && parts[0].equals(EPSILON))) {
			for (String p : parts) {
				if (p.equals(EPSILON))
					throw new DataFormatException(EPSILON+" must stand alone in "+text);
				if (p.equals("->"))
					throw new DataFormatException("More than one arrow in "+text);
				syms.add(p);
			}
		}
		rhs = Collections.unmodifiableList(syms);
	}

	public String getLHS() { return lhs; }
	public List<String> getRHS() { return rhs; }
	public boolean isEpsilon() { return rhs.isEmpty(); }

	// equals if lhs and rhs sequence are the same
	public boolean equals(Object o) {
		if (!(o instanceof CFGRule))
			return false;
		CFGRule r = (CFGRule)o;
		return lhs.equals(r.lhs) && rhs.equals(r.rhs);
	}

	public int hashCode() {
		return 31*lhs.hashCode()+rhs.hashCode();
	}

	public String toString() {
		StringBuffer sb = new StringBuffer(lhs+" ->");
		if (rhs.isEmpty())
			sb.append(" "+EPSILON);
		for (String s : rhs)
			sb.append(" "+s);
		return sb.toString();
	}
}
