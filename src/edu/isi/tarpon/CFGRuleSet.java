package edu.isi.tarpon;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Hashtable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A context-free grammar as read from a rule file. The first line that isn't
 * blank or a comment names the start symbol; every later such line is one rule,
 * <code>lhs -&gt; sym sym ...</code>, with <code>*e*</code> for an empty right
 * side. <code>%</code> starts a comment. Symbols on some left side are
 * nonterminals; everything else is a terminal.
 */
public class CFGRuleSet {

	/** classpath location of the expression grammar */
	public static final String EXPRESSION_RESOURCE = "/grammars/expression.cfg";

	private String startState;
	private ArrayList<CFGRule> rules;
	private LinkedHashSet<String> states;
	private LinkedHashSet<String> terminals;
	private Hashtable<String, ArrayList<CFGRule>> rulesByLHS;

	public CFGRuleSet(String start, List<CFGRule> inrules) {
		startState = start;
		rules = new ArrayList<CFGRule>(inrules);
		initialize();
	}

	public CFGRuleSet(String filename) throws FileNotFoundException, IOException, DataFormatException  {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(filename), "utf-8")));
	}
	public CFGRuleSet(String filename, String encoding) throws FileNotFoundException, IOException, DataFormatException  {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");

	// something that can be a start state -- no spaces
	// can be followed by whitespace and comment
	private static Pattern startStatePat = Pattern.compile("\\s*([^\\s%]+)\\s*(%.*)?");

	// strip comments off
	private static Pattern commentStripPat = Pattern.compile("\\s*(.*?[^\\s%])(\\s*(?:%.*)?)?");

	// read from file. the reader is closed when done
	public CFGRuleSet(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		try {
			String line = br.readLine();
			int lineno = 1;
			// 1) ignore all comments fields and blank lines in the header
			while (line != null && commentPat.matcher(line).matches()) {
				if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
				line = br.readLine();
				lineno++;
			}
			if (line == null)
				throw new DataFormatException("No start symbol found; grammar is empty");

			// 2) get start state
			Matcher startStateMatch = startStatePat.matcher(line);
			if (debug) Debug.debug(debug, "Trying to get a start state out of "+line);
			if (!startStateMatch.matches())
				throw new DataFormatException("Line "+lineno+": could not find start symbol in "+line);
			startState = startStateMatch.group(1);

			// 3) get rules, skipping white space and comments
			rules = new ArrayList<CFGRule>();
			while ((line = br.readLine()) != null) {
				lineno++;
				if (commentPat.matcher(line).matches()) {
					if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
					continue;
				}
				Matcher commentStripMatch = commentStripPat.matcher(line);
				if (!commentStripMatch.matches())
					throw new DataFormatException("Line "+lineno+": couldn't strip comments off of "+line);
				String ruleText = commentStripMatch.group(1);
				if (debug) Debug.debug(debug, "Isolated "+ruleText+" for rule");
				try {
					rules.add(new CFGRule(ruleText));
				}
				catch (DataFormatException e) {
					throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
				}
			}
		}
		finally {
			br.close();
		}
		if (rules.isEmpty())
			throw new DataFormatException("Grammar with start symbol "+startState+" has no rules");
		initialize();
	}

	/** the bundled expression grammar E -&gt; E + T | T, T -&gt; T * F | F, F -&gt; ( E ) | id | num */
	public static CFGRuleSet expression() throws IOException, DataFormatException {
		InputStream is = CFGRuleSet.class.getResourceAsStream(EXPRESSION_RESOURCE);
		if (is == null)
			throw new IOException("Missing grammar resource "+EXPRESSION_RESOURCE);
		return new CFGRuleSet(new BufferedReader(new InputStreamReader(is, "utf-8")));
	}

	// find out what's a state, what's a term
	private void initialize() {
		states = new LinkedHashSet<String>();
		states.add(startState);
		rulesByLHS = new Hashtable<String, ArrayList<CFGRule>>();
		for (CFGRule r : rules) {
			states.add(r.getLHS());
			if (!rulesByLHS.containsKey(r.getLHS()))
				rulesByLHS.put(r.getLHS(), new ArrayList<CFGRule>());
			rulesByLHS.get(r.getLHS()).add(r);
		}
		terminals = new LinkedHashSet<String>();
		for (CFGRule r : rules)
			for (String s : r.getRHS())
				if (!states.contains(s))
					terminals.add(s);
	}

	public String getStartState() { return startState; }
	public List<CFGRule> getRules() { return Collections.unmodifiableList(rules); }
	public Set<String> getStates() { return Collections.unmodifiableSet(states); }
	public Set<String> getTerminals() { return Collections.unmodifiableSet(terminals); }
	public int getNumRules() { return rules.size(); }
	public int getNumStates() { return states.size(); }
	public int getNumTerminals() { return terminals.size(); }

	public List<CFGRule> getRulesOfType(String lhs) {
		if (!rulesByLHS.containsKey(lhs))
			return Collections.emptyList();
		return Collections.unmodifiableList(rulesByLHS.get(lhs));
	}

	// same start symbol and same rules, in any order
	public boolean isSameGrammar(CFGRuleSet o) {
		return startState.equals(o.startState) && new HashSet<CFGRule>(rules).equals(new HashSet<CFGRule>(o.rules));
	}

	/**
	 * Normal form of this grammar for the CYK recognizer. There is no general
	 * conversion: the only grammar with a known normal form is the expression
	 * grammar, which maps to {@link NormalFormGrammar#expression()}. Any other
	 * grammar is refused rather than given an unrelated table.
	 */
	public NormalFormGrammar toNormalForm() throws ImproperConversionException {
		CFGRuleSet known;
		try {
			known = expression();
		}
		catch (IOException e) {
			throw new ImproperConversionException("Couldn't load expression grammar to compare against", e);
		}
		catch (DataFormatException e) {
			throw new ImproperConversionException("Bundled expression grammar is malformed", e);
		}
		if (!isSameGrammar(known))
			throw new ImproperConversionException("No normal form known for grammar with start symbol "+startState+" and "+rules.size()+" rules; only the expression grammar can be converted");
		return NormalFormGrammar.expression();
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(startState+"\n");
		for (CFGRule r : rules)
			sb.append(r+"\n");
		return sb.toString();
	}
}
