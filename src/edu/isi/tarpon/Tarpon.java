package edu.isi.tarpon;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class Tarpon {
	// version number. change this when updating tarpon!
	static final String VERSION = "1.0";

	/** compiled when no source is given */
	public static final String DEMO_SOURCE = "a + 1 * ( b + 2 )";

	// everything having to do with the JSAP parameters.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// encoding of the diagnostic stream
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of grammar files and diagnostic output, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// grammar to convert instead of the bundled one
		FlaggedOption grammaropt = new FlaggedOption("grammar",
				FileStringParser.getParser().setMustExist(true),
				JSAP.NO_DEFAULT,
				false,
				'g',
				"grammar",
				"rule file of a context-free grammar to recognize with instead of the bundled expression grammar. "+
		"The grammar must have a known normal form");
		jsap.registerParameter(grammaropt);

		// timing
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				't',
				"time",
				"print timing information to stderr. Higher levels give more detail: 1 for "+
		"tokenizing and recognizing, 2 for setup, 3 for minimization and chart filling");
		jsap.registerParameter(timeopt);

		// what we compile
		UnflaggedOption sourceopt = new UnflaggedOption("source",
				StringStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				true,
				"source strings to compile, each reported in turn. If none are given, \""+DEMO_SOURCE+"\" is compiled");
		jsap.registerParameter(sourceopt);

		JSAPResult config = jsap.parse(argv);
		if (config.contains("time") && config.getInt("time") < 0)
			throw new ConfigureException("Time level must not be negative: "+config.getInt("time"));
		return config;
	}

	// the report printed for one compiled source
	public static String report(String source, CompileResult result) {
		StringBuffer sb = new StringBuffer();
		Metrics m = result.getMetrics();
		sb.append("Source: "+source+"\n");
		sb.append("Tokens: "+result.getTokens()+"\n");
		sb.append("Parse "+(result.isAccepted() ? "success" : "failure")+"\n");
		sb.append("\n");
		sb.append("Optimization Results:\n");
		sb.append("Lexer states: "+m.getLexStates()+"\n");
		sb.append("Productions: "+m.getParseProductions()+"\n");
		sb.append("Lex time: "+Rounding.fixed(m.getLexTime(), 6)+"s\n");
		sb.append("Parse time: "+Rounding.fixed(m.getParseTime(), 6)+"s\n");
		return sb.toString();
	}

	/**
	 * Run with the given arguments, writing reports to out.
	 * @return the process exit code
	 */
	public static int run(String[] argv, PrintStream out) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;

		// 1) Set up all parameters. Die on bad combinations.
		Date registerAllParametersTime = new Date();
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Tarpon options improperly configured: "+e.getMessage());
			System.err.println("Try 'tarpon -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Tarpon options improperly configured: "+e.getMessage());
			System.err.println("Try 'tarpon -h' for a detailed help message");
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: tarpon ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: tarpon ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		Debug.setEncoding(config.getString("encoding"));
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));
		Debug.dbtime(2, registerAllParametersTime, "register and configure parameters");

		// 2) Build the lexer and recognizer
		Date preBuildTime = new Date();
		Compiler compiler = null;
		if (config.contains("grammar")) {
			File gfile = config.getFile("grammar");
			try {
				CFGRuleSet cfg = new CFGRuleSet(gfile.getPath(), config.getString("encoding"));
				compiler = new Compiler(new Lexer(), new CYKRecognizer(cfg.toNormalForm()));
			}
			catch (FileNotFoundException e) {
				System.err.println("Grammar file not found: "+e.getMessage());
				return 1;
			}
			catch (DataFormatException e) {
				System.err.println("Syntax error while reading grammar file: "+e.getMessage());
				return 1;
			}
			catch (ImproperConversionException e) {
				System.err.println("Can't recognize with "+gfile+": "+e.getMessage());
				return 1;
			}
			catch (IOException e) {
				System.err.println("Couldn't read grammar file: "+e.getMessage());
				return 1;
			}
		}
		else {
			compiler = new Compiler();
		}
		Debug.dbtime(2, preBuildTime, "build lexer and recognizer");

		// 3) Compile and report
		String[] sources = config.contains("source") ? config.getStringArray("source") : new String[] {DEMO_SOURCE};
		for (int i = 0; i < sources.length; i++) {
			if (i > 0)
				out.println();
			out.print(report(sources[i], compiler.compile(sources[i])));
		}
		out.flush();
		return 0;
	}

	public static void main(String argv[]) {
		int code = run(argv, System.out);
		if (code != 0)
			System.exit(code);
	}
}
