package edu.isi.tarpon;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.io.PrintStream;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class TarponTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private String output;

	@After
	public void resetDebug() {
		Debug.setDbLevel(-1);
		Debug.setEncoding("utf-8");
	}

	private int run(String... argv) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "utf-8");
		int code = Tarpon.run(argv, out);
		output = bytes.toString("utf-8");
		return code;
	}

	private static String fixture(String name) throws Exception {
		return new File(TarponTest.class.getResource("/grammars/"+name).toURI()).getPath();
	}

	@Test
	public void testDemoRun() throws Exception {
		assertEquals(0, run());
		String[] lines = output.split("\n");
		assertEquals(9, lines.length);
		assertEquals("Source: a + 1 * ( b + 2 )", lines[0]);
		assertEquals("Tokens: [(id, a), (+, +), (num, 1), (*, *), ((, (), (id, b), (+, +), (num, 2), (), ))]", lines[1]);
		assertEquals("Parse success", lines[2]);
		assertEquals("", lines[3]);
		assertEquals("Optimization Results:", lines[4]);
		assertEquals("Lexer states: 4", lines[5]);
		assertEquals("Productions: 14", lines[6]);
		assertTrue(lines[7], lines[7].matches("Lex time: \\d+\\.\\d{6}s"));
		assertTrue(lines[8], lines[8].matches("Parse time: \\d+\\.\\d{6}s"));
	}

	@Test
	public void testGivenSources() throws Exception {
		assertEquals(0, run("a+b", "a + * b"));
		assertTrue(output.contains("Source: a+b\nTokens: [(id, a), (+, +), (id, b)]\nParse success\n"));
		assertTrue(output.contains("Source: a + * b\n"));
		assertTrue(output.contains("Parse failure\n"));
		assertEquals(2, output.split("Optimization Results:").length - 1);
	}

	@Test
	public void testTimingGoesToStderrOnly() throws Exception {
		assertEquals(0, run("-t", "1", "a"));
		assertFalse(output.contains(" ms"));
		assertTrue(output.contains("Parse success"));
	}

	@Test
	public void testHelp() throws Exception {
		assertEquals(0, run("-h"));
		assertEquals("", output);
	}

	@Test
	public void testBadOption() throws Exception {
		assertEquals(1, run("--no-such-option"));
		assertEquals("", output);
	}

	@Test
	public void testNegativeTimeLevel() throws Exception {
		assertEquals(1, run("-t", "-2"));
	}

	@Test
	public void testGrammarOption() throws Exception {
		assertEquals(0, run("-g", fixture("expression-reordered.cfg"), "(a)"));
		assertTrue(output.contains("Parse success"));
	}

	// the expression grammar written out in the given charset
	private String expressionFile(String charset) throws Exception {
		File f = tmp.newFile("expression-"+charset+".cfg");
		Writer w = new OutputStreamWriter(new FileOutputStream(f), charset);
		try {
			w.write(CFGRuleSet.expression().toString());
		}
		finally {
			w.close();
		}
		return f.getPath();
	}

	@Test
	public void testGrammarReadInGivenEncoding() throws Exception {
		String g = expressionFile("utf-16");
		assertEquals(0, run("-e", "utf-16", "-g", g, "a*2"));
		assertTrue(output.contains("Parse success"));
		// the same file read as utf-8 is garbage
		assertEquals(1, run("-g", g, "a*2"));
		assertEquals("", output);
	}

	@Test
	public void testUnconvertibleGrammar() throws Exception {
		assertEquals(1, run("-g", fixture("balanced.cfg"), "(a)"));
		assertEquals("", output);
	}

	@Test
	public void testReportFormat() {
		CompileResult r = new CompileResult(new Lexer().tokenize("7"), true, new Metrics(4, 14, 0.0000123, 1.5));
		assertEquals("Source: 7\nTokens: [(num, 7)]\nParse success\n\nOptimization Results:\n"+
				"Lexer states: 4\nProductions: 14\nLex time: 0.000012s\nParse time: 1.500000s\n",
				Tarpon.report("7", r));
	}
}
