package edu.isi.tarpon;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// debugging output. everything goes to stderr so stdout stays clean for results
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		initializeStream();
	}

	private static OutputStreamWriter w=null;
	private static void initializeStream() {
		try {
			w = new OutputStreamWriter(System.err, encoding);
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Warning: encoding "+encoding+" not supported; using default");
			w = new OutputStreamWriter(System.err);
		}
	}

	// stuff we always print to stderr
	public static void prettyDebug(String s) {
		if (w == null)
			initializeStream();
		try {
			w.write(s+"\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}
	// true debugging stuff
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		debug(d, 0, caller(), s);
	}
	// class:method of whoever called debug
	private static String caller() {
		StackTraceElement el = new Throwable().getStackTrace()[2];
		return el.getClassName()+":"+el.getMethodName();
	}
	private static void debug(boolean d, int i, String caller, String s) {
		if (w == null)
			initializeStream();
		if (d) {
			try {
				for (int x = 0; x < i; x++)
					w.write(" ");
				w.write(caller+" : "+s+"\n");
				w.flush();
			}
			catch (IOException e) {
				System.err.println("IOException while trying to print "+s);
			}
		}
	}
	private static int dblevel=-1;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	// global version of dbtime
	public static void dbtime(int needlevel, Date pta, String msg) {
		Date ptb = new Date();
		if (dblevel < needlevel)
			return;
		dbtime(msg, ptb.getTime() - pta.getTime());
	}

	// nanosecond version, for phases too short to see in ms
	public static void dbtime(int needlevel, long nanos, String msg) {
		if (dblevel < needlevel)
			return;
		if (w == null)
			initializeStream();
		try {
			w.write(msg+": "+Rounding.fixed(nanos/1.0e6, 3)+" ms\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+msg);
		}
	}

	private static void dbtime(String msg, long ms) {
		if (w == null)
			initializeStream();
		try {
			w.write(msg+": "+ms+" ms\n");
			w.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+msg);
		}
	}

}
