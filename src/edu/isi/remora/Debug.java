package edu.isi.remora;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics to stderr. Messages either always print (prettyDebug), print when the
// calling method has its debug flag on (debug), or print timings above a level (dbtime)
public class Debug {

	private static String encoding = "utf-8";
	private static OutputStreamWriter w = null;
	// timing messages at or below this level are shown
	private static int dblevel = -1;

	public static void setEncoding(String s) {
		encoding = s;
		w = null;
	}

	public static void setDbLevel(int i) {
		dblevel = i;
	}

	private static OutputStreamWriter writer() {
		if (w == null) {
			try {
				w = new OutputStreamWriter(System.err, encoding);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Warning: encoding "+encoding+" not supported; using default");
				w = new OutputStreamWriter(System.err);
			}
		}
		return w;
	}

	private static void write(String s) {
		OutputStreamWriter out = writer();
		try {
			out.write(s+"\n");
			out.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// always printed
	public static void prettyDebug(String s) {
		write(s);
	}

	// printed when d is set. Prefixed by the calling class and method
	public static void debug(boolean d, String s) {
		if (!d)
			return;
		debug(d, 0, caller(new Throwable().getStackTrace()), s);
	}
	// indented by i spaces, for recursive calls
	public static void debug(boolean d, int i, String s) {
		if (!d)
			return;
		debug(d, i, caller(new Throwable().getStackTrace()), s);
	}
	private static void debug(boolean d, int i, String caller, String s) {
		StringBuffer sb = new StringBuffer();
		for (int x = 0; x < i; x++)
			sb.append(' ');
		sb.append(caller).append(" : ").append(s);
		write(sb.toString());
	}
	private static String caller(StackTraceElement[] trace) {
		if (trace.length < 2)
			return "?";
		return trace[1].getClassName()+":"+trace[1].getMethodName();
	}

	// time between two dates, if the current level is high enough
	public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
		if (currlevel < needlevel)
			return;
		write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
	}
	// time since pta against the global level
	public static void dbtime(int needlevel, Date pta, String msg) {
		dbtime(dblevel, needlevel, pta, new Date(), msg);
	}
}
