package edu.isi.remora;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.Vector;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// reads a base transducer, one transition per line, in the notation reports are printed in:
//     S0 --(01/1)--> S1
// % begins a comment; blank lines are skipped
public class TransducerReader {

	/** Comment character for transducer files */
	static final public int COMMENT = '%';

	private static Pattern rulePat = Pattern.compile("\\s*(\\S+?)\\s*--\\(\\s*(\\S+?)\\s*/\\s*(\\S+?)\\s*\\)-->\\s*(\\S+)\\s*");

	public static Transducer read(File f, String encoding) throws DataFormatException, IOException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			return read(br);
		}
		finally {
			br.close();
		}
	}

	public static Transducer read(BufferedReader br) throws DataFormatException, IOException {
		boolean debug = false;
		Vector<Transition> rules = new Vector<Transition>();
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			int c = line.indexOf(COMMENT);
			if (c >= 0)
				line = line.substring(0, c);
			if (line.trim().length() == 0)
				continue;
			Matcher m = rulePat.matcher(line);
			if (!m.matches())
				throw new DataFormatException("Line "+lineno+": expected \"from --(in/out)--> to\" but saw \""+line.trim()+"\"");
			try {
				Step.checkSymbols(m.group(2), m.group(3));
				rules.add(new Transition(State.get(m.group(1)), m.group(2), m.group(3), State.get(m.group(4))));
			}
			catch (DataFormatException e) {
				throw new DataFormatException("Line "+lineno+": "+e.getMessage(), e);
			}
			if (debug) Debug.debug(debug, "Read "+rules.lastElement());
		}
		return new Transducer(rules);
	}
}
