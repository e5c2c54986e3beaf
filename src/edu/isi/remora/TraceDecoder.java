package edu.isi.remora;

import java.util.Vector;
import java.util.regex.Pattern;

// turns a raw trace such as "001_010_010" into steps. Anything that isn't a 0 or 1 is
// dropped first; what remains must divide into whole steps
public class TraceDecoder {

	private static Pattern noisePat = Pattern.compile("[^01]");

	// the trace with separators and other noise removed
	public static String clean(String raw) {
		if (raw == null)
			return "";
		return noisePat.matcher(raw).replaceAll("");
	}

	public static Vector<Step> decode(String raw) throws InvalidTraceLengthException {
		boolean debug = false;
		String bits = clean(raw);
		if (bits.length() % Step.WIDTH != 0)
			throw new InvalidTraceLengthException(bits.length());
		Vector<Step> steps = new Vector<Step>();
		for (int i = 0; i < bits.length() / Step.WIDTH; i++) {
			int off = i*Step.WIDTH;
			try {
				steps.add(new Step(i, bits.substring(off, off+2), bits.substring(off+2, off+3)));
			}
			catch (DataFormatException e) {
				// clean() leaves only binary symbols
				throw new IllegalStateException("Unexpected symbols in cleaned trace "+bits, e);
			}
			if (debug) Debug.debug(debug, "Step "+steps.lastElement());
		}
		return steps;
	}
}
