package edu.isi.remora;

import java.util.regex.Pattern;

// one unit of a trace: the two input symbols read and the output symbol that must be written
public class Step {
	// symbols per step: two of input, one of output
	public static final int WIDTH = 3;
	private static Pattern inputPat = Pattern.compile("[01]{2}");
	private static Pattern outputPat = Pattern.compile("[01]");

	private int index;
	private String input;
	private String output;

	public Step(int index, String input, String output) throws DataFormatException {
		checkSymbols(input, output);
		this.index = index;
		this.input = input;
		this.output = output;
	}

	// input is two binary symbols, output is one
	public static void checkSymbols(String input, String output) throws DataFormatException {
		if (input == null || !inputPat.matcher(input).matches())
			throw new DataFormatException("Expected two binary input symbols, saw \""+input+"\"");
		if (output == null || !outputPat.matcher(output).matches())
			throw new DataFormatException("Expected one binary output symbol, saw \""+output+"\"");
	}

	public int getIndex() { return index; }
	public String getInput() { return input; }
	public String getOutput() { return output; }

	public boolean equals(Object o) {
		if (!(o instanceof Step))
			return false;
		Step s = (Step)o;
		return index == s.index && input.equals(s.input) && output.equals(s.output);
	}
	public int hashCode() { return (index*31+input.hashCode())*31+output.hashCode(); }
	public String toString() { return index+":"+input+"/"+output; }
}
