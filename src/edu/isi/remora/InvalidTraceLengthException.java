package edu.isi.remora;
/** a trace whose length, once cleaned of non-binary characters, is not
    a whole number of steps */
public class InvalidTraceLengthException extends DataFormatException {
	private int length;
	/**      Constructs a new exception for a cleaned trace of the given length. */
	public InvalidTraceLengthException(int length) {
		super("Input length must be a multiple of "+Step.WIDTH+" but was "+length);
		this.length = length;
	}
	// length of the trace after cleaning
	public int getLength() { return length; }
}
