package edu.isi.remora;
/** no start state leads to a completion of the transducer for a trace */

public class NoCompletionException extends Exception {
	/**          Constructs a new exception with null as its detail message. */
	public NoCompletionException() { super(); }
	/**      Constructs a new exception with the specified detail message. */
	public NoCompletionException(String message) { super(message); }
	/**      Constructs a new exception with the specified detail message and cause.    */
	public NoCompletionException(String message, Throwable cause) { super(message, cause); }
	/**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()). */
	public NoCompletionException(Throwable cause) { super(cause); }
}
