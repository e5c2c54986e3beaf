package edu.isi.remora;

import java.util.Comparator;

// an arc of the transducer: reading input in state from writes output and moves to to.
// The kind says where the arc came from when it appears in a completion path
public class Transition {

	public enum Kind {
		// part of the base table
		PREDEFINED,
		// added earlier in the same search branch and taken again
		REUSED,
		// added here, to a state that already existed
		EXTRA,
		// added here, to a state created for it
		NEW_STATE
	}

	// orders by source state then input, which is unique within one transducer or extension set
	public static final Comparator<Transition> KEY_ORDER = new Comparator<Transition>() {
		public int compare(Transition a, Transition b) {
			int c = a.from.compareTo(b.from);
			if (c != 0)
				return c;
			return a.input.compareTo(b.input);
		}
	};

	private State from;
	private String input;
	private String output;
	private State to;
	private Kind kind;

	public Transition(State from, String input, String output, State to) {
		this(from, input, output, to, Kind.PREDEFINED);
	}
	public Transition(State from, String input, String output, State to, Kind kind) {
		this.from = from;
		this.input = input;
		this.output = output;
		this.to = to;
		this.kind = kind;
	}

	// same arc, different provenance
	public Transition as(Kind k) {
		if (k == kind)
			return this;
		return new Transition(from, input, output, to, k);
	}

	public State getFrom() { return from; }
	public String getInput() { return input; }
	public String getOutput() { return output; }
	public State getTo() { return to; }
	public Kind getKind() { return kind; }

	// was this arc added at this point of the path
	public boolean isExtra() { return kind == Kind.EXTRA || kind == Kind.NEW_STATE; }
	public boolean createsState() { return kind == Kind.NEW_STATE; }

	// same source, input, output and destination, whatever the kind
	public boolean sameArc(Transition t) {
		return from.equals(t.from) && input.equals(t.input) &&
			output.equals(t.output) && to.equals(t.to);
	}

	public boolean equals(Object o) {
		if (!(o instanceof Transition))
			return false;
		Transition t = (Transition)o;
		return sameArc(t) && kind == t.kind;
	}
	public int hashCode() {
		int h = from.hashCode();
		h = h*31+input.hashCode();
		h = h*31+output.hashCode();
		h = h*31+to.hashCode();
		return h*31+kind.hashCode();
	}

	public String toString() {
		return from+" --("+input+"/"+output+")--> "+to;
	}
}
