package edu.isi.remora;

// a node of a transducer. Either one of the named states of the base table, or a
// state synthesized during a search and known only by its tag (printed as N<tag>).
// Predefined states sort before synthesized ones; predefined by name, synthesized by tag
public class State implements Comparable<State> {
	// prefix of synthesized state names
	public static final String SYNTH_PREFIX = "N";

	private String name;
	// 0 for predefined states
	private int tag;

	private State(String name, int tag) {
		this.name = name;
		this.tag = tag;
	}

	// a predefined state. Names may not be empty or contain whitespace
	public static State get(String name) throws DataFormatException {
		if (name == null || name.length() == 0)
			throw new DataFormatException("Empty state name");
		for (int i = 0; i < name.length(); i++)
			if (Character.isWhitespace(name.charAt(i)))
				throw new DataFormatException("State name \""+name+"\" contains whitespace");
		return new State(name, 0);
	}

	// the tag'th state created by a search; tags start at 1
	public static State synthesized(int tag) {
		if (tag < 1)
			throw new IllegalArgumentException("Synthesized state tags start at 1, not "+tag);
		return new State(SYNTH_PREFIX+tag, tag);
	}

	public boolean isSynthesized() { return tag > 0; }
	public int getTag() { return tag; }
	public String getName() { return name; }

	public int compareTo(State o) {
		if (isSynthesized() != o.isSynthesized())
			return isSynthesized() ? 1 : -1;
		if (isSynthesized())
			return tag < o.tag ? -1 : (tag == o.tag ? 0 : 1);
		return name.compareTo(o.name);
	}

	public boolean equals(Object o) {
		if (!(o instanceof State))
			return false;
		State s = (State)o;
		return tag == s.tag && name.equals(s.name);
	}
	public int hashCode() { return 31*name.hashCode()+tag; }
	public String toString() { return name; }
}
