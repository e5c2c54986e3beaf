package edu.isi.remora;

// a point in the completion search: how far into the trace, which state we're in, what has
// been added so far and how many states have been made. Equal nodes have equal best continuations
public class SearchNode {
	private int index;
	private State state;
	private ExtensionSet extensions;
	private int synthesized;
	private int hsh;

	public SearchNode(int index, State state, ExtensionSet extensions, int synthesized) {
		this.index = index;
		this.state = state;
		this.extensions = extensions;
		this.synthesized = synthesized;
		int h = index;
		h = h*31+state.hashCode();
		h = h*31+extensions.hashCode();
		hsh = h*31+synthesized;
	}

	public int getIndex() { return index; }
	public State getState() { return state; }
	public ExtensionSet getExtensions() { return extensions; }
	public int getSynthesized() { return synthesized; }

	public boolean equals(Object o) {
		if (!(o instanceof SearchNode))
			return false;
		SearchNode n = (SearchNode)o;
		return index == n.index &&
			synthesized == n.synthesized &&
			state.equals(n.state) &&
			extensions.equals(n.extensions);
	}
	public int hashCode() { return hsh; }
	public String toString() { return "["+index+", "+state+", "+extensions+", "+synthesized+"]"; }
}
