package edu.isi.remora;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

// the transitions a search branch has added to the base transducer, keyed by (state, input).
// Sets are immutable: add() returns a new set that points back at this one, so branches
// that diverge after a common prefix share the entries of that prefix.
// Two sets are equal when they hold the same arcs, in whatever order they were added.
// Entries are kept as REUSED transitions since that is what they are when read back
public class ExtensionSet {

	private static final ExtensionSet EMPTY = new ExtensionSet();

	// the rest of the set and the newest entry; both null for the empty set
	private ExtensionSet rest;
	private Transition entry;
	private int size;
	// sum of entry hashes, so insertion order doesn't matter
	private int hsh;
	// entries sorted by key, built on first use
	private Transition[] canon = null;

	private ExtensionSet() {
		rest = null;
		entry = null;
		size = 0;
		hsh = 0;
	}
	private ExtensionSet(ExtensionSet rest, Transition entry) {
		this.rest = rest;
		this.entry = entry;
		size = rest.size+1;
		hsh = rest.hsh+entry.hashCode();
	}

	public static ExtensionSet empty() { return EMPTY; }

	// a new set with t added. The key of t must not already be present
	public ExtensionSet add(Transition t) {
		if (containsKey(t.getFrom(), t.getInput()))
			throw new IllegalArgumentException("Extension for "+t.getFrom()+" on "+t.getInput()+" already present");
		return new ExtensionSet(this, t.as(Transition.Kind.REUSED));
	}

	// the entry for state on input, or null
	public Transition get(State state, String input) {
		for (ExtensionSet e = this; e.entry != null; e = e.rest) {
			if (e.entry.getFrom().equals(state) && e.entry.getInput().equals(input))
				return e.entry;
		}
		return null;
	}

	public boolean containsKey(State state, String input) {
		return get(state, input) != null;
	}

	public int size() { return size; }
	public boolean isEmpty() { return size == 0; }

	// every state some entry leads to
	public SortedSet<State> destinations() {
		TreeSet<State> ret = new TreeSet<State>();
		for (ExtensionSet e = this; e.entry != null; e = e.rest)
			ret.add(e.entry.getTo());
		return ret;
	}

	// the entries in key order
	public List<Transition> entries() {
		return Collections.unmodifiableList(Arrays.asList(canonical()));
	}

	private Transition[] canonical() {
		if (canon == null) {
			Transition[] arr = new Transition[size];
			int i = 0;
			for (ExtensionSet e = this; e.entry != null; e = e.rest)
				arr[i++] = e.entry;
			Arrays.sort(arr, Transition.KEY_ORDER);
			canon = arr;
		}
		return canon;
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof ExtensionSet))
			return false;
		ExtensionSet e = (ExtensionSet)o;
		if (size != e.size || hsh != e.hsh)
			return false;
		return Arrays.equals(canonical(), e.canonical());
	}
	public int hashCode() { return hsh; }

	public String toString() { return Arrays.toString(canonical()); }
}
