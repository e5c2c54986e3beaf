package edu.isi.remora;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.Vector;

// the base transducer: a fixed, deterministic table of predefined transitions.
// Nothing is added after construction; searches record their additions elsewhere
public class Transducer {

	// state -> input -> transition
	private HashMap<State, HashMap<String, Transition>> table;
	private TreeSet<State> states;
	// in the order given
	private Vector<Transition> transitions;

	private static Transducer def = null;

	public Transducer(Collection<Transition> rules) throws DataFormatException {
		boolean debug = false;
		table = new HashMap<State, HashMap<String, Transition>>();
		states = new TreeSet<State>();
		transitions = new Vector<Transition>();
		for (Transition t : rules) {
			Step.checkSymbols(t.getInput(), t.getOutput());
			if (t.getFrom().isSynthesized() || t.getTo().isSynthesized())
				throw new DataFormatException("Synthesized state in predefined transition "+t);
			if (!table.containsKey(t.getFrom()))
				table.put(t.getFrom(), new HashMap<String, Transition>());
			HashMap<String, Transition> row = table.get(t.getFrom());
			if (row.containsKey(t.getInput()))
				throw new DataFormatException("State "+t.getFrom()+" already reads "+t.getInput()+
											  ": "+row.get(t.getInput())+" conflicts with "+t);
			Transition pt = t.as(Transition.Kind.PREDEFINED);
			row.put(t.getInput(), pt);
			transitions.add(pt);
			states.add(t.getFrom());
			states.add(t.getTo());
			if (debug) Debug.debug(debug, "Added "+pt);
		}
	}

	// the transition for state on input, or null if the table has none
	public Transition lookup(State state, String input) {
		HashMap<String, Transition> row = table.get(state);
		if (row == null)
			return null;
		return row.get(input);
	}

	public boolean defines(State state, String input) {
		return lookup(state, input) != null;
	}

	// every state named in the table, sources and destinations, in State order
	public SortedSet<State> getStates() { return Collections.unmodifiableSortedSet(states); }
	public List<Transition> getTransitions() { return Collections.unmodifiableList(transitions); }
	public int getNumStates() { return states.size(); }
	public int getNumTransitions() { return transitions.size(); }

	// the four-state table the command line uses when no file is given
	public static Transducer getDefault() {
		if (def == null) {
			try {
				State s0 = State.get("S0");
				State s1 = State.get("S1");
				State s2 = State.get("S2");
				State s3 = State.get("S3");
				Vector<Transition> v = new Vector<Transition>();
				v.add(new Transition(s0, "01", "1", s1));
				v.add(new Transition(s0, "11", "0", s1));
				v.add(new Transition(s0, "10", "0", s2));
				v.add(new Transition(s1, "01", "1", s3));
				v.add(new Transition(s2, "00", "1", s3));
				v.add(new Transition(s2, "11", "0", s1));
				v.add(new Transition(s2, "10", "0", s3));
				v.add(new Transition(s3, "01", "1", s0));
				def = new Transducer(v);
			}
			catch (DataFormatException e) {
				throw new IllegalStateException("Built-in transducer is malformed: "+e.getMessage(), e);
			}
		}
		return def;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		for (Transition t : transitions)
			sb.append(t.toString()+"\n");
		return sb.toString();
	}
}
