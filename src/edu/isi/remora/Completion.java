package edu.isi.remora;

import java.util.Collections;
import java.util.List;
import java.util.Vector;

// the answer to a search: where to start, which transitions to take, what they cost.
// cost is one per extra transition plus one per state created
public class Completion {
	private State start;
	private int cost;
	private Vector<Transition> path;
	private ExtensionSet extensions;

	public Completion(State start, int cost, List<Transition> path, ExtensionSet extensions) {
		this.start = start;
		this.cost = cost;
		this.path = new Vector<Transition>(path);
		this.extensions = extensions;
	}

	public State getStart() { return start; }
	public int getCost() { return cost; }
	public List<Transition> getPath() { return Collections.unmodifiableList(path); }
	// all transitions added over the whole path
	public ExtensionSet getExtensions() { return extensions; }

	// transitions added along the path (the "(extra)" ones)
	public int getNumExtra() {
		int n = 0;
		for (Transition t : path)
			if (t.isExtra())
				n++;
		return n;
	}
	public int getNumNewStates() {
		int n = 0;
		for (Transition t : path)
			if (t.createsState())
				n++;
		return n;
	}

	// outputs written along the path
	public String getOutput() {
		StringBuffer sb = new StringBuffer();
		for (Transition t : path)
			sb.append(t.getOutput());
		return sb.toString();
	}

	// run the completed machine, base plus extensions, from the start state over the
	// inputs of the steps and return what it writes. Stops early if it gets stuck
	public String replay(Transducer base, List<Step> steps) {
		boolean debug = false;
		StringBuffer sb = new StringBuffer();
		State cur = start;
		for (Step s : steps) {
			Transition t = base.lookup(cur, s.getInput());
			if (t == null)
				t = extensions.get(cur, s.getInput());
			if (t == null) {
				if (debug) Debug.debug(debug, "No transition from "+cur+" on "+s.getInput());
				break;
			}
			sb.append(t.getOutput());
			cur = t.getTo();
		}
		return sb.toString();
	}

	public String toString() { return "start "+start+", cost "+cost+", path "+path; }
}
