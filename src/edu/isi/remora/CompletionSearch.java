package edu.isi.remora;

import gnu.trove.TIntObjectHashMap;
import gnu.trove.TIntObjectProcedure;

import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.TreeSet;
import java.util.Vector;

// finds the cheapest way to extend a base transducer so that it writes the required
// output of every step of a trace. At each step the options are, in order:
//   1) the predefined transition, if its output matches
//   2) an extension added earlier in this branch, if its output matches
//   3) a new extension to each state that exists so far (cost 1)
//   4) a new extension to a new state (cost 2)
// 3 and 4 only when neither 1 nor 2 has a transition for the (state, input) at all; a
// transition whose output is wrong ends the branch. The cheapest option wins and ties
// go to the earlier option. Every predefined state is tried as the start.
public class CompletionSearch {

	private Transducer base;

	public CompletionSearch(Transducer base) {
		this.base = base;
	}

	public Completion solve(List<Step> steps) throws NoCompletionException {
		boolean debug = false;
		Date startTime = new Date();
		Session session = new Session(steps);
		Completion best = null;
		for (State start : base.getStates()) {
			Branch b = session.search(0, start, ExtensionSet.empty(), 0);
			if (b == null) {
				if (debug) Debug.debug(debug, "No completion from "+start);
				continue;
			}
			if (debug) Debug.debug(debug, "Completion from "+start+" costs "+b.cost);
			if (best == null || b.cost < best.getCost())
				best = new Completion(start, b.cost, b.path(), b.extensions);
		}
		if (debug) session.dumpMemo();
		Debug.dbtime(2, startTime, "searched "+steps.size()+" steps from "+base.getNumStates()+" states");
		if (best == null)
			throw new NoCompletionException("No start state among "+base.getStates()+" completes a trace of "+
											steps.size()+" steps");
		return best;
	}

	// the best continuation from some search node: the transition taken there and the best
	// continuation after it. Shared between every node whose best path runs through it
	static class Branch {
		private Transition head;
		private Branch rest;
		private int cost;
		// what the branch has added by the time the trace ends
		private ExtensionSet extensions;

		// end of trace
		Branch(ExtensionSet extensions) {
			head = null;
			rest = null;
			cost = 0;
			this.extensions = extensions;
		}
		Branch(Transition head, int stepCost, Branch rest) {
			this.head = head;
			this.rest = rest;
			cost = stepCost+rest.cost;
			extensions = rest.extensions;
		}
		Vector<Transition> path() {
			Vector<Transition> v = new Vector<Transition>();
			for (Branch b = this; b.head != null; b = b.rest)
				v.add(b.head);
			return v;
		}
	}

	// state of one solve() call. The memo only makes sense for the steps it was built
	// from, so it lives and dies with the session
	private class Session {
		private List<Step> steps;
		// step index -> HashMap of node -> best branch (null if there is none)
		private TIntObjectHashMap memo;

		Session(List<Step> steps) {
			this.steps = steps;
			memo = new TIntObjectHashMap();
		}

		@SuppressWarnings("unchecked")
		Branch search(int i, State current, ExtensionSet ext, int made) {
			SearchNode node = new SearchNode(i, current, ext, made);
			HashMap<SearchNode, Branch> bucket = (HashMap<SearchNode, Branch>)memo.get(i);
			if (bucket == null) {
				bucket = new HashMap<SearchNode, Branch>();
				memo.put(i, bucket);
			}
			if (bucket.containsKey(node))
				return bucket.get(node);
			Branch b = expand(i, current, ext, made);
			bucket.put(node, b);
			return b;
		}

		private Branch expand(int i, State current, ExtensionSet ext, int made) {
			boolean debug = false;
			if (i == steps.size())
				return new Branch(ext);
			Step step = steps.get(i);
			String input = step.getInput();
			String output = step.getOutput();
			if (debug) Debug.debug(debug, i, "At "+current+" reading "+input+", must write "+output);

			// an existing transition decides the step: take it or give up
			Transition predef = base.lookup(current, input);
			if (predef != null) {
				if (!predef.getOutput().equals(output))
					return null;
				return extend(predef, 0, i+1, ext, made);
			}
			Transition reused = ext.get(current, input);
			if (reused != null) {
				if (!reused.getOutput().equals(output))
					return null;
				return extend(reused, 0, i+1, ext, made);
			}

			Branch best = null;
			TreeSet<State> reachable = new TreeSet<State>(base.getStates());
			reachable.addAll(ext.destinations());
			for (State dest : reachable) {
				Transition t = new Transition(current, input, output, dest, Transition.Kind.EXTRA);
				Branch b = extend(t, 1, i+1, ext.add(t), made);
				if (b != null && (best == null || b.cost < best.cost))
					best = b;
			}
			State fresh = State.synthesized(made+1);
			Transition t = new Transition(current, input, output, fresh, Transition.Kind.NEW_STATE);
			Branch b = extend(t, 2, i+1, ext.add(t), made+1);
			if (b != null && (best == null || b.cost < best.cost))
				best = b;
			return best;
		}

		// take t at the given cost and continue from its destination
		private Branch extend(Transition t, int stepCost, int next, ExtensionSet ext, int made) {
			Branch rest = search(next, t.getTo(), ext, made);
			if (rest == null)
				return null;
			return new Branch(t, stepCost, rest);
		}

		// memo size per depth
		void dumpMemo() {
			memo.forEachEntry(new TIntObjectProcedure() {
				public boolean execute(int i, Object bucket) {
					Debug.debug(true, "depth "+i+": "+((HashMap)bucket).size()+" nodes");
					return true;
				}
			});
		}
	}
}
