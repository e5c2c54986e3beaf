package edu.isi.remora;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Vector;

class CompletionSearchTest {

	private static Completion solve(String trace) throws Exception {
		return new CompletionSearch(Transducer.getDefault()).solve(TraceDecoder.decode(trace));
	}

	private static Vector<String> lines(Completion c) {
		Vector<String> v = new Vector<String>();
		for (Transition t : c.getPath())
			v.add(CompletionReporter.format(t));
		return v;
	}

	// cost, counts and replay agree with each other and with the trace
	private static void assertConsistent(String trace, Completion c) throws Exception {
		List<Step> steps = TraceDecoder.decode(trace);
		StringBuffer want = new StringBuffer();
		for (Step s : steps)
			want.append(s.getOutput());
		Assertions.assertEquals(steps.size(), c.getPath().size());
		Assertions.assertEquals(want.toString(), c.getOutput());
		Assertions.assertEquals(want.toString(), c.replay(Transducer.getDefault(), steps));
		Assertions.assertEquals(c.getNumExtra()+c.getNumNewStates(), c.getCost());
		Assertions.assertEquals(c.getNumExtra(), c.getExtensions().size());
		State cur = c.getStart();
		for (int i = 0; i < steps.size(); i++) {
			Transition t = c.getPath().get(i);
			Assertions.assertEquals(cur, t.getFrom());
			Assertions.assertEquals(steps.get(i).getInput(), t.getInput());
			cur = t.getTo();
		}
	}

	@Test
	void testFirstDefaultCase() throws Exception {
		String trace = "001_010_010_101_100_001_110_110";
		Completion c = solve(trace);
		Assertions.assertEquals(5, c.getCost());
		Assertions.assertEquals(4, c.getNumExtra());
		Assertions.assertEquals(1, c.getNumNewStates());
		Assertions.assertEquals("S0", c.getStart().toString());
		Vector<String> want = new Vector<String>();
		want.add("S0 --(00/1)--> N1 (extra, new node)");
		want.add("N1 --(01/0)--> N1 (extra)");
		want.add("N1 --(01/0)--> N1");
		want.add("N1 --(10/1)--> S0 (extra)");
		want.add("S0 --(10/0)--> S2");
		want.add("S2 --(00/1)--> S3");
		want.add("S3 --(11/0)--> S0 (extra)");
		want.add("S0 --(11/0)--> S1");
		Assertions.assertEquals(want, lines(c));
		Assertions.assertEquals(Transition.Kind.REUSED, c.getPath().get(2).getKind());
		assertConsistent(trace, c);
	}

	@Test
	void testSecondDefaultCase() throws Exception {
		String trace = "111_010_000_100_110_101_110_000";
		Completion c = solve(trace);
		Assertions.assertEquals(4, c.getCost());
		Assertions.assertEquals(4, c.getNumExtra());
		Assertions.assertEquals(0, c.getNumNewStates());
		Assertions.assertEquals("S1", c.getStart().toString());
		Assertions.assertEquals("S1 --(11/1)--> S2 (extra)", lines(c).get(0));
		Assertions.assertEquals("S1 --(00/0)--> S0", lines(c).get(7));
		assertConsistent(trace, c);
	}

	@Test
	void testTwoNewStates() throws Exception {
		Completion c = solve("011_011_010");
		Assertions.assertEquals(5, c.getCost());
		Assertions.assertEquals(2, c.getNumNewStates());
		Assertions.assertEquals("S2", c.getStart().toString());
		Assertions.assertEquals("N1 --(01/1)--> N2 (extra, new node)", lines(c).get(1));
		assertConsistent("011_011_010", c);
	}

	@Test
	void testEmptyTrace() throws Exception {
		Completion c = solve("");
		Assertions.assertEquals(0, c.getCost());
		Assertions.assertTrue(c.getPath().isEmpty());
		Assertions.assertTrue(Transducer.getDefault().getStates().contains(c.getStart()));
	}

	@Test
	void testPredefinedOnly() throws Exception {
		// S0 -01/1-> S1 -01/1-> S3 -01/1-> S0 -10/0-> S2 -00/1-> S3
		String trace = "011_011_011_100_001";
		Completion c = solve(trace);
		Assertions.assertEquals(0, c.getCost());
		Assertions.assertEquals(0, c.getNumExtra());
		for (Transition t : c.getPath())
			Assertions.assertEquals(Transition.Kind.PREDEFINED, t.getKind());
		assertConsistent(trace, c);
	}

	@Test
	void testUndefinedPairNeedsExtra() throws Exception {
		// no state reads 00 and writes 0
		Completion c = solve("000");
		Assertions.assertEquals(1, c.getCost());
		Assertions.assertEquals("S0 --(00/0)--> S0 (extra)", lines(c).get(0));
	}

	@Test
	void testFreshEngineSameAnswer() throws Exception {
		String trace = "001_010_010_101_100_001_110_110";
		Completion a = solve(trace);
		Completion b = solve(trace);
		Assertions.assertEquals(a.getCost(), b.getCost());
		Assertions.assertEquals(a.getStart(), b.getStart());
		Assertions.assertEquals(a.getPath(), b.getPath());
	}

	@Test
	void testNothingCarriedBetweenCalls() throws Exception {
		CompletionSearch search = new CompletionSearch(Transducer.getDefault());
		search.solve(TraceDecoder.decode("001_010_010_101_100_001_110_110"));
		Completion reused = search.solve(TraceDecoder.decode("111_010_000_100_110_101_110_000"));
		Completion fresh = solve("111_010_000_100_110_101_110_000");
		Assertions.assertEquals(fresh.getCost(), reused.getCost());
		Assertions.assertEquals(fresh.getPath(), reused.getPath());
	}

	@Test
	void testNoStates() throws Exception {
		CompletionSearch search = new CompletionSearch(new Transducer(new Vector<Transition>()));
		Assertions.assertThrows(NoCompletionException.class, () -> search.solve(TraceDecoder.decode("011")));
	}

	@Test
	void testMatchesBruteForce() throws Exception {
		Transducer def = Transducer.getDefault();
		CompletionSearch search = new CompletionSearch(def);
		for (int len = 1; len <= 3; len++) {
			for (int bits = 0; bits < (1 << (3*len)); bits++) {
				StringBuffer sb = new StringBuffer(Integer.toBinaryString(bits));
				while (sb.length() < 3*len)
					sb.insert(0, '0');
				String trace = sb.toString();
				List<Step> steps = TraceDecoder.decode(trace);
				Completion c = search.solve(steps);
				int best = Integer.MAX_VALUE;
				for (State start : def.getStates())
					best = Math.min(best, bruteForce(def, steps, 0, start.toString(),
													  new HashMap<String, String[]>(), 0));
				Assertions.assertEquals(best, c.getCost(), trace);
				assertConsistent(trace, c);
			}
		}
	}

	// every legal completion, no memo, states as plain names; MAX_VALUE if none
	private static int bruteForce(Transducer def, List<Step> steps, int i, String cur,
								  HashMap<String, String[]> added, int made) throws DataFormatException {
		if (i == steps.size())
			return 0;
		Step s = steps.get(i);
		HashSet<String> names = new HashSet<String>();
		for (State st : def.getStates())
			names.add(st.toString());
		Transition p = names.contains(cur) ? def.lookup(State.get(cur), s.getInput()) : null;
		String[] e = added.get(cur+" "+s.getInput());
		if (p != null || e != null) {
			String out = p != null ? p.getOutput() : e[1];
			String to = p != null ? p.getTo().toString() : e[0];
			if (!out.equals(s.getOutput()))
				return Integer.MAX_VALUE;
			return bruteForce(def, steps, i+1, to, added, made);
		}
		HashSet<String> reachable = new HashSet<String>(names);
		for (String[] v : added.values())
			reachable.add(v[0]);
		String fresh = "new"+(made+1);
		reachable.add(fresh);
		int best = Integer.MAX_VALUE;
		for (String to : reachable) {
			HashMap<String, String[]> next = new HashMap<String, String[]>(added);
			next.put(cur+" "+s.getInput(), new String[] { to, s.getOutput() });
			int isNew = to.equals(fresh) ? 1 : 0;
			int rest = bruteForce(def, steps, i+1, to, next, made+isNew);
			if (rest != Integer.MAX_VALUE)
				best = Math.min(best, 1+isNew+rest);
		}
		return best;
	}
}
