package edu.isi.remora;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.TreeSet;

class StateTest {
	@Test
	void testPredefinedBeforeSynthesized() throws DataFormatException {
		TreeSet<State> set = new TreeSet<State>();
		set.add(State.synthesized(2));
		set.add(State.get("S1"));
		set.add(State.synthesized(1));
		set.add(State.get("S0"));
		Assertions.assertEquals("[S0, S1, N1, N2]", set.toString());
	}

	@Test
	void testSynthesizedIsNotPredefinedOfSameName() throws DataFormatException {
		State named = State.get("N1");
		State made = State.synthesized(1);
		Assertions.assertEquals(named.toString(), made.toString());
		Assertions.assertNotEquals(named, made);
		Assertions.assertTrue(named.compareTo(made) < 0);
	}

	@Test
	void testEquality() throws DataFormatException {
		Assertions.assertEquals(State.get("S0"), State.get("S0"));
		Assertions.assertEquals(State.get("S0").hashCode(), State.get("S0").hashCode());
		Assertions.assertEquals(State.synthesized(3), State.synthesized(3));
	}

	@Test
	void testBadNames() {
		Assertions.assertThrows(DataFormatException.class, () -> State.get(""));
		Assertions.assertThrows(DataFormatException.class, () -> State.get("S 0"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> State.synthesized(0));
	}
}
