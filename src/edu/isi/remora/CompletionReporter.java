package edu.isi.remora;

// text renderings of completions and transducers
public class CompletionReporter {

	// cost summary followed by the path, one transition per line
	public static String report(Completion c) {
		StringBuffer buffer = new StringBuffer();
		buffer.append("Extra Cost = "+c.getCost()+"\n");
		buffer.append("Extra Path = "+c.getNumExtra()+"\n");
		buffer.append("Extra Node = "+c.getNumNewStates()+"\n");
		buffer.append("Start Node = "+c.getStart()+"\n");
		buffer.append("Path:\n");
		for (Transition t : c.getPath())
			buffer.append(format(t)+"\n");
		return buffer.toString();
	}

	// a transition and, if it was added, how
	public static String format(Transition t) {
		if (t.createsState())
			return t.toString()+" (extra, new node)";
		if (t.isExtra())
			return t.toString()+" (extra)";
		return t.toString();
	}

	// create a summary of a transducer. The counts are commented out so that the whole
	// summary can be read back by TransducerReader
	public static String check(String name, Transducer trs) {
		StringBuffer buffer = new StringBuffer();
		buffer.append("% Transducer info for "+name+":\n");
		buffer.append("%\t"+trs.getNumStates()+" states\n");
		buffer.append("%\t"+trs.getNumTransitions()+" transitions\n");
		for (Transition t : trs.getTransitions())
			buffer.append(t.toString()+"\n");
		return buffer.toString();
	}
}
