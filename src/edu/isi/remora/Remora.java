package edu.isi.remora;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.Date;
import java.util.Vector;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class Remora {
	// version number. change this when updating remora!
	static final String VERSION = "1.0";

	// solved when no traces are given
	static final String[] DEFAULT_TRACES = {
		"001_010_010_101_100_001_110_110",
		"111_010_000_100_110_101_110_000",
	};

	static final String SEPARATOR = "------------------------------";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// format of the transducer file and the output - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// base transducer. The built-in four state table if absent
		FlaggedOption transduceropt = new FlaggedOption("transducer",
				FileStringParser.getParser().setMustExist(true).setMustBeFile(true),
				null,
				false,
				'f',
				"transducer",
				"file of predefined transitions, one per line in the form 'S0 --(01/1)--> S1'. "+
				"% begins a comment. If absent, the built-in four state transducer is used");
		jsap.registerParameter(transduceropt);

		// summary of the base transducer before solving
		Switch csw = new Switch("check",
				'c',
				"check",
				"print the number of states and transitions of the base transducer, "+
				"and its transitions, before solving");
		jsap.registerParameter(csw);

		// timing info
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
				"print timing information. Higher levels print more");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt = new FlaggedOption("outfile",
				FileStringParser.getParser(),
				null,
				false,
				'o',
				"outputfile",
				"file to write the reports to. If absent, writing is done to stdout");
		jsap.registerParameter(outfileopt);

		// the traces. Separators such as '_' may be used; anything but 0 and 1 is ignored
		UnflaggedOption traceopt = new UnflaggedOption("traces",
				StringStringParser.getParser(),
				null,
				false,
				true,
				"traces to solve, each a string of binary symbols whose length (ignoring any "+
				"other characters) is a multiple of 3: two input symbols then one output symbol "+
				"per step. If absent, two built-in traces are solved");
		jsap.registerParameter(traceopt);

		JSAPResult config = jsap.parse(argv);

		if (config.contains("time") && config.getInt("time") < 0)
			throw new ConfigureException("Time level (-t) must not be negative");

		// don't clobber the transducer we're reading
		if (config.contains("transducer") && config.contains("outfile") &&
				config.getFile("transducer").getAbsoluteFile().equals(config.getFile("outfile").getAbsoluteFile()))
			throw new ConfigureException("Output file (-o) is the same as the transducer file (-f)");

		return config;
	}

	// solve each trace against the transducer and gather the reports. A trace that can't be
	// decoded or completed gets an error line and the next one is tried
	static String solveAll(Transducer trs, String name, String[] traces, boolean check) {
		boolean debug = false;
		StringBuffer buffer = new StringBuffer();
		if (check)
			buffer.append(CompletionReporter.check(name, trs)+"\n");
		CompletionSearch search = new CompletionSearch(trs);
		for (int i = 0; i < traces.length; i++) {
			buffer.append(SEPARATOR+"\n");
			buffer.append("Testing case "+(i+1)+":\n"+traces[i]+"\n\n");
			try {
				Vector<Step> steps = TraceDecoder.decode(traces[i]);
				if (debug) Debug.debug(debug, "Decoded "+steps.size()+" steps from "+traces[i]);
				Completion c = search.solve(steps);
				buffer.append(CompletionReporter.report(c));
			}
			catch (InvalidTraceLengthException e) {
				buffer.append("Invalid trace: "+e.getMessage()+"\n");
			}
			catch (NoCompletionException e) {
				if (debug) Debug.debug(debug, e.getMessage());
				buffer.append("No valid path found.\n");
			}
			buffer.append("\n\n");
		}
		return buffer.toString();
	}

	// everything main does, returning the exit status instead of exiting
	static int run(String argv[]) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		int timeLevel = -1;
		String encoding = null;

		// 1) Set up all parameters. Die on bad combinations.
		Date registerAllParametersTime = new Date();
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Remora options improperly configured: "+e.getMessage());
			System.err.println("Try 'remora -h` for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Remora options improperly configured: "+e.getMessage());
			System.err.println("Try 'remora -h` for a detailed help message");
			return 1;
		}

		if (config.getBoolean("help", false)) {
			Debug.prettyDebug("Usage: remora ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: remora ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}
		encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		if (config.contains("time")) {
			timeLevel = config.getInt("time", -1);
			Debug.setDbLevel(timeLevel);
		}
		Debug.dbtime(timeLevel, 2, registerAllParametersTime, new Date(), "register and configure parameters");

		// 2) Read the base transducer
		Transducer trs = null;
		String name = "built-in transducer";
		try {
			Date preReadTime = new Date();
			File tfile = config.getFile("transducer");
			if (tfile == null)
				trs = Transducer.getDefault();
			else {
				name = tfile.getName();
				trs = TransducerReader.read(tfile, encoding);
			}
			Debug.dbtime(timeLevel, 1, preReadTime, new Date(), "read "+name);
		}
		catch (FileNotFoundException e) {
			System.err.println("Transducer file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading transducer file: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem reading transducer file: "+e.getMessage());
			return 1;
		}

		// 3) Solve and write
		String[] traces = config.contains("traces") ? config.getStringArray("traces") : DEFAULT_TRACES;
		Date preSolveTime = new Date();
		String output = solveAll(trs, name, traces, config.getBoolean("check"));
		Debug.dbtime(timeLevel, 1, preSolveTime, new Date(), "solved "+traces.length+" traces");

		OutputStreamWriter w = null;
		try {
			File outfile = config.getFile("outfile");
			if (outfile == null)
				w = new OutputStreamWriter(System.out, encoding);
			else
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			w.write(output);
			w.flush();
			if (outfile != null)
				w.close();
		}
		catch (IOException e) {
			System.err.println("Problem writing output: "+e.getMessage());
			return 1;
		}
		return 0;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is Remora, version "+VERSION);
		System.exit(run(argv));
	}
}
