package mascpcr.core.thermo;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.List;

import mascpcr.core.sequence.SequenceUtils;

import org.apache.log4j.Logger;

/**
 * Thermodynamic calculations delegated to the primer3 command line programs
 * oligotm (melting temperature) and ntthal (hairpin and homodimer).
 * Each call starts a new process, so instances can be shared between threads.
 */
public class Primer3ExecutableOracle implements ThermodynamicOracle {

	static Logger logger = Logger.getLogger(Primer3ExecutableOracle.class.getName());

	private static final String NO_STRUCTURE_MESSAGE = "No secondary structure";

	private final String oligotmCommand;
	private final String ntthalCommand;

	/**
	 * @param primer3Directory Directory containing the oligotm and ntthal executables
	 */
	public Primer3ExecutableOracle(File primer3Directory) {
		this(new File(primer3Directory, "oligotm").getAbsolutePath(), new File(primer3Directory, "ntthal").getAbsolutePath());
	}

	/**
	 * @param oligotmCommand oligotm executable
	 * @param ntthalCommand ntthal executable
	 */
	public Primer3ExecutableOracle(String oligotmCommand, String ntthalCommand) {
		this.oligotmCommand = oligotmCommand;
		this.ntthalCommand = ntthalCommand;
	}

	@Override
	public double meltingTemperature(String sequence, ThermoParameters params) throws ThermodynamicsException {
		validate(sequence);
		List<String> cmd = new ArrayList<String>();
		cmd.add(oligotmCommand);
		addConditions(cmd, params);
		cmd.add(sequence.toUpperCase());
		String out = run(cmd);
		try {
			return Double.parseDouble(out);
		} catch (NumberFormatException e) {
			throw new ThermodynamicsException("Could not parse oligotm output for " + sequence + ": " + out, e);
		}
	}

	@Override
	public ThermoResult hairpin(String sequence, ThermoParameters params) throws ThermodynamicsException {
		validate(sequence);
		List<String> cmd = ntthal(params, "HAIRPIN");
		cmd.add("-s1");
		cmd.add(sequence.toUpperCase());
		return parseStructure(sequence, run(cmd));
	}

	@Override
	public ThermoResult homodimer(String sequence, ThermoParameters params) throws ThermodynamicsException {
		validate(sequence);
		List<String> cmd = ntthal(params, "ANY");
		cmd.add("-s1");
		cmd.add(sequence.toUpperCase());
		cmd.add("-s2");
		cmd.add(sequence.toUpperCase());
		return parseStructure(sequence, run(cmd));
	}

	@Override
	public String reverseComplement(String sequence) {
		return SequenceUtils.reverseComplement(sequence);
	}

	private List<String> ntthal(ThermoParameters params, String alignmentType) {
		List<String> cmd = new ArrayList<String>();
		cmd.add(ntthalCommand);
		addConditions(cmd, params);
		cmd.add("-t");
		cmd.add(Double.toString(params.getTemperature()));
		cmd.add("-maxloop");
		cmd.add(Integer.toString(params.getMaxLoop()));
		cmd.add("-a");
		cmd.add(alignmentType);
		// Report the melting temperature only
		cmd.add("-r");
		return cmd;
	}

	private static void addConditions(List<String> cmd, ThermoParameters params) {
		cmd.add("-mv");
		cmd.add(Double.toString(params.getMonovalentConc()));
		cmd.add("-dv");
		cmd.add(Double.toString(params.getDivalentConc()));
		cmd.add("-n");
		cmd.add(Double.toString(params.getDntpConc()));
		cmd.add("-d");
		cmd.add(Double.toString(params.getDnaConc()));
	}

	private static ThermoResult parseStructure(String sequence, String out) throws ThermodynamicsException {
		if(out.startsWith(NO_STRUCTURE_MESSAGE)) {
			return ThermoResult.NO_STRUCTURE;
		}
		try {
			double tm = Double.parseDouble(out);
			if(tm <= 0) {
				return ThermoResult.NO_STRUCTURE;
			}
			return new ThermoResult(true, tm, Double.NaN, Double.NaN, Double.NaN);
		} catch (NumberFormatException e) {
			throw new ThermodynamicsException("Could not parse ntthal output for " + sequence + ": " + out, e);
		}
	}

	/**
	 * Run a command and return the first line of its standard output
	 */
	private static String run(List<String> cmd) throws ThermodynamicsException {
		logger.debug("Running " + cmd);
		ProcessBuilder pb = new ProcessBuilder(cmd);
		pb.redirectErrorStream(true);
		try {
			Process proc = pb.start();
			BufferedReader reader = new BufferedReader(new InputStreamReader(proc.getInputStream()));
			StringBuilder out = new StringBuilder();
			String line;
			while((line = reader.readLine()) != null) {
				if(out.length() == 0 && !line.trim().isEmpty()) {
					out.append(line.trim());
				}
			}
			reader.close();
			int exit = proc.waitFor();
			if(exit != 0) {
				throw new ThermodynamicsException(cmd.get(0) + " exited with status " + exit + ": " + out);
			}
			return out.toString();
		} catch (IOException e) {
			throw new ThermodynamicsException("Could not run " + cmd.get(0), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ThermodynamicsException("Interrupted while running " + cmd.get(0), e);
		}
	}

	private static void validate(String sequence) throws ThermodynamicsException {
		if(sequence == null || !SequenceUtils.isUnambiguousDna(sequence.toUpperCase())) {
			throw new ThermodynamicsException("Sequence contains bases other than A, C, G, T: " + sequence);
		}
	}

}
