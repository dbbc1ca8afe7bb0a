package mascpcr.core.thermo;

import java.util.HashMap;
import java.util.Map;

import mascpcr.core.sequence.SequenceUtils;

/**
 * Thermodynamic calculations from the SantaLucia (1998) unified nearest neighbor
 * parameters, with the salt correction and divalent cation conversion used by primer3.
 * <br><br>
 * Secondary structures are estimated from ungapped helices only: a homodimer is the
 * most stable run of consecutive Watson-Crick pairs between two antiparallel copies of
 * the sequence, and a hairpin is the most stable stem closing a loop of at least three
 * bases. Bulges, internal loops and dangling ends are not modeled, so values are lower
 * bounds on what a full dynamic programming search such as primer3's ntthal reports.
 * <br><br>
 * The class holds no mutable state and is safe to share between threads.
 */
public class NearestNeighborOracle implements ThermodynamicOracle {

	private static final double GAS_CONSTANT = 1.9872;
	private static final double KELVIN = 273.15;
	private static final double LOOP_REFERENCE_KELVIN = 310.15;
	private static final int MIN_HELIX_LENGTH = 2;
	private static final int MIN_HAIRPIN_LOOP = 3;

	/**
	 * Stack enthalpy (kcal/mol) and entropy (cal/K/mol) by top strand dinucleotide
	 */
	private static final Map<String, double[]> STACKS = new HashMap<String, double[]>();

	private static final double[] INIT_TERMINAL_GC = {0.1, -2.8};
	private static final double[] INIT_TERMINAL_AT = {2.3, 4.1};
	private static final double SYMMETRY_ENTROPY = -1.4;

	/**
	 * Hairpin loop free energy at 37C (kcal/mol) by loop length, up to 9
	 */
	private static final double[] HAIRPIN_LOOP_DG = {0, 0, 0, 3.5, 3.5, 3.3, 4.0, 4.2, 4.3, 4.5};

	static {
		putStack("AA", -7.9, -22.2);
		putStack("AT", -7.2, -20.4);
		putStack("TA", -7.2, -21.3);
		putStack("CA", -8.5, -22.7);
		putStack("GT", -8.4, -22.4);
		putStack("CT", -7.8, -21.0);
		putStack("GA", -8.2, -22.2);
		putStack("CG", -10.6, -27.2);
		putStack("GC", -9.8, -24.4);
		putStack("GG", -8.0, -19.9);
	}

	private static void putStack(String dinucleotide, double dh, double ds) {
		double[] values = new double[] {dh, ds};
		STACKS.put(dinucleotide, values);
		STACKS.put(SequenceUtils.reverseComplement(dinucleotide), values);
	}

	@Override
	public double meltingTemperature(String sequence, ThermoParameters params) throws ThermodynamicsException {
		String seq = validate(sequence);
		int n = seq.length();
		double[] stack = stackSum(seq, 0, n - 1);
		double[] init = initiation(seq.charAt(0), seq.charAt(n - 1));
		double dh = stack[0] + init[0];
		double ds = stack[1] + init[1] + saltCorrection(params, n - 1);
		double conc = params.getDnaConc() * 1e-9;
		if(seq.equals(SequenceUtils.reverseComplement(seq))) {
			ds += SYMMETRY_ENTROPY;
		} else {
			conc /= 4;
		}
		return dh * 1000 / (ds + GAS_CONSTANT * Math.log(conc)) - KELVIN;
	}

	@Override
	public ThermoResult hairpin(String sequence, ThermoParameters params) throws ThermodynamicsException {
		String seq = validate(sequence);
		int n = seq.length();
		ThermoResult best = ThermoResult.NO_STRUCTURE;
		// Pairs (i, k-i) lie on one antiparallel diagonal; larger i is closer to the loop
		for(int k = 2 * MIN_HELIX_LENGTH + MIN_HAIRPIN_LOOP - 1; k <= 2 * n - 2; k++) {
			int iMin = Math.max(0, k - n + 1);
			int iMax = Math.min(n - 1, (k - MIN_HAIRPIN_LOOP - 1) / 2);
			int runStart = -1;
			for(int i = iMin; i <= iMax + 1; i++) {
				boolean paired = i <= iMax && SequenceUtils.isComplementary(seq.charAt(i), seq.charAt(k - i));
				if(paired && runStart < 0) {
					runStart = i;
				} else if(!paired && runStart >= 0) {
					int loop = k - 2 * (i - 1) - 1;
					if(loop <= params.getMaxLoop()) {
						best = moreStable(best, stem(seq, runStart, i - 1, loop, params));
					}
					runStart = -1;
				}
			}
		}
		return best;
	}

	@Override
	public ThermoResult homodimer(String sequence, ThermoParameters params) throws ThermodynamicsException {
		String seq = validate(sequence);
		int n = seq.length();
		ThermoResult best = ThermoResult.NO_STRUCTURE;
		for(int k = 0; k <= 2 * n - 2; k++) {
			int iMin = Math.max(0, k - n + 1);
			int iMax = Math.min(n - 1, k);
			int runStart = -1;
			for(int i = iMin; i <= iMax + 1; i++) {
				boolean paired = i <= iMax && SequenceUtils.isComplementary(seq.charAt(i), seq.charAt(k - i));
				if(paired && runStart < 0) {
					runStart = i;
				} else if(!paired && runStart >= 0) {
					best = moreStable(best, helix(seq, runStart, i - 1, params));
					runStart = -1;
				}
			}
		}
		return best;
	}

	@Override
	public String reverseComplement(String sequence) {
		return SequenceUtils.reverseComplement(sequence);
	}

	/**
	 * Bimolecular helix formed by seq[from..to] and its partner strand
	 */
	private static ThermoResult helix(String seq, int from, int to, ThermoParameters params) {
		int length = to - from + 1;
		if(length < MIN_HELIX_LENGTH) {
			return ThermoResult.NO_STRUCTURE;
		}
		double[] stack = stackSum(seq, from, to);
		double[] init = initiation(seq.charAt(from), seq.charAt(to));
		double dh = (stack[0] + init[0]) * 1000;
		double ds = stack[1] + init[1] + saltCorrection(params, length - 1);
		double tm = dh / (ds + GAS_CONSTANT * Math.log(params.getDnaConc() * 1e-9 / 4)) - KELVIN;
		return result(tm, dh, ds, params);
	}

	/**
	 * Hairpin stem formed by seq[from..to] folding back onto its partner bases
	 */
	private static ThermoResult stem(String seq, int from, int to, int loop, ThermoParameters params) {
		int length = to - from + 1;
		if(length < MIN_HELIX_LENGTH) {
			return ThermoResult.NO_STRUCTURE;
		}
		double[] stack = stackSum(seq, from, to);
		double dh = stack[0] * 1000;
		double loopEntropy = -hairpinLoopFreeEnergy(loop) * 1000 / LOOP_REFERENCE_KELVIN;
		double ds = stack[1] + loopEntropy + saltCorrection(params, length - 1);
		double tm = dh / ds - KELVIN;
		return result(tm, dh, ds, params);
	}

	private static ThermoResult result(double tm, double dh, double ds, ThermoParameters params) {
		if(!(tm > 0)) {
			return ThermoResult.NO_STRUCTURE;
		}
		double dg = dh - (params.getTemperature() + KELVIN) * ds;
		return new ThermoResult(true, tm, dg, dh, ds);
	}

	private static ThermoResult moreStable(ThermoResult current, ThermoResult candidate) {
		if(candidate.isStructureFound() && candidate.getMeltingTemp() > current.getMeltingTemp()) {
			return candidate;
		}
		return current;
	}

	/**
	 * @return Summed enthalpy (kcal/mol) and entropy (cal/K/mol) of the stacks in seq[from..to]
	 */
	private static double[] stackSum(String seq, int from, int to) {
		double dh = 0;
		double ds = 0;
		for(int i = from; i < to; i++) {
			double[] values = STACKS.get(seq.substring(i, i + 2));
			dh += values[0];
			ds += values[1];
		}
		return new double[] {dh, ds};
	}

	private static double[] initiation(char first, char last) {
		double[] a = terminalInitiation(first);
		double[] b = terminalInitiation(last);
		return new double[] {a[0] + b[0], a[1] + b[1]};
	}

	private static double[] terminalInitiation(char base) {
		return (base == 'G' || base == 'C') ? INIT_TERMINAL_GC : INIT_TERMINAL_AT;
	}

	private static double saltCorrection(ThermoParameters params, int numPhosphates) {
		return 0.368 * numPhosphates * Math.log(params.getEquivalentMonovalentConc() / 1000);
	}

	/**
	 * Loop free energy at 37C (kcal/mol); loops longer than the table are extrapolated
	 * with the Jacobson-Stockmayer relation
	 */
	static double hairpinLoopFreeEnergy(int loop) {
		int last = HAIRPIN_LOOP_DG.length - 1;
		if(loop <= last) {
			return HAIRPIN_LOOP_DG[loop];
		}
		return HAIRPIN_LOOP_DG[last] + 2.44 * GAS_CONSTANT * LOOP_REFERENCE_KELVIN / 1000 * Math.log((double)loop / last);
	}

	private static String validate(String sequence) throws ThermodynamicsException {
		if(sequence == null || sequence.length() < MIN_HELIX_LENGTH) {
			throw new ThermodynamicsException("Sequence must have at least " + MIN_HELIX_LENGTH + " bases: " + sequence);
		}
		String upper = sequence.toUpperCase();
		if(!SequenceUtils.isUnambiguousDna(upper)) {
			throw new ThermodynamicsException("Sequence contains bases other than A, C, G, T: " + sequence);
		}
		return upper;
	}

}
