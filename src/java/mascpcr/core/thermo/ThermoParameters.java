package mascpcr.core.thermo;

/**
 * Solution conditions forwarded to the thermodynamic calculations.
 * Defaults are the primer3 defaults.
 */
public final class ThermoParameters {

	public static final double DEFAULT_MONOVALENT_CONC = 50.0;
	public static final double DEFAULT_DIVALENT_CONC = 0.0;
	public static final double DEFAULT_DNTP_CONC = 0.8;
	public static final double DEFAULT_DNA_CONC = 50.0;
	public static final double DEFAULT_TEMPERATURE = 37.0;
	public static final int DEFAULT_MAX_LOOP = 30;

	private final double monovalentConc;
	private final double divalentConc;
	private final double dntpConc;
	private final double dnaConc;
	private final double temperature;
	private final int maxLoop;

	/**
	 * @param monovalentConc Monovalent cation concentration (mM)
	 * @param divalentConc Divalent cation concentration (mM)
	 * @param dntpConc dNTP concentration (mM)
	 * @param dnaConc Oligo concentration (nM)
	 * @param temperature Temperature at which free energies are reported (C)
	 * @param maxLoop Maximum loop size considered for secondary structures
	 */
	public ThermoParameters(double monovalentConc, double divalentConc, double dntpConc, double dnaConc, double temperature, int maxLoop) {
		if(monovalentConc < 0 || divalentConc < 0 || dntpConc < 0) {
			throw new IllegalArgumentException("Salt and dNTP concentrations must be non-negative");
		}
		if(dnaConc <= 0) {
			throw new IllegalArgumentException("DNA concentration must be positive: " + dnaConc);
		}
		if(monovalentConc == 0 && divalentConc <= dntpConc) {
			throw new IllegalArgumentException("No free cations: monovalent concentration is 0 and divalent concentration does not exceed dNTP concentration");
		}
		if(maxLoop < 3) {
			throw new IllegalArgumentException("Max loop must be at least 3: " + maxLoop);
		}
		this.monovalentConc = monovalentConc;
		this.divalentConc = divalentConc;
		this.dntpConc = dntpConc;
		this.dnaConc = dnaConc;
		this.temperature = temperature;
		this.maxLoop = maxLoop;
	}

	/**
	 * @return Parameters with all primer3 default values
	 */
	public static ThermoParameters getDefault() {
		return new ThermoParameters(DEFAULT_MONOVALENT_CONC, DEFAULT_DIVALENT_CONC, DEFAULT_DNTP_CONC, DEFAULT_DNA_CONC, DEFAULT_TEMPERATURE, DEFAULT_MAX_LOOP);
	}

	public double getMonovalentConc() {
		return monovalentConc;
	}

	public double getDivalentConc() {
		return divalentConc;
	}

	public double getDntpConc() {
		return dntpConc;
	}

	public double getDnaConc() {
		return dnaConc;
	}

	public double getTemperature() {
		return temperature;
	}

	public int getMaxLoop() {
		return maxLoop;
	}

	/**
	 * Monovalent-equivalent cation concentration in mM, converting free divalent
	 * cations with the von Ahsen approximation used by primer3
	 * @return Equivalent monovalent concentration (mM)
	 */
	public double getEquivalentMonovalentConc() {
		double free = divalentConc - dntpConc;
		if(free <= 0) {
			return monovalentConc;
		}
		return monovalentConc + 120 * Math.sqrt(free);
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof ThermoParameters)) return false;
		ThermoParameters p = (ThermoParameters)o;
		return Double.compare(monovalentConc, p.monovalentConc) == 0
				&& Double.compare(divalentConc, p.divalentConc) == 0
				&& Double.compare(dntpConc, p.dntpConc) == 0
				&& Double.compare(dnaConc, p.dnaConc) == 0
				&& Double.compare(temperature, p.temperature) == 0
				&& maxLoop == p.maxLoop;
	}

	@Override
	public int hashCode() {
		return toString().hashCode();
	}

	@Override
	public String toString() {
		return "mv=" + monovalentConc + " dv=" + divalentConc + " dntp=" + dntpConc + " dna=" + dnaConc + " t=" + temperature + " maxloop=" + maxLoop;
	}

}
