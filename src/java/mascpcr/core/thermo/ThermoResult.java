package mascpcr.core.thermo;

/**
 * Result of a secondary structure calculation (hairpin or dimer)
 */
public final class ThermoResult {

	/**
	 * Result reported when no structure could be formed
	 */
	public static final ThermoResult NO_STRUCTURE = new ThermoResult(false, 0, 0, 0, 0);

	private final boolean structureFound;
	private final double meltingTemp;
	private final double deltaG;
	private final double deltaH;
	private final double deltaS;

	/**
	 * @param structureFound Whether any structure was found
	 * @param meltingTemp Melting temperature of the structure (C)
	 * @param deltaG Free energy (cal/mol)
	 * @param deltaH Enthalpy (cal/mol)
	 * @param deltaS Entropy (cal/K/mol)
	 */
	public ThermoResult(boolean structureFound, double meltingTemp, double deltaG, double deltaH, double deltaS) {
		this.structureFound = structureFound;
		this.meltingTemp = meltingTemp;
		this.deltaG = deltaG;
		this.deltaH = deltaH;
		this.deltaS = deltaS;
	}

	public boolean isStructureFound() {
		return structureFound;
	}

	public double getMeltingTemp() {
		return meltingTemp;
	}

	public double getDeltaG() {
		return deltaG;
	}

	public double getDeltaH() {
		return deltaH;
	}

	public double getDeltaS() {
		return deltaS;
	}

	@Override
	public String toString() {
		return "tm=" + meltingTemp + " dg=" + deltaG + " dh=" + deltaH + " ds=" + deltaS;
	}

}
