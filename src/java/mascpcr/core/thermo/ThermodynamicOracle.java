package mascpcr.core.thermo;

/**
 * Source of the thermodynamic values used to judge primer candidates.
 * Implementations used from several threads at once must be reentrant.
 */
public interface ThermodynamicOracle {

	/**
	 * Melting temperature of the sequence against its perfect complement
	 * @param sequence Sequence 5' to 3'
	 * @param params Solution conditions
	 * @return Melting temperature (C)
	 * @throws ThermodynamicsException If the value cannot be computed
	 */
	public double meltingTemperature(String sequence, ThermoParameters params) throws ThermodynamicsException;

	/**
	 * Most stable hairpin of the sequence
	 * @param sequence Sequence 5' to 3'
	 * @param params Solution conditions
	 * @return The hairpin, or a result with no structure
	 * @throws ThermodynamicsException If the value cannot be computed
	 */
	public ThermoResult hairpin(String sequence, ThermoParameters params) throws ThermodynamicsException;

	/**
	 * Most stable dimer of the sequence with itself
	 * @param sequence Sequence 5' to 3'
	 * @param params Solution conditions
	 * @return The homodimer, or a result with no structure
	 * @throws ThermodynamicsException If the value cannot be computed
	 */
	public ThermoResult homodimer(String sequence, ThermoParameters params) throws ThermodynamicsException;

	/**
	 * @param sequence Sequence 5' to 3'
	 * @return Reverse complement 5' to 3'
	 */
	public String reverseComplement(String sequence);

}
