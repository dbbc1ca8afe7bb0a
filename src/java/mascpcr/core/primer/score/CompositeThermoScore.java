package mascpcr.core.primer.score;

import mascpcr.core.primer.PrimerSearchConfiguration;
import mascpcr.core.primer.WindowThermodynamics;
import mascpcr.core.thermo.ThermoParameters;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

/**
 * Penalizes distance of the melting temperature from the middle of the Tm range and
 * the hairpin and homodimer melting temperatures, each as the square of its scaled
 * error. The best possible score is 0.
 */
public class CompositeThermoScore implements PrimerScore {

	private final ThermodynamicOracle oracle;
	private final ThermoParameters params;
	private final double targetTm;
	private final double tmRangeWidth;
	private final double spuriousTmClip;

	/**
	 * @param oracle Used for any temperature not supplied by the caller
	 * @param config Tm range, spurious Tm clip and thermodynamic parameters
	 */
	public CompositeThermoScore(ThermodynamicOracle oracle, PrimerSearchConfiguration config) {
		this.oracle = oracle;
		this.params = config.getThermoParameters();
		this.targetTm = config.getTargetTm();
		this.tmRangeWidth = config.getTmRangeWidth();
		this.spuriousTmClip = config.getSpuriousTmClip();
	}

	@Override
	public double getScore(String sequence) throws ThermodynamicsException {
		return getScore(sequence, null, null, null);
	}

	/**
	 * Score a sequence, computing any temperature passed as null
	 * @param sequence Primer sequence
	 * @param meltingTemp Melting temperature or null
	 * @param hairpinTemp Hairpin melting temperature or null
	 * @param homodimerTemp Homodimer melting temperature or null
	 * @return The score
	 * @throws ThermodynamicsException
	 */
	public double getScore(String sequence, Double meltingTemp, Double hairpinTemp, Double homodimerTemp) throws ThermodynamicsException {
		double tm = meltingTemp != null ? meltingTemp.doubleValue() : oracle.meltingTemperature(sequence, params);
		double hairpin = hairpinTemp != null ? hairpinTemp.doubleValue() : oracle.hairpin(sequence, params).getMeltingTemp();
		double homodimer = homodimerTemp != null ? homodimerTemp.doubleValue() : oracle.homodimer(sequence, params).getMeltingTemp();
		return score(tm, hairpin, homodimer);
	}

	/**
	 * @param window Measured window; structure temperatures must be present
	 * @return The score
	 */
	public double getScore(WindowThermodynamics window) {
		if(!window.hasStructureTemps()) {
			throw new IllegalArgumentException("Window was not fully measured: " + window);
		}
		return score(window.getMeltingTemp(), window.getHairpinTemp(), window.getHomodimerTemp());
	}

	/**
	 * @param meltingTemp Melting temperature
	 * @param hairpinTemp Hairpin melting temperature
	 * @param homodimerTemp Homodimer melting temperature
	 * @return The score
	 */
	public double score(double meltingTemp, double hairpinTemp, double homodimerTemp) {
		return heterodimerPenalty(meltingTemp) + structurePenalty(hairpinTemp) + structurePenalty(homodimerTemp);
	}

	private double heterodimerPenalty(double tm) {
		double x = (tm - targetTm) / tmRangeWidth;
		return -(x * x);
	}

	private double structurePenalty(double tm) {
		double x = tm / spuriousTmClip;
		return -(x * x);
	}

	@Override
	public String getScoreName() {
		return "composite_thermo_score";
	}

}
