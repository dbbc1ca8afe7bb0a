package mascpcr.core.primer;

/**
 * Melting temperatures measured for one candidate window. Structure temperatures are
 * NaN when the check stopped before computing them.
 */
public final class WindowThermodynamics {

	private final String sequence;
	private final double meltingTemp;
	private final double hairpinTemp;
	private final double homodimerTemp;

	public WindowThermodynamics(String sequence, double meltingTemp, double hairpinTemp, double homodimerTemp) {
		this.sequence = sequence;
		this.meltingTemp = meltingTemp;
		this.hairpinTemp = hairpinTemp;
		this.homodimerTemp = homodimerTemp;
	}

	public String getSequence() {
		return sequence;
	}

	public double getMeltingTemp() {
		return meltingTemp;
	}

	public double getHairpinTemp() {
		return hairpinTemp;
	}

	public double getHomodimerTemp() {
		return homodimerTemp;
	}

	/**
	 * @return True if the hairpin and homodimer temperatures were computed
	 */
	public boolean hasStructureTemps() {
		return !Double.isNaN(hairpinTemp) && !Double.isNaN(homodimerTemp);
	}

	@Override
	public String toString() {
		return sequence + " tm=" + meltingTemp + " hairpin=" + hairpinTemp + " homodimer=" + homodimerTemp;
	}

}
