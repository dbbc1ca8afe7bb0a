package mascpcr.core.primer.score;

import mascpcr.core.thermo.ThermodynamicsException;

/**
 * A score for a primer sequence, higher is better
 */
public interface PrimerScore {

	/**
	 * Get the value of the score
	 * @param sequence Primer sequence 5' to 3'
	 * @return The score
	 * @throws ThermodynamicsException
	 */
	public double getScore(String sequence) throws ThermodynamicsException;

	/**
	 * Get the name of the score
	 * @return Score name
	 */
	public String getScoreName();

}
