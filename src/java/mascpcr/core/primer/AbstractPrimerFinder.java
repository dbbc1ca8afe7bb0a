package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.primer.predicate.ThreePrimeGCClamp;
import mascpcr.core.primer.score.CompositeThermoScore;
import mascpcr.core.thermo.ThermodynamicOracle;

/**
 * State shared by the primer searches. A finder only reads the genome and configuration,
 * so one instance can serve many threads as long as the oracle is reentrant.
 */
public abstract class AbstractPrimerFinder {

	protected final RecodedGenome genome;
	protected final ThermodynamicOracle oracle;
	protected final PrimerSearchConfiguration config;
	protected final ThreePrimeGCClamp gcClamp;
	protected final CompositeThermoScore thermoScore;

	protected AbstractPrimerFinder(RecodedGenome genome, ThermodynamicOracle oracle, PrimerSearchConfiguration config) {
		if(genome == null || oracle == null || config == null) {
			throw new IllegalArgumentException("Genome, thermodynamic oracle and configuration are required");
		}
		this.genome = genome;
		this.oracle = oracle;
		this.config = config;
		this.gcClamp = new ThreePrimeGCClamp();
		this.thermoScore = new CompositeThermoScore(oracle, config);
	}

	/**
	 * @param index Anchor coordinate
	 * @throws IllegalArgumentException If the coordinate is not in the recoded genome
	 */
	protected void validateIndex(int index) {
		if(index < 0 || index >= genome.length()) {
			throw new IllegalArgumentException("Index " + index + " is outside the genome (length " + genome.length() + ")");
		}
	}

	public RecodedGenome getGenome() {
		return genome;
	}

	public PrimerSearchConfiguration getConfiguration() {
		return config;
	}

}
