package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

import org.apache.log4j.Logger;

/**
 * Finds the best common primer whose 3' end binds a given coordinate. A common primer
 * binds the recoded and reference genomes alike, so its footprint may not cover any
 * designed mismatch; the search ends at the first length that would. The thermodynamic
 * filter and the 3' GC clamp check are always applied.
 */
public class CommonPrimerFinder extends AbstractPrimerFinder {

	static Logger logger = Logger.getLogger(CommonPrimerFinder.class.getName());

	/**
	 * Bases required between the far end of a reverse strand region and the end of the genome
	 */
	public static final int END_MARGIN = 2;

	private final ThermoFilter filter;

	/**
	 * @param genome Recoded genome with its lookup tables
	 * @param oracle Thermodynamic calculations
	 * @param config Search settings; lenient mode and mismatch settings are ignored
	 */
	public CommonPrimerFinder(RecodedGenome genome, ThermodynamicOracle oracle, PrimerSearchConfiguration config) {
		super(genome, oracle, config);
		filter = new ThermoFilter(oracle, config, false);
	}

	/**
	 * @param index Coordinate of the primer 3' end
	 * @param strand 1 or -1
	 * @return The best primer, or null if none
	 * @throws ThermodynamicsException If a thermodynamic calculation fails
	 * @throws IllegalArgumentException If the strand or index is invalid
	 */
	public PrimerCandidate findPrimer(int index, int strand) throws ThermodynamicsException {
		return findPrimer(index, Strand.fromValue(strand));
	}

	/**
	 * @param index Coordinate of the primer 3' end
	 * @param strand Strand
	 * @return The best primer, or null if none
	 * @throws ThermodynamicsException If a thermodynamic calculation fails
	 * @throws IllegalArgumentException If the index is invalid
	 */
	public PrimerCandidate findPrimer(int index, Strand strand) throws ThermodynamicsException {
		if(strand == null) {
			throw new IllegalArgumentException("Strand is required");
		}
		validateIndex(index);
		int minSize = config.getMinSize();
		int maxSize = config.getMaxSize();

		CandidateRegion region = CandidateRegion.forMutant(genome, oracle, index, strand, maxSize, END_MARGIN);
		if(region == null) {
			logger.debug("NO_REGION\t" + index + "\t" + strand + "\tnot enough flanking sequence");
			return null;
		}
		if(!gcClamp.evaluate(region.getSequence())) {
			logger.debug("GC_CLAMP\t" + index + "\t" + strand + "\t" + gcClamp.getShortFailureMessage(region.getSequence()));
			return null;
		}

		PrimerCandidate best = null;
		double bestScore = Double.NEGATIVE_INFINITY;
		for(int length = minSize; length <= maxSize; length++) {
			// The first window is checked whole, after that only the base each step adds
			int firstNewOffset = length == minSize ? 0 : length - 1;
			for(int offset = firstNewOffset; offset < length; offset++) {
				if(genome.isMismatch(region.coordinate(offset))) {
					logger.debug("MISMATCH\t" + index + "\t" + strand + "\tfootprint of length " + length + " covers mismatch at " + region.coordinate(offset));
					return best;
				}
			}

			String window = region.window(length);
			ThermoFilter.Result check = filter.check(window);
			if(check.getDecision() == ThermoDecision.CONTINUE) {
				continue;
			}
			if(check.getDecision() == ThermoDecision.STOP) {
				break;
			}

			WindowThermodynamics thermo = check.getWindow(0);
			double score = thermoScore.getScore(thermo);
			if(score > bestScore) {
				best = new PrimerCandidate(region.fivePrimeMostIndex(length), window, strand, new int[length],
						thermo.getMeltingTemp(), thermo.getHomodimerTemp(), thermo.getHairpinTemp(), score);
				bestScore = score;
			}
		}
		return best;
	}

}
