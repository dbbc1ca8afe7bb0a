package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

import org.apache.log4j.Logger;

/**
 * Finds the best discriminatory primer whose 3' end binds a given coordinate of the
 * recoded genome, together with the wildtype primer covering the same footprint on the
 * reference genome.
 * <br><br>
 * Every length in the configured size range is tried from shortest to longest. A length
 * is kept if the mutant and wildtype windows pass the thermodynamic filter and the mutant
 * window covers at least the minimum number of designed mismatches. Its score is the
 * composite thermodynamic score plus the weighted mismatch score, and the highest scoring
 * length wins (the shortest on ties).
 */
public class DiscriminatoryPrimerFinder extends AbstractPrimerFinder {

	static Logger logger = Logger.getLogger(DiscriminatoryPrimerFinder.class.getName());

	/**
	 * Bases required between the far end of a reverse strand region and the end of the genome
	 */
	public static final int END_MARGIN = 1;

	private final ThermoFilter filter;
	private final MismatchWeighter weighter;

	/**
	 * @param genome Recoded genome with its reference and lookup tables
	 * @param oracle Thermodynamic calculations
	 * @param config Search settings
	 */
	public DiscriminatoryPrimerFinder(RecodedGenome genome, ThermodynamicOracle oracle, PrimerSearchConfiguration config) {
		super(genome, oracle, config);
		filter = new ThermoFilter(oracle, config, config.isLenientMode());
		weighter = new MismatchWeighter(genome, config);
	}

	/**
	 * @param index Coordinate of the primer 3' end on the recoded genome
	 * @param strand 1 or -1
	 * @return The best pair, or {@link PrimerCandidatePair#NOT_FOUND}
	 * @throws ThermodynamicsException If a thermodynamic calculation fails
	 * @throws IllegalArgumentException If the strand or index is invalid
	 */
	public PrimerCandidatePair findPrimer(int index, int strand) throws ThermodynamicsException {
		return findPrimer(index, Strand.fromValue(strand));
	}

	/**
	 * @param index Coordinate of the primer 3' end on the recoded genome
	 * @param strand Strand
	 * @return The best pair, or {@link PrimerCandidatePair#NOT_FOUND}
	 * @throws ThermodynamicsException If a thermodynamic calculation fails
	 * @throws IllegalArgumentException If the index is invalid
	 */
	public PrimerCandidatePair findPrimer(int index, Strand strand) throws ThermodynamicsException {
		if(strand == null) {
			throw new IllegalArgumentException("Strand is required");
		}
		validateIndex(index);
		int minSize = config.getMinSize();
		int maxSize = config.getMaxSize();

		CandidateRegion mutantRegion = CandidateRegion.forMutant(genome, oracle, index, strand, maxSize, END_MARGIN);
		if(mutantRegion == null) {
			logger.debug("NO_REGION\t" + index + "\t" + strand + "\tnot enough flanking sequence");
			return PrimerCandidatePair.NOT_FOUND;
		}
		CandidateRegion wildtypeRegion = CandidateRegion.forWildtype(genome, oracle, index, strand, maxSize);
		if(wildtypeRegion == null) {
			logger.debug("NO_REGION\t" + index + "\t" + strand + "\twildtype region extends past the reference genome");
			return PrimerCandidatePair.NOT_FOUND;
		}
		if(!config.isLenientMode() && !gcClamp.evaluate(mutantRegion.getSequence())) {
			logger.debug("GC_CLAMP\t" + index + "\t" + strand + "\t" + gcClamp.getShortFailureMessage(mutantRegion.getSequence()));
			return PrimerCandidatePair.NOT_FOUND;
		}

		PrimerCandidatePair best = PrimerCandidatePair.NOT_FOUND;
		double bestScore = Double.NEGATIVE_INFINITY;
		for(int length = minSize; length <= maxSize; length++) {
			String mutantWindow = mutantRegion.window(length);
			String wildtypeWindow = wildtypeRegion.window(length);

			ThermoFilter.Result check = filter.check(mutantWindow, wildtypeWindow);
			if(check.getDecision() == ThermoDecision.CONTINUE) {
				continue;
			}
			if(check.getDecision() == ThermoDecision.STOP) {
				break;
			}

			MismatchTally tally = weighter.weigh(mutantRegion, length);
			if(!weighter.hasEnoughMismatches(tally)) {
				logger.debug("TOO_FEW_MISMATCHES\t" + index + "\t" + strand + "\t" + length + "\t" + tally.getNumMismatches());
				continue;
			}

			WindowThermodynamics mutantThermo = check.getWindow(0);
			WindowThermodynamics wildtypeThermo = check.getWindow(1);
			double score = thermoScore.getScore(mutantThermo) + tally.getWeightedScore();
			if(score > bestScore) {
				int anchor = mutantRegion.fivePrimeMostIndex(length);
				PrimerCandidate mutant = new PrimerCandidate(anchor, mutantWindow, strand, tally.getFlags(),
						mutantThermo.getMeltingTemp(), mutantThermo.getHomodimerTemp(), mutantThermo.getHairpinTemp(), score);
				PrimerCandidate wildtype = new PrimerCandidate(genome.toReferenceIndex(anchor), wildtypeWindow, strand, new int[length],
						wildtypeThermo.getMeltingTemp(), wildtypeThermo.getHomodimerTemp(), wildtypeThermo.getHairpinTemp(), 0);
				best = new PrimerCandidatePair(mutant, wildtype);
				bestScore = score;
			}
		}
		if(best.isFound()) {
			logger.debug("FOUND\t" + index + "\t" + strand + "\t" + best.getMutantPrimer());
		}
		return best;
	}

}
