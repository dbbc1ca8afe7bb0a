package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;

import org.apache.log4j.Logger;

/**
 * Scores how well a window discriminates the recoded genome from the reference by
 * walking it from the 3' end and weighting each designed mismatch by its offset.
 */
public class MismatchWeighter {

	static Logger logger = Logger.getLogger(MismatchWeighter.class.getName());

	private final RecodedGenome genome;
	private final PrimerSearchConfiguration config;

	public MismatchWeighter(RecodedGenome genome, PrimerSearchConfiguration config) {
		this.genome = genome;
		this.config = config;
	}

	/**
	 * Tally mismatches in the trailing window of a region. The walk stops at the first
	 * edge; mismatches already counted are kept and the window is still scored.
	 * @param region Region on the recoded genome
	 * @param length Window length
	 * @return The tally
	 */
	public MismatchTally weigh(CandidateRegion region, int length) {
		int[] flags = new int[length];
		int count = 0;
		double score = 0;
		int edgeOffset = -1;
		for(int offset = 0; offset < length; offset++) {
			int pos = region.coordinate(offset);
			if(genome.isEdge(pos)) {
				edgeOffset = offset;
				logger.debug("Edge at " + pos + " (offset " + offset + ") ends mismatch walk from " + region.getThreePrimeIndex());
				break;
			}
			if(genome.isMismatch(pos)) {
				flags[offset] = 1;
				count++;
				score += config.getMismatchWeight(offset);
			}
		}
		return new MismatchTally(flags, count, score, edgeOffset);
	}

	/**
	 * @param tally A tally
	 * @return True if the tally has the configured minimum number of mismatches
	 */
	public boolean hasEnoughMismatches(MismatchTally tally) {
		return tally.getNumMismatches() >= config.getMinNumMismatches();
	}

}
