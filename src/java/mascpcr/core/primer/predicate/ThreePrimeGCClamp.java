package mascpcr.core.primer.predicate;

import mascpcr.core.sequence.SequenceUtils;

/**
 * Check that the 3' end of a sequence is not too G/C rich, which makes mispriming
 * more likely
 */
public class ThreePrimeGCClamp implements PrimerSequencePredicate {

	public static final int DEFAULT_END_LENGTH = 5;
	public static final int DEFAULT_MAX_GC = 3;

	private int endLength = DEFAULT_END_LENGTH;
	private int maxGC = DEFAULT_MAX_GC;

	public ThreePrimeGCClamp() {}

	/**
	 * @param endLength Number of 3'-most bases to examine
	 * @param maxGC Maximum number of G or C bases allowed among them
	 */
	public ThreePrimeGCClamp(int endLength, int maxGC) {
		this.endLength = endLength;
		this.maxGC = maxGC;
	}

	@Override
	public boolean evaluate(String sequence) {
		return countEndGC(sequence) <= maxGC;
	}

	private int countEndGC(String sequence) {
		int start = Math.max(0, sequence.length() - endLength);
		return SequenceUtils.countGC(sequence.substring(start));
	}

	@Override
	public String getPredicateName() {
		return "three_prime_gc_clamp";
	}

	@Override
	public String getShortFailureMessage(String sequence) {
		return countEndGC(sequence) + "_gc_in_last_" + endLength;
	}

}
