package mascpcr.core.primer;

/**
 * A discriminatory primer on the recoded genome and its counterpart on the reference genome
 */
public final class PrimerCandidatePair {

	/**
	 * Returned when no discriminatory primer exists at an anchor
	 */
	public static final PrimerCandidatePair NOT_FOUND = new PrimerCandidatePair();

	private final PrimerCandidate mutantPrimer;
	private final PrimerCandidate wildtypePrimer;

	private PrimerCandidatePair() {
		mutantPrimer = null;
		wildtypePrimer = null;
	}

	/**
	 * @param mutantPrimer Discriminatory primer on the recoded genome
	 * @param wildtypePrimer Counterpart on the reference genome
	 */
	public PrimerCandidatePair(PrimerCandidate mutantPrimer, PrimerCandidate wildtypePrimer) {
		if(mutantPrimer == null || wildtypePrimer == null) {
			throw new IllegalArgumentException("Both primers are required; use NOT_FOUND for a missing pair");
		}
		if(mutantPrimer.getStrand() != wildtypePrimer.getStrand() || mutantPrimer.length() != wildtypePrimer.length()) {
			throw new IllegalArgumentException("Mutant and wildtype primers must share strand and length");
		}
		this.mutantPrimer = mutantPrimer;
		this.wildtypePrimer = wildtypePrimer;
	}

	/**
	 * @return False for the not found sentinel
	 */
	public boolean isFound() {
		return mutantPrimer != null;
	}

	/**
	 * @return The discriminatory primer, or null if not found
	 */
	public PrimerCandidate getMutantPrimer() {
		return mutantPrimer;
	}

	/**
	 * @return The wildtype primer, or null if not found
	 */
	public PrimerCandidate getWildtypePrimer() {
		return wildtypePrimer;
	}

	@Override
	public String toString() {
		if(!isFound()) return "NOT_FOUND";
		return mutantPrimer.toString() + "\n" + wildtypePrimer.toString();
	}

}
