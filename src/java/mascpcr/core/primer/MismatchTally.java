package mascpcr.core.primer;

/**
 * Designed mismatches found in one candidate window
 */
public final class MismatchTally {

	private final int[] flags;
	private final int numMismatches;
	private final double weightedScore;
	private final int edgeOffset;

	/**
	 * @param flags Mismatch flag per offset from the 3' end
	 * @param numMismatches Number of flagged offsets
	 * @param weightedScore Sum of the weights of the flagged offsets
	 * @param edgeOffset Offset at which an edge ended the walk, or -1
	 */
	MismatchTally(int[] flags, int numMismatches, double weightedScore, int edgeOffset) {
		this.flags = flags;
		this.numMismatches = numMismatches;
		this.weightedScore = weightedScore;
		this.edgeOffset = edgeOffset;
	}

	/**
	 * @return Copy of the flags, index 0 is the 3'-most base
	 */
	public int[] getFlags() {
		return flags.clone();
	}

	public int getNumMismatches() {
		return numMismatches;
	}

	public double getWeightedScore() {
		return weightedScore;
	}

	/**
	 * @return True if an edge inside the window ended the walk early
	 */
	public boolean isTruncatedAtEdge() {
		return edgeOffset >= 0;
	}

	/**
	 * @return Offset of the edge that ended the walk, or -1
	 */
	public int getEdgeOffset() {
		return edgeOffset;
	}

}
