package mascpcr.core.primer;

import java.util.Arrays;

/**
 * A primer selected at one genomic anchor.
 * <br><br>
 * The anchor index is the 5'-most nucleotide of the footprint on the forward strand of the
 * primer's own genome, so it is the same for a forward primer ending at position p with
 * length L (p - L + 1) and a reverse primer whose 3' end sits on that position:
 * <pre>
 * Fwd primer idx  |
 * Fwd primer      &gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;&gt;
 * Genome          ATTACCGATACCAATTGACCAGTTGGGACCCAGTTGACCAGTTGG
 * Rev primer                                  &lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;&lt;
 * Rev primer idx                              |
 * </pre>
 * Mismatch flags are indexed from the 3' end of the primer.
 */
public final class PrimerCandidate {

	private final int anchorIndex;
	private final String sequence;
	private final Strand strand;
	private final int[] mismatchFlags;
	private final double meltingTemp;
	private final double homodimerTemp;
	private final double hairpinTemp;
	private final double score;

	/**
	 * @param anchorIndex Forward strand coordinate of the 5'-most footprint position
	 * @param sequence Primer sequence 5' to 3'
	 * @param strand Strand
	 * @param mismatchFlags 1 at each offset from the 3' end carrying a designed mismatch, one entry per base
	 * @param meltingTemp Melting temperature
	 * @param homodimerTemp Homodimer melting temperature
	 * @param hairpinTemp Hairpin melting temperature
	 * @param score Composite score
	 */
	public PrimerCandidate(int anchorIndex, String sequence, Strand strand, int[] mismatchFlags, double meltingTemp, double homodimerTemp, double hairpinTemp, double score) {
		if(sequence == null || strand == null || mismatchFlags == null) {
			throw new IllegalArgumentException("Sequence, strand and mismatch flags are required");
		}
		if(mismatchFlags.length != sequence.length()) {
			throw new IllegalArgumentException("Got " + mismatchFlags.length + " mismatch flags for a primer of length " + sequence.length());
		}
		this.anchorIndex = anchorIndex;
		this.sequence = sequence;
		this.strand = strand;
		this.mismatchFlags = mismatchFlags.clone();
		this.meltingTemp = meltingTemp;
		this.homodimerTemp = homodimerTemp;
		this.hairpinTemp = hairpinTemp;
		this.score = score;
	}

	public int getAnchorIndex() {
		return anchorIndex;
	}

	public String getSequence() {
		return sequence;
	}

	public Strand getStrand() {
		return strand;
	}

	public int length() {
		return sequence.length();
	}

	/**
	 * @return Copy of the mismatch flags, index 0 is the 3'-most base
	 */
	public int[] getMismatchFlags() {
		return mismatchFlags.clone();
	}

	/**
	 * @param offset Offset from the 3' end
	 * @return True if the position carries a designed mismatch
	 */
	public boolean isMismatch(int offset) {
		return mismatchFlags[offset] == 1;
	}

	/**
	 * @return Number of designed mismatches in the footprint
	 */
	public int getNumMismatches() {
		int count = 0;
		for(int flag : mismatchFlags) {
			count += flag;
		}
		return count;
	}

	public double getMeltingTemp() {
		return meltingTemp;
	}

	public double getHomodimerTemp() {
		return homodimerTemp;
	}

	public double getHairpinTemp() {
		return hairpinTemp;
	}

	public double getScore() {
		return score;
	}

	/**
	 * @return Tab-delimited field names matching toString()
	 */
	public static String getFieldNames() {
		return "anchor_index\tsequence\tstrand\tlength\tmismatch_offsets\ttm\ttm_homodimer\ttm_hairpin\tscore";
	}

	/**
	 * @return Comma separated 3' offsets of the mismatches, or - if none
	 */
	public String getMismatchOffsetString() {
		StringBuilder sb = new StringBuilder();
		for(int i = 0; i < mismatchFlags.length; i++) {
			if(mismatchFlags[i] == 1) {
				if(sb.length() > 0) sb.append(",");
				sb.append(i);
			}
		}
		return sb.length() == 0 ? "-" : sb.toString();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(anchorIndex)
			.append("\t").append(sequence)
			.append("\t").append(strand)
			.append("\t").append(length())
			.append("\t").append(getMismatchOffsetString())
			.append("\t").append(String.format("%.2f", Double.valueOf(meltingTemp)))
			.append("\t").append(String.format("%.2f", Double.valueOf(homodimerTemp)))
			.append("\t").append(String.format("%.2f", Double.valueOf(hairpinTemp)))
			.append("\t").append(String.format("%.4f", Double.valueOf(score)));
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof PrimerCandidate)) return false;
		PrimerCandidate p = (PrimerCandidate)o;
		return anchorIndex == p.anchorIndex && sequence.equals(p.sequence) && strand == p.strand
				&& Arrays.equals(mismatchFlags, p.mismatchFlags)
				&& Double.compare(meltingTemp, p.meltingTemp) == 0
				&& Double.compare(homodimerTemp, p.homodimerTemp) == 0
				&& Double.compare(hairpinTemp, p.hairpinTemp) == 0
				&& Double.compare(score, p.score) == 0;
	}

	@Override
	public int hashCode() {
		return (anchorIndex + "_" + sequence + "_" + strand).hashCode();
	}

}
