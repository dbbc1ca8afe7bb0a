package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.thermo.ThermodynamicOracle;

/**
 * The longest primer footprint whose 3' end sits on a fixed genome coordinate, read 5' to 3'
 * in the primer's orientation. Shorter candidates are its trailing windows, so every window
 * shares the 3' end and the 5' end recedes as the window grows.
 * <br><br>
 * All strand arithmetic lives here: offset o from the 3' end is at genome coordinate
 * {@code threePrimeIndex - o * strand}.
 */
public final class CandidateRegion {

	private final String sequence;
	private final int threePrimeIndex;
	private final Strand strand;

	private CandidateRegion(String sequence, int threePrimeIndex, Strand strand) {
		this.sequence = sequence;
		this.threePrimeIndex = threePrimeIndex;
		this.strand = strand;
	}

	/**
	 * Region on the recoded genome
	 * @param genome The genome
	 * @param oracle Supplies the reverse complement
	 * @param index Coordinate of the primer 3' end
	 * @param strand Strand
	 * @param maxSize Region length
	 * @param margin Bases that must remain between the far end of the reverse strand region and the end of the genome
	 * @return The region, or null if there is not enough flanking sequence
	 */
	public static CandidateRegion forMutant(RecodedGenome genome, ThermodynamicOracle oracle, int index, Strand strand, int maxSize, int margin) {
		if(index - maxSize < 0 || index + maxSize > genome.length() - margin) {
			return null;
		}
		return extract(genome.getMutantSequence(), oracle, index, strand, maxSize);
	}

	/**
	 * Region on the reference genome matching a recoded genome region, anchored at the
	 * reference coordinate the index lookup table gives for the recoded 3' end
	 * @param genome The genome
	 * @param oracle Supplies the reverse complement
	 * @param index Recoded genome coordinate of the primer 3' end
	 * @param strand Strand
	 * @param maxSize Region length
	 * @return The region, or null if it would extend past the reference genome
	 */
	public static CandidateRegion forWildtype(RecodedGenome genome, ThermodynamicOracle oracle, int index, Strand strand, int maxSize) {
		int referenceIndex;
		if(strand == Strand.FORWARD) {
			if(index + 1 >= genome.length()) return null;
			referenceIndex = genome.toReferenceIndex(index + 1) - 1;
		} else {
			referenceIndex = genome.toReferenceIndex(index);
		}
		return extract(genome.getReferenceSequence(), oracle, referenceIndex, strand, maxSize);
	}

	private static CandidateRegion extract(String genomeSequence, ThermodynamicOracle oracle, int threePrimeIndex, Strand strand, int maxSize) {
		if(strand == Strand.FORWARD) {
			int start = threePrimeIndex - maxSize + 1;
			if(start < 0 || threePrimeIndex >= genomeSequence.length()) return null;
			return new CandidateRegion(genomeSequence.substring(start, threePrimeIndex + 1), threePrimeIndex, strand);
		}
		int end = threePrimeIndex + maxSize;
		if(threePrimeIndex < 0 || end > genomeSequence.length()) return null;
		return new CandidateRegion(oracle.reverseComplement(genomeSequence.substring(threePrimeIndex, end)), threePrimeIndex, strand);
	}

	/**
	 * @return The full region 5' to 3'
	 */
	public String getSequence() {
		return sequence;
	}

	/**
	 * @return Region length, the largest window available
	 */
	public int length() {
		return sequence.length();
	}

	/**
	 * @return Genome coordinate of the 3' end
	 */
	public int getThreePrimeIndex() {
		return threePrimeIndex;
	}

	public Strand getStrand() {
		return strand;
	}

	/**
	 * @param length Window length
	 * @return The trailing window of the given length, 5' to 3'
	 */
	public String window(int length) {
		if(length < 1 || length > sequence.length()) {
			throw new IllegalArgumentException("Window length " + length + " is outside 1-" + sequence.length());
		}
		return sequence.substring(sequence.length() - length);
	}

	/**
	 * @param length Number of bases
	 * @return The 3'-most bases of the region
	 */
	public String threePrimeEnd(int length) {
		return window(Math.min(length, sequence.length()));
	}

	/**
	 * @param offset Offset from the 3' end
	 * @return Genome coordinate of the base at the offset
	 */
	public int coordinate(int offset) {
		return threePrimeIndex - offset * strand.getSign();
	}

	/**
	 * @param length Window length
	 * @return Forward strand coordinate of the 5'-most footprint position of the window
	 */
	public int fivePrimeMostIndex(int length) {
		return strand == Strand.FORWARD ? threePrimeIndex - length + 1 : threePrimeIndex;
	}

}
