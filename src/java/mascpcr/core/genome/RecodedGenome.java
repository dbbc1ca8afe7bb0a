package mascpcr.core.genome;

import org.apache.log4j.Logger;

/**
 * A recoded (mutant) genome together with its reference genome and the per-coordinate
 * lookup tables relating them. All tables are indexed by mutant genome coordinate.
 * <br><br>
 * Instances are read-only once built and can be shared by concurrent primer searches.
 */
public class RecodedGenome {

	static Logger logger = Logger.getLogger(RecodedGenome.class.getName());

	private final String mutantSequence;
	private final String referenceSequence;
	private final int[] indexLookup;
	private final boolean[] edges;
	private final boolean[] mismatches;

	/**
	 * @param mutantSequence Recoded genome sequence
	 * @param referenceSequence Reference genome sequence
	 * @param indexLookup Reference coordinate for each mutant coordinate, non-decreasing
	 * @param edges Mutant coordinates a primer footprint must not cross
	 * @param mismatches Mutant coordinates carrying a designed change relative to the reference
	 */
	public RecodedGenome(String mutantSequence, String referenceSequence, int[] indexLookup, boolean[] edges, boolean[] mismatches) {
		if(mutantSequence == null || referenceSequence == null) {
			throw new IllegalArgumentException("Mutant and reference sequences are required");
		}
		int n = mutantSequence.length();
		validateLength("Index lookup table", indexLookup == null ? -1 : indexLookup.length, n);
		validateLength("Edge table", edges == null ? -1 : edges.length, n);
		validateLength("Mismatch table", mismatches == null ? -1 : mismatches.length, n);
		for(int i = 0; i < n; i++) {
			if(indexLookup[i] < 0 || indexLookup[i] > referenceSequence.length()) {
				throw new IllegalArgumentException("Index lookup value " + indexLookup[i] + " at " + i + " is outside the reference genome (length " + referenceSequence.length() + ")");
			}
			if(i > 0 && indexLookup[i] < indexLookup[i - 1]) {
				throw new IllegalArgumentException("Index lookup table decreases at " + i + ": " + indexLookup[i - 1] + " > " + indexLookup[i]);
			}
		}
		this.mutantSequence = mutantSequence.toUpperCase();
		this.referenceSequence = referenceSequence.toUpperCase();
		this.indexLookup = indexLookup.clone();
		this.edges = edges.clone();
		this.mismatches = mismatches.clone();
		logger.debug("Recoded genome of length " + n + " against reference of length " + referenceSequence.length());
	}

	private static void validateLength(String name, int length, int expected) {
		if(length != expected) {
			throw new IllegalArgumentException(name + " length " + length + " does not match mutant genome length " + expected);
		}
	}

	/**
	 * An identity lookup table for genomes that share a coordinate system
	 * @param length Genome length
	 * @return Table mapping every coordinate to itself
	 */
	public static int[] identityLookup(int length) {
		int[] lut = new int[length];
		for(int i = 0; i < length; i++) {
			lut[i] = i;
		}
		return lut;
	}

	/**
	 * @return Length of the mutant genome
	 */
	public int length() {
		return mutantSequence.length();
	}

	/**
	 * @return Length of the reference genome
	 */
	public int referenceLength() {
		return referenceSequence.length();
	}

	public String getMutantSequence() {
		return mutantSequence;
	}

	public String getReferenceSequence() {
		return referenceSequence;
	}

	/**
	 * @param start Start position, inclusive
	 * @param end End position, exclusive
	 * @return Mutant bases in [start, end)
	 */
	public String getMutantBases(int start, int end) {
		return mutantSequence.substring(start, end);
	}

	/**
	 * @param start Start position, inclusive
	 * @param end End position, exclusive
	 * @return Reference bases in [start, end)
	 */
	public String getReferenceBases(int start, int end) {
		return referenceSequence.substring(start, end);
	}

	/**
	 * @param mutantIndex Mutant genome coordinate
	 * @return Corresponding reference genome coordinate
	 */
	public int toReferenceIndex(int mutantIndex) {
		return indexLookup[mutantIndex];
	}

	public boolean isEdge(int mutantIndex) {
		return edges[mutantIndex];
	}

	public boolean isMismatch(int mutantIndex) {
		return mismatches[mutantIndex];
	}

	/**
	 * @return Number of coordinates flagged in the mismatch table
	 */
	public int countMismatches() {
		int count = 0;
		for(boolean b : mismatches) {
			if(b) count++;
		}
		return count;
	}

	/**
	 * @return Number of coordinates flagged in the edge table
	 */
	public int countEdges() {
		int count = 0;
		for(boolean b : edges) {
			if(b) count++;
		}
		return count;
	}

}
