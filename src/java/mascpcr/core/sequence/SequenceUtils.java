package mascpcr.core.sequence;

import org.apache.commons.lang3.StringUtils;

/**
 * Static helpers for DNA sequences held as strings
 */
public class SequenceUtils {

	private SequenceUtils() {}

	/**
	 * Reverse complement of a DNA sequence. Case is preserved and any
	 * character other than A, C, G, T is copied as an N.
	 * @param seq Sequence 5' to 3'
	 * @return Reverse complement 5' to 3'
	 */
	public static String reverseComplement(String seq) {
		char[] rc = new char[seq.length()];
		for(int i = 0; i < seq.length(); i++) {
			rc[seq.length() - 1 - i] = complement(seq.charAt(i));
		}
		return new String(rc);
	}

	/**
	 * @param base A nucleotide
	 * @return The complementary nucleotide, or N for anything unrecognized
	 */
	public static char complement(char base) {
		switch(base) {
			case 'A': return 'T';
			case 'C': return 'G';
			case 'G': return 'C';
			case 'T': return 'A';
			case 'a': return 't';
			case 'c': return 'g';
			case 'g': return 'c';
			case 't': return 'a';
			case 'n': return 'n';
			default: return 'N';
		}
	}

	/**
	 * @param a A nucleotide
	 * @param b A nucleotide
	 * @return True if the two bases form a Watson-Crick pair
	 */
	public static boolean isComplementary(char a, char b) {
		char ca = complement(Character.toUpperCase(a));
		return ca != 'N' && ca == Character.toUpperCase(b);
	}

	/**
	 * @param seq Sequence
	 * @return Number of G and C bases, either case
	 */
	public static int countGC(String seq) {
		return StringUtils.countMatches(seq, 'G') + StringUtils.countMatches(seq, 'C')
				+ StringUtils.countMatches(seq, 'g') + StringUtils.countMatches(seq, 'c');
	}

	/**
	 * @param seq Sequence
	 * @return True if the sequence is non-empty and contains only upper case A, C, G, T
	 */
	public static boolean isUnambiguousDna(String seq) {
		return StringUtils.isNotEmpty(seq) && StringUtils.containsOnly(seq, "ACGT");
	}

}
