package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import junit.framework.TestCase;

public class CandidateRegionTest extends TestCase {

	private static final String GENOME = "AACCGGTTACGTAGCTAGCA";

	private StubOracle oracle = new StubOracle();

	private RecodedGenome genome() {
		return new GenomeBuilder(GENOME).build();
	}

	public void testForwardRegion() {
		CandidateRegion region = CandidateRegion.forMutant(genome(), oracle, 10, Strand.FORWARD, 5, 1);
		assertEquals("TTACG", region.getSequence());
		assertEquals(5, region.length());
		assertEquals(10, region.getThreePrimeIndex());
		assertEquals("ACG", region.window(3));
		assertEquals("CG", region.threePrimeEnd(2));
		assertEquals("TTACG", region.threePrimeEnd(8));
		assertEquals(10, region.coordinate(0));
		assertEquals(6, region.coordinate(4));
		assertEquals(8, region.fivePrimeMostIndex(3));
	}

	public void testReverseRegion() {
		CandidateRegion region = CandidateRegion.forMutant(genome(), oracle, 10, Strand.REVERSE, 5, 1);
		// Reverse complement of GTAGC at 10-14
		assertEquals("GCTAC", region.getSequence());
		assertEquals("AC", region.window(2));
		assertEquals(10, region.coordinate(0));
		assertEquals(14, region.coordinate(4));
		assertEquals(10, region.fivePrimeMostIndex(3));
		assertEquals(Strand.REVERSE, region.getStrand());
	}

	public void testFlankingBounds() {
		RecodedGenome genome = genome();
		assertNull(CandidateRegion.forMutant(genome, oracle, 4, Strand.FORWARD, 5, 1));
		assertNotNull(CandidateRegion.forMutant(genome, oracle, 5, Strand.FORWARD, 5, 1));
		assertNotNull(CandidateRegion.forMutant(genome, oracle, 14, Strand.REVERSE, 5, 1));
		assertNull(CandidateRegion.forMutant(genome, oracle, 15, Strand.REVERSE, 5, 1));
		assertNull(CandidateRegion.forMutant(genome, oracle, 14, Strand.REVERSE, 5, 2));
	}

	public void testWildtypeRegionUsesIndexLookup() {
		// Two extra reference bases ahead of mutant coordinate 3
		String reference = "AAC" + "TT" + GENOME.substring(3);
		int[] lut = new int[GENOME.length()];
		for(int i = 0; i < lut.length; i++) {
			lut[i] = i < 3 ? i : i + 2;
		}
		RecodedGenome genome = new GenomeBuilder(GENOME).setReference(reference, lut).build();

		CandidateRegion forward = CandidateRegion.forWildtype(genome, oracle, 10, Strand.FORWARD, 5);
		assertEquals(12, forward.getThreePrimeIndex());
		assertEquals("TTACG", forward.getSequence());

		CandidateRegion reverse = CandidateRegion.forWildtype(genome, oracle, 10, Strand.REVERSE, 5);
		assertEquals(12, reverse.getThreePrimeIndex());
		assertEquals("GCTAC", reverse.getSequence());

		assertNull(CandidateRegion.forWildtype(genome, oracle, GENOME.length() - 1, Strand.FORWARD, 5));
		assertNull(CandidateRegion.forWildtype(genome, oracle, 17, Strand.REVERSE, 5));
	}

	public void testWindowLengthIsChecked() {
		CandidateRegion region = CandidateRegion.forMutant(genome(), oracle, 10, Strand.FORWARD, 5, 1);
		try {
			region.window(0);
			fail("Empty window should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			region.window(6);
			fail("Window longer than the region should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

}
