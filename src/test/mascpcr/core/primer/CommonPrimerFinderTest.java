package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.sequence.SequenceUtils;
import mascpcr.core.thermo.ThermodynamicsException;
import junit.framework.TestCase;

public class CommonPrimerFinderTest extends TestCase {

	private static final String UNIT = "ATGCA";
	private static final int LENGTH = 1000;

	private StubOracle oracle;
	private PrimerSearchConfiguration config;

	@Override
	protected void setUp() {
		oracle = new StubOracle();
		config = PrimerSearchConfigurationFactory.getDefaultConfiguration();
	}

	private CommonPrimerFinder finder(RecodedGenome genome) {
		return new CommonPrimerFinder(genome, oracle, config);
	}

	public void testForwardPrimer() throws ThermodynamicsException {
		GenomeBuilder builder = GenomeBuilder.repeating(UNIT, LENGTH);
		PrimerCandidate primer = finder(builder.build()).findPrimer(500, 1);
		assertNotNull(primer);
		assertEquals(22, primer.length());
		assertEquals(479, primer.getAnchorIndex());
		assertEquals(Strand.FORWARD, primer.getStrand());
		assertEquals(builder.getMutantSequence().substring(479, 501), primer.getSequence());
		assertEquals(0, primer.getNumMismatches());
		assertEquals(62.0, primer.getMeltingTemp(), 1e-9);
		assertEquals(-0.01 - 0.125, primer.getScore(), 1e-9);
	}

	public void testReversePrimer() throws ThermodynamicsException {
		GenomeBuilder builder = GenomeBuilder.repeating(UNIT, LENGTH);
		PrimerCandidate primer = finder(builder.build()).findPrimer(500, Strand.REVERSE);
		assertEquals(22, primer.length());
		assertEquals(500, primer.getAnchorIndex());
		assertEquals(SequenceUtils.reverseComplement(builder.getMutantSequence().substring(500, 522)), primer.getSequence());
	}

	public void testMismatchInShortestWindowGivesNull() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).build();
		assertNull(finder(genome).findPrimer(500, 1));
		assertEquals(0, oracle.getTmCalls());
	}

	public void testMismatchInShortestReverseWindowGivesNull() throws ThermodynamicsException {
		// Offset 17, the 5'-most base of the shortest reverse window
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(517).build();
		assertNull(finder(genome).findPrimer(500, -1));
	}

	public void testGrowthStopsBeforeCoveringMismatch() throws ThermodynamicsException {
		// Length 22 would reach coordinate 479
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(479).build();
		PrimerCandidate primer = finder(genome).findPrimer(500, 1);
		assertEquals(21, primer.length());
		assertEquals(480, primer.getAnchorIndex());
		assertEquals(21, oracle.getMaxTmLength());
	}

	public void testMismatchPastLongestWindowIsIgnored() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(470).addMismatch(530).build();
		assertEquals(22, finder(genome).findPrimer(500, 1).length());
		assertEquals(22, finder(genome).findPrimer(500, -1).length());
	}

	public void testGcClampIsAlwaysApplied() throws ThermodynamicsException {
		config = PrimerSearchConfigurationFactory.getLenientConfiguration();
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).setBases(496, "GCGCG").build();
		assertNull(finder(genome).findPrimer(500, 1));
	}

	public void testThermodynamicFilterIgnoresLenientMode() throws ThermodynamicsException {
		oracle.setTm(80, 0);
		config = PrimerSearchConfigurationFactory.getLenientConfiguration();
		assertNull(finder(GenomeBuilder.repeating(UNIT, LENGTH).build()).findPrimer(500, 1));
	}

	public void testEndMarginOfTwo() throws ThermodynamicsException {
		CommonPrimerFinder finder = finder(GenomeBuilder.repeating(UNIT, LENGTH).build());
		PrimerCandidate primer = finder.findPrimer(968, 1);
		assertNotNull(primer);
		assertEquals(947, primer.getAnchorIndex());
		assertNull(finder.findPrimer(969, 1));
		assertNull(finder.findPrimer(29, 1));
		assertNotNull(finder.findPrimer(30, 1));
	}

	public void testInvalidArguments() throws ThermodynamicsException {
		CommonPrimerFinder finder = finder(GenomeBuilder.repeating(UNIT, LENGTH).build());
		try {
			finder.findPrimer(500, 2);
			fail("Strand 2 should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			finder.findPrimer(LENGTH + 5, 1);
			fail("Index past the genome should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

}
