package mascpcr.core.primer;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.sequence.SequenceUtils;
import mascpcr.core.thermo.ThermodynamicsException;
import junit.framework.TestCase;

public class DiscriminatoryPrimerFinderTest extends TestCase {

	// Every 5 consecutive bases carry exactly 2 G/C, so the GC clamp always passes
	private static final String UNIT = "ATGCA";
	private static final int LENGTH = 1000;

	// Stub Tm is 40 + length: lengths 20-25 are in range, 22 and 23 tie for the best Tm score
	private static final double BEST_THERMO_SCORE = -0.01 - 2 * 0.0625;

	private StubOracle oracle;
	private PrimerSearchConfiguration config;

	@Override
	protected void setUp() {
		oracle = new StubOracle();
		config = PrimerSearchConfigurationFactory.getDefaultConfiguration();
	}

	private DiscriminatoryPrimerFinder finder(RecodedGenome genome) {
		return new DiscriminatoryPrimerFinder(genome, oracle, config);
	}

	public void testNoMismatchesGivesNotFound() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).build();
		PrimerCandidatePair pair = finder(genome).findPrimer(500, 1);
		assertSame(PrimerCandidatePair.NOT_FOUND, pair);
		assertFalse(pair.isFound());
		assertNull(pair.getMutantPrimer());
	}

	public void testForwardPrimerCoveringOneMismatch() throws ThermodynamicsException {
		GenomeBuilder builder = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495);
		RecodedGenome genome = builder.build();
		PrimerCandidatePair pair = finder(genome).findPrimer(500, 1);
		assertTrue(pair.isFound());

		PrimerCandidate mutant = pair.getMutantPrimer();
		assertEquals(22, mutant.length());
		assertEquals(479, mutant.getAnchorIndex());
		assertEquals(Strand.FORWARD, mutant.getStrand());
		assertEquals(builder.getMutantSequence().substring(479, 501), mutant.getSequence());
		assertEquals(1, mutant.getNumMismatches());
		assertTrue(mutant.isMismatch(5));
		assertEquals("5", mutant.getMismatchOffsetString());
		assertEquals(62.0, mutant.getMeltingTemp(), 1e-9);
		assertEquals(10.0, mutant.getHairpinTemp(), 1e-9);
		assertEquals(10.0, mutant.getHomodimerTemp(), 1e-9);
		assertEquals(BEST_THERMO_SCORE + 2, mutant.getScore(), 1e-9);

		PrimerCandidate wildtype = pair.getWildtypePrimer();
		assertEquals(479, wildtype.getAnchorIndex());
		assertEquals(builder.getRecodedReference().substring(479, 501), wildtype.getSequence());
		assertEquals(0, wildtype.getNumMismatches());
		assertEquals(0.0, wildtype.getScore(), 0);
		assertEquals(22, wildtype.length());
		assertFalse(mutant.getSequence().equals(wildtype.getSequence()));
		assertEquals(mutant.getSequence().substring(0, 16), wildtype.getSequence().substring(0, 16));
		assertEquals(mutant.getSequence().substring(17), wildtype.getSequence().substring(17));
	}

	public void testSearchStopsAtFirstWindowOverTmRange() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).build();
		finder(genome).findPrimer(500, Strand.FORWARD);
		// 66 > 65 at length 26 ends the search
		assertEquals(26, oracle.getMaxTmLength());
	}

	public void testSearchStopsAtSpuriousStructure() throws ThermodynamicsException {
		oracle.setStructureSpike(22, 50);
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).build();
		PrimerCandidate mutant = finder(genome).findPrimer(500, 1).getMutantPrimer();
		assertEquals(21, mutant.length());
		assertEquals(-0.09 - 0.125 + 2, mutant.getScore(), 1e-9);
		assertEquals(22, oracle.getMaxTmLength());
	}

	public void testReverseStrand() throws ThermodynamicsException {
		GenomeBuilder builder = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(503);
		RecodedGenome genome = builder.build();
		PrimerCandidatePair pair = finder(genome).findPrimer(500, -1);
		assertTrue(pair.isFound());

		PrimerCandidate mutant = pair.getMutantPrimer();
		assertEquals(Strand.REVERSE, mutant.getStrand());
		assertEquals(22, mutant.length());
		assertEquals(500, mutant.getAnchorIndex());
		assertEquals(SequenceUtils.reverseComplement(builder.getMutantSequence().substring(500, 522)), mutant.getSequence());
		assertTrue(mutant.isMismatch(3));
		assertEquals(1, mutant.getNumMismatches());
		assertEquals(BEST_THERMO_SCORE + 3, mutant.getScore(), 1e-9);

		PrimerCandidate wildtype = pair.getWildtypePrimer();
		assertEquals(500, wildtype.getAnchorIndex());
		assertEquals(SequenceUtils.reverseComplement(builder.getRecodedReference().substring(500, 522)), wildtype.getSequence());
	}

	public void testMismatchWeightPastTableReusesLastWeight() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(490).build();
		PrimerCandidate mutant = finder(genome).findPrimer(500, 1).getMutantPrimer();
		assertTrue(mutant.isMismatch(10));
		assertEquals(BEST_THERMO_SCORE + 1, mutant.getScore(), 1e-9);
	}

	public void testMinimumNumberOfMismatches() throws ThermodynamicsException {
		config = config.toBuilder().setMinNumMismatches(2).build();
		RecodedGenome oneMismatch = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).build();
		assertFalse(finder(oneMismatch).findPrimer(500, 1).isFound());

		RecodedGenome twoMismatches = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).addMismatch(499).build();
		PrimerCandidate mutant = finder(twoMismatches).findPrimer(500, 1).getMutantPrimer();
		assertEquals(2, mutant.getNumMismatches());
		assertEquals("1,5", mutant.getMismatchOffsetString());
		assertEquals(BEST_THERMO_SCORE + 4 + 2, mutant.getScore(), 1e-9);
	}

	public void testEdgeTruncatesMismatchWalkButWindowIsStillScored() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(499).addEdge(497).addMismatch(495).build();
		PrimerCandidate mutant = finder(genome).findPrimer(500, 1).getMutantPrimer();
		assertEquals(22, mutant.length());
		assertTrue(mutant.isMismatch(1));
		assertFalse(mutant.isMismatch(5));
		assertEquals(1, mutant.getNumMismatches());
		assertEquals(BEST_THERMO_SCORE + 4, mutant.getScore(), 1e-9);
	}

	public void testEdgeBeforeAnyMismatchGivesNotFound() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addEdge(497).addMismatch(495).build();
		assertFalse(finder(genome).findPrimer(500, 1).isFound());
	}

	public void testGcClampRejectsAnchor() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).setBases(496, "GCGCG").addMismatch(495).build();
		assertFalse(finder(genome).findPrimer(500, 1).isFound());
		assertEquals(0, oracle.getTmCalls());
	}

	public void testLenientModeSkipsGcClamp() throws ThermodynamicsException {
		config = PrimerSearchConfigurationFactory.getLenientConfiguration();
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).setBases(496, "GCGCG").addMismatch(495).build();
		PrimerCandidatePair pair = finder(genome).findPrimer(500, 1);
		assertTrue(pair.isFound());
		assertEquals(22, pair.getMutantPrimer().length());
	}

	public void testLenientModeAcceptsWindowsOutsideTmRange() throws ThermodynamicsException {
		oracle.setTm(80, 0);
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).build();
		assertFalse(finder(genome).findPrimer(500, 1).isFound());

		config = PrimerSearchConfigurationFactory.getLenientConfiguration();
		PrimerCandidate mutant = finder(genome).findPrimer(500, 1).getMutantPrimer();
		// Every length scores the same, so the shortest is kept
		assertEquals(18, mutant.length());
		assertEquals(80.0, mutant.getMeltingTemp(), 1e-9);
		assertEquals(10.0, mutant.getHairpinTemp(), 1e-9);
	}

	public void testWildtypeWindowFollowsIndexLookup() throws ThermodynamicsException {
		GenomeBuilder builder = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495);
		String recoded = builder.getRecodedReference();
		// Reference carries three extra bases ahead of coordinate 100
		String reference = recoded.substring(0, 100) + "TTT" + recoded.substring(100);
		int[] lut = new int[LENGTH];
		for(int i = 0; i < LENGTH; i++) {
			lut[i] = i < 100 ? i : i + 3;
		}
		RecodedGenome genome = builder.setReference(reference, lut).build();
		PrimerCandidatePair pair = finder(genome).findPrimer(500, 1);
		PrimerCandidate wildtype = pair.getWildtypePrimer();
		assertEquals(479, pair.getMutantPrimer().getAnchorIndex());
		assertEquals(482, wildtype.getAnchorIndex());
		assertEquals(recoded.substring(479, 501), wildtype.getSequence());
	}

	public void testNotEnoughFlankingSequence() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(15).addMismatch(964).build();
		DiscriminatoryPrimerFinder finder = finder(genome);
		assertFalse(finder.findPrimer(20, 1).isFound());
		assertTrue(finder.findPrimer(969, 1).isFound());
		assertFalse(finder.findPrimer(970, 1).isFound());
	}

	public void testInvalidArguments() throws ThermodynamicsException {
		DiscriminatoryPrimerFinder finder = finder(GenomeBuilder.repeating(UNIT, LENGTH).build());
		try {
			finder.findPrimer(500, 0);
			fail("Strand 0 should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			finder.findPrimer(-1, 1);
			fail("Negative index should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			finder.findPrimer(LENGTH, -1);
			fail("Index past the genome should be rejected");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	public void testOracleFailurePropagates() {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).setBases(490, "N").addMismatch(495).build();
		try {
			finder(genome).findPrimer(500, 1);
			fail("Expected the oracle failure to reach the caller");
		} catch (ThermodynamicsException e) {
			// expected
		}
	}

	public void testRepeatedSearchGivesSameResult() throws ThermodynamicsException {
		RecodedGenome genome = GenomeBuilder.repeating(UNIT, LENGTH).addMismatch(495).addMismatch(503).build();
		DiscriminatoryPrimerFinder finder = finder(genome);
		assertEquals(finder.findPrimer(500, 1).getMutantPrimer(), finder.findPrimer(500, 1).getMutantPrimer());
		assertEquals(finder.findPrimer(500, -1).getMutantPrimer(), finder.findPrimer(500, -1).getMutantPrimer());
	}

}
