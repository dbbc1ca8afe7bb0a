package mascpcr.core.primer.predicate;

import junit.framework.TestCase;

public class ThreePrimeGCClampTest extends TestCase {

	private final ThreePrimeGCClamp clamp = new ThreePrimeGCClamp();

	public void testMoreThanThreeGcRejects() {
		assertFalse(clamp.evaluate("AAAAAGCGC"));
		assertFalse(clamp.evaluate("AAAAAGCGCG"));
		assertEquals("4_gc_in_last_5", clamp.getShortFailureMessage("AAAAATGCGC"));
	}

	public void testThreeOrFewerGcPasses() {
		assertTrue(clamp.evaluate("AAAAAGCGA"));
		assertTrue(clamp.evaluate("GGGGGATGCA"));
		assertTrue(clamp.evaluate("TTTTT"));
	}

	public void testOnlyThreePrimeEndCounts() {
		assertTrue(clamp.evaluate("GCGCGCGCGCATATA"));
		assertTrue(clamp.evaluate("gcgcgcataTA"));
		assertFalse(clamp.evaluate("atatagcgcg"));
	}

	public void testShortSequences() {
		assertTrue(clamp.evaluate("GCG"));
		assertFalse(clamp.evaluate("GCGC"));
	}

	public void testCustomSettings() {
		ThreePrimeGCClamp strict = new ThreePrimeGCClamp(3, 1);
		assertFalse(strict.evaluate("AAAAAGCA"));
		assertTrue(strict.evaluate("GGGGGATC"));
		assertEquals("three_prime_gc_clamp", strict.getPredicateName());
	}

}
