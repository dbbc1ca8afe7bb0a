package mascpcr.programs;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import mascpcr.core.primer.PrimerCandidate;

import org.apache.commons.io.FileUtils;

import junit.framework.TestCase;

public class FindPrimerCandidatesTest extends TestCase {

	private File dir;
	private String genome;

	@Override
	protected void setUp() throws IOException {
		dir = new File("target", "find-primer-candidates-test");
		FileUtils.forceMkdir(dir);
		Random random = new Random(17);
		char[] bases = new char[600];
		for(int i = 0; i < bases.length; i++) {
			bases[i] = "ACGT".charAt(random.nextInt(4));
		}
		genome = new String(bases);
		write("mutant.fa", ">mutant", genome.substring(0, 300), genome.substring(300));
		write("reference.fa", ">reference", genome);
		write("mismatches.txt", "300", "304");
	}

	private File write(String name, String... lines) throws IOException {
		File file = new File(dir, name);
		FileUtils.writeLines(file, "UTF-8", Arrays.asList(lines));
		return file;
	}

	private String path(String name) {
		return new File(dir, name).getPath();
	}

	public void testCommonMode() throws Exception {
		String out = path("common.txt");
		FindPrimerCandidates.main(new String[] {"-m", path("mutant.fa"), "-r", path("reference.fa"), "-x", path("mismatches.txt"),
				"-mode", "common", "-s", "100", "-n", "120", "-t", "2", "-o", out});
		List<String> lines = FileUtils.readLines(new File(out), "UTF-8");
		assertEquals(PrimerCandidate.getFieldNames(), lines.get(0));
		for(String line : lines.subList(1, lines.size())) {
			String[] fields = line.split("\t");
			assertEquals(9, fields.length);
			assertEquals("-", fields[4]);
		}
	}

	public void testDiscriminatoryMode() throws Exception {
		String out = path("discriminatory.txt");
		FindPrimerCandidates.main(new String[] {"-m", path("mutant.fa"), "-r", path("reference.fa"), "-x", path("mismatches.txt"),
				"-s", "300", "-n", "310", "-strand", "1", "-o", out});
		List<String> lines = FileUtils.readLines(new File(out), "UTF-8");
		assertEquals("pair_id\tgenome\t" + PrimerCandidate.getFieldNames(), lines.get(0));
		assertEquals(1, lines.size() % 2);
		for(int i = 1; i < lines.size(); i += 2) {
			assertTrue(lines.get(i).split("\t")[1].equals("mutant"));
			assertTrue(lines.get(i + 1).split("\t")[1].equals("wildtype"));
		}
	}

	public void testInvalidMode() throws Exception {
		try {
			FindPrimerCandidates.main(new String[] {"-m", path("mutant.fa"), "-r", path("reference.fa"), "-x", path("mismatches.txt"),
					"-mode", "both", "-s", "300", "-n", "310", "-o", path("unused.txt")});
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

}
