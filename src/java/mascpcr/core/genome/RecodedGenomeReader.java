package mascpcr.core.genome;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

/**
 * Reads the inputs of a primer search from disk.
 * <br><br>
 * Formats:
 * <ul>
 * <li>Genomes: fasta, first record only</li>
 * <li>Index lookup table: one reference coordinate per line, in mutant coordinate order</li>
 * <li>Edge and mismatch tables: one flagged 0-based mutant coordinate per line</li>
 * </ul>
 * Blank lines and lines starting with # are ignored in the table files.
 */
public class RecodedGenomeReader {

	static Logger logger = Logger.getLogger(RecodedGenomeReader.class.getName());

	private static final String COMMENT = "#";
	private static final String ENCODING = "UTF-8";

	private RecodedGenomeReader() {}

	/**
	 * Load a recoded genome and its lookup tables
	 * @param mutantFasta Fasta file of the recoded genome
	 * @param referenceFasta Fasta file of the reference genome
	 * @param indexLookupFile Index lookup table, or null if both genomes share coordinates
	 * @param edgeFile Edge positions, or null for none
	 * @param mismatchFile Mismatch positions
	 * @return The genome
	 * @throws IOException
	 */
	public static RecodedGenome read(File mutantFasta, File referenceFasta, File indexLookupFile, File edgeFile, File mismatchFile) throws IOException {
		String mutant = readFastaSequence(mutantFasta);
		String reference = readFastaSequence(referenceFasta);
		int n = mutant.length();
		int[] lut;
		if(indexLookupFile == null) {
			if(reference.length() != n) {
				throw new IllegalArgumentException("An index lookup table is required when genome lengths differ (" + n + " vs " + reference.length() + ")");
			}
			lut = RecodedGenome.identityLookup(n);
		} else {
			lut = readIndexLookup(indexLookupFile);
		}
		boolean[] edges = edgeFile == null ? new boolean[n] : readPositions(edgeFile, n);
		boolean[] mismatches = readPositions(mismatchFile, n);
		RecodedGenome genome = new RecodedGenome(mutant, reference, lut, edges, mismatches);
		logger.info("Loaded recoded genome of length " + n + " with " + genome.countMismatches() + " mismatches and " + genome.countEdges() + " edges");
		return genome;
	}

	/**
	 * Read the first sequence of a fasta file
	 * @param fasta Fasta file
	 * @return Upper case sequence with line breaks removed
	 * @throws IOException
	 */
	public static String readFastaSequence(File fasta) throws IOException {
		StringBuilder seq = new StringBuilder();
		boolean inRecord = false;
		LineIterator iter = FileUtils.lineIterator(fasta, ENCODING);
		try {
			while(iter.hasNext()) {
				String line = iter.nextLine().trim();
				if(line.startsWith(">")) {
					if(inRecord) {
						logger.warn("Using only the first record of " + fasta.getName());
						break;
					}
					inRecord = true;
					continue;
				}
				if(!inRecord) {
					if(line.isEmpty()) continue;
					throw new IOException("Not a fasta file: " + fasta.getAbsolutePath());
				}
				seq.append(line);
			}
		} finally {
			LineIterator.closeQuietly(iter);
		}
		if(!inRecord) {
			throw new IOException("No fasta record in " + fasta.getAbsolutePath());
		}
		return seq.toString().toUpperCase();
	}

	/**
	 * @param file Index lookup table file
	 * @return Reference coordinate by mutant coordinate
	 * @throws IOException
	 */
	public static int[] readIndexLookup(File file) throws IOException {
		List<Integer> values = new ArrayList<Integer>();
		LineIterator iter = FileUtils.lineIterator(file, ENCODING);
		try {
			int lineNum = 0;
			while(iter.hasNext()) {
				String line = iter.nextLine().trim();
				lineNum++;
				if(line.isEmpty() || line.startsWith(COMMENT)) continue;
				values.add(Integer.valueOf(parseInt(line, file, lineNum)));
			}
		} finally {
			LineIterator.closeQuietly(iter);
		}
		int[] lut = new int[values.size()];
		for(int i = 0; i < lut.length; i++) {
			lut[i] = values.get(i).intValue();
		}
		return lut;
	}

	/**
	 * @param file File of flagged coordinates
	 * @param genomeLength Mutant genome length
	 * @return Table with the listed coordinates set
	 * @throws IOException
	 */
	public static boolean[] readPositions(File file, int genomeLength) throws IOException {
		boolean[] table = new boolean[genomeLength];
		LineIterator iter = FileUtils.lineIterator(file, ENCODING);
		try {
			int lineNum = 0;
			while(iter.hasNext()) {
				String line = iter.nextLine().trim();
				lineNum++;
				if(line.isEmpty() || line.startsWith(COMMENT)) continue;
				int pos = parseInt(line, file, lineNum);
				if(pos < 0 || pos >= genomeLength) {
					throw new IllegalArgumentException("Position " + pos + " on line " + lineNum + " of " + file.getName() + " is outside the genome (length " + genomeLength + ")");
				}
				table[pos] = true;
			}
		} finally {
			LineIterator.closeQuietly(iter);
		}
		return table;
	}

	private static int parseInt(String line, File file, int lineNum) throws IOException {
		try {
			return Integer.parseInt(line);
		} catch (NumberFormatException e) {
			throw new IOException("Line " + lineNum + " of " + file.getName() + " is not an integer: " + line, e);
		}
	}

}
