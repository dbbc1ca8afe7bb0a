package mascpcr.programs;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import mascpcr.core.genome.RecodedGenome;
import mascpcr.core.genome.RecodedGenomeReader;
import mascpcr.core.parser.CommandLineParser;
import mascpcr.core.primer.PrimerCandidate;
import mascpcr.core.primer.PrimerCandidatePair;
import mascpcr.core.primer.PrimerCandidateScan;
import mascpcr.core.primer.PrimerSearchConfiguration;
import mascpcr.core.primer.PrimerSearchConfigurationFactory;
import mascpcr.core.primer.Strand;
import mascpcr.core.thermo.NearestNeighborOracle;
import mascpcr.core.thermo.Primer3ExecutableOracle;
import mascpcr.core.thermo.ThermodynamicOracle;
import mascpcr.core.thermo.ThermodynamicsException;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/**
 * Find discriminatory or common MASC-PCR primer candidates at every anchor of a range of
 * recoded genome coordinates and write them to a table
 */
public class FindPrimerCandidates {

	static Logger logger = Logger.getLogger(FindPrimerCandidates.class.getName());

	public static final String MODE_DISCRIMINATORY = "discriminatory";
	public static final String MODE_COMMON = "common";

	private static final int DEFAULT_NUM_THREADS = 1;

	/**
	 * Write discriminatory pairs, the recoded primer followed by its wildtype counterpart
	 * @param pairs Primer pairs
	 * @param outFile Output table
	 * @throws IOException
	 */
	public static void writeDiscriminatory(List<PrimerCandidatePair> pairs, String outFile) throws IOException {
		BufferedWriter w = new BufferedWriter(new FileWriter(outFile));
		w.write("pair_id\tgenome\t" + PrimerCandidate.getFieldNames() + "\n");
		int id = 0;
		for(PrimerCandidatePair pair : pairs) {
			w.write(id + "\tmutant\t" + pair.getMutantPrimer().toString() + "\n");
			w.write(id + "\twildtype\t" + pair.getWildtypePrimer().toString() + "\n");
			id++;
		}
		w.close();
		logger.info("Wrote " + pairs.size() + " primer pairs to " + outFile);
	}

	/**
	 * @param primers Common primers
	 * @param outFile Output table
	 * @throws IOException
	 */
	public static void writeCommon(List<PrimerCandidate> primers, String outFile) throws IOException {
		BufferedWriter w = new BufferedWriter(new FileWriter(outFile));
		w.write(PrimerCandidate.getFieldNames() + "\n");
		for(PrimerCandidate primer : primers) {
			w.write(primer.toString() + "\n");
		}
		w.close();
		logger.info("Wrote " + primers.size() + " primers to " + outFile);
	}

	private static Collection<Strand> parseStrands(int strand) {
		Collection<Strand> strands = new ArrayList<Strand>();
		if(strand == 0) {
			strands.add(Strand.FORWARD);
			strands.add(Strand.REVERSE);
		} else {
			strands.add(Strand.fromValue(strand));
		}
		return strands;
	}

	/**
	 * @param args
	 * @throws IOException
	 * @throws ThermodynamicsException
	 * @throws InterruptedException
	 */
	public static void main(String[] args) throws IOException, ThermodynamicsException, InterruptedException {

		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Find MASC-PCR primer candidates anchored at each coordinate of a range of a recoded genome");
		p.addStringArg("-m", "Fasta file of the recoded genome", true);
		p.addStringArg("-r", "Fasta file of the reference genome", true);
		p.addStringArg("-l", "Index lookup table: reference coordinate for each recoded coordinate, one per line (omit if coordinates are shared)", false);
		p.addStringArg("-x", "File of designed mismatch coordinates, one per line", true);
		p.addStringArg("-e", "File of edge coordinates primers may not cross, one per line", false);
		p.addStringArg("-c", "Parameter file (tm_range, spurious_tm_clip, size_range, min_num_mismatches, lenient_mode, mismatch_weights, mv_conc, dv_conc, dntp_conc, dna_conc, temp_c, max_loop)", false);
		p.addStringArg("-mode", "Primer type: " + MODE_DISCRIMINATORY + " or " + MODE_COMMON, false, MODE_DISCRIMINATORY);
		p.addIntArg("-s", "First anchor coordinate (0-based, inclusive)", true);
		p.addIntArg("-n", "Last anchor coordinate (0-based, inclusive)", true);
		p.addIntArg("-strand", "Strand: 1, -1, or 0 for both", false, 0);
		p.addIntArg("-t", "Number of threads", false, DEFAULT_NUM_THREADS);
		p.addStringArg("-p3", "Directory containing the primer3 oligotm and ntthal executables (default: built-in nearest neighbor model)", false);
		p.addStringArg("-o", "Output table", true);
		p.addBooleanArg("-d", "Debug logging on", false, false);
		p.parse(args);
		if(p.getBooleanArg("-d")) {
			logger.setLevel(Level.DEBUG);
			Logger.getLogger("mascpcr").setLevel(Level.DEBUG);
		}

		String mode = p.getStringArg("-mode");
		if(!mode.equals(MODE_DISCRIMINATORY) && !mode.equals(MODE_COMMON)) {
			throw new IllegalArgumentException("Mode must be " + MODE_DISCRIMINATORY + " or " + MODE_COMMON + ": " + mode);
		}

		PrimerSearchConfiguration config = p.getStringArg("-c") == null
				? PrimerSearchConfigurationFactory.getDefaultConfiguration()
				: PrimerSearchConfigurationFactory.fromParameterFile(new File(p.getStringArg("-c")));
		logger.info("Configuration: " + config);

		ThermodynamicOracle oracle = p.getStringArg("-p3") == null
				? new NearestNeighborOracle()
				: new Primer3ExecutableOracle(new File(p.getStringArg("-p3")));

		RecodedGenome genome = RecodedGenomeReader.read(
				new File(p.getStringArg("-m")),
				new File(p.getStringArg("-r")),
				p.getStringArg("-l") == null ? null : new File(p.getStringArg("-l")),
				p.getStringArg("-e") == null ? null : new File(p.getStringArg("-e")),
				new File(p.getStringArg("-x")));

		PrimerCandidateScan scan = new PrimerCandidateScan(genome, oracle, config, p.getIntArg("-t"));
		Collection<Strand> strands = parseStrands(p.getIntArg("-strand"));
		int start = p.getIntArg("-s");
		int end = p.getIntArg("-n");
		String outFile = p.getStringArg("-o");

		if(mode.equals(MODE_DISCRIMINATORY)) {
			writeDiscriminatory(scan.scanDiscriminatory(start, end, strands), outFile);
		} else {
			writeCommon(scan.scanCommon(start, end, strands), outFile);
		}

		logger.info("");
		logger.info("All done.");

	}

}
