package mascpcr.core.primer;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import mascpcr.core.parser.ParameterFileParser;
import mascpcr.core.thermo.ThermoParameters;

import org.apache.log4j.Logger;

/**
 * A factory that produces configurations for primer searches
 */
public class PrimerSearchConfigurationFactory {

	static Logger logger = Logger.getLogger(PrimerSearchConfigurationFactory.class.getName());

	public static final String OPTION_TM_RANGE = "tm_range";
	public static final String OPTION_SPURIOUS_TM_CLIP = "spurious_tm_clip";
	public static final String OPTION_SIZE_RANGE = "size_range";
	public static final String OPTION_MIN_NUM_MISMATCHES = "min_num_mismatches";
	public static final String OPTION_LENIENT_MODE = "lenient_mode";
	public static final String OPTION_MISMATCH_WEIGHTS = "mismatch_weights";
	public static final String OPTION_MV_CONC = "mv_conc";
	public static final String OPTION_DV_CONC = "dv_conc";
	public static final String OPTION_DNTP_CONC = "dntp_conc";
	public static final String OPTION_DNA_CONC = "dna_conc";
	public static final String OPTION_TEMP_C = "temp_c";
	public static final String OPTION_MAX_LOOP = "max_loop";

	private static final Set<String> OPTIONS = new HashSet<String>(Arrays.asList(
			OPTION_TM_RANGE, OPTION_SPURIOUS_TM_CLIP, OPTION_SIZE_RANGE, OPTION_MIN_NUM_MISMATCHES,
			OPTION_LENIENT_MODE, OPTION_MISMATCH_WEIGHTS, OPTION_MV_CONC, OPTION_DV_CONC,
			OPTION_DNTP_CONC, OPTION_DNA_CONC, OPTION_TEMP_C, OPTION_MAX_LOOP));

	private PrimerSearchConfigurationFactory() {}

	/**
	 * @return Tm 60-65, spurious Tm clip 40, size 18-30, at least one mismatch, strict thermodynamic filter
	 */
	public static PrimerSearchConfiguration getDefaultConfiguration() {
		return PrimerSearchConfiguration.builder().build();
	}

	/**
	 * Configuration for regions where strict settings find nothing: the GC clamp check
	 * and the thermodynamic filter are skipped for discriminatory primers
	 * @return Default configuration in lenient mode
	 */
	public static PrimerSearchConfiguration getLenientConfiguration() {
		return PrimerSearchConfiguration.builder().setLenientMode(true).build();
	}

	/**
	 * Read a configuration from a parameter file; absent options take default values
	 * @param file Parameter file
	 * @return The configuration
	 * @throws IOException
	 */
	public static PrimerSearchConfiguration fromParameterFile(File file) throws IOException {
		PrimerSearchConfiguration config = fromParameters(new ParameterFileParser(file));
		logger.info("Primer search configuration from " + file.getName() + ": " + config);
		return config;
	}

	/**
	 * @param parser Parsed parameters
	 * @return The configuration
	 * @throws IllegalArgumentException If an option is unknown or invalid
	 */
	public static PrimerSearchConfiguration fromParameters(ParameterFileParser parser) {
		for(String option : parser.getOptionNames()) {
			if(!OPTIONS.contains(option)) {
				throw new IllegalArgumentException("Unknown option " + option + ". Valid options: " + OPTIONS);
			}
		}
		ThermoParameters thermo = new ThermoParameters(
				parser.getDouble(OPTION_MV_CONC, ThermoParameters.DEFAULT_MONOVALENT_CONC),
				parser.getDouble(OPTION_DV_CONC, ThermoParameters.DEFAULT_DIVALENT_CONC),
				parser.getDouble(OPTION_DNTP_CONC, ThermoParameters.DEFAULT_DNTP_CONC),
				parser.getDouble(OPTION_DNA_CONC, ThermoParameters.DEFAULT_DNA_CONC),
				parser.getDouble(OPTION_TEMP_C, ThermoParameters.DEFAULT_TEMPERATURE),
				parser.getInt(OPTION_MAX_LOOP, ThermoParameters.DEFAULT_MAX_LOOP));
		double[] tmRange = parser.getRange(OPTION_TM_RANGE, new double[] {PrimerSearchConfiguration.DEFAULT_TM_MIN, PrimerSearchConfiguration.DEFAULT_TM_MAX});
		double[] sizeRange = parser.getRange(OPTION_SIZE_RANGE, new double[] {PrimerSearchConfiguration.DEFAULT_MIN_SIZE, PrimerSearchConfiguration.DEFAULT_MAX_SIZE});
		if(sizeRange[0] != Math.rint(sizeRange[0]) || sizeRange[1] != Math.rint(sizeRange[1])) {
			throw new IllegalArgumentException("Option " + OPTION_SIZE_RANGE + " takes whole numbers");
		}
		return PrimerSearchConfiguration.builder()
				.setTmRange(tmRange[0], tmRange[1])
				.setSpuriousTmClip(parser.getDouble(OPTION_SPURIOUS_TM_CLIP, PrimerSearchConfiguration.DEFAULT_SPURIOUS_TM_CLIP))
				.setSizeRange((int)sizeRange[0], (int)sizeRange[1])
				.setThermoParameters(thermo)
				.setMinNumMismatches(parser.getInt(OPTION_MIN_NUM_MISMATCHES, PrimerSearchConfiguration.DEFAULT_MIN_NUM_MISMATCHES))
				.setLenientMode(parser.getBoolean(OPTION_LENIENT_MODE, PrimerSearchConfiguration.DEFAULT_LENIENT_MODE))
				.setMismatchWeights(parser.getDoubles(OPTION_MISMATCH_WEIGHTS, PrimerSearchConfiguration.DEFAULT_MISMATCH_WEIGHTS))
				.build();
	}

}
