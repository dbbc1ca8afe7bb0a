package mascpcr.core.parser;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

/**
 * Parses a parameter file where each line holds an option name followed by one or
 * more whitespace separated values, e.g.
 * <pre>
 * # comment
 * tm_range 60 65
 * mismatch_weights 5 4 4 3 3 2 1
 * </pre>
 * An option may appear only once.
 */
public class ParameterFileParser {

	static Logger logger = Logger.getLogger(ParameterFileParser.class.getName());

	private static final String COMMENT = "#";

	private final Map<String, List<String>> values;
	private final String source;

	/**
	 * @param file Parameter file
	 * @throws IOException
	 */
	public ParameterFileParser(File file) throws IOException {
		source = file.getName();
		values = new LinkedHashMap<String, List<String>>();
		LineIterator iter = FileUtils.lineIterator(file, "UTF-8");
		try {
			int lineNum = 0;
			while(iter.hasNext()) {
				lineNum++;
				addLine(iter.nextLine(), lineNum);
			}
		} finally {
			LineIterator.closeQuietly(iter);
		}
		logger.debug("Read " + values.size() + " options from " + source);
	}

	/**
	 * @param lines Lines of a parameter file
	 */
	public ParameterFileParser(Collection<String> lines) {
		source = "parameter lines";
		values = new LinkedHashMap<String, List<String>>();
		int lineNum = 0;
		for(String line : lines) {
			lineNum++;
			addLine(line, lineNum);
		}
	}

	private void addLine(String rawLine, int lineNum) {
		String line = rawLine.trim();
		if(line.isEmpty() || line.startsWith(COMMENT)) {
			return;
		}
		String[] tokens = line.split("\\s+");
		if(tokens.length < 2) {
			throw new IllegalArgumentException("Line " + lineNum + " of " + source + " has no value: " + line);
		}
		if(values.containsKey(tokens[0])) {
			throw new IllegalArgumentException("Option " + tokens[0] + " appears more than once in " + source);
		}
		values.put(tokens[0], new ArrayList<String>(Arrays.asList(tokens).subList(1, tokens.length)));
	}

	/**
	 * @return Names of all options in the file, in file order
	 */
	public Set<String> getOptionNames() {
		return values.keySet();
	}

	/**
	 * @param option Option name
	 * @return True if the option is present
	 */
	public boolean hasOption(String option) {
		return values.containsKey(option);
	}

	/**
	 * @param option Option name
	 * @return The raw values, or null if absent
	 */
	public List<String> getValues(String option) {
		return values.get(option);
	}

	public double getDouble(String option, double def) {
		if(!hasOption(option)) return def;
		return parseDouble(option, singleValue(option));
	}

	public int getInt(String option, int def) {
		if(!hasOption(option)) return def;
		String value = singleValue(option);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + option + " in " + source + " is not an integer: " + value, e);
		}
	}

	public boolean getBoolean(String option, boolean def) {
		if(!hasOption(option)) return def;
		String value = singleValue(option);
		if(value.equalsIgnoreCase("true")) return true;
		if(value.equalsIgnoreCase("false")) return false;
		throw new IllegalArgumentException("Option " + option + " in " + source + " is not true or false: " + value);
	}

	/**
	 * @param option Option name
	 * @param def Default values
	 * @return All values of the option as doubles
	 */
	public double[] getDoubles(String option, double[] def) {
		if(!hasOption(option)) return def;
		List<String> raw = values.get(option);
		double[] rtrn = new double[raw.size()];
		for(int i = 0; i < rtrn.length; i++) {
			rtrn[i] = parseDouble(option, raw.get(i));
		}
		return rtrn;
	}

	/**
	 * @param option Option name
	 * @param def Default values
	 * @return The two values of a range option
	 */
	public double[] getRange(String option, double[] def) {
		if(!hasOption(option)) return def;
		if(values.get(option).size() != 2) {
			throw new IllegalArgumentException("Option " + option + " in " + source + " needs exactly two values");
		}
		return getDoubles(option, def);
	}

	private String singleValue(String option) {
		List<String> raw = values.get(option);
		if(raw.size() != 1) {
			throw new IllegalArgumentException("Option " + option + " in " + source + " takes a single value, got " + raw);
		}
		return raw.get(0);
	}

	private double parseDouble(String option, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Option " + option + " in " + source + " is not a number: " + value, e);
		}
	}

}
