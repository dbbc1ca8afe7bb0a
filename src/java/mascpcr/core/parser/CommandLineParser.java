package mascpcr.core.parser;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Command line parser for programs taking "-flag value" pairs.
 * Flags are declared with a type, a description and optionally a default before
 * {@link #parse(String[])} is called; values are then read with the typed getters.
 */
public final class CommandLineParser {

	private enum ArgType {
		STRING("String"),
		INT("int"),
		DOUBLE("double"),
		BOOLEAN("boolean");

		private final String label;

		private ArgType(String label) {
			this.label = label;
		}
	}

	private static final class Arg {
		final ArgType type;
		final String description;
		final boolean required;
		final String def;

		Arg(ArgType type, String description, boolean required, String def) {
			this.type = type;
			this.description = description;
			this.required = required;
			this.def = def;
		}
	}

	private final Map<String, Arg> args = new HashMap<String, Arg>();
	private final Set<String> descriptions = new HashSet<String>();
	private final Map<String, String> values = new HashMap<String, String>();
	private String programDescription;
	private boolean isParsed = false;

	/**
	 * Sets program description to be printed as part of help menu
	 * @param description The program description
	 */
	public void setProgramDescription(String description) {
		programDescription = description;
	}

	public void addStringArg(String flag, String description, boolean required) {
		add(flag, ArgType.STRING, description, required, null);
	}

	public void addStringArg(String flag, String description, boolean required, String def) {
		add(flag, ArgType.STRING, description, required, def);
	}

	public void addIntArg(String flag, String description, boolean required) {
		add(flag, ArgType.INT, description, required, null);
	}

	public void addIntArg(String flag, String description, boolean required, int def) {
		add(flag, ArgType.INT, description, required, Integer.toString(def));
	}

	public void addDoubleArg(String flag, String description, boolean required) {
		add(flag, ArgType.DOUBLE, description, required, null);
	}

	public void addDoubleArg(String flag, String description, boolean required, double def) {
		add(flag, ArgType.DOUBLE, description, required, Double.toString(def));
	}

	public void addBooleanArg(String flag, String description, boolean required, boolean def) {
		add(flag, ArgType.BOOLEAN, description, required, Boolean.toString(def));
	}

	private void add(String flag, ArgType type, String description, boolean required, String def) {
		if(args.containsKey(flag)) {
			throw new IllegalArgumentException("Flag " + flag + " has already been used.");
		}
		if(descriptions.contains(description)) {
			throw new IllegalArgumentException("Description " + description + " has already been used.");
		}
		args.put(flag, new Arg(type, description, required, def));
		descriptions.add(description);
	}

	/**
	 * Parse command arguments. On a malformed command line or a missing required
	 * argument the help menu is printed and an exception thrown.
	 * @param commandLine The command line arguments passed to a main program
	 * @throws IllegalArgumentException If the command line is invalid
	 */
	public void parse(String[] commandLine) {
		isParsed = false;
		values.clear();
		int i = 0;
		while(i < commandLine.length) {
			String flag = commandLine[i];
			if(!args.containsKey(flag)) {
				fail("Unknown flag " + flag);
			}
			if(values.containsKey(flag)) {
				fail("Flag " + flag + " given more than once");
			}
			if(i + 1 == commandLine.length || args.containsKey(commandLine[i + 1])) {
				fail("No value for flag " + flag);
			}
			values.put(flag, commandLine[i + 1]);
			i += 2;
		}
		for(String flag : args.keySet()) {
			if(args.get(flag).required && !values.containsKey(flag)) {
				fail("Argument " + flag + " is required");
			}
		}
		isParsed = true;
	}

	private void fail(String message) {
		System.err.println("\n------------------------------------------------------");
		System.err.println("Invalid command line: " + message);
		System.err.println("------------------------------------------------------");
		System.err.println(getHelpMessage());
		throw new IllegalArgumentException(message);
	}

	/**
	 * @param flag The command line flag
	 * @return True if the flag was given on the command line
	 */
	public boolean hasValue(String flag) {
		checkParsed();
		return values.containsKey(flag);
	}

	/**
	 * @param flag The command line flag
	 * @return The value, the default, or null if neither exists
	 */
	public String getStringArg(String flag) {
		return raw(flag, ArgType.STRING);
	}

	public int getIntArg(String flag) {
		String value = raw(flag, ArgType.INT);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Value for " + flag + " is not an integer: " + value, e);
		}
	}

	public double getDoubleArg(String flag) {
		String value = raw(flag, ArgType.DOUBLE);
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Value for " + flag + " is not a number: " + value, e);
		}
	}

	public boolean getBooleanArg(String flag) {
		String value = raw(flag, ArgType.BOOLEAN);
		if(!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
			throw new IllegalArgumentException("Value for " + flag + " is not true or false: " + value);
		}
		return Boolean.parseBoolean(value);
	}

	private String raw(String flag, ArgType type) {
		checkParsed();
		Arg arg = args.get(flag);
		if(arg == null || arg.type != type) {
			throw new IllegalArgumentException("Trying to get " + type.label + " value for non-" + type.label + " parameter " + flag);
		}
		String value = values.containsKey(flag) ? values.get(flag) : arg.def;
		if(value == null && type != ArgType.STRING) {
			throw new IllegalArgumentException("No value or default for " + flag);
		}
		return value;
	}

	private void checkParsed() {
		if(!isParsed) {
			throw new IllegalStateException("Cannot get parameter value without first calling method parse()");
		}
	}

	/**
	 * @return Program description plus argument flags and descriptions
	 */
	public String getHelpMessage() {
		StringBuilder sb = new StringBuilder("\n");
		if(programDescription != null) {
			sb.append(programDescription).append("\n\n");
		}
		Map<String, Arg> sorted = new TreeMap<String, Arg>(args);
		for(String flag : sorted.keySet()) {
			Arg arg = sorted.get(flag);
			sb.append(flag).append(" <").append(arg.type.label).append(">\t").append(arg.description);
			sb.append(arg.required ? " (required)" : " (default=" + arg.def + ")").append("\n");
		}
		return sb.toString();
	}

}
