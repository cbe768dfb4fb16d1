package cover;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from the <code>cover.ini</code> on the class path and from an optional
 * <code>cover.ini</code> in the working directory (later files win).
 */
public class Config {

	public static final String configFile = "cover.ini";

	public static final Logger LOG = Logger.getLogger("Cover");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("insertionNonTerminal", "H");
		put("insertedTerminalNonTerminal", "I");
		put("logLevel", "INFO");
	}};

	/** Preferred name of the non terminal that derives runs of inserted terminals (<pre>H -> HI | I</pre>) */
	public static char insertionNonTerminal(){
		return nonTerminalName("insertionNonTerminal");
	}

	/** Preferred name of the non terminal that derives a single inserted terminal (<pre>I -> a</pre>) */
	public static char insertedTerminalNonTerminal(){
		return nonTerminalName("insertedTerminalNonTerminal");
	}

	public static Level logLevel(){
		return parseLevel(config.get("logLevel"));
	}

	private static Level parseLevel(String value){
		try {
			return Level.parse(value.trim());
		} catch (IllegalArgumentException e){
			throw new CoverException(String.format("Invalid log level \"%s\"", value), e);
		}
	}

	/**
	 * Overrides a setting for the rest of the run.
	 */
	public static void set(String key, String value){
		if (!config.containsKey(key)){
			throw new CoverException(String.format("Unknown config key \"%s\"", key));
		}
		if (key.equals("logLevel")){
			LOG.setLevel(parseLevel(value));
		} else if (key.endsWith("NonTerminal")){
			checkNonTerminalName(key, value);
		}
		config.put(key, value);
	}

	private static char nonTerminalName(String key){
		return checkNonTerminalName(key, config.get(key));
	}

	private static char checkNonTerminalName(String key, String name){
		String value = name.trim();
		if (value.length() != 1 || !Character.isUpperCase(value.charAt(0))){
			throw new InvalidGrammarError(String.format("%s has to be a single upper case letter, got \"%s\"", key, value));
		}
		return value.charAt(0);
	}

	private static void readConfig(BufferedReader reader) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.trim().startsWith("#") || !line.contains("=")){
				continue;
			}
			String[] parts = line.split("=", 2);
			String key = parts[0].trim();
			if (config.containsKey(key)){
				config.put(key, parts[1].trim());
			} else {
				System.err.println("Unknown config key \"" + key + "\"");
			}
		}
	}

	private static void loadConfig(){
		try {
			InputStream resource = Config.class.getResourceAsStream("/" + configFile);
			if (resource != null){
				try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource, StandardCharsets.UTF_8))){
					readConfig(reader);
				}
			}
			File file = new File(configFile);
			if (file.exists()){
				try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))){
					readConfig(reader);
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile + ", using the defaults", e);
		}
	}

	static {
		loadConfig();
		LOG.setLevel(logLevel());
	}
}
