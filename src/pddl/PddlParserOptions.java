package pddl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parser configuration, read from a JSON document such as
 * <pre>
 * {"parser": {"maxNumberOfProblems": 100, "verbose": false}}
 * </pre>
 * Every field is optional.
 */
public class PddlParserOptions {

	public static final String PARSER_FIELD = "parser";
	public static final String MAX_NUMBER_OF_PROBLEMS_FIELD = "maxNumberOfProblems";
	public static final String VERBOSE_FIELD = "verbose";

	private static final int DEFAULT_MAX_NUMBER_OF_PROBLEMS = 100;

	// keep at most this many parsing problems per file
	public final int maxNumberOfProblems;

	/**
	 * Be verbose, print extra detailed information. A parser built with this set raises the
	 * shared {@code pddl} logger to FINE for the rest of the process.
	 */
	public final boolean verbose;

	public PddlParserOptions() {
		this(DEFAULT_MAX_NUMBER_OF_PROBLEMS, false);
	}

	public PddlParserOptions(int maxNumberOfProblems, boolean verbose) {
		this.maxNumberOfProblems = maxNumberOfProblems;
		this.verbose = verbose;
	}

	public static PddlParserOptions fromJson(String json) throws PddlOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new PddlOptionException("parsing error: " + e.getMessage(), e);
		}

		if (!config.has(PARSER_FIELD)) {
			return new PddlParserOptions();
		}

		try {
			JSONObject parser = config.getJSONObject(PARSER_FIELD);
			int maxNumberOfProblems = DEFAULT_MAX_NUMBER_OF_PROBLEMS;
			if (parser.has(MAX_NUMBER_OF_PROBLEMS_FIELD)) {
				maxNumberOfProblems = parser.getInt(MAX_NUMBER_OF_PROBLEMS_FIELD);
			}
			if (maxNumberOfProblems < 0) {
				throw new PddlOptionException(MAX_NUMBER_OF_PROBLEMS_FIELD + " must not be negative");
			}
			boolean verbose = false;
			if (parser.has(VERBOSE_FIELD)) {
				verbose = parser.getBoolean(VERBOSE_FIELD);
			}
			return new PddlParserOptions(maxNumberOfProblems, verbose);
		} catch (JSONException e) {
			throw new PddlOptionException(e.getMessage(), e);
		}
	}

	public static PddlParserOptions fromFile(String configFilePath) throws PddlOptionException {
		String json;
		try {
			json = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new PddlOptionException("Error reading configuration file: " + e.getMessage(), e);
		}
		try {
			return fromJson(json);
		} catch (PddlOptionException e) {
			throw new PddlOptionException(configFilePath + ": " + e.getMsg(), e);
		}
	}
}
