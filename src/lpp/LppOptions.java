package lpp;

import lpp.lexer.Tokenizer;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

public class LppOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	@Option(value = "-t Print the linked token stream", aliases = {"-tokens"})
	public boolean dumpTokens = false;

	@Option(value = "-a Print the syntax tree", aliases = {"-ast"})
	public boolean dumpAst = false;

	@Option(value = "-s Print the scopes recorded while parsing", aliases = {"-scopes"})
	public boolean dumpScopes = false;

	@Option(value = "-o path of the JSON model file to write", aliases = {"-output"})
	public String outputFilePath;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public boolean reportWhitespace = false;
	public boolean reportNewlines = false;
	public boolean requireSpaceAfterNumber = true;
	public boolean allowMultilineStrings = false;
	public Path synonymsFile;

	private final Options plumeOptions;
	private final String[] args;
	private String[] remainingArgs;

	public LppOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("lpp [options] file.lpp", this);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * @return whether the run should stop after printing the version or usage
	 */
	public boolean isInformational() {
		return version || help;
	}

	public void parse() throws LppOptionException {
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new LppOptionException(e.getMessage(), e);
		}

		if (isInformational()) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new LppOptionException("Expected exactly one source file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (configFilePath != null && !configFilePath.isEmpty()) {
			readConfig(Paths.get(configFilePath));
		}
	}

	private void readConfig(Path configFile) throws LppOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new LppOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}

		Path base = configFile.toAbsolutePath().getParent();
		try {
			JSONObject config = new JSONObject(s);
			JSONObject lexer = config.optJSONObject("lexer");
			if (lexer != null) {
				reportWhitespace = lexer.optBoolean("report_whitespace", reportWhitespace);
				reportNewlines = lexer.optBoolean("report_newlines", reportNewlines);
				requireSpaceAfterNumber = lexer.optBoolean("require_space_after_number", requireSpaceAfterNumber);
				allowMultilineStrings = lexer.optBoolean("allow_multiline_strings", allowMultilineStrings);
			}
			JSONObject chemicals = config.optJSONObject("chemicals");
			if (chemicals != null && chemicals.has("synonyms")) {
				synonymsFile = base.resolve(chemicals.getString("synonyms"));
			}
			JSONObject output = config.optJSONObject("output");
			if (output != null && output.has("model_file") && outputFilePath == null) {
				outputFilePath = base.resolve(output.getString("model_file")).toString();
			}
		} catch (JSONException e) {
			throw new LppOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}
	}

	/**
	 * Applies the scanner flags from the configuration file.
	 */
	public void configure(Tokenizer tokenizer) {
		tokenizer.setReportWhitespace(reportWhitespace);
		if (reportNewlines) {
			tokenizer.setReportNewlines(true);
		}
		tokenizer.setRequireSpaceAfterNumber(requireSpaceAfterNumber);
		tokenizer.setAllowMultilineStrings(allowMultilineStrings);
	}
}
