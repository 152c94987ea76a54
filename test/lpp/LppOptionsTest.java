package lpp;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import lpp.errors.TopLevelIssueContext;
import lpp.lexer.RecordingErrorCollector;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.lexer.Tokenizer;
import lpp.trans.passes.option.OptionParsingPass;

public class LppOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static LppOptions options(String... args) throws LppOptionException {
		LppOptions opts = new LppOptions(args);
		opts.parse();
		return opts;
	}

	private File config(JSONObject json) throws IOException {
		File file = folder.newFile("lpp.json");
		FileUtils.writeStringToFile(file, json.toString(), StandardCharsets.UTF_8);
		return file;
	}

	// the single positional argument is the source file
	@Test
	public void testInputFile() throws LppOptionException {
		LppOptions opts = options("-v", "brew.lpp");
		assertThat(opts.inputFilePath, is("brew.lpp"));
		assertTrue(opts.logLvlVerbose);
		assertFalse(opts.isInformational());
		assertThat(opts.outputFilePath, nullValue());
	}

	@Test(expected = LppOptionException.class)
	public void testNoInputFile() throws LppOptionException {
		options("-v");
	}

	@Test(expected = LppOptionException.class)
	public void testTwoInputFiles() throws LppOptionException {
		options("brew.lpp", "ferment.lpp");
	}

	// printing the version needs no source file
	@Test
	public void testVersion() throws LppOptionException {
		LppOptions opts = options("--version");
		assertTrue(opts.isInformational());
		assertThat(opts.inputFilePath, nullValue());
	}

	// scanner flags keep their defaults when the configuration file leaves them out
	@Test
	public void testEmptyConfig() throws Exception {
		LppOptions opts = options("-c", config(new JSONObject()).getPath(), "brew.lpp");
		assertFalse(opts.reportWhitespace);
		assertFalse(opts.reportNewlines);
		assertTrue(opts.requireSpaceAfterNumber);
		assertFalse(opts.allowMultilineStrings);
		assertThat(opts.synonymsFile, nullValue());
	}

	// paths in the configuration file are relative to the file itself
	@Test
	public void testConfig() throws Exception {
		JSONObject json = new JSONObject();
		JSONObject lexer = new JSONObject();
		lexer.put("report_newlines", true);
		lexer.put("require_space_after_number", false);
		json.put("lexer", lexer);
		json.put("chemicals", new JSONObject().put("synonyms", "synonyms.json"));
		json.put("output", new JSONObject().put("model_file", "brew.json"));

		LppOptions opts = options("-c", config(json).getPath(), "brew.lpp");
		assertTrue(opts.reportNewlines);
		assertFalse(opts.requireSpaceAfterNumber);
		assertThat(opts.synonymsFile, is(folder.getRoot().toPath().toAbsolutePath().resolve("synonyms.json")));
		assertThat(opts.outputFilePath,
				is(folder.getRoot().toPath().toAbsolutePath().resolve("brew.json").toString()));
	}

	// an output file given on the command line wins over the configuration file
	@Test
	public void testOutputFlagOverridesConfig() throws Exception {
		JSONObject json = new JSONObject();
		json.put("output", new JSONObject().put("model_file", "brew.json"));
		LppOptions opts = options("-o", "out.json", "-c", config(json).getPath(), "brew.lpp");
		assertThat(opts.outputFilePath, is("out.json"));
	}

	@Test
	public void testMalformedConfig() throws Exception {
		File file = folder.newFile("broken.json");
		FileUtils.writeStringToFile(file, "{\"lexer\": ", StandardCharsets.UTF_8);
		try {
			options("-c", file.getPath(), "brew.lpp");
			fail("expected an option error");
		} catch (LppOptionException e) {
			assertThat(e.getMessage(), containsString("parsing error"));
		}
	}

	@Test
	public void testMissingConfig() {
		try {
			options("-c", new File(folder.getRoot(), "absent.json").getPath(), "brew.lpp");
			fail("expected an option error");
		} catch (LppOptionException e) {
			assertThat(e.getMessage(), startsWith("Error reading configuration file"));
		}
	}

	// newline reporting from the configuration file reaches the scanner
	@Test
	public void testConfigure() throws Exception {
		JSONObject json = new JSONObject();
		json.put("lexer", new JSONObject().put("report_newlines", true));
		LppOptions opts = options("-c", config(json).getPath(), "brew.lpp");

		Tokenizer tokenizer = new Tokenizer(new RecordingErrorCollector());
		opts.configure(tokenizer);
		TokenStream stream = tokenizer.tokenize(folder.getRoot().toPath().resolve("brew.lpp"), "a = 1;\nb = 2;");
		boolean sawNewline = false;
		for (int i = stream.firstIndex(); i < stream.endIndex(); i++) {
			sawNewline |= stream.type(i) == TokenType.NEWLINE;
		}
		assertTrue(sawNewline);
	}

	@Test
	public void testLogLevels() {
		Logger logger = Logger.getLogger("lpp.optionstest");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[]{"-q", "brew.lpp"});
		assertThat(logger.getLevel(), is(Level.WARNING));
		OptionParsingPass.perform(ctx, logger, new String[]{"-v", "brew.lpp"});
		assertThat(logger.getLevel(), is(Level.FINE));
		OptionParsingPass.perform(ctx, logger, new String[]{"brew.lpp"});
		assertThat(logger.getLevel(), is(Level.INFO));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void testOptionErrorsAreRecorded() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, Logger.getLogger("lpp.optionstest"), new String[]{});
		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), containsString("Expected exactly one source file, found 0"));
	}
}
