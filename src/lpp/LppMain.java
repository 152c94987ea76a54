package lpp;

import lpp.chem.ChemicalResolver;
import lpp.chem.JsonChemicalResolver;
import lpp.errors.Issue;
import lpp.errors.TopLevelIssueContext;
import lpp.formatters.IndentingWriter;
import lpp.formatters.NodeFormattingVisitor;
import lpp.formatters.SimulationJsonFormatter;
import lpp.lexer.TokenStream;
import lpp.model.ast.Node;
import lpp.model.context.Simulation;
import lpp.scope.ScopeRegistry;
import lpp.trans.LppTransException;
import lpp.trans.intermediate.OptionParserIssue;
import lpp.trans.passes.chem.ChemicalResolutionPass;
import lpp.trans.passes.context.ContextBuildingPass;
import lpp.trans.passes.link.ImportLinkingPass;
import lpp.trans.passes.option.OptionParsingPass;
import lpp.trans.passes.parse.ParsingPass;
import lpp.trans.passes.scan.ScanningPass;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.json.JSONException;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class LppMain {
	private final String[] cmdArgs;
	private static final Logger logger = Logger.getLogger(LppMain.class.getName());

	public LppMain(String[] args) {
		cmdArgs = args;
	}

	// Creates an LppMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new LppMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		LppOptions opts = OptionParsingPass.perform(ctx, Logger.getLogger("lpp"), cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}
		if (opts.version) {
			System.out.println("L++ compiler version " + LppOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp();
			return true;
		}

		try {
			Simulation simulation = compile(ctx, opts);
			if (opts.outputFilePath != null) {
				logger.info("Writing simulation model to \"" + opts.outputFilePath + "\"");
				FileUtils.writeStringToFile(new File(opts.outputFilePath),
						SimulationJsonFormatter.format(simulation).toString(2), StandardCharsets.UTF_8);
			}
		} catch (Issue issue) {
			ctx.error(issue);
			logger.severe("found issues");
			System.err.println(ctx.format());
			return false;
		} catch (LppTransException e) {
			logger.severe("found issues");
			System.err.println(e.getDetails());
			return false;
		} catch (IOException | JSONException e) {
			logger.severe("unable to write output: " + e.getMessage());
			return false;
		}
		return true;
	}

	/**
	 * Runs every pass from scanning to context building on the input file.
	 *
	 * @throws LppTransException if a pass reported issues
	 */
	Simulation compile(TopLevelIssueContext ctx, LppOptions opts) throws IOException {
		Path inputFilePath = Paths.get(opts.inputFilePath);

		logger.info("Scanning source file");
		TokenStream tokens = ScanningPass.perform(ctx, inputFilePath, opts::configure);
		checkErrors(ctx);

		logger.info("Linking imports");
		TokenStream linked = ImportLinkingPass.perform(ctx, inputFilePath, tokens, opts::configure);
		checkErrors(ctx);
		if (opts.dumpTokens) {
			System.out.print(linked);
		}

		TokenStream significant = linked.withoutLayout();

		logger.info("Resolving chemicals");
		ChemicalResolver resolver = loadResolver(ctx, opts);
		checkErrors(ctx);
		ChemicalResolutionPass.perform(significant, resolver);

		logger.info("Parsing");
		ScopeRegistry scopes = new ScopeRegistry();
		Node root = ParsingPass.perform(ctx, significant, scopes);
		checkErrors(ctx);
		if (opts.dumpAst) {
			IndentingWriter out = new IndentingWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			new NodeFormattingVisitor(out).writeStatements(root);
			out.newLine();
			out.flush();
		}
		if (opts.dumpScopes) {
			IndentingWriter out = new IndentingWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			scopes.format(out);
			out.newLine();
			out.flush();
		}

		logger.info("Building simulation");
		Simulation simulation = ContextBuildingPass.perform(
				ctx, root, FilenameUtils.getBaseName(inputFilePath.toString()));
		checkErrors(ctx);
		return simulation;
	}

	private static ChemicalResolver loadResolver(TopLevelIssueContext ctx, LppOptions opts) {
		try {
			if (opts.synonymsFile != null) {
				return JsonChemicalResolver.fromFile(opts.synonymsFile);
			}
			return JsonChemicalResolver.bundled();
		} catch (LppOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
			return null;
		}
	}

	private static void checkErrors(TopLevelIssueContext ctx) {
		if (ctx.hasErrors()) {
			throw new LppTransException(ctx.format());
		}
	}
}
