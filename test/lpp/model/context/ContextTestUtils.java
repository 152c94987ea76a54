package lpp.model.context;

import static org.junit.Assert.*;

import java.nio.file.Paths;

import lpp.LppOptionException;
import lpp.chem.JsonChemicalResolver;
import lpp.lexer.RecordingErrorCollector;
import lpp.lexer.TokenStream;
import lpp.lexer.Tokenizer;
import lpp.model.ast.Node;
import lpp.parser.Parser;
import lpp.scope.ScopeRegistry;
import lpp.trans.passes.chem.ChemicalResolutionPass;

public class ContextTestUtils {
	private ContextTestUtils() {}

	public static Node parse(String text) {
		RecordingErrorCollector errors = new RecordingErrorCollector();
		TokenStream stream = new Tokenizer(errors).tokenize(Paths.get("TEST"), text);
		assertTrue(errors.getErrors().toString(), errors.getErrors().isEmpty());
		try {
			ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());
		} catch (LppOptionException e) {
			throw new AssertionError(e);
		}
		return new Parser(stream, new ScopeRegistry()).parse();
	}

	public static Compartment build(String text) {
		Simulation simulation = new Simulation("TEST");
		simulation.buildSimulation(parse(text));
		return simulation.getGlobalCompartment();
	}

	public static String buildFailure(String text) {
		try {
			build(text);
		} catch (ContextBuildingIssue e) {
			return e.getProblem();
		}
		fail("expected a context building issue for " + text);
		return null;
	}
}
