package lpp.trans.passes.chem;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import lpp.LppOptionException;
import lpp.chem.ChemicalResolution;
import lpp.chem.JsonChemicalResolver;
import lpp.lexer.ChemicalToken;
import lpp.lexer.RecordingErrorCollector;
import lpp.lexer.Token;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.lexer.Tokenizer;

public class ChemicalResolutionPassTest {

	static Path testFile = Paths.get("TEST");

	private static TokenStream scan(String text) {
		return new Tokenizer(new RecordingErrorCollector()).tokenize(testFile, text);
	}

	private static Token find(TokenStream stream, String text) {
		for (Token token : stream.body()) {
			if (token.getText().equals(text)) {
				return token;
			}
		}
		throw new AssertionError("no token " + text + " in stream");
	}

	@Test
	public void testDeclaredIdentifiers() {
		TokenStream stream = scan("int Rate = 2;\nreaction Brew(Water --> Ice, k = Rate);\nprotein Enzyme { }");
		assertThat(ChemicalResolutionPass.findIdentifiers(stream),
				is(new HashSet<>(Arrays.asList("Rate", "Brew", "Enzyme"))));
	}

	@Test
	public void testReactionOperandsBecomeChemicals() throws LppOptionException {
		TokenStream stream = scan("reaction Brew(Water + Glucose --> Ethanol, k = 1);");
		ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());

		Token water = find(stream, "WATER");
		assertThat(water, instanceOf(ChemicalToken.class));
		assertThat(water.getType(), is(TokenType.CHEMICAL));
		assertThat(((ChemicalToken) water).getFormula(), is("H2O"));
		assertThat(((ChemicalToken) water).getRegistryId(), is("7732-18-5"));
		assertThat(((ChemicalToken) find(stream, "GLUCOSE")).getFormula(), is("C6H12O6"));
		assertThat(((ChemicalToken) find(stream, "ETHANOL")).getFormula(), is("C2H6O"));
		assertThat(find(stream, "Brew").getType(), is(TokenType.IDENTIFIER));
	}

	@Test
	public void testUnknownChemicalKeepsItsName() throws LppOptionException {
		TokenStream stream = scan("reaction Melt(Frost --> Slush, k = 1);");
		ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());
		ChemicalToken frost = (ChemicalToken) find(stream, "FROST");
		assertThat(frost.getFormula(), is("FROST"));
		assertThat(frost.getRegistryId(), is(ChemicalToken.MISSING));
	}

	@Test
	public void testDeclaredNamesStayIdentifiers() throws LppOptionException {
		TokenStream stream = scan("int Rate = 2;\nreaction Brew(Water --> Rate, k = 1);");
		ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());
		for (Token token : stream.body()) {
			if (token.getText().equals("Rate")) {
				assertThat(token.getType(), is(TokenType.IDENTIFIER));
			}
		}
	}

	@Test
	public void testStatementsOutsideReactionsAreLeftAlone() throws LppOptionException {
		TokenStream stream = scan("Water = 5;\nWater[10] = 2;");
		ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());
		for (Token token : stream.body()) {
			assertThat(token.getType(), not(TokenType.CHEMICAL));
		}
	}

	@Test
	public void testReagentBlock() throws LppOptionException {
		TokenStream stream = scan("reagent Sample { Oxygen }");
		ChemicalResolutionPass.perform(stream, JsonChemicalResolver.bundled());
		assertThat(((ChemicalToken) find(stream, "OXYGEN")).getFormula(), is("O2"));
		assertThat(find(stream, "Sample").getType(), is(TokenType.IDENTIFIER));
	}

	@Test
	public void testUnsupportedChemical() {
		TokenStream stream = scan("reaction Brew(Unobtainium --> Water, k = 1);");
		try {
			ChemicalResolutionPass.perform(stream, name -> name.equals("UNOBTAINIUM")
					? ChemicalResolution.missing() : ChemicalResolution.canonical());
			fail("expected an unresolved chemical");
		} catch (UnresolvedChemicalIssue e) {
			assertThat(e.getChemical().getText(), is("UNOBTAINIUM"));
		}
	}
}
