package lpp.trans.passes.link;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import lpp.errors.IssueWithContext;
import lpp.errors.TopLevelIssueContext;
import lpp.lexer.Token;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.trans.intermediate.IOErrorIssue;
import lpp.trans.intermediate.WhileLoadingFile;
import lpp.trans.passes.scan.ScanningPass;

public class ImportLinkingPassTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String name, String text) throws IOException {
		File file = new File(folder.getRoot(), name + ImportLinkingPass.SOURCE_EXTENSION);
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file.toPath();
	}

	private TokenStream link(TopLevelIssueContext ctx, Path file) {
		TokenStream stream = ScanningPass.perform(ctx, file, tokenizer -> {});
		assertFalse(ctx.format(), ctx.hasErrors());
		return ImportLinkingPass.perform(ctx, file, stream, tokenizer -> {});
	}

	private static List<String> identifiers(TokenStream stream) {
		List<String> names = new ArrayList<>();
		for (Token token : stream.body()) {
			if (token.is(TokenType.IDENTIFIER)) {
				names.add(token.getText());
			}
		}
		return names;
	}

	@Test
	public void testNoImports() throws IOException {
		Path main = write("Main", "rootVal = 1;");
		TokenStream linked = link(new TopLevelIssueContext(), main);
		assertThat(identifiers(linked), is(Arrays.asList("rootVal")));
	}

	@Test
	public void testImportedCodeComesFirst() throws IOException {
		write("Stock", "stockVal = 2;");
		Path main = write("Main", "import Stock;\nrootVal = 1;");
		TokenStream linked = link(new TopLevelIssueContext(), main);
		assertThat(identifiers(linked), is(Arrays.asList("stockVal", "rootVal")));
		for (Token token : linked.body()) {
			assertThat(token.getType(), not(TokenType.IMPORT));
		}
	}

	@Test
	public void testSharedImportLoadedOnce() throws IOException {
		write("Base", "baseVal = 0;");
		write("Stock", "import Base;\nstockVal = 2;");
		write("Buffer", "import Base;\nbufferVal = 3;");
		Path main = write("Main", "import Stock;\nimport Buffer;\nrootVal = 1;");
		TokenStream linked = link(new TopLevelIssueContext(), main);
		assertThat(identifiers(linked), is(Arrays.asList("baseVal", "bufferVal", "stockVal", "rootVal")));
	}

	@Test
	public void testTransitiveImports() throws IOException {
		write("Base", "baseVal = 0;");
		write("Stock", "import Base;\nstockVal = 2;");
		Path main = write("Main", "import Stock;\nrootVal = 1;");
		TokenStream linked = link(new TopLevelIssueContext(), main);
		assertThat(identifiers(linked), is(Arrays.asList("baseVal", "stockVal", "rootVal")));
	}

	@Test
	public void testSelfImport() throws IOException {
		Path main = write("Main", "import Main;\nrootVal = 1;");
		try {
			link(new TopLevelIssueContext(), main);
			fail("expected a circular import");
		} catch (CircularImportIssue e) {
			assertTrue(e.isSelfImport());
			assertThat(e.getImportToken().getText(), is("Main"));
		}
	}

	@Test
	public void testImportCycle() throws IOException {
		Path alpha = write("Alpha", "import Beta;\nalphaVal = 1;");
		Path beta = write("Beta", "import Alpha;\nbetaVal = 2;");
		try {
			link(new TopLevelIssueContext(), alpha);
			fail("expected a circular import");
		} catch (CircularImportIssue e) {
			assertFalse(e.isSelfImport());
			Path canonicalAlpha = alpha.toAbsolutePath().normalize();
			Path canonicalBeta = beta.toAbsolutePath().normalize();
			assertThat(e.getChain(), is(Arrays.asList(canonicalAlpha, canonicalBeta, canonicalAlpha)));
		}
	}

	@Test
	public void testMissingSemicolon() throws IOException {
		write("Stock", "stockVal = 2;");
		Path main = write("Main", "import Stock\nrootVal = 1;");
		try {
			link(new TopLevelIssueContext(), main);
			fail("expected a malformed import");
		} catch (ImportSyntaxIssue e) {
			assertThat(e.getProblem(), is("Semicolon not found after 'import Stock'"));
		}
	}

	@Test
	public void testMissingFile() throws IOException {
		Path main = write("Main", "import Absent;\nrootVal = 1;");
		try {
			link(new TopLevelIssueContext(), main);
			fail("expected an IO error");
		} catch (IssueWithContext e) {
			assertThat(e.getIssue(), instanceOf(IOErrorIssue.class));
			assertThat(e.getContext(), instanceOf(WhileLoadingFile.class));
			assertThat(((WhileLoadingFile) e.getContext()).getImportToken().getText(), is("Absent"));
		}
	}

	@Test
	public void testLexicalErrorInImportedFile() throws IOException {
		write("Stock", "stockVal = 5mL;");
		Path main = write("Main", "import Stock;\nrootVal = 1;");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		link(ctx, main);
		assertTrue(ctx.hasErrors());
		assertThat(ctx.format(), containsString("Need space between number and identifier."));
	}
}
