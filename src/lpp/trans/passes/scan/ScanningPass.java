package lpp.trans.passes.scan;

import lpp.errors.IssueContext;
import lpp.lexer.TokenStream;
import lpp.lexer.Tokenizer;
import lpp.trans.intermediate.IOErrorIssue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

public class ScanningPass {
	private ScanningPass() {}

	/**
	 * Scans one source file. Lexical problems are recorded in ctx; an unreadable file is thrown as an
	 * {@link IOErrorIssue}.
	 *
	 * @param configure applies the scanner flags chosen by the user
	 */
	public static TokenStream perform(IssueContext ctx, Path file, Consumer<Tokenizer> configure) {
		Tokenizer tokenizer = new Tokenizer(new IssueCollectingErrorCollector(ctx, file));
		configure.accept(tokenizer);
		try {
			return tokenizer.tokenize(file);
		} catch (IOException e) {
			throw new IOErrorIssue(file, e);
		}
	}
}
