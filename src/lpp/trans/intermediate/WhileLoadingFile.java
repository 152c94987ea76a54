package lpp.trans.intermediate;

import lpp.errors.Context;
import lpp.errors.ContextVisitor;
import lpp.lexer.Token;

import java.nio.file.Path;

/**
 * Issues found while tokenizing or linking an imported file. The import token points at the statement in
 * the importing file that caused the load.
 */
public class WhileLoadingFile extends Context {

	private final Path file;
	private final Token importToken;

	public WhileLoadingFile(Path file, Token importToken) {
		this.file = file;
		this.importToken = importToken;
	}

	public Path getFile() {
		return file;
	}

	public Token getImportToken() {
		return importToken;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
