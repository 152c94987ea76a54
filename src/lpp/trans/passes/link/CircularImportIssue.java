package lpp.trans.passes.link;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;
import lpp.lexer.Token;

import java.nio.file.Path;
import java.util.List;

public class CircularImportIssue extends Issue {

	private final Token importToken;
	private final List<Path> chain;

	/**
	 * @param chain the files involved, starting and ending with the same file
	 */
	public CircularImportIssue(Token importToken, List<Path> chain) {
		this.importToken = importToken;
		this.chain = chain;
	}

	public Token getImportToken() {
		return importToken;
	}

	public List<Path> getChain() {
		return chain;
	}

	public boolean isSelfImport() {
		return chain.size() == 2;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
