package lpp.trans.passes.link;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;
import lpp.lexer.Token;

public class ImportSyntaxIssue extends Issue {

	private final Token token;
	private final String problem;

	public ImportSyntaxIssue(Token token, String problem) {
		this.token = token;
		this.problem = problem;
	}

	public Token getToken() {
		return token;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
