package lpp.parser;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;
import lpp.lexer.Token;

public class ParseIssue extends Issue {

	private final Token token;
	private final String problem;

	public ParseIssue(Token token, String problem) {
		this.token = token;
		this.problem = problem;
	}

	/**
	 * @return the token the parser was looking at when it gave up
	 */
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
