package lpp.model.ast;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;

public class EvaluationIssue extends Issue {

	private final Node node;
	private final String problem;

	public EvaluationIssue(Node node, String problem) {
		this.node = node;
		this.problem = problem;
	}

	public Node getNode() {
		return node;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
