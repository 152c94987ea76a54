package lpp.model.context;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;
import lpp.model.ast.Node;
import lpp.util.SourceLocation;

/**
 * A statement that parses but does not describe a consistent simulation, such as a reaction whose kinetics
 * cannot be determined or a molecule count fixed at a negative time.
 */
public class ContextBuildingIssue extends Issue {

	private final SourceLocation location;
	private final String problem;

	public ContextBuildingIssue(SourceLocation location, String problem) {
		this.location = location;
		this.problem = problem;
	}

	public ContextBuildingIssue(Node node, String problem) {
		this(node.getLocation(), problem);
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
