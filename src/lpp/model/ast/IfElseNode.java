package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class IfElseNode extends Node {

	private final Node condition;
	private final Node ifBody;
	private final Node elseBody;

	public IfElseNode(SourceLocation location, Node condition, Node ifBody, Node elseBody) {
		super(location);
		this.condition = condition;
		this.ifBody = ifBody;
		this.elseBody = elseBody;
	}

	public Node getCondition() {
		return condition;
	}

	public Node getIfBody() {
		return ifBody;
	}

	public Node getElseBody() {
		return elseBody;
	}

	@Override
	public List<Node> getChildren() {
		return Arrays.asList(condition, ifBody, elseBody);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, ifBody, elseBody);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		IfElseNode other = (IfElseNode) obj;
		return Objects.equals(condition, other.condition) && Objects.equals(ifBody, other.ifBody) &&
				Objects.equals(elseBody, other.elseBody);
	}
}
