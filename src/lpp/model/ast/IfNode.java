package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class IfNode extends Node {

	private final Node condition;
	private final Node body;

	public IfNode(SourceLocation location, Node condition, Node body) {
		super(location);
		this.condition = condition;
		this.body = body;
	}

	public Node getCondition() {
		return condition;
	}

	public Node getBody() {
		return body;
	}

	@Override
	public List<Node> getChildren() {
		return Arrays.asList(condition, body);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		IfNode other = (IfNode) obj;
		return Objects.equals(condition, other.condition) && Objects.equals(body, other.body);
	}
}
