package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class ReturnNode extends Node {

	private final Node value;

	public ReturnNode(SourceLocation location, Node value) {
		super(location);
		this.value = value;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.singletonList(value);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return Objects.equals(value, ((ReturnNode) obj).value);
	}
}
