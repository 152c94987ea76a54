package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call of one of the built-in lab functions. The parameters are a chain of parameter assignments starting at
 * {@link #getParams()}, or an {@link EmptyNode} when called without arguments.
 */
public class FunctionNode extends Node {

	public enum Kind {
		INSTANCE,
		STATIC,
		CLASS,
	}

	private final String name;
	private final Kind kind;
	private final Node params;

	public FunctionNode(SourceLocation location, String name, Kind kind, Node params) {
		super(location);
		this.name = name;
		this.kind = kind;
		this.params = params;
	}

	public String getName() {
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	public Node getParams() {
		return params;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.singletonList(params);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind, params);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		FunctionNode other = (FunctionNode) obj;
		return name.equals(other.name) && kind == other.kind && Objects.equals(params, other.params);
	}
}
