package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class IdentifierNode extends Node {

	public enum Kind {
		PRIMITIVE,
		NON_FUNCTION,
		FUNCTION,
	}

	private final String name;
	private final Kind kind;
	private final Primitive primitive;

	public IdentifierNode(SourceLocation location, String name, Kind kind) {
		this(location, name, kind, null);
	}

	/**
	 * @param primitive the declared type of a {@link Kind#PRIMITIVE} identifier, otherwise null
	 */
	public IdentifierNode(SourceLocation location, String name, Kind kind, Primitive primitive) {
		super(location);
		this.name = name;
		this.kind = kind;
		this.primitive = primitive;
	}

	public String getName() {
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	public Primitive getPrimitive() {
		return primitive;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind, primitive);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		IdentifierNode other = (IdentifierNode) obj;
		return name.equals(other.name) && kind == other.kind && primitive == other.primitive;
	}
}
