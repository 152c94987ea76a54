package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Stands in for an omitted part, such as an empty block or an open end of a slice.
 */
public class EmptyNode extends Node {

	private final String description;

	public EmptyNode(SourceLocation location, String description) {
		super(location);
		this.description = description;
	}

	public String getDescription() {
		return description;
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
		return 17;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
