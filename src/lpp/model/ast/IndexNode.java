package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * target[index]
 *
 * where index is a time point or, as a {@link Operator#COLON} symbol, a time interval.
 */
public class IndexNode extends Node {

	private final Node target;
	private final Node index;

	public IndexNode(SourceLocation location, Node target, Node index) {
		super(location);
		this.target = target;
		this.index = index;
	}

	public Node getTarget() {
		return target;
	}

	public Node getIndex() {
		return index;
	}

	@Override
	public List<Node> getChildren() {
		return Arrays.asList(target, index);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		IndexNode other = (IndexNode) obj;
		return Objects.equals(target, other.target) && Objects.equals(index, other.index);
	}
}
