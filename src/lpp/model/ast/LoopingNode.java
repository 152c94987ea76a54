package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A loop. For a {@code for} loop the left side is the loop variable's declaration and the right side an
 * {@link IfElseNode} holding the condition, the body and the increment. For a {@code while} loop the left side
 * is the condition and the right side the body.
 */
public class LoopingNode extends Node {

	public enum Kind {
		FOR,
		WHILE,
		DO,
	}

	private final Kind kind;
	private final Node left;
	private final Node right;

	public LoopingNode(SourceLocation location, Kind kind, Node left, Node right) {
		super(location);
		this.kind = kind;
		this.left = left;
		this.right = right;
	}

	public Kind getKind() {
		return kind;
	}

	public Node getLeft() {
		return left;
	}

	public Node getRight() {
		return right;
	}

	@Override
	public List<Node> getChildren() {
		return Arrays.asList(left, right);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, left, right);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		LoopingNode other = (LoopingNode) obj;
		return kind == other.kind && Objects.equals(left, other.left) && Objects.equals(right, other.right);
	}
}
