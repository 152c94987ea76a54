package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * AST node:
 *
 * left &lt;op&gt; right
 *
 * Covers arithmetic, comparisons, reaction arrows, slices ({@code a:b}), assignments and member calls.
 */
public class SymbolNode extends Node {

	private final Operator operator;
	private final Node left;
	private final Node right;

	public SymbolNode(SourceLocation location, Operator operator, Node left, Node right) {
		super(location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
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
		return Objects.hash(operator, left, right);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		SymbolNode other = (SymbolNode) obj;
		return operator == other.operator && Objects.equals(left, other.left) && Objects.equals(right, other.right);
	}
}
