package lpp.model.ast;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;
import lpp.formatters.NodeFormattingVisitor;
import lpp.util.SourceLocatable;
import lpp.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 *
 * The base class for any L++ AST node. Statements within a block are chained through
 * {@link #getNextStatement()}; the chain is not part of a node's identity, so two nodes are equal when their
 * own contents are.
 *
 */
public abstract class Node implements SourceLocatable {
	private final SourceLocation location;
	private Node nextStatement;

	public Node(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public Node getNextStatement() {
		return nextStatement;
	}

	public void setNextStatement(Node nextStatement) {
		this.nextStatement = nextStatement;
	}

	/**
	 * @return the direct children of this node, not including the next statement
	 */
	public abstract List<Node> getChildren();

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new NodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new InternalCompilerError("writing to a string failed", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E;

}
