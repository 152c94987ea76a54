package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A declaration introduced by a keyword.
 *
 * Block declarations ({@code protein P { ... }}) hold the first statement of their block as body. Flat
 * declarations ({@code reaction R(eq, k = 1);}) always have keyword {@link Keyword#REACTION}, hold their first
 * parameter assignment as body and do not allow statements.
 */
public class KeywordNode extends Node {

	private final Keyword keyword;
	private final IdentifierNode name;
	private final Node body;
	private final boolean allowsStatements;

	public KeywordNode(SourceLocation location, Keyword keyword, IdentifierNode name, Node body,
	                   boolean allowsStatements) {
		super(location);
		this.keyword = keyword;
		this.name = name;
		this.body = body;
		this.allowsStatements = allowsStatements;
	}

	public Keyword getKeyword() {
		return keyword;
	}

	public IdentifierNode getName() {
		return name;
	}

	public Node getBody() {
		return body;
	}

	public boolean allowsStatements() {
		return allowsStatements;
	}

	@Override
	public List<Node> getChildren() {
		return Arrays.asList(name, body);
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, name, body, allowsStatements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		KeywordNode other = (KeywordNode) obj;
		return keyword == other.keyword && allowsStatements == other.allowsStatements &&
				Objects.equals(name, other.name) && Objects.equals(body, other.body);
	}
}
