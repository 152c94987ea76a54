package lpp.lexer;

import lpp.util.SourceLocatable;
import lpp.util.SourceLocation;

/**
 * An immutable lexical token. Reclassification replaces a token's slot in its {@link TokenStream} rather than
 * mutating the token.
 */
public class Token implements SourceLocatable {

	private final String text;
	private final TokenType type;
	private final SourceLocation location;

	public Token(String text, TokenType type, SourceLocation location) {
		this.text = text;
		this.type = type;
		this.location = location;
	}

	public static Token sentinel(TokenType type, SourceLocation location) {
		return new Token("", type, location);
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getText() {
		return text;
	}

	public TokenType getType() {
		return type;
	}

	public boolean is(TokenType type) {
		return this.type == type;
	}

	public int getLine() {
		return location.getLine();
	}

	public int getColumn() {
		return location.getStartColumn();
	}

	public int getEndColumn() {
		return location.getEndColumn();
	}

	/**
	 * @return a copy of this token with a different type and text, at the same location
	 */
	public Token reclassify(TokenType newType, String newText) {
		return new Token(newText, newType, location);
	}

	@Override
	public String toString() {
		return type + " \"" + text + "\" " + getLine() + ":" + getColumn() + "-" + getEndColumn();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((text == null) ? 0 : text.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Token other = (Token) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (text == null) {
			return other.text == null;
		} else return text.equals(other.text);
	}

}
