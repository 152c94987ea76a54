package lpp.scope;

import lpp.lexer.TokenType;

import java.util.Objects;

/**
 * One symbol table value: the kind of token that declared the name and either a number or a tag string such
 * as {@code "reaction"} or {@code "chemical"}.
 */
public final class ScopeEntry {

	private final TokenType type;
	private final Double number;
	private final String text;

	private ScopeEntry(TokenType type, Double number, String text) {
		this.type = type;
		this.number = number;
		this.text = text;
	}

	public static ScopeEntry ofNumber(TokenType type, double number) {
		return new ScopeEntry(type, number, null);
	}

	public static ScopeEntry ofText(TokenType type, String text) {
		return new ScopeEntry(type, null, Objects.requireNonNull(text));
	}

	public TokenType getType() {
		return type;
	}

	public boolean isNumber() {
		return number != null;
	}

	public double getNumber() {
		if (number == null) {
			throw new IllegalStateException("scope entry holds text, not a number");
		}
		return number;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return type + " " + (isNumber() ? number.toString() : '"' + text + '"');
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, number, text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ScopeEntry other = (ScopeEntry) obj;
		return type == other.type && Objects.equals(number, other.number) && Objects.equals(text, other.text);
	}
}
