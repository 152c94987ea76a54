package lpp.lexer;

public enum TokenType {
	/** Sentinel preceding the first token of a stream. */
	START,
	/** Sentinel following the last token of a stream. */
	END,

	IDENTIFIER,
	/** An identifier reclassified as a chemical name inside a reaction or reagent parameter list. */
	CHEMICAL,
	KEYWORD,
	FUNCTION,
	PARAM,
	/** The name following the keyword {@code import}. */
	IMPORT,
	UNIT,
	INTEGER,
	FLOAT,
	STRING,
	PRIMITIVE,
	LOOPING,
	RETURN,
	IF,
	ELSE,
	/** Only produced when whitespace reporting is enabled. */
	WHITESPACE,
	/** Only produced when newline reporting is enabled. */
	NEWLINE,

	SYMBOL_ADD("+"),
	SYMBOL_SUBTRACT("-"),
	SYMBOL_MULTIPLY("*"),
	SYMBOL_DIVIDE("/"),
	SYMBOL_EQUAL("="),
	SYMBOL_NOT("!"),
	SYMBOL_COMMA(","),
	SYMBOL_DOT("."),
	SYMBOL_GEQ(">="),
	SYMBOL_LEQ("<="),
	SYMBOL_GT(">"),
	SYMBOL_LT("<"),
	SYMBOL_QUOTE_DOUBLE("\""),
	SYMBOL_QUOTE_SINGLE("'"),
	SYMBOL_QUESTION("?"),
	SYMBOL_PERCENT("%"),
	SYMBOL_CARAT("^"),
	SYMBOL_OR("|"),
	SYMBOL_AND("&"),
	SYMBOL_UNDERSCORE("_"),
	SYMBOL_COLON(":"),
	SYMBOL_SEMICOLON(";"),
	SYMBOL_PAREN_OPEN("("),
	SYMBOL_PAREN_CLOSED(")"),
	SYMBOL_CURLY_OPEN("{"),
	SYMBOL_CURLY_CLOSED("}"),
	SYMBOL_BRACKET_OPEN("["),
	SYMBOL_BRACKET_CLOSED("]"),
	SYMBOL_UNKNOWN;

	private final String symbol;

	TokenType() {
		this(null);
	}

	TokenType(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the source text of this symbol, or null if this is not a fixed symbol
	 */
	public String getSymbol() {
		return symbol;
	}

	public boolean isSymbol() {
		return name().startsWith("SYMBOL_");
	}

	/**
	 * Classifies captured symbol text, falling back to {@link #SYMBOL_UNKNOWN}.
	 */
	public static TokenType fromSymbol(String text) {
		for (TokenType type : values()) {
			if (type.symbol != null && type.symbol.equals(text)) {
				return type;
			}
		}
		return SYMBOL_UNKNOWN;
	}
}
