package lpp.model.ast;

/**
 * The operation of a {@link SymbolNode}.
 */
public enum Operator {
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	POWER("^"),
	MODULUS("%"),
	LOGICAL_OR("||"),
	LOGICAL_AND("&&"),
	BITWISE_OR("|"),
	BITWISE_AND("&"),
	EQUALS("=="),
	NOT_EQUALS("!="),
	GEQ(">="),
	GT(">"),
	LEQ("<="),
	LT("<"),
	// reaction arrows
	FORWARD("-->"),
	BACKWARD("<--"),
	REVERSIBLE("<->"),
	INHIBITION("--|"),
	COLON(":"),
	ASSIGNMENT("="),
	DOT(".");

	private final String text;

	Operator(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public boolean isArrow() {
		return this == FORWARD || this == BACKWARD || this == REVERSIBLE || this == INHIBITION;
	}
}
