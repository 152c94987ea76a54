package lpp.model.ast;

public enum Primitive {
	INT("int"),
	FLOAT("float"),
	DOUBLE("double"),
	BOOL("bool"),
	STRING("string");

	private final String text;

	Primitive(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public static Primitive fromText(String text) {
		for (Primitive primitive : values()) {
			if (primitive.text.equals(text)) {
				return primitive;
			}
		}
		return null;
	}
}
