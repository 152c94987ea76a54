package lpp.model.ast;

public enum Keyword {
	REAGENT("reagent"),
	PROTOCOL("protocol"),
	CONTAINER("container"),
	IMPORT("import"),
	REACTION("reaction"),
	PROTEIN("protein"),
	COMPLEX("complex"),
	PATHWAY("pathway"),
	MEMBRANE("membrane"),
	DOMAIN("domain"),
	PLASM("plasm");

	private final String text;

	Keyword(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public static Keyword fromText(String text) {
		for (Keyword keyword : values()) {
			if (keyword.text.equals(text)) {
				return keyword;
			}
		}
		return null;
	}
}
