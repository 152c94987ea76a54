package lpp.model.ast;

public enum Param {
	CONTAINER("ctr"),
	TIME("time"),
	MASS("mass"),
	SPEED("spd"),
	VOLUME("vol"),
	TEMP("temp"),
	FORMULA("form"),
	VOLTAGE("voltage"),
	CONFIG("config"),
	EQUATION("eq"),
	MOLS("mols"),
	KREV("krev"),
	KCAT("kcat"),
	KM("KM"),
	K("k"),
	KI("Ki"),
	N("n"),
	KA("Ka");

	private final String text;

	Param(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public static Param fromText(String text) {
		for (Param param : values()) {
			if (param.text.equals(text)) {
				return param;
			}
		}
		return null;
	}
}
