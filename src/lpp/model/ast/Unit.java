package lpp.model.ast;

/**
 * Units of measurement, together with the parameter a bare value in that unit stands for.
 */
public enum Unit {
	NONE("", null),
	LITER("L", Param.VOLUME),
	SECOND("s", Param.TIME),
	MINUTE("min", Param.TIME),
	HOUR("h", Param.TIME),
	GRAM("g", Param.MASS),
	CELSIUS("C", Param.TEMP),
	FAHRENHEIT("F", Param.TEMP),
	KELVIN("K", Param.TEMP),
	VOLT("V", Param.VOLTAGE),
	AMPERE("A", Param.VOLTAGE),
	MOL("mol", Param.MOLS),
	MOLARITY("M", Param.MOLS),
	MOLALITY("m", Param.MOLS),
	CANDELA("cd", null),
	RPM("rpm", Param.SPEED),
	GFORCE("G", Param.SPEED);

	private final String text;
	private final Param inferredParam;

	Unit(String text, Param inferredParam) {
		this.text = text;
		this.inferredParam = inferredParam;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the parameter a value in this unit is assumed to set, or null if none can be inferred
	 */
	public Param getInferredParam() {
		return inferredParam;
	}

	public static Unit fromText(String text) {
		for (Unit unit : values()) {
			if (unit != NONE && unit.text.equals(text)) {
				return unit;
			}
		}
		return null;
	}
}
