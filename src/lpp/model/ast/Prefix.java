package lpp.model.ast;

/**
 * SI prefixes accepted in front of a unit.
 */
public enum Prefix {
	NONE("", 1),
	YOTTA("Y", 1e24),
	ZETTA("Z", 1e21),
	EXA("E", 1e18),
	PETA("P", 1e15),
	TERA("T", 1e12),
	GIGA("G", 1e9),
	MEGA("M", 1e6),
	KILO("k", 1e3),
	HECTO("h", 1e2),
	DECA("da", 1e1),
	DECI("d", 1e-1),
	CENTI("c", 1e-2),
	MILLI("m", 1e-3),
	MICRO("u", 1e-6),
	NANO("n", 1e-9),
	PICO("p", 1e-12),
	FEMTO("f", 1e-15),
	ATTO("a", 1e-18),
	ZEPTO("z", 1e-21),
	YOCTO("y", 1e-24);

	private final String text;
	private final double multiplier;

	Prefix(String text, double multiplier) {
		this.text = text;
		this.multiplier = multiplier;
	}

	public String getText() {
		return text;
	}

	public double getMultiplier() {
		return multiplier;
	}

	/**
	 * @return the prefix written as text, or null if there is none
	 */
	public static Prefix fromText(String text) {
		for (Prefix prefix : values()) {
			if (prefix.text.equals(text)) {
				return prefix;
			}
		}
		return null;
	}
}
