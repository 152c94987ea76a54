package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A numeric literal, or the folded value of a constant expression, with an optional prefixed unit.
 */
public class NumberNode extends Node {

	public enum Kind {
		FLOAT,
		INTEGER,
	}

	private final double num;
	private final Kind kind;
	private final Prefix prefix;
	private final Unit unit;

	public NumberNode(SourceLocation location, double num, Kind kind, Prefix prefix, Unit unit) {
		super(location);
		this.num = num;
		this.kind = kind;
		this.prefix = prefix;
		this.unit = unit;
	}

	public NumberNode(SourceLocation location, double num, Kind kind) {
		this(location, num, kind, Prefix.NONE, Unit.NONE);
	}

	/**
	 * @return INTEGER if value has no fractional part, FLOAT otherwise
	 */
	public static Kind kindOf(double value) {
		return value == Math.rint(value) && !Double.isInfinite(value) ? Kind.INTEGER : Kind.FLOAT;
	}

	public double getNum() {
		return num;
	}

	public Kind getKind() {
		return kind;
	}

	public Prefix getPrefix() {
		return prefix;
	}

	public Unit getUnit() {
		return unit;
	}

	/**
	 * @return the value scaled by its prefix
	 */
	public double siValue() {
		return num * prefix.getMultiplier();
	}

	public boolean samePrefixAndUnit(NumberNode other) {
		return prefix == other.prefix && unit == other.unit;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(num, kind, prefix, unit);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NumberNode other = (NumberNode) obj;
		return Double.compare(num, other.num) == 0 && kind == other.kind && prefix == other.prefix &&
				unit == other.unit;
	}
}
