package lpp.chem;

import java.util.Objects;

/**
 * The answer of a {@link ChemicalResolver} for one chemical name. Either field may hold {@link #NULL}, meaning
 * the name is already in canonical form, or {@link #MISSING}, meaning the name is not supported.
 */
public final class ChemicalResolution {

	public static final String NULL = "NULL";
	public static final String MISSING = "MISSING";

	private final String formula;
	private final String registryId;

	public ChemicalResolution(String formula, String registryId) {
		this.formula = Objects.requireNonNull(formula);
		this.registryId = Objects.requireNonNull(registryId);
	}

	public static ChemicalResolution canonical() {
		return new ChemicalResolution(NULL, NULL);
	}

	public static ChemicalResolution missing() {
		return new ChemicalResolution(MISSING, MISSING);
	}

	public String getFormula() {
		return formula;
	}

	public String getRegistryId() {
		return registryId;
	}

	public boolean isMissing() {
		return formula.equals(MISSING) || registryId.equals(MISSING);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ChemicalResolution that = (ChemicalResolution) o;
		return formula.equals(that.formula) && registryId.equals(that.registryId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(formula, registryId);
	}

	@Override
	public String toString() {
		return "ChemicalResolution [formula=" + formula + ", registryId=" + registryId + "]";
	}
}
