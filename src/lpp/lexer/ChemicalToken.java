package lpp.lexer;

import java.util.Objects;

/**
 * A {@link TokenType#CHEMICAL} token carrying the result of resolving its name against the chemical database.
 */
public class ChemicalToken extends Token {

	public static final String MISSING = "MISSING";

	private final String formula;
	private final String registryId;

	public ChemicalToken(Token original) {
		this(original, MISSING, MISSING);
	}

	public ChemicalToken(Token original, String formula, String registryId) {
		super(original.getText(), TokenType.CHEMICAL, original.getLocation());
		this.formula = formula;
		this.registryId = registryId;
	}

	public String getFormula() {
		return formula;
	}

	/**
	 * @return the CAS registry number of the chemical, or {@link #MISSING}
	 */
	public String getRegistryId() {
		return registryId;
	}

	public ChemicalToken withResolution(String formula, String registryId) {
		return new ChemicalToken(this, formula, registryId);
	}

	@Override
	public String toString() {
		return super.toString() + " [formula=" + formula + ", cas=" + registryId + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(super.hashCode(), formula, registryId);
	}

	@Override
	public boolean equals(Object obj) {
		if (!super.equals(obj)) {
			return false;
		}
		ChemicalToken other = (ChemicalToken) obj;
		return Objects.equals(formula, other.formula) && Objects.equals(registryId, other.registryId);
	}
}
