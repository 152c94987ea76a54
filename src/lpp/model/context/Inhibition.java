package lpp.model.context;

import lpp.model.ast.Param;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A standard unregulated reaction that an inhibitor molecule inhibits. The inhibition keeps the name, equation and
 * parameters of the reaction it regulates; its own name and parameters are held separately.
 */
public class Inhibition extends Reaction {

	private final String inhibitionName;
	private final Molecule inhibitor;
	private final Map<Param, Double> inhibitionParameters = new EnumMap<>(Param.class);

	/**
	 * @param regulated a reaction of type {@link ReactionType#STANDARD_UNREGULATED}
	 */
	public Inhibition(Reaction regulated, String inhibitionName, Molecule inhibitor) {
		super(regulated);
		if (regulated.getType() != ReactionType.STANDARD_UNREGULATED) {
			throw new IllegalArgumentException("only standard unregulated reactions can be regulated, not " +
					regulated.getType());
		}
		this.inhibitionName = inhibitionName;
		this.inhibitor = inhibitor;
	}

	public String getInhibitionName() {
		return inhibitionName;
	}

	public Molecule getInhibitor() {
		return inhibitor;
	}

	public boolean hasInhibitionParameter(Param parameter) {
		return inhibitionParameters.containsKey(parameter);
	}

	public double getInhibitionParameterValue(Param parameter) {
		Double value = inhibitionParameters.get(parameter);
		if (value == null) {
			throw new IllegalStateException("Reaction " + inhibitionName + " has no parameter " + parameter.getText());
		}
		return value;
	}

	public Map<Param, Double> getInhibitionParameters() {
		return Collections.unmodifiableMap(inhibitionParameters);
	}

	public void addInhibitionParameter(Param parameter, double value) {
		inhibitionParameters.put(parameter, value);
	}

	/**
	 * Considers only the inhibition parameters; the regulated reaction keeps its own type.
	 */
	@Override
	public boolean canHaveType(ReactionType reactionType) {
		return fits(inhibitionParameters, reactionType);
	}
}
