package lpp.model.context;

import lpp.model.ast.Param;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A standard unregulated reaction that an activator molecule activates. The activation keeps the name, equation and
 * parameters of the reaction it regulates; its own name and parameters are held separately.
 */
public class Activation extends Reaction {

	private final String activationName;
	private final Molecule activator;
	private final Map<Param, Double> activationParameters = new EnumMap<>(Param.class);

	/**
	 * @param regulated a reaction of type {@link ReactionType#STANDARD_UNREGULATED}
	 */
	public Activation(Reaction regulated, String activationName, Molecule activator) {
		super(regulated);
		if (regulated.getType() != ReactionType.STANDARD_UNREGULATED) {
			throw new IllegalArgumentException("only standard unregulated reactions can be regulated, not " +
					regulated.getType());
		}
		this.activationName = activationName;
		this.activator = activator;
	}

	public String getActivationName() {
		return activationName;
	}

	public Molecule getActivator() {
		return activator;
	}

	public boolean hasActivationParameter(Param parameter) {
		return activationParameters.containsKey(parameter);
	}

	public double getActivationParameterValue(Param parameter) {
		Double value = activationParameters.get(parameter);
		if (value == null) {
			throw new IllegalStateException("Reaction " + activationName + " has no parameter " + parameter.getText());
		}
		return value;
	}

	public Map<Param, Double> getActivationParameters() {
		return Collections.unmodifiableMap(activationParameters);
	}

	public void addActivationParameter(Param parameter, double value) {
		activationParameters.put(parameter, value);
	}

	/**
	 * Considers only the activation parameters; the regulated reaction keeps its own type.
	 */
	@Override
	public boolean canHaveType(ReactionType reactionType) {
		return fits(activationParameters, reactionType);
	}
}
