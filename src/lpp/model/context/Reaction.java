package lpp.model.context;

import lpp.InternalCompilerError;
import lpp.model.ast.Param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A reaction between molecules of one compartment. Reactants carry negative stoichiometric coefficients and
 * products positive ones.
 */
public class Reaction {

	private static final Logger logger = Logger.getLogger(Reaction.class.getName());

	private final Compartment compartment;
	private final String name;
	private ReactionType type = ReactionType.NOT_YET_DETERMINED;

	private final List<Molecule> reactants;
	private final List<Molecule> products;
	private final Map<Molecule, Integer> stoichiometry;
	private final Map<Param, Double> parameters;
	private Molecule protein;

	public Reaction(Compartment compartment, String name) {
		if (compartment == null) {
			throw new IllegalArgumentException("reaction " + name + " must belong to a compartment");
		}
		this.compartment = compartment;
		this.name = name;
		this.reactants = new ArrayList<>();
		this.products = new ArrayList<>();
		this.stoichiometry = new LinkedHashMap<>();
		this.parameters = new EnumMap<>(Param.class);
	}

	/**
	 * Copies the equation, parameters and type of other.
	 */
	protected Reaction(Reaction other) {
		this.compartment = other.compartment;
		this.name = other.name;
		this.type = other.type;
		this.reactants = new ArrayList<>(other.reactants);
		this.products = new ArrayList<>(other.products);
		this.stoichiometry = new LinkedHashMap<>(other.stoichiometry);
		this.parameters = new EnumMap<>(Param.class);
		this.parameters.putAll(other.parameters);
		this.protein = other.protein;
	}

	public Compartment getCompartment() {
		return compartment;
	}

	public String getName() {
		return name;
	}

	public ReactionType getType() {
		return type;
	}

	/**
	 * @return whether the parameters given so far fit reactionType. A reaction given only {@code k} fits
	 * {@link ReactionType#STANDARD_UNREGULATED}, with {@code krev} implied to be 0.
	 */
	public boolean canHaveType(ReactionType reactionType) {
		if (reactionType == ReactionType.STANDARD_UNREGULATED && parameters.size() == 1 &&
				parameters.containsKey(Param.K)) {
			return true;
		}
		return fits(parameters, reactionType);
	}

	static boolean fits(Map<Param, Double> parameters, ReactionType reactionType) {
		List<Param> required = reactionType.getRequiredParams();
		if (parameters.size() > required.size()) {
			return false;
		}
		return parameters.keySet().containsAll(required);
	}

	public void setType(ReactionType newType) {
		if (newType == ReactionType.NOT_YET_DETERMINED) {
			throw new InternalCompilerError("reaction " + name + " cannot be reset to an undetermined type");
		}
		if (newType == ReactionType.STANDARD_UNREGULATED && !parameters.containsKey(Param.KREV)) {
			logger.warning("reaction " + name + " in compartment " + compartment.getName() +
					" was assumed to have implicit parameter krev = 0");
			parameters.put(Param.KREV, 0.0);
		}
		type = newType;
	}

	public List<Molecule> getReactants() {
		return Collections.unmodifiableList(reactants);
	}

	public void addReactant(Molecule molecule, int stoichiometricCoefficient) {
		reactants.add(molecule);
		stoichiometry.put(molecule, stoichiometricCoefficient);
	}

	public List<Molecule> getProducts() {
		return Collections.unmodifiableList(products);
	}

	public void addProduct(Molecule molecule, int stoichiometricCoefficient) {
		products.add(molecule);
		stoichiometry.put(molecule, stoichiometricCoefficient);
	}

	/**
	 * @return the coefficient of molecule, or 0 if it takes no part in this reaction
	 */
	public int getStoichiometricCoefficient(Molecule molecule) {
		return stoichiometry.getOrDefault(molecule, 0);
	}

	public boolean hasProtein() {
		return protein != null;
	}

	public Molecule getProtein() {
		if (protein == null) {
			throw new IllegalStateException("Reaction " + name + " asked for protein, but has none.");
		}
		return protein;
	}

	public void setProtein(Molecule protein) {
		this.protein = protein;
	}

	public boolean hasParameter(Param parameter) {
		return parameters.containsKey(parameter);
	}

	public double getParameterValue(Param parameter) {
		Double value = parameters.get(parameter);
		if (value == null) {
			throw new IllegalStateException("Reaction " + name + " has no parameter " + parameter.getText());
		}
		return value;
	}

	public Map<Param, Double> getParameters() {
		return Collections.unmodifiableMap(parameters);
	}

	public void addParameter(Param parameter, double value) {
		parameters.put(parameter, value);
	}

	@Override
	public String toString() {
		return "Reaction [" + name + " " + type + "]";
	}
}
