package lpp.formatters;

import lpp.model.ast.Param;
import lpp.model.context.Activation;
import lpp.model.context.Compartment;
import lpp.model.context.Inhibition;
import lpp.model.context.Molecule;
import lpp.model.context.Reaction;
import lpp.model.context.Simulation;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Serializes a simulation model for the code and diagram generators. Molecules are referred to by name;
 * times are keyed by their decimal text. A number JSON cannot hold is written as the string {@code "inf"},
 * {@code "-inf"} or {@code "nan"}.
 */
public class SimulationJsonFormatter {
	private SimulationJsonFormatter() {}

	public static JSONObject format(Simulation simulation) {
		JSONObject json = new JSONObject();
		json.put("name", simulation.getName());
		json.put("global", format(simulation.getGlobalCompartment()));
		return json;
	}

	public static JSONObject format(Compartment compartment) {
		JSONObject json = new JSONObject();
		json.put("name", compartment.getName());
		json.put("type", compartment.getType().name());
		json.put("volume", number(compartment.getVolume()));
		json.put("spatial", compartment.isSpatial());
		json.put("hasConstantMolecules", compartment.hasConstantMolecules());
		json.put("hasChangedMolecules", compartment.hasChangedMolecules());
		json.put("hasFixedMolecules", compartment.hasFixedMolecules());

		JSONArray molecules = new JSONArray();
		for (Molecule molecule : compartment.getMolecules()) {
			molecules.put(format(molecule));
		}
		json.put("molecules", molecules);

		JSONArray reactions = new JSONArray();
		for (Reaction reaction : compartment.getReactions()) {
			reactions.put(format(reaction));
		}
		json.put("reactions", reactions);

		JSONArray children = new JSONArray();
		for (Compartment child : compartment.getChildren()) {
			children.put(format(child));
		}
		json.put("children", children);
		return json;
	}

	public static JSONObject format(Molecule molecule) {
		JSONObject json = new JSONObject();
		json.put("name", molecule.getName());
		json.put("index", molecule.getIndexInCompartment());
		if (molecule.hasInitialCount()) {
			json.put("initialCount", number(molecule.getInitialCount()));
		}
		OptionalDouble baseline = molecule.getBaseline();
		if (baseline.isPresent()) {
			json.put("baseline", number(baseline.getAsDouble()));
		}

		JSONObject changePoints = new JSONObject();
		for (Map.Entry<Double, Double> point : molecule.getChangePoints().entrySet()) {
			changePoints.put(time(point.getKey()), number(point.getValue()));
		}
		json.put("changePoints", changePoints);

		JSONArray intervalPoints = new JSONArray();
		for (Map.Entry<Double, OptionalDouble> point : molecule.getIntervalPoints().entrySet()) {
			JSONObject entry = new JSONObject();
			entry.put("time", number(point.getKey()));
			entry.put("count", point.getValue().isPresent() ? number(point.getValue().getAsDouble()) : JSONObject.NULL);
			intervalPoints.put(entry);
		}
		json.put("intervalPoints", intervalPoints);
		return json;
	}

	public static JSONObject format(Reaction reaction) {
		JSONObject json = new JSONObject();
		json.put("name", reaction.getName());
		json.put("type", reaction.getType().getAcronym());

		JSONObject stoichiometry = new JSONObject();
		JSONArray reactants = new JSONArray();
		for (Molecule molecule : reaction.getReactants()) {
			reactants.put(molecule.getName());
			stoichiometry.put(molecule.getName(), reaction.getStoichiometricCoefficient(molecule));
		}
		JSONArray products = new JSONArray();
		for (Molecule molecule : reaction.getProducts()) {
			products.put(molecule.getName());
			stoichiometry.put(molecule.getName(), reaction.getStoichiometricCoefficient(molecule));
		}
		json.put("reactants", reactants);
		json.put("products", products);
		json.put("stoichiometry", stoichiometry);
		json.put("parameters", parameters(reaction.getParameters()));
		if (reaction.hasProtein()) {
			json.put("protein", reaction.getProtein().getName());
		}

		if (reaction instanceof Activation) {
			Activation activation = (Activation) reaction;
			JSONObject regulation = new JSONObject();
			regulation.put("name", activation.getActivationName());
			regulation.put("activator", activation.getActivator().getName());
			regulation.put("parameters", parameters(activation.getActivationParameters()));
			json.put("activation", regulation);
		} else if (reaction instanceof Inhibition) {
			Inhibition inhibition = (Inhibition) reaction;
			JSONObject regulation = new JSONObject();
			regulation.put("name", inhibition.getInhibitionName());
			regulation.put("inhibitor", inhibition.getInhibitor().getName());
			regulation.put("parameters", parameters(inhibition.getInhibitionParameters()));
			json.put("inhibition", regulation);
		}
		return json;
	}

	private static JSONObject parameters(Map<Param, Double> parameters) {
		JSONObject json = new JSONObject();
		for (Map.Entry<Param, Double> parameter : parameters.entrySet()) {
			json.put(parameter.getKey().getText(), number(parameter.getValue()));
		}
		return json;
	}

	private static String time(double time) {
		return Double.isInfinite(time) ? "inf" : Double.toString(time);
	}

	private static Object number(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		return value;
	}
}
