package lpp.formatters;

import static lpp.model.context.ContextTestUtils.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

import lpp.model.context.Simulation;

public class SimulationJsonFormatterTest {

	private static final String BREW = "reaction Brew(Glucose --> 2 Ethanol + 2 CarbonDioxide, k = 3);\n";

	private static JSONObject global(String text) {
		Simulation simulation = new Simulation("brewery");
		simulation.buildSimulation(parse(text));
		JSONObject json = SimulationJsonFormatter.format(simulation);
		assertThat(json.getString("name"), is("brewery"));
		return json.getJSONObject("global");
	}

	@Test
	public void testCompartment() {
		JSONObject global = global("water = 1;");
		assertThat(global.getString("name"), is(Simulation.GLOBAL_COMPARTMENT));
		assertThat(global.getString("type"), is("NON_SPATIAL"));
		assertThat(global.getDouble("volume"), is(1.0));
		assertFalse(global.getBoolean("spatial"));
		assertThat(global.getJSONArray("children").length(), is(0));
		assertThat(global.getJSONArray("reactions").length(), is(0));
	}

	@Test
	public void testMoleculeCounts() {
		JSONObject global = global("water[0] = 5;\nwater[10:20] = 3;\nsalt[:] = 2;");
		JSONArray molecules = global.getJSONArray("molecules");
		assertThat(molecules.length(), is(2));

		JSONObject water = molecules.getJSONObject(0);
		assertThat(water.getString("name"), is("water"));
		assertThat(water.getInt("index"), is(0));
		assertThat(water.getDouble("initialCount"), is(5.0));
		assertFalse(water.has("baseline"));
		assertThat(water.getJSONObject("changePoints").getDouble("0.0"), is(5.0));

		JSONArray points = water.getJSONArray("intervalPoints");
		assertThat(points.length(), is(3));
		assertThat(points.getJSONObject(0).getDouble("time"), is(0.0));
		assertTrue(points.getJSONObject(0).isNull("count"));
		assertThat(points.getJSONObject(1).getDouble("time"), is(10.0));
		assertThat(points.getJSONObject(1).getDouble("count"), is(3.0));
		assertTrue(points.getJSONObject(2).isNull("count"));

		JSONObject salt = molecules.getJSONObject(1);
		assertThat(salt.getDouble("baseline"), is(2.0));
		assertThat(salt.getDouble("initialCount"), is(2.0));
		assertThat(salt.getJSONArray("intervalPoints").length(), is(0));

		assertTrue(global.getBoolean("hasChangedMolecules"));
		assertTrue(global.getBoolean("hasFixedMolecules"));
		assertTrue(global.getBoolean("hasConstantMolecules"));
	}

	@Test
	public void testReaction() {
		JSONObject brew = global(BREW).getJSONArray("reactions").getJSONObject(0);
		assertThat(brew.getString("name"), is("Brew"));
		assertThat(brew.getString("type"), is("SU"));
		assertThat(brew.getJSONArray("reactants").getString(0), is("C6H12O6"));
		assertThat(brew.getJSONArray("products").length(), is(2));
		assertThat(brew.getJSONObject("stoichiometry").getInt("C2H6O"), is(2));
		assertThat(brew.getJSONObject("parameters").getDouble("k"), is(3.0));
		assertThat(brew.getJSONObject("parameters").getDouble("krev"), is(0.0));
		assertFalse(brew.has("protein"));
		assertFalse(brew.has("activation"));
	}

	@Test
	public void testNumbersJsonCannotHold() {
		JSONObject brew = global("reaction Brew(Glucose --> Ethanol, k = 10 ^ 400, krev = 0 - 10 ^ 400);")
				.getJSONArray("reactions").getJSONObject(0);
		assertThat(brew.getJSONObject("parameters").getString("k"), is("inf"));
		assertThat(brew.getJSONObject("parameters").getString("krev"), is("-inf"));
	}

	@Test
	public void testActivation() {
		JSONObject brew = global(BREW + "reaction Boost(Inducer --> Brew, Ka = 0.5, n = 2);")
				.getJSONArray("reactions").getJSONObject(0);
		assertThat(brew.getString("name"), is("Brew"));
		assertThat(brew.getString("type"), is("SAA"));
		JSONObject activation = brew.getJSONObject("activation");
		assertThat(activation.getString("name"), is("Boost"));
		assertThat(activation.getString("activator"), is("INDUCER"));
		assertThat(activation.getJSONObject("parameters").getDouble("Ka"), is(0.5));
	}

	@Test
	public void testProtein() {
		JSONObject burn = global("protein Enzyme { reaction Burn(Glucose --> Ethanol, kcat = 2, KM = 4); }")
				.getJSONArray("reactions").getJSONObject(0);
		assertThat(burn.getString("type"), is("MMU"));
		assertThat(burn.getString("protein"), is("Enzyme"));
	}
}
