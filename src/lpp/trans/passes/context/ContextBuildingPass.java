package lpp.trans.passes.context;

import lpp.errors.IssueContext;
import lpp.model.ast.Node;
import lpp.model.context.ContextBuildingIssue;
import lpp.model.context.Simulation;

public class ContextBuildingPass {
	private ContextBuildingPass() {}

	/**
	 * @return the simulation named name built from the statements reachable from root, or null if a
	 * statement could not be modelled; the problem is recorded in ctx
	 */
	public static Simulation perform(IssueContext ctx, Node root, String name) {
		Simulation simulation = new Simulation(name);
		try {
			simulation.buildSimulation(root);
		} catch (ContextBuildingIssue e) {
			ctx.error(e);
			return null;
		}
		return simulation;
	}
}
