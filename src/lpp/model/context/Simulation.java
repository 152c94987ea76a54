package lpp.model.context;

import lpp.model.ast.IdentifierNode;
import lpp.model.ast.KeywordNode;
import lpp.model.ast.Node;
import lpp.model.ast.Operator;
import lpp.model.ast.SymbolNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The reaction network described by a program: a tree of compartments rooted at the global compartment.
 */
public class Simulation {

	private static final Logger logger = Logger.getLogger(Simulation.class.getName());

	public static final String GLOBAL_COMPARTMENT = "global";

	private final String name;
	private final Compartment globalCompartment;

	public Simulation(String name) {
		this.name = name;
		this.globalCompartment = new Compartment(
				null, GLOBAL_COMPARTMENT, CompartmentType.NON_SPATIAL, Compartment.DEFAULT_VOLUME, false);
	}

	public String getName() {
		return name;
	}

	public Compartment getGlobalCompartment() {
		return globalCompartment;
	}

	/**
	 * Adds every top-level statement reachable from root to the global compartment. Each statement is
	 * processed once, even if several chains lead to it.
	 *
	 * @throws ContextBuildingIssue on the first statement that does not fit the model
	 */
	public void buildSimulation(Node root) {
		logger.info("Building simulation " + name);
		Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Node> unvisited = new ArrayDeque<>();
		unvisited.push(root);
		while (!unvisited.isEmpty()) {
			Node node = unvisited.pop();
			if (visited.add(node)) {
				buildContext(node);
				if (node.getNextStatement() != null) {
					unvisited.push(node.getNextStatement());
				}
			}
		}
		logger.info("Simulation " + name + " built with " + globalCompartment.getMolecules().size() +
				" molecules and " + globalCompartment.getReactions().size() + " reactions");
	}

	private void buildContext(Node node) {
		if (node instanceof KeywordNode) {
			KeywordNode keyword = (KeywordNode) node;
			switch (keyword.getKeyword()) {
				case REACTION:
					globalCompartment.processReaction(keyword, false, null);
					break;
				case PROTEIN:
					globalCompartment.processProtein(keyword);
					break;
				default:
					throw new ContextBuildingIssue(keyword, "KeywordNode other than REACTION or PROTEIN in buildContext.");
			}
		} else if (node instanceof SymbolNode && ((SymbolNode) node).getOperator() == Operator.ASSIGNMENT) {
			SymbolNode assignment = (SymbolNode) node;
			if (isVariableDeclaration(assignment)) {
				logger.fine("Skipping variable declaration at " + node.getLocation() + " during context building");
			} else {
				globalCompartment.processMoleculeAssignment(assignment);
			}
		} else {
			logger.warning("Skipping statement at " + node.getLocation() + " during context building");
		}
	}

	/**
	 * Typed declarations such as {@code int n = 3;} only feed constant folding.
	 */
	private static boolean isVariableDeclaration(SymbolNode assignment) {
		return assignment.getLeft() instanceof IdentifierNode &&
				((IdentifierNode) assignment.getLeft()).getKind() == IdentifierNode.Kind.PRIMITIVE;
	}

	@Override
	public String toString() {
		return "Simulation [" + name + "]";
	}
}
