package lpp.model.context;

import lpp.model.ast.ChemicalNode;
import lpp.model.ast.EmptyNode;
import lpp.model.ast.IdentifierNode;
import lpp.model.ast.IndexNode;
import lpp.model.ast.Keyword;
import lpp.model.ast.KeywordNode;
import lpp.model.ast.Node;
import lpp.model.ast.NumberNode;
import lpp.model.ast.Operator;
import lpp.model.ast.Param;
import lpp.model.ast.ParamNode;
import lpp.model.ast.SymbolNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * A region of the simulation holding molecules and the reactions between them. Compartments nest; the
 * simulation's global compartment is the root.
 *
 * Molecules and reactions are looked up by name. Molecules named by a chemical use its formula as name.
 */
public class Compartment {

	private static final Logger logger = Logger.getLogger(Compartment.class.getName());

	public static final double DEFAULT_VOLUME = 1.0;

	private static final Set<Param> REACTION_PARAMETERS = Collections.unmodifiableSet(EnumSet.of(
			Param.K, Param.KREV, Param.KCAT, Param.KM, Param.KI, Param.N, Param.KA));

	private final Compartment parent;
	private final String name;
	private final CompartmentType type;
	private final double volume;
	private final boolean spatial;

	private boolean hasConstantMolecules = false;
	private boolean hasChangedMolecules = false;
	private boolean hasFixedMolecules = false;

	private final List<Compartment> children = new ArrayList<>();
	private final List<Molecule> molecules = new ArrayList<>();
	private final Map<String, Integer> moleculeNameToIndex = new HashMap<>();
	private final List<Reaction> reactions = new ArrayList<>();
	private final Map<String, Integer> reactionNameToIndex = new HashMap<>();

	public Compartment(Compartment parent, String name, CompartmentType type) {
		this(parent, name, type, DEFAULT_VOLUME, false);
	}

	/**
	 * @param parent the enclosing compartment, or null for the root
	 */
	public Compartment(Compartment parent, String name, CompartmentType type, double volume, boolean spatial) {
		this.parent = parent;
		this.name = name;
		this.type = type;
		this.volume = volume;
		this.spatial = spatial;
	}

	public Compartment getParent() {
		return parent;
	}

	public String getName() {
		return name;
	}

	public CompartmentType getType() {
		return type;
	}

	public double getVolume() {
		return volume;
	}

	public boolean isSpatial() {
		return spatial;
	}

	/**
	 * @return whether some molecule has a count fixed for the whole run
	 */
	public boolean hasConstantMolecules() {
		return hasConstantMolecules;
	}

	public void setHasConstantMolecules(boolean hasConstantMolecules) {
		this.hasConstantMolecules = hasConstantMolecules;
	}

	/**
	 * @return whether some molecule has its count set at a point in time
	 */
	public boolean hasChangedMolecules() {
		return hasChangedMolecules;
	}

	public void setHasChangedMolecules(boolean hasChangedMolecules) {
		this.hasChangedMolecules = hasChangedMolecules;
	}

	/**
	 * @return whether some molecule has its count fixed over an interval of time
	 */
	public boolean hasFixedMolecules() {
		return hasFixedMolecules;
	}

	public void setHasFixedMolecules(boolean hasFixedMolecules) {
		this.hasFixedMolecules = hasFixedMolecules;
	}

	public List<Compartment> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public void addChild(Compartment child) {
		children.add(child);
	}

	// molecules

	public List<Molecule> getMolecules() {
		return Collections.unmodifiableList(molecules);
	}

	public boolean hasMolecule(String moleculeName) {
		return moleculeNameToIndex.containsKey(moleculeName);
	}

	public Molecule getMolecule(String moleculeName) {
		Integer index = moleculeNameToIndex.get(moleculeName);
		if (index == null) {
			throw new IllegalArgumentException("no molecule " + moleculeName + " in compartment " + name);
		}
		return molecules.get(index);
	}

	public void addMolecule(Molecule molecule) {
		molecules.add(molecule);
		moleculeNameToIndex.put(molecule.getName(), molecules.size() - 1);
	}

	private Molecule getOrCreateMolecule(String moleculeName) {
		if (hasMolecule(moleculeName)) {
			return getMolecule(moleculeName);
		}
		Molecule molecule = new Molecule(this, moleculeName, molecules.size());
		addMolecule(molecule);
		return molecule;
	}

	/**
	 * Handles {@code m = v}, {@code m[t] = v} and {@code m[a:b] = v}, where every number has already been folded.
	 */
	public void processMoleculeAssignment(SymbolNode assignment) {
		if (assignment.getOperator() != Operator.ASSIGNMENT) {
			throw new ContextBuildingIssue(assignment,
					"Symbol node other than ASSIGNMENT type passed to processMoleculeAssignment.");
		}
		if (!(assignment.getRight() instanceof NumberNode)) {
			throw new ContextBuildingIssue(assignment.getRight(),
					"Only number nodes supported for molecule assignments at present.");
		}
		double value = ((NumberNode) assignment.getRight()).siValue();
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new ContextBuildingIssue(assignment.getRight(), "Molecule count " + value + " is not a finite number.");
		}
		Node left = assignment.getLeft();

		if (left instanceof IdentifierNode || left instanceof ChemicalNode) {
			String moleculeName = moleculeName(left,
					"processMoleculeAssignment ASSIGNMENT node has left child other than IDENTIFIER, CHEMICAL or INDEX.");
			if (hasMolecule(moleculeName)) {
				Molecule molecule = getMolecule(moleculeName);
				if (molecule.hasInitialCount()) {
					logger.warning("assignment to molecule " + moleculeName + " of initial count " + value +
							" shadows previous assignment of count " + molecule.getInitialCount());
				}
				molecule.setInitialCount(value);
			} else {
				addMolecule(new Molecule(this, moleculeName, molecules.size(), value));
			}
			logger.info("assignment of molecule " + moleculeName + " implicitly refers to initial count. Consider " +
					"making explicit with " + moleculeName + "[0], or using " + moleculeName +
					"[:] if molecule is meant to be kept constant.");
			return;
		}
		if (!(left instanceof IndexNode)) {
			throw new ContextBuildingIssue(left,
					"processMoleculeAssignment ASSIGNMENT node has left child other than IDENTIFIER, CHEMICAL or INDEX.");
		}

		IndexNode indexNode = (IndexNode) left;
		Molecule molecule = getOrCreateMolecule(moleculeName(indexNode.getTarget(),
				"Index node with target other than IDENTIFIER or CHEMICAL type."));
		FixedCountHandler handler = molecule.getFixedCountHandler();
		Node index = indexNode.getIndex();
		if (index instanceof NumberNode) {
			handler.addChangePoint(((NumberNode) index).siValue(), value, assignment.getLocation());
		} else if (index instanceof SymbolNode && ((SymbolNode) index).getOperator() == Operator.COLON) {
			SymbolNode colon = (SymbolNode) index;
			double start = bound(colon.getLeft(), 0);
			double end = bound(colon.getRight(), Double.POSITIVE_INFINITY);
			handler.addInterval(value, start, end, assignment.getLocation());
		} else {
			throw new ContextBuildingIssue(index, "Index node with index other than NUMBER or COLON type.");
		}
	}

	private static double bound(Node node, double missing) {
		if (node instanceof NumberNode) {
			return ((NumberNode) node).siValue();
		}
		if (node instanceof EmptyNode) {
			return missing;
		}
		throw new ContextBuildingIssue(node, "Colon node has child other than NUMBER or an empty bound.");
	}

	private static String moleculeName(Node node, String problem) {
		if (node instanceof IdentifierNode) {
			return ((IdentifierNode) node).getName();
		}
		if (node instanceof ChemicalNode) {
			return ((ChemicalNode) node).getFormula();
		}
		throw new ContextBuildingIssue(node, problem);
	}

	// reactions

	public List<Reaction> getReactions() {
		return Collections.unmodifiableList(reactions);
	}

	public boolean hasReaction(String reactionName) {
		return reactionNameToIndex.containsKey(reactionName);
	}

	public Reaction getReaction(String reactionName) {
		Integer index = reactionNameToIndex.get(reactionName);
		if (index == null) {
			throw new IllegalArgumentException("no reaction " + reactionName + " in compartment " + name);
		}
		return reactions.get(index);
	}

	public void addReaction(Reaction reaction) {
		reactions.add(reaction);
		reactionNameToIndex.put(reaction.getName(), reactions.size() - 1);
	}

	public void removeReaction(Reaction reaction) {
		Integer index = reactionNameToIndex.remove(reaction.getName());
		if (index == null) {
			return;
		}
		reactions.remove((int) index);
		for (int i = index; i < reactions.size(); i++) {
			reactionNameToIndex.put(reactions.get(i).getName(), i);
		}
	}

	/**
	 * Builds a reaction from its parameter chain, or turns an earlier reaction into an activation or
	 * inhibition when the equation names that reaction.
	 *
	 * @param inProtein whether the reaction is declared inside a protein block, making proteinName its enzyme
	 */
	public void processReaction(KeywordNode reactionNode, boolean inProtein, String proteinName) {
		if (reactionNode.getKeyword() != Keyword.REACTION) {
			throw new ContextBuildingIssue(reactionNode, "KeywordNode other than REACTION type passed to " +
					"processReaction (type passed: " + reactionNode.getKeyword().getText() + ").");
		}
		String reactionName = reactionNode.getName().getName();
		Node parameterNode = reactionNode.getBody();
		if (parameterNode == null || parameterNode instanceof EmptyNode) {
			throw new ContextBuildingIssue(reactionNode, "Syntax error: reaction " + reactionName +
					" has no parameters.");
		}

		Reaction reaction = new Reaction(this, reactionName);
		boolean seenEquation = false;
		for (; parameterNode != null; parameterNode = parameterNode.getNextStatement()) {
			SymbolNode assignment = parameterAssignment(parameterNode, "processReaction");
			Param parameter = ((ParamNode) assignment.getLeft()).getParam();
			if (parameter != Param.EQUATION) {
				addParameter(reactionName, assignment, reaction::hasParameter, reaction::addParameter);
				continue;
			}

			if (seenEquation) {
				throw new ContextBuildingIssue(assignment, "Reaction " + reactionName +
						" has equation defined more than once.");
			}
			seenEquation = true;
			if (!(assignment.getRight() instanceof SymbolNode)) {
				throw new ContextBuildingIssue(assignment.getRight(),
						"Reaction eq parameter assignment does not have symbol node right child.");
			}
			SymbolNode arrow = (SymbolNode) assignment.getRight();
			switch (arrow.getOperator()) {
				case FORWARD:
					if (checkForActivation(arrow)) {
						processActivation(reactionName, reaction, assignment);
						return;
					}
					processReactants(arrow.getLeft(), reaction);
					processProducts(arrow.getRight(), reaction);
					break;
				case INHIBITION:
					processInhibition(reactionName, reaction, assignment);
					return;
				default:
					throw new ContextBuildingIssue(arrow, "Reaction eq parameter assignment has symbol node " +
							"right child, but that symbol is not a --> or --|.");
			}
		}

		ReactionType[] candidates;
		if (inProtein) {
			reaction.setProtein(getOrCreateMolecule(proteinName));
			candidates = new ReactionType[]{
					ReactionType.ENZYMATIC_STANDARD_UNREGULATED, ReactionType.MICHAELIS_MENTEN_UNREGULATED};
		} else {
			candidates = new ReactionType[]{ReactionType.STANDARD_UNREGULATED};
		}
		inferType(reaction, reactionName, reactionNode, candidates);
		addReaction(reaction);
		logger.info("Added reaction " + reactionName + " to compartment " + name);
	}

	/**
	 * Reactants have negative stoichiometric coefficients.
	 */
	void processReactants(Node equationSide, Reaction reaction) {
		processTerms(equationSide, reaction, "LHS", -1, reaction::addReactant);
	}

	void processProducts(Node equationSide, Reaction reaction) {
		processTerms(equationSide, reaction, "RHS", 1, reaction::addProduct);
	}

	private void processTerms(Node term, Reaction reaction, String side, int sign,
	                          BiConsumer<Molecule, Integer> add) {
		if (term instanceof IdentifierNode || term instanceof ChemicalNode) {
			add.accept(getOrCreateMolecule(moleculeName(term, null)), sign);
			return;
		}
		if (!(term instanceof SymbolNode)) {
			throw new ContextBuildingIssue(term, side + " of reaction " + reaction.getName() +
					" has node other than IDENTIFIER, CHEMICAL or SYMBOL.");
		}
		SymbolNode symbol = (SymbolNode) term;
		switch (symbol.getOperator()) {
			case ADD:
				processTerms(symbol.getLeft(), reaction, side, sign, add);
				processTerms(symbol.getRight(), reaction, side, sign, add);
				break;
			case MULTIPLY: {
				if (!(symbol.getLeft() instanceof NumberNode)) {
					throw new ContextBuildingIssue(symbol.getLeft(), side + " of reaction " + reaction.getName() +
							" has multiplication node with left child other than NUMBER type.");
				}
				String moleculeName = moleculeName(symbol.getRight(), side + " of reaction " + reaction.getName() +
						" has multiplication node with right child other than IDENTIFIER or CHEMICAL type.");
				int coefficient = sign * (int) Math.round(((NumberNode) symbol.getLeft()).getNum());
				add.accept(getOrCreateMolecule(moleculeName), coefficient);
				break;
			}
			default:
				throw new ContextBuildingIssue(symbol, side + " of reaction " + reaction.getName() +
						" has symbol other than + or *");
		}
	}

	/**
	 * @return whether arrow reads {@code molecule --> reaction} for a reaction of this compartment
	 */
	boolean checkForActivation(SymbolNode arrow) {
		if (!(arrow.getLeft() instanceof IdentifierNode) && !(arrow.getLeft() instanceof ChemicalNode)) {
			return false;
		}
		return arrow.getRight() instanceof IdentifierNode &&
				hasReaction(((IdentifierNode) arrow.getRight()).getName());
	}

	/**
	 * @param inProgress the reaction built from the parameters before the equation
	 * @param equation the {@code eq} assignment; parameters after it belong to the activation
	 */
	void processActivation(String activationName, Reaction inProgress, SymbolNode equation) {
		SymbolNode arrow = (SymbolNode) equation.getRight();
		String activatedName = ((IdentifierNode) arrow.getRight()).getName();
		Reaction old = regulatedReaction(activatedName, equation);
		Molecule activator = getOrCreateMolecule(moleculeName(arrow.getLeft(), null));

		Activation activation = new Activation(old, activationName, activator);
		removeReaction(old);
		inProgress.getParameters().forEach(activation::addActivationParameter);
		addFollowingParameters(activationName, equation, "processActivation",
				activation::hasActivationParameter, activation::addActivationParameter);

		inferType(activation, activationName, equation, ReactionType.STANDARD_ALLOSTERIC_ACTIVATION);
		addReaction(activation);
		logger.info("Reaction " + activationName + " caused reaction " + activation.getName() +
				" to become an activation reaction in compartment " + name);
	}

	/**
	 * @param inProgress the reaction built from the parameters before the equation
	 * @param equation the {@code eq} assignment; parameters after it belong to the inhibition
	 */
	void processInhibition(String inhibitionName, Reaction inProgress, SymbolNode equation) {
		SymbolNode arrow = (SymbolNode) equation.getRight();
		String inhibitorName = moleculeName(arrow.getLeft(), "Inhibition " + inhibitionName +
				" has left child that is not a CHEMICAL or IDENTIFIER node.");
		if (!(arrow.getRight() instanceof IdentifierNode)) {
			throw new ContextBuildingIssue(arrow.getRight(), "Inhibition " + inhibitionName +
					" has right child that is not an IDENTIFIER node.");
		}
		String inhibitedName = ((IdentifierNode) arrow.getRight()).getName();
		if (!hasReaction(inhibitedName)) {
			throw new ContextBuildingIssue(arrow, "Inhibition " + inhibitionName + " inhibitions reaction " +
					inhibitedName + ", but this reaction does not exist.");
		}
		Reaction old = regulatedReaction(inhibitedName, equation);
		Molecule inhibitor = getOrCreateMolecule(inhibitorName);

		Inhibition inhibition = new Inhibition(old, inhibitionName, inhibitor);
		removeReaction(old);
		inProgress.getParameters().forEach(inhibition::addInhibitionParameter);
		addFollowingParameters(inhibitionName, equation, "processInhibition",
				inhibition::hasInhibitionParameter, inhibition::addInhibitionParameter);

		inferType(inhibition, inhibitionName, equation, ReactionType.STANDARD_ALLOSTERIC_INHIBITION);
		addReaction(inhibition);
		logger.info("Reaction " + inhibitionName + " caused reaction " + inhibition.getName() +
				" to become an inhibition reaction in compartment " + name);
	}

	private Reaction regulatedReaction(String reactionName, Node at) {
		Reaction old = getReaction(reactionName);
		if (old.getType() != ReactionType.STANDARD_UNREGULATED) {
			throw new ContextBuildingIssue(at, "Converting reactions to activations/inhibitions is only " +
					"supported for standard unregulated reactions.");
		}
		return old;
	}

	private void addFollowingParameters(String reactionName, SymbolNode equation, String processor,
	                                    Predicate<Param> has, BiConsumer<Param, Double> add) {
		for (Node node = equation.getNextStatement(); node != null; node = node.getNextStatement()) {
			SymbolNode assignment = parameterAssignment(node, processor);
			if (((ParamNode) assignment.getLeft()).getParam() == Param.EQUATION) {
				throw new ContextBuildingIssue(assignment, "Reaction " + reactionName +
						" has equation defined more than once.");
			}
			addParameter(reactionName, assignment, has, add);
		}
	}

	private static SymbolNode parameterAssignment(Node node, String processor) {
		if (!(node instanceof SymbolNode) || ((SymbolNode) node).getOperator() != Operator.ASSIGNMENT) {
			throw new ContextBuildingIssue(node, "Reaction node with parameter node other than ASSIGNMENT " +
					"type passed to " + processor + ".");
		}
		SymbolNode assignment = (SymbolNode) node;
		if (!(assignment.getLeft() instanceof ParamNode)) {
			throw new ContextBuildingIssue(assignment, "Parameter assignment node with left child other than " +
					"PARAM type passed to " + processor + ".");
		}
		return assignment;
	}

	private static void addParameter(String reactionName, SymbolNode assignment, Predicate<Param> has,
	                                 BiConsumer<Param, Double> add) {
		Param parameter = ((ParamNode) assignment.getLeft()).getParam();
		if (!REACTION_PARAMETERS.contains(parameter)) {
			throw new ContextBuildingIssue(assignment, "Reaction " + reactionName + " has invalid parameter " +
					parameter.getText() + ".");
		}
		if (has.test(parameter)) {
			throw new ContextBuildingIssue(assignment, "Reaction " + reactionName + " has parameter " +
					parameter.getText() + " defined more than once.");
		}
		if (!(assignment.getRight() instanceof NumberNode)) {
			throw new ContextBuildingIssue(assignment.getRight(),
					"Only number nodes supported for reaction parameter values at present.");
		}
		add.accept(parameter, ((NumberNode) assignment.getRight()).siValue());
	}

	private static void inferType(Reaction reaction, String reactionName, Node at, ReactionType... candidates) {
		for (ReactionType candidate : candidates) {
			if (reaction.canHaveType(candidate)) {
				reaction.setType(candidate);
				return;
			}
		}
		throw new ContextBuildingIssue(at, "Reaction type of reaction " + reactionName + " cannot be " +
				"determined. It likely has not enough or conflicting parameters.");
	}

	/**
	 * Processes every reaction of a protein block with the protein as enzyme.
	 */
	public void processProtein(KeywordNode proteinNode) {
		if (proteinNode.getKeyword() != Keyword.PROTEIN) {
			throw new ContextBuildingIssue(proteinNode, "KeywordNode with type other than PROTEIN passed to " +
					"processProtein.");
		}
		String proteinName = proteinNode.getName().getName();
		for (Node statement = proteinNode.getBody(); statement != null; statement = statement.getNextStatement()) {
			if (!(statement instanceof KeywordNode)) {
				throw new ContextBuildingIssue(statement, "Protein statement other than KEYWORD type.");
			}
			KeywordNode keyword = (KeywordNode) statement;
			if (keyword.getKeyword() != Keyword.REACTION) {
				throw new ContextBuildingIssue(keyword, "Protein KEYWORD statement other than REACTION type.");
			}
			processReaction(keyword, true, proteinName);
		}
	}

	@Override
	public String toString() {
		return "Compartment [" + name + " " + type + "]";
	}
}
