package lpp.model.ast;

import lpp.scope.ScopeEntry;

import java.util.Map;

/**
 * Folds constant expressions to a single {@link NumberNode}.
 *
 * Arithmetic works on the written values, ignoring prefixes. The result takes its prefix and unit from the
 * left operand when both operands agree; otherwise each of prefix and unit comes from whichever operand has
 * one, the left operand first.
 */
public class ExpressionEvaluator extends NodeVisitor<NumberNode, EvaluationIssue> {

	private final Map<String, ScopeEntry> scope;

	private ExpressionEvaluator(Map<String, ScopeEntry> scope) {
		this.scope = scope;
	}

	/**
	 * @param scope the names visible at the expression, used to resolve identifiers
	 * @throws EvaluationIssue if node is not a constant numeric expression
	 */
	public static NumberNode evaluate(Node node, Map<String, ScopeEntry> scope) {
		return node.accept(new ExpressionEvaluator(scope));
	}

	@Override
	public NumberNode visit(NumberNode numberNode) {
		return numberNode;
	}

	@Override
	public NumberNode visit(SymbolNode symbolNode) {
		NumberNode left = symbolNode.getLeft().accept(this);
		NumberNode right = symbolNode.getRight().accept(this);
		double l = left.getNum();
		double r = right.getNum();
		double result;
		switch (symbolNode.getOperator()) {
			case ADD:
				result = l + r;
				break;
			case SUBTRACT:
				result = l - r;
				break;
			case MULTIPLY:
				result = l * r;
				break;
			case DIVIDE:
				if (r == 0) {
					throw new EvaluationIssue(symbolNode, "Division by zero.");
				}
				result = l / r;
				break;
			case POWER:
				result = Math.pow(l, r);
				break;
			case MODULUS:
				if ((long) r == 0) {
					throw new EvaluationIssue(symbolNode, "Modulus by zero.");
				}
				result = (long) l % (long) r;
				break;
			case LOGICAL_OR:
				result = truth(l != 0 || r != 0);
				break;
			case LOGICAL_AND:
				result = truth(l != 0 && r != 0);
				break;
			case EQUALS:
				result = truth(l == r);
				break;
			case NOT_EQUALS:
				result = truth(l != r);
				break;
			case GEQ:
				result = truth(l >= r);
				break;
			case GT:
				result = truth(l > r);
				break;
			case LEQ:
				result = truth(l <= r);
				break;
			case LT:
				result = truth(l < r);
				break;
			default:
				throw new EvaluationIssue(symbolNode,
						"Evaluation operation cannot be performed with symbol " + symbolNode.getOperator().getText());
		}

		Prefix prefix;
		Unit unit;
		if (left.samePrefixAndUnit(right)) {
			prefix = left.getPrefix();
			unit = left.getUnit();
		} else {
			prefix = left.getPrefix() != Prefix.NONE ? left.getPrefix() : right.getPrefix();
			unit = left.getUnit() != Unit.NONE ? left.getUnit() : right.getUnit();
		}
		return new NumberNode(symbolNode.getLocation(), result, NumberNode.Kind.FLOAT, prefix, unit);
	}

	private static double truth(boolean b) {
		return b ? 1 : 0;
	}

	@Override
	public NumberNode visit(IdentifierNode identifierNode) {
		ScopeEntry entry = scope.get(identifierNode.getName());
		if (entry == null) {
			throw new EvaluationIssue(identifierNode, "Identifier " + identifierNode.getName() + " is not declared.");
		}
		if (!entry.isNumber()) {
			throw new EvaluationIssue(identifierNode,
					"Found identifier " + identifierNode.getName() + " in symbol table but the value is not a number.");
		}
		double value = entry.getNumber();
		return new NumberNode(identifierNode.getLocation(), value, NumberNode.kindOf(value));
	}

	@Override
	public NumberNode visit(LoopingNode loopingNode) {
		throw notConstant(loopingNode);
	}

	@Override
	public NumberNode visit(IfNode ifNode) {
		throw notConstant(ifNode);
	}

	@Override
	public NumberNode visit(IfElseNode ifElseNode) {
		throw notConstant(ifElseNode);
	}

	@Override
	public NumberNode visit(FunctionNode functionNode) {
		throw notConstant(functionNode);
	}

	@Override
	public NumberNode visit(ChemicalNode chemicalNode) {
		throw notConstant(chemicalNode);
	}

	@Override
	public NumberNode visit(ReturnNode returnNode) {
		throw notConstant(returnNode);
	}

	@Override
	public NumberNode visit(KeywordNode keywordNode) {
		throw notConstant(keywordNode);
	}

	@Override
	public NumberNode visit(ImportNode importNode) {
		throw notConstant(importNode);
	}

	@Override
	public NumberNode visit(ParamNode paramNode) {
		throw notConstant(paramNode);
	}

	@Override
	public NumberNode visit(IndexNode indexNode) {
		throw notConstant(indexNode);
	}

	@Override
	public NumberNode visit(EmptyNode emptyNode) {
		throw notConstant(emptyNode);
	}

	private static EvaluationIssue notConstant(Node node) {
		return new EvaluationIssue(node, "Evaluation operation cannot be performed on " + node);
	}
}
