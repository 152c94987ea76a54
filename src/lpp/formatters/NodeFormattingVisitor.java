package lpp.formatters;

import lpp.model.ast.ChemicalNode;
import lpp.model.ast.EmptyNode;
import lpp.model.ast.FunctionNode;
import lpp.model.ast.IdentifierNode;
import lpp.model.ast.IfElseNode;
import lpp.model.ast.IfNode;
import lpp.model.ast.ImportNode;
import lpp.model.ast.IndexNode;
import lpp.model.ast.KeywordNode;
import lpp.model.ast.LoopingNode;
import lpp.model.ast.Node;
import lpp.model.ast.NodeVisitor;
import lpp.model.ast.NumberNode;
import lpp.model.ast.ParamNode;
import lpp.model.ast.Prefix;
import lpp.model.ast.ReturnNode;
import lpp.model.ast.SymbolNode;
import lpp.model.ast.Unit;

import java.io.IOException;

/**
 * Writes an AST as an indented tree, one node per line. Blocks and parameter lists are written as the whole
 * chain of statements they start.
 */
public class NodeFormattingVisitor extends NodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public NodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * Writes first and every statement chained after it, one tree per statement.
	 */
	public void writeStatements(Node first) throws IOException {
		for (Node statement = first; statement != null; statement = statement.getNextStatement()) {
			if (statement != first) {
				out.newLine();
			}
			statement.accept(this);
		}
	}

	private void child(String label, Node node) throws IOException {
		out.newLine();
		out.write(label);
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			node.accept(this);
		}
	}

	private void block(String label, Node first) throws IOException {
		out.newLine();
		out.write(label);
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			writeStatements(first);
		}
	}

	@Override
	public Void visit(NumberNode numberNode) throws IOException {
		out.write("Number ");
		out.write(numberNode.getKind() == NumberNode.Kind.INTEGER
				? Long.toString((long) numberNode.getNum())
				: Double.toString(numberNode.getNum()));
		if (numberNode.getPrefix() != Prefix.NONE || numberNode.getUnit() != Unit.NONE) {
			out.write(" ");
			out.write(numberNode.getPrefix().getText());
			out.write(numberNode.getUnit().getText());
		}
		return null;
	}

	@Override
	public Void visit(SymbolNode symbolNode) throws IOException {
		out.write("Symbol ");
		out.write(symbolNode.getOperator().getText());
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("left", symbolNode.getLeft());
			child("right", symbolNode.getRight());
		}
		return null;
	}

	@Override
	public Void visit(LoopingNode loopingNode) throws IOException {
		out.write("Loop ");
		out.write(loopingNode.getKind().name().toLowerCase());
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("head", loopingNode.getLeft());
			block("body", loopingNode.getRight());
		}
		return null;
	}

	@Override
	public Void visit(IfNode ifNode) throws IOException {
		out.write("If");
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("condition", ifNode.getCondition());
			block("then", ifNode.getBody());
		}
		return null;
	}

	@Override
	public Void visit(IfElseNode ifElseNode) throws IOException {
		out.write("IfElse");
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("condition", ifElseNode.getCondition());
			block("then", ifElseNode.getIfBody());
			block("else", ifElseNode.getElseBody());
		}
		return null;
	}

	@Override
	public Void visit(IdentifierNode identifierNode) throws IOException {
		out.write("Identifier ");
		out.write(identifierNode.getName());
		if (identifierNode.getKind() == IdentifierNode.Kind.PRIMITIVE && identifierNode.getPrimitive() != null) {
			out.write(" : ");
			out.write(identifierNode.getPrimitive().getText());
		} else if (identifierNode.getKind() == IdentifierNode.Kind.FUNCTION) {
			out.write(" (function)");
		}
		return null;
	}

	@Override
	public Void visit(FunctionNode functionNode) throws IOException {
		out.write("Function ");
		out.write(functionNode.getName());
		try (IndentingWriter.Indent ignored = out.indent()) {
			block("params", functionNode.getParams());
		}
		return null;
	}

	@Override
	public Void visit(ChemicalNode chemicalNode) throws IOException {
		out.write("Chemical ");
		out.write(chemicalNode.getName());
		out.write(" [");
		out.write(chemicalNode.getFormula());
		out.write(", ");
		out.write(chemicalNode.getRegistryId());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(ReturnNode returnNode) throws IOException {
		out.write("Return");
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("value", returnNode.getValue());
		}
		return null;
	}

	@Override
	public Void visit(KeywordNode keywordNode) throws IOException {
		out.write("Keyword ");
		out.write(keywordNode.getKeyword().getText());
		out.write(" ");
		out.write(keywordNode.getName().getName());
		try (IndentingWriter.Indent ignored = out.indent()) {
			block(keywordNode.allowsStatements() ? "body" : "params", keywordNode.getBody());
		}
		return null;
	}

	@Override
	public Void visit(ImportNode importNode) throws IOException {
		out.write("Import ");
		out.write(importNode.getKind().getText());
		return null;
	}

	@Override
	public Void visit(ParamNode paramNode) throws IOException {
		out.write("Param ");
		out.write(paramNode.getParam().getText());
		return null;
	}

	@Override
	public Void visit(IndexNode indexNode) throws IOException {
		out.write("Index");
		try (IndentingWriter.Indent ignored = out.indent()) {
			child("target", indexNode.getTarget());
			child("index", indexNode.getIndex());
		}
		return null;
	}

	@Override
	public Void visit(EmptyNode emptyNode) throws IOException {
		out.write(emptyNode.getDescription());
		return null;
	}
}
