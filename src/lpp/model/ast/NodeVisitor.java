package lpp.model.ast;

public abstract class NodeVisitor<T, E extends Throwable> {
	public abstract T visit(NumberNode numberNode) throws E;
	public abstract T visit(SymbolNode symbolNode) throws E;
	public abstract T visit(LoopingNode loopingNode) throws E;
	public abstract T visit(IfNode ifNode) throws E;
	public abstract T visit(IfElseNode ifElseNode) throws E;
	public abstract T visit(IdentifierNode identifierNode) throws E;
	public abstract T visit(FunctionNode functionNode) throws E;
	public abstract T visit(ChemicalNode chemicalNode) throws E;
	public abstract T visit(ReturnNode returnNode) throws E;
	public abstract T visit(KeywordNode keywordNode) throws E;
	public abstract T visit(ImportNode importNode) throws E;
	public abstract T visit(ParamNode paramNode) throws E;
	public abstract T visit(IndexNode indexNode) throws E;
	public abstract T visit(EmptyNode emptyNode) throws E;
}
