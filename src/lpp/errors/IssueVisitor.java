package lpp.errors;

import lpp.model.ast.EvaluationIssue;
import lpp.model.context.ContextBuildingIssue;
import lpp.parser.ParseIssue;
import lpp.trans.intermediate.IOErrorIssue;
import lpp.trans.intermediate.OptionParserIssue;
import lpp.trans.passes.chem.UnresolvedChemicalIssue;
import lpp.trans.passes.link.CircularImportIssue;
import lpp.trans.passes.link.ImportSyntaxIssue;
import lpp.trans.passes.scan.LexicalIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(LexicalIssue lexicalIssue) throws E;
	public abstract T visit(CircularImportIssue circularImportIssue) throws E;
	public abstract T visit(ImportSyntaxIssue importSyntaxIssue) throws E;
	public abstract T visit(UnresolvedChemicalIssue unresolvedChemicalIssue) throws E;
	public abstract T visit(ParseIssue parseIssue) throws E;
	public abstract T visit(EvaluationIssue evaluationIssue) throws E;
	public abstract T visit(ContextBuildingIssue contextBuildingIssue) throws E;
}
