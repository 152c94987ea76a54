package lpp.formatters;

import lpp.errors.IssueVisitor;
import lpp.errors.IssueWithContext;
import lpp.lexer.Token;
import lpp.model.ast.EvaluationIssue;
import lpp.model.context.ContextBuildingIssue;
import lpp.parser.ParseIssue;
import lpp.trans.intermediate.IOErrorIssue;
import lpp.trans.intermediate.OptionParserIssue;
import lpp.trans.passes.chem.UnresolvedChemicalIssue;
import lpp.trans.passes.link.CircularImportIssue;
import lpp.trans.passes.link.ImportSyntaxIssue;
import lpp.trans.passes.scan.LexicalIssue;

import java.io.IOException;
import java.nio.file.Path;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("unable to read ");
		out.write(ioErrorIssue.getFile().toString());
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(LexicalIssue lexicalIssue) throws IOException {
		out.write("lexical error at line ");
		out.write(Integer.toString(lexicalIssue.getLine()));
		out.write(" column ");
		out.write(Integer.toString(lexicalIssue.getColumn()));
		if (lexicalIssue.getFile() != null) {
			out.write(" in file ");
			out.write(lexicalIssue.getFile().toString());
		}
		out.write(": ");
		out.write(lexicalIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(CircularImportIssue circularImportIssue) throws IOException {
		if (circularImportIssue.isSelfImport()) {
			out.write("file imports itself ");
		} else {
			out.write("circular import ");
		}
		circularImportIssue.getImportToken().getLocation().writePretty(out);
		out.write(": ");
		boolean first = true;
		for (Path path : circularImportIssue.getChain()) {
			if (!first) {
				out.write(" -> ");
			}
			first = false;
			out.write(path.toString());
		}
		return null;
	}

	@Override
	public Void visit(ImportSyntaxIssue importSyntaxIssue) throws IOException {
		out.write("malformed import ");
		importSyntaxIssue.getToken().getLocation().writePretty(out);
		out.write(": ");
		out.write(importSyntaxIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(UnresolvedChemicalIssue unresolvedChemicalIssue) throws IOException {
		Token chemical = unresolvedChemicalIssue.getChemical();
		out.write("chemical ");
		out.write(chemical.getText());
		out.write(" ");
		chemical.getLocation().writePretty(out);
		out.write(" is not supported by the chemical database");
		return null;
	}

	@Override
	public Void visit(ParseIssue parseIssue) throws IOException {
		out.write("syntax error ");
		parseIssue.getToken().getLocation().writePretty(out);
		out.write(" near \"");
		out.write(parseIssue.getToken().getText());
		out.write("\": ");
		out.write(parseIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(EvaluationIssue evaluationIssue) throws IOException {
		out.write("cannot evaluate expression ");
		evaluationIssue.getNode().getLocation().writePretty(out);
		out.write(": ");
		out.write(evaluationIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(ContextBuildingIssue contextBuildingIssue) throws IOException {
		out.write("invalid simulation ");
		contextBuildingIssue.getLocation().writePretty(out);
		out.write(": ");
		out.write(contextBuildingIssue.getProblem());
		return null;
	}
}
