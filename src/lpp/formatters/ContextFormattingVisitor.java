package lpp.formatters;

import lpp.errors.ContextVisitor;
import lpp.trans.intermediate.WhileLoadingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileLoadingFile whileLoadingFile) throws IOException {
		out.write("while loading file ");
		out.write(whileLoadingFile.getFile().toString());
		out.write(" imported ");
		whileLoadingFile.getImportToken().getLocation().writePretty(out);
		return null;
	}

}
