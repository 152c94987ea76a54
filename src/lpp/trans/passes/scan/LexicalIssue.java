package lpp.trans.passes.scan;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;

import java.nio.file.Path;

public class LexicalIssue extends Issue {

	private final Path file;
	private final int line;
	private final int column;
	private final String problem;

	public LexicalIssue(Path file, int line, int column, String problem) {
		this.file = file;
		this.line = line;
		this.column = column;
		this.problem = problem;
	}

	public Path getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
