package lpp.trans.intermediate;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A source file that could not be read.
 */
public class IOErrorIssue extends Issue {

	private final Path file;
	private final IOException error;

	public IOErrorIssue(Path file, IOException error) {
		this.file = file;
		this.error = error;
		initCause(error);
	}

	public Path getFile() {
		return file;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
