package lpp.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;

/**
 * Collects every issue of a compilation run, in the order reported.
 */
public class TopLevelIssueContext implements IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	/**
	 * Writes a header counting the issues, followed by each issue indented on its own line.
	 */
	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + issues.size() + " issue(s):");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Issue issue : issues) {
				out.newLine();
				issue.format(out);
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new InternalCompilerError("writing to a string failed", e);
		}
		return w.toString();
	}
}
