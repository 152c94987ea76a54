package lpp.errors;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;
import lpp.formatters.IssueFormattingVisitor;
import lpp.trans.LppTransException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found in the user's input. Issues are both collected by an {@link IssueContext} and thrown
 * directly when the pass that finds them cannot continue.
 */
public abstract class Issue extends LppTransException {
	protected Issue() {
		super("");
	}

	/**
	 * Writes this issue the way it appears in the compiler's report.
	 */
	public void format(IndentingWriter out) throws IOException {
		accept(new IssueFormattingVisitor(out));
	}

	@Override
	public String getMessage() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new InternalCompilerError("writing to a string failed", e);
		}
		return w.toString();
	}

	/**
	 * @return this issue, reported as having happened within context
	 */
	public Issue withContext(Context context) {
		return new IssueWithContext(this, context);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
