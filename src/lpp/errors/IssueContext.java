package lpp.errors;

/**
 * Where a pass reports the problems it finds without stopping. The driver checks {@link #hasErrors()}
 * between passes.
 */
public interface IssueContext {

	void error(Issue err);

	boolean hasErrors();

	/**
	 * @return a context that reports into this one, wrapping every issue in context
	 */
	default IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
