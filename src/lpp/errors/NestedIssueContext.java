package lpp.errors;

/**
 * Forwards issues to an enclosing context, e.g. while scanning an imported file.
 */
class NestedIssueContext implements IssueContext {

	private final IssueContext enclosing;
	private final Context context;

	NestedIssueContext(IssueContext enclosing, Context context) {
		this.enclosing = enclosing;
		this.context = context;
	}

	@Override
	public void error(Issue err) {
		enclosing.error(err.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return enclosing.hasErrors();
	}

}
