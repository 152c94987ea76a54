package lpp;

/**
 * Thrown when the compiler reaches a state its own invariants rule out, as opposed to a problem in the
 * program being compiled. Those are reported as {@link lpp.errors.Issue}s.
 */
public class InternalCompilerError extends RuntimeException {
	private static final String PREFIX = "internal error in the L++ compiler";

	public InternalCompilerError(String reason) {
		super(PREFIX + ": " + reason);
	}

	public InternalCompilerError(String reason, Exception cause) {
		super(PREFIX + ": " + reason, cause);
	}
}
