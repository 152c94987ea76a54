package lpp;

/**
 * Base of the exceptions the compiler reports to its user. The message is the kind of failure followed by
 * the details, e.g. {@code "Compilation Error: ..."}.
 */
public abstract class LppException extends RuntimeException {
	private final String kind;
	private final String details;

	protected LppException(String kind, String details) {
		super(kind + ": " + details);
		this.kind = kind;
		this.details = details;
	}

	public String getKind() {
		return kind;
	}

	public String getDetails() {
		return details;
	}
}
