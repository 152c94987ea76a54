package lpp;

public class LppOptionException extends Exception {
	private static final long serialVersionUID = 4139186527723710112L;

	public LppOptionException(String message) {
		super(message);
	}

	public LppOptionException(String message, Throwable cause) {
		super(message, cause);
	}
}
