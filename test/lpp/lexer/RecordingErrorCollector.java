package lpp.lexer;

import java.util.ArrayList;
import java.util.List;

public class RecordingErrorCollector implements ErrorCollector {

	private final List<String> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();

	@Override
	public void addError(int line, int column, String message) {
		errors.add(line + ":" + column + ": " + message);
	}

	@Override
	public void addWarning(int line, int column, String message) {
		warnings.add(line + ":" + column + ": " + message);
	}

	public List<String> getErrors() {
		return errors;
	}

	public List<String> getWarnings() {
		return warnings;
	}
}
