package lpp.lexer;

/**
 * Receives problems found while scanning. The scanner keeps going after reporting, so an implementation sees
 * every lexical problem in a file.
 */
public interface ErrorCollector {

	void addError(int line, int column, String message);

	void addWarning(int line, int column, String message);

}
