package lpp.util;

/**
 * Anything that can be traced back to where it was written, i.e. tokens and AST nodes.
 */
public interface SourceLocatable {

	SourceLocation getLocation();

}
