package lpp.trans.passes.scan;

import lpp.errors.IssueContext;
import lpp.lexer.ErrorCollector;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Records scanner errors as {@link LexicalIssue}s and logs scanner warnings.
 */
public class IssueCollectingErrorCollector implements ErrorCollector {

	private static final Logger logger = Logger.getLogger(IssueCollectingErrorCollector.class.getName());

	private final IssueContext ctx;
	private final Path file;

	public IssueCollectingErrorCollector(IssueContext ctx, Path file) {
		this.ctx = ctx;
		this.file = file;
	}

	@Override
	public void addError(int line, int column, String message) {
		ctx.error(new LexicalIssue(file, line, column, message));
	}

	@Override
	public void addWarning(int line, int column, String message) {
		logger.warning(file + ":" + line + ":" + column + ": " + message);
	}
}
