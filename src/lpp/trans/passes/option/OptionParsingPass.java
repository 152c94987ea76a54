package lpp.trans.passes.option;

import lpp.LppOptionException;
import lpp.LppOptions;
import lpp.errors.IssueContext;
import lpp.trans.intermediate.OptionParserIssue;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	/**
	 * @param logger the logger whose level follows the -q and -v flags, along with every logger below it
	 */
	public static LppOptions perform(IssueContext ctx, Logger logger, String[] args) {
		LppOptions opts = new LppOptions(args);
		try {
			opts.parse();
		} catch (LppOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
