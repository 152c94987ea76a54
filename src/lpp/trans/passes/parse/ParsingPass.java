package lpp.trans.passes.parse;

import lpp.errors.IssueContext;
import lpp.lexer.TokenStream;
import lpp.model.ast.EvaluationIssue;
import lpp.model.ast.Node;
import lpp.parser.ParseIssue;
import lpp.parser.Parser;
import lpp.scope.ScopeRegistry;

public class ParsingPass {
	private ParsingPass() {}

	/**
	 * Parses a linked, layout-free stream. The first parse or folding problem is recorded in ctx.
	 *
	 * @param scopes receives the scope of every block parsed
	 * @return the first top-level statement, or null if parsing failed
	 */
	public static Node perform(IssueContext ctx, TokenStream stream, ScopeRegistry scopes) {
		try {
			return new Parser(stream, scopes).parse();
		} catch (ParseIssue | EvaluationIssue e) {
			ctx.error(e);
			return null;
		}
	}
}
