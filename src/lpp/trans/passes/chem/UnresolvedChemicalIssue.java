package lpp.trans.passes.chem;

import lpp.errors.Issue;
import lpp.errors.IssueVisitor;
import lpp.lexer.Token;

public class UnresolvedChemicalIssue extends Issue {

	private final Token chemical;

	public UnresolvedChemicalIssue(Token chemical) {
		this.chemical = chemical;
	}

	public Token getChemical() {
		return chemical;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
