package lpp.errors;

import lpp.trans.intermediate.WhileLoadingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileLoadingFile whileLoadingFile) throws E;

}
