package lpp.errors;

/**
 * Describes what the compiler was doing when an issue was found, e.g. which imported file it was loading.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;

}
