package lpp.scope;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * The scopes of one parse. Open scopes form a stack; a closed scope becomes a child of the scope below it and
 * is registered under its name.
 */
public class ScopeRegistry {

	private static final Logger logger = Logger.getLogger(ScopeRegistry.class.getName());

	private final Deque<Scope> open = new ArrayDeque<>();
	private final Map<String, Scope> closed = new LinkedHashMap<>();

	public Scope openScope(String name) {
		Scope scope = new Scope(name);
		open.push(scope);
		return scope;
	}

	public Scope closeScope() {
		if (open.isEmpty()) {
			throw new InternalCompilerError("no scope to close");
		}
		Scope scope = open.pop();
		if (!open.isEmpty()) {
			scope.attachTo(open.peek());
		}
		if (closed.put(scope.getName(), scope) != null) {
			logger.fine("Scope " + scope.getName() + " shadows an earlier scope of the same name");
		}
		logger.fine("Closed scope " + scope.getName() + " with " + scope.getSymbols().size() + " symbols");
		return scope;
	}

	public Scope current() {
		if (open.isEmpty()) {
			throw new InternalCompilerError("no open scope");
		}
		return open.peek();
	}

	/**
	 * @return a view resolving names through the open scopes, innermost first
	 */
	public Map<String, ScopeEntry> lookup() {
		Iterator<Scope> outward = open.descendingIterator();
		Map<String, ScopeEntry> view = Collections.emptyMap();
		while (outward.hasNext()) {
			view = new ChainMap<>(outward.next().getSymbolTable(), view);
		}
		return view;
	}

	public Scope getScope(String name) {
		return closed.get(name);
	}

	public Map<String, Scope> getScopes() {
		return Collections.unmodifiableMap(closed);
	}

	public void format(IndentingWriter out) throws IOException {
		boolean first = true;
		for (Scope scope : closed.values()) {
			if (!first) {
				out.newLine();
			}
			first = false;
			out.write("scope " + scope.getName());
			if (scope.getParent() != null) {
				out.write(" (in " + scope.getParent().getName() + ")");
			}
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (Map.Entry<String, ScopeEntry> symbol : scope.getSymbols().entrySet()) {
					out.newLine();
					out.write(symbol.getKey() + " = " + symbol.getValue());
				}
			}
		}
	}
}
