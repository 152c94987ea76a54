package lpp.scope;

import lpp.InternalCompilerError;
import lpp.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The symbol table of one declaration block. Names are unique within a scope; putting a name again replaces its
 * value. The parent link is set once, when the scope is closed.
 */
public class Scope {

	private final String name;
	private final Map<String, ScopeEntry> symbols = new LinkedHashMap<>();
	private final List<Scope> children = new ArrayList<>();
	private Scope parent;

	public Scope(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public void put(String symbol, TokenType type, double value) {
		symbols.put(symbol, ScopeEntry.ofNumber(type, value));
	}

	public void put(String symbol, TokenType type, String value) {
		symbols.put(symbol, ScopeEntry.ofText(type, value));
	}

	public boolean has(String symbol) {
		return symbols.containsKey(symbol);
	}

	public ScopeEntry get(String symbol) {
		return symbols.get(symbol);
	}

	Map<String, ScopeEntry> getSymbolTable() {
		return symbols;
	}

	public Map<String, ScopeEntry> getSymbols() {
		return Collections.unmodifiableMap(symbols);
	}

	public Scope getParent() {
		return parent;
	}

	public List<Scope> getChildren() {
		return Collections.unmodifiableList(children);
	}

	void attachTo(Scope newParent) {
		if (parent != null) {
			throw new InternalCompilerError("scope " + name + " already has parent " + parent.name);
		}
		parent = newParent;
		newParent.children.add(this);
	}

	@Override
	public String toString() {
		return "Scope [" + name + "]";
	}
}
