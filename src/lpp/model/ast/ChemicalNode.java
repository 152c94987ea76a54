package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chemical named in a reaction or reagent, with the formula and CAS registry number it resolved to.
 */
public class ChemicalNode extends Node {

	private final String name;
	private final String formula;
	private final String registryId;

	public ChemicalNode(SourceLocation location, String name, String formula, String registryId) {
		super(location);
		this.name = name;
		this.formula = formula;
		this.registryId = registryId;
	}

	public String getName() {
		return name;
	}

	public String getFormula() {
		return formula;
	}

	public String getRegistryId() {
		return registryId;
	}

	@Override
	public List<Node> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, formula, registryId);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ChemicalNode other = (ChemicalNode) obj;
		return name.equals(other.name) && Objects.equals(formula, other.formula) &&
				Objects.equals(registryId, other.registryId);
	}
}
