package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class ParamNode extends Node {

	private final Param param;

	public ParamNode(SourceLocation location, Param param) {
		super(location);
		this.param = param;
	}

	public Param getParam() {
		return param;
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
		return param.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return param == ((ParamNode) obj).param;
	}
}
