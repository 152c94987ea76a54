package lpp.model.ast;

import lpp.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * An import of a built-in lab equipment module.
 */
public class ImportNode extends Node {

	public enum Kind {
		CENTRIFUGE("Centrifuge"),
		ELECTROPHORESIS("Electrophoresis");

		private final String text;

		Kind(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		public static Kind fromText(String text) {
			for (Kind kind : values()) {
				if (kind.text.equals(text)) {
					return kind;
				}
			}
			return null;
		}
	}

	private final Kind kind;

	public ImportNode(SourceLocation location, Kind kind) {
		super(location);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
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
		return kind.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return kind == ((ImportNode) obj).kind;
	}
}
