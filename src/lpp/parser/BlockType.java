package lpp.parser;

import lpp.model.ast.Keyword;

/**
 * The kind of declaration block the parser is inside. Parameters without a name are only accepted in
 * {@link #CONTAINER} and {@link #REAGENT} blocks.
 */
public enum BlockType {
	GLOBAL,
	CONTAINER,
	PROTEIN,
	COMPLEX,
	PROTOCOL,
	REAGENT,
	REACTION,
	MEMBRANE,
	PATHWAY,
	PLASM,
	DOM;

	public static BlockType of(Keyword keyword) {
		switch (keyword) {
			case CONTAINER:
				return CONTAINER;
			case PROTEIN:
				return PROTEIN;
			case COMPLEX:
				return COMPLEX;
			case PROTOCOL:
				return PROTOCOL;
			case REAGENT:
				return REAGENT;
			case REACTION:
				return REACTION;
			case MEMBRANE:
				return MEMBRANE;
			case PATHWAY:
				return PATHWAY;
			case PLASM:
				return PLASM;
			case DOMAIN:
				return DOM;
			default:
				return GLOBAL;
		}
	}
}
