package lpp.model.context;

import lpp.model.ast.Param;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The kinetic classes a reaction can be assigned. Each class names the parameters a reaction of that class must
 * be given; the receptor binding and cross boundary classes are reserved and never inferred.
 */
public enum ReactionType {
	NOT_YET_DETERMINED(""),
	STANDARD_UNREGULATED("SU", Param.K, Param.KREV),
	STANDARD_ALLOSTERIC_INHIBITION("SAI", Param.KI, Param.N),
	STANDARD_ALLOSTERIC_ACTIVATION("SAA", Param.KA, Param.N),
	ENZYMATIC_STANDARD_UNREGULATED("ESU", Param.K, Param.KREV),
	MICHAELIS_MENTEN_UNREGULATED("MMU", Param.KCAT, Param.KM),
	RECEPTOR_BINDING("RB"),
	CROSS_BOUNDARY_STANDARD_UNREGULATED("CBSU"),
	CROSS_BOUNDARY_ENZYMATIC_STANDARD_UNREGULATED("CBESU"),
	CROSS_BOUNDARY_MICHAELIS_MENTEN_UNREGULATED("CBMMU");

	private final String acronym;
	private final List<Param> requiredParams;

	ReactionType(String acronym, Param... requiredParams) {
		this.acronym = acronym;
		this.requiredParams = Collections.unmodifiableList(Arrays.asList(requiredParams));
	}

	public String getAcronym() {
		return acronym;
	}

	public List<Param> getRequiredParams() {
		return requiredParams;
	}
}
