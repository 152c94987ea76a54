package lpp.chem;

/**
 * Looks up chemical names. Names are passed upper-cased, as they appear in reclassified tokens.
 */
public interface ChemicalResolver {

	ChemicalResolution resolve(String name);

}
