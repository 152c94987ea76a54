package lpp.trans.passes.chem;

import lpp.chem.ChemicalResolution;
import lpp.chem.ChemicalResolver;
import lpp.lexer.ChemicalToken;
import lpp.lexer.Token;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.lexer.Tokenizer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns names used inside reaction and reagent parameter lists into chemicals and resolves them to their
 * formula and registry number. Names that were declared somewhere (after a keyword, primitive type or
 * {@code return}) stay identifiers.
 */
public class ChemicalResolutionPass {

	private static final Logger logger = Logger.getLogger(ChemicalResolutionPass.class.getName());

	private ChemicalResolutionPass() {}

	public static void perform(TokenStream stream, ChemicalResolver resolver) {
		Set<String> identifiers = findIdentifiers(stream);
		logger.fine("Declared identifiers: " + identifiers);
		findChemicals(stream, identifiers);
		resolveChemicals(stream, resolver);
	}

	/**
	 * @return the text of every identifier appearing in a declaration head, i.e. after a keyword, primitive
	 * type or {@code return} and before the next {@code , ; ( ) { }}
	 */
	public static Set<String> findIdentifiers(TokenStream stream) {
		Set<String> identifiers = new HashSet<>();
		boolean inDeclaration = false;
		for (int i = stream.firstIndex(); i < stream.endIndex(); i++) {
			switch (stream.type(i)) {
				case KEYWORD:
				case PRIMITIVE:
				case RETURN:
					inDeclaration = true;
					break;
				case SYMBOL_COMMA:
				case SYMBOL_SEMICOLON:
				case SYMBOL_PAREN_OPEN:
				case SYMBOL_PAREN_CLOSED:
				case SYMBOL_CURLY_OPEN:
				case SYMBOL_CURLY_CLOSED:
					inDeclaration = false;
					break;
				case IDENTIFIER:
					if (inDeclaration) {
						identifiers.add(stream.get(i).getText());
					}
					break;
				default:
					break;
			}
		}
		return identifiers;
	}

	/**
	 * Reclassifies undeclared identifiers inside {@code reaction} and {@code reagent} parameter windows as
	 * chemicals, upper-casing their text.
	 */
	public static void findChemicals(TokenStream stream, Set<String> identifiers) {
		boolean inParams = false;
		for (int i = stream.firstIndex(); i < stream.endIndex(); i++) {
			Token token = stream.get(i);
			TokenType afterName = stream.type(i + 2);
			if ((token.getText().equals("reaction") || token.getText().equals("reagent")) &&
					(afterName == TokenType.SYMBOL_PAREN_OPEN || afterName == TokenType.SYMBOL_CURLY_OPEN)) {
				inParams = true;
			} else if (token.is(TokenType.SYMBOL_PAREN_CLOSED) || token.is(TokenType.SYMBOL_CURLY_CLOSED)) {
				inParams = false;
			}
			if (inParams && token.is(TokenType.IDENTIFIER) && !identifiers.contains(token.getText())) {
				stream.replace(i, new ChemicalToken(token.reclassify(TokenType.CHEMICAL,
						token.getText().toUpperCase(Locale.ROOT))));
			}
		}
	}

	/**
	 * Replaces every chemical token with one carrying its resolved formula and registry number.
	 *
	 * @throws UnresolvedChemicalIssue if the resolver does not support a chemical
	 */
	public static void resolveChemicals(TokenStream stream, ChemicalResolver resolver) {
		for (int i = stream.firstIndex(); i < stream.endIndex(); i++) {
			if (!Tokenizer.isChemical(stream, i) || !stream.get(i).is(TokenType.CHEMICAL)) {
				continue;
			}
			Token token = stream.get(i);
			ChemicalResolution resolution = resolver.resolve(token.getText());
			if (resolution.isMissing()) {
				throw new UnresolvedChemicalIssue(token);
			}
			String formula = resolution.getFormula().equals(ChemicalResolution.NULL)
					? token.getText() : resolution.getFormula();
			String registryId = resolution.getRegistryId().equals(ChemicalResolution.NULL)
					? ChemicalToken.MISSING : resolution.getRegistryId();
			stream.replace(i, new ChemicalToken(token, formula, registryId));
			logger.fine("Resolved chemical " + token.getText() + " to " + formula + " (" + registryId + ")");
		}
	}
}
