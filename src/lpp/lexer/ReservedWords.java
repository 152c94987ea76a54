package lpp.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The fixed vocabularies of L++. Words are classified in the order {@link Tokenizer} checks them, so a word in
 * more than one set is classified by the first set that matches.
 */
public final class ReservedWords {

	private ReservedWords() {}

	public static final Set<String> KEYWORDS = set(
			"import", "container", "protocol", "reagent", "protein", "reaction", "pathway", "membrane", "domain",
			"plasm");

	public static final Set<String> PARAMS = set(
			"ctr", "time", "spd", "vol", "temp", "form", "voltage", "config", "eq", "krev", "kcat", "KM", "k", "Ki",
			"n", "Ka");

	public static final Set<String> FUNCTIONS = set(
			"getReagent", "mix", "add", "clear", "close", "pellet", "supernatant", "remove");

	public static final Set<String> PRIMITIVES = set("int", "double", "float", "bool", "string");

	public static final Set<String> LOOPING = set("for", "while", "do");

	public static final String PREFIX_PATTERN = "(Y|Z|E|P|T|G|M|k|h|da|d|c|m|u|n|p|f|a|z|y)";
	public static final String UNIT_PATTERN = "(L|s|min|h|g|C|F|K|V|A|mol|M|m|cd|G|rpm)";

	/** An optional SI prefix followed by a supported unit. */
	public static final Pattern UNIT = Pattern.compile(PREFIX_PATTERN + "?" + UNIT_PATTERN);

	public static boolean isKeyword(String word) {
		return KEYWORDS.contains(word);
	}

	public static boolean isUnit(String word) {
		return UNIT.matcher(word).matches();
	}

	public static boolean isParam(String word) {
		return PARAMS.contains(word);
	}

	public static boolean isFunction(String word) {
		return FUNCTIONS.contains(word);
	}

	public static boolean isPrimitive(String word) {
		return PRIMITIVES.contains(word);
	}

	public static boolean isLooping(String word) {
		return LOOPING.contains(word);
	}

	private static Set<String> set(String... words) {
		return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(words)));
	}
}
