package lpp.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

public class ReservedWordsTest {

	static Path testFile = Paths.get("TEST");

	private static List<Set<String>> vocabularies() {
		return Arrays.asList(ReservedWords.KEYWORDS, ReservedWords.PARAMS, ReservedWords.FUNCTIONS,
				ReservedWords.PRIMITIVES, ReservedWords.LOOPING);
	}

	private static TokenType classify(String word) {
		TokenStream stream = new Tokenizer(new RecordingErrorCollector()).tokenize(testFile, word);
		assertThat(stream.body().size(), is(1));
		return stream.type(stream.firstIndex());
	}

	@Test
	public void testKeywordsAndParamsAreDisjoint() {
		Set<String> shared = new HashSet<>(ReservedWords.KEYWORDS);
		shared.retainAll(ReservedWords.PARAMS);
		assertThat(shared.isEmpty(), is(true));
		for (String keyword : ReservedWords.KEYWORDS) {
			assertFalse(keyword, ReservedWords.isParam(keyword));
		}
	}

	@Test
	public void testReservedWordsAreNeverIdentifiers() {
		for (Set<String> vocabulary : vocabularies()) {
			for (String word : vocabulary) {
				assertThat(word, classify(word), not(TokenType.IDENTIFIER));
			}
		}
	}

	@Test
	public void testIdentifiersAreUnreserved() {
		List<String> words = new ArrayList<>(Arrays.asList("Water", "Tube", "Sample", "level", "beaker", "Kinase"));
		for (String word : words) {
			assertThat(word, classify(word), is(TokenType.IDENTIFIER));
			for (Set<String> vocabulary : vocabularies()) {
				assertFalse(word, vocabulary.contains(word));
			}
			assertFalse(word, ReservedWords.isUnit(word));
		}
	}

	@Test
	public void testUnits() {
		assertTrue(ReservedWords.isUnit("mL"));
		assertTrue(ReservedWords.isUnit("rpm"));
		assertTrue(ReservedWords.isUnit("kmol"));
		assertFalse(ReservedWords.isUnit("cd2"));
		assertThat(classify("uL"), is(TokenType.UNIT));
	}
}
