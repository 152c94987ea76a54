package lpp.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class TokenizerTest {

	static Path testFile = Paths.get("TEST");

	private static String tok(String text, TokenType type) {
		return type + " " + text;
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "reaction", Arrays.asList(tok("reaction", TokenType.KEYWORD)) },
			{ "krev", Arrays.asList(tok("krev", TokenType.PARAM)) },
			{ "mix", Arrays.asList(tok("mix", TokenType.FUNCTION)) },
			{ "int", Arrays.asList(tok("int", TokenType.PRIMITIVE)) },
			{ "while", Arrays.asList(tok("while", TokenType.LOOPING)) },
			{ "return", Arrays.asList(tok("return", TokenType.RETURN)) },
			{ "if else", Arrays.asList(tok("if", TokenType.IF), tok("else", TokenType.ELSE)) },
			{ "Glucose", Arrays.asList(tok("Glucose", TokenType.IDENTIFIER)) },
			{ "5 mL", Arrays.asList(tok("5", TokenType.INTEGER), tok("mL", TokenType.UNIT)) },
			{ "30 min", Arrays.asList(tok("30", TokenType.INTEGER), tok("min", TokenType.UNIT)) },
			{ "1.5e3", Arrays.asList(tok("1.5e3", TokenType.FLOAT)) },
			{ "2E-4", Arrays.asList(tok("2E-4", TokenType.FLOAT)) },
			{ ".5", Arrays.asList(tok(".5", TokenType.FLOAT)) },
			{ "\"buffer\"", Arrays.asList(tok("\"buffer\"", TokenType.STRING)) },
			{ "'tube'", Arrays.asList(tok("'tube'", TokenType.STRING)) },
			{ "import Centrifuge;", Arrays.asList(
					tok("import", TokenType.KEYWORD),
					tok("Centrifuge", TokenType.IMPORT),
					tok(";", TokenType.SYMBOL_SEMICOLON)
					)
			},
			// the word after import is an import name even when it reads like an identifier
			{ "import Water", Arrays.asList(tok("import", TokenType.KEYWORD), tok("Water", TokenType.IMPORT)) },
			{ "Water --> Ice", Arrays.asList(
					tok("Water", TokenType.IDENTIFIER),
					tok("-", TokenType.SYMBOL_SUBTRACT),
					tok("-", TokenType.SYMBOL_SUBTRACT),
					tok(">", TokenType.SYMBOL_GT),
					tok("Ice", TokenType.IDENTIFIER)
					)
			},
			{ "Water --| Ice", Arrays.asList(
					tok("Water", TokenType.IDENTIFIER),
					tok("-", TokenType.SYMBOL_SUBTRACT),
					tok("-", TokenType.SYMBOL_SUBTRACT),
					tok("|", TokenType.SYMBOL_OR),
					tok("Ice", TokenType.IDENTIFIER)
					)
			},
			{ "level[0:10]", Arrays.asList(
					tok("level", TokenType.IDENTIFIER),
					tok("[", TokenType.SYMBOL_BRACKET_OPEN),
					tok("0", TokenType.INTEGER),
					tok(":", TokenType.SYMBOL_COLON),
					tok("10", TokenType.INTEGER),
					tok("]", TokenType.SYMBOL_BRACKET_CLOSED)
					)
			},
			{ "// a note\nGlucose /* skipped\n text */ Water", Arrays.asList(
					tok("Glucose", TokenType.IDENTIFIER),
					tok("Water", TokenType.IDENTIFIER)
					)
			},
			{ "@", Arrays.asList(tok("@", TokenType.SYMBOL_UNKNOWN)) },
			{ "", Arrays.asList() },
		});
	}

	private final String input;
	private final List<String> expected;

	public TokenizerTest(String input, List<String> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		RecordingErrorCollector errors = new RecordingErrorCollector();
		TokenStream stream = new Tokenizer(errors).tokenize(testFile, input);
		List<String> actual = new ArrayList<>();
		for (Token token : stream.body()) {
			actual.add(tok(token.getText(), token.getType()));
		}
		assertThat(errors.getErrors(), is(Collections.<String>emptyList()));
		assertThat(actual, is(expected));
		assertThat(stream.type(0), is(TokenType.START));
		assertThat(stream.type(stream.endIndex()), is(TokenType.END));
	}
}
