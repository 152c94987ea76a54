package lpp.lexer;

import lpp.util.SourceLocation;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Hand-written scanner for L++ source text.
 *
 * The scanner never stops at a lexical problem: it reports it to its {@link ErrorCollector} and carries on, so
 * that one run surfaces every problem in a file. Lines are 1-based; columns are 0-based and a tab advances the
 * column to the next multiple of {@value #TAB_WIDTH}.
 *
 * Words are classified in priority order: keyword, unit, param, function, primitive, looping, {@code return},
 * import name, {@code if}, {@code else}, identifier. The import name is whichever word first reaches that
 * step after the keyword {@code import} was scanned.
 */
public class Tokenizer {

	private static final Logger logger = Logger.getLogger(Tokenizer.class.getName());

	public static final int TAB_WIDTH = 8;

	private static final String ESCAPES = "abfnrtv\\?'\"";

	private final ErrorCollector collector;

	private boolean reportWhitespace = false;
	private boolean reportNewlines = false;
	private boolean requireSpaceAfterNumber = true;
	private boolean allowMultilineStrings = false;

	// state of the scan in progress
	private Path file;
	private String text;
	private int pos;
	private int line;
	private int column;
	private int tokenStartPos;
	private int tokenStartLine;
	private int tokenStartColumn;
	private boolean expectingImportName;
	private List<Token> tokens;

	public Tokenizer(ErrorCollector collector) {
		this.collector = collector;
	}

	public boolean reportWhitespace() {
		return reportWhitespace;
	}

	/**
	 * Turning whitespace reporting off also turns newline reporting off.
	 */
	public void setReportWhitespace(boolean report) {
		reportWhitespace = report;
		if (!report) {
			reportNewlines = false;
		}
	}

	public boolean reportNewlines() {
		return reportNewlines;
	}

	/**
	 * Turning newline reporting on also turns whitespace reporting on.
	 */
	public void setReportNewlines(boolean report) {
		reportNewlines = report;
		if (report) {
			reportWhitespace = true;
		}
	}

	public void setRequireSpaceAfterNumber(boolean require) {
		requireSpaceAfterNumber = require;
	}

	public void setAllowMultilineStrings(boolean allow) {
		allowMultilineStrings = allow;
	}

	public TokenStream tokenize(Path file) throws IOException {
		return tokenize(file, FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8));
	}

	public TokenStream tokenize(Path file, String text) {
		this.file = file;
		this.text = text;
		this.pos = 0;
		this.line = 1;
		this.column = 0;
		this.expectingImportName = false;
		this.tokens = new ArrayList<>();

		while (!atEnd()) {
			char c = current();
			if (isWhitespace(c)) {
				consumeWhitespace();
			} else if (c == '/' && peek(1) == '/') {
				consumeLineComment();
			} else if (c == '/' && peek(1) == '*') {
				consumeBlockComment();
			} else if (c < ' ') {
				addError(String.format("Invalid control character 0x%02x encountered in text.", (int) c));
				nextChar();
			} else if (isLetter(c)) {
				startToken();
				nextChar();
				while (!atEnd() && isAlphanumeric(current())) {
					nextChar();
				}
				emit(classifyWord(text.substring(tokenStartPos, pos)));
			} else if (c == '.') {
				startToken();
				nextChar();
				if (isDigit(current())) {
					Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
					if (previous != null && previous.is(TokenType.IDENTIFIER) &&
							previous.getLine() == tokenStartLine && previous.getEndColumn() == tokenStartColumn) {
						collector.addError(tokenStartLine, tokenStartColumn,
								"Need space between identifier and decimal point.");
					}
					emit(consumeNumber(true));
				} else {
					emit(TokenType.SYMBOL_DOT);
				}
			} else if (isDigit(c)) {
				startToken();
				emit(consumeNumber(false));
			} else if (c == '"' || c == '\'') {
				startToken();
				consumeString(c);
				emit(TokenType.STRING);
			} else {
				startToken();
				nextChar();
				emit(TokenType.fromSymbol(String.valueOf(c)));
			}
		}

		logger.fine("Scanned " + tokens.size() + " tokens from " + file);
		return new TokenStream(file, tokens);
	}

	private TokenType classifyWord(String word) {
		if (ReservedWords.isKeyword(word)) {
			if (word.equals("import")) {
				expectingImportName = true;
			}
			return TokenType.KEYWORD;
		}
		if (ReservedWords.isUnit(word)) {
			return TokenType.UNIT;
		}
		if (ReservedWords.isParam(word)) {
			return TokenType.PARAM;
		}
		if (ReservedWords.isFunction(word)) {
			return TokenType.FUNCTION;
		}
		if (ReservedWords.isPrimitive(word)) {
			return TokenType.PRIMITIVE;
		}
		if (ReservedWords.isLooping(word)) {
			return TokenType.LOOPING;
		}
		if (word.equals("return")) {
			return TokenType.RETURN;
		}
		if (expectingImportName) {
			expectingImportName = false;
			return TokenType.IMPORT;
		}
		if (word.equals("if")) {
			return TokenType.IF;
		}
		if (word.equals("else")) {
			return TokenType.ELSE;
		}
		return TokenType.IDENTIFIER;
	}

	private void consumeWhitespace() {
		startToken();
		if (reportNewlines) {
			if (current() == '\n') {
				nextChar();
				emit(TokenType.NEWLINE);
				return;
			}
			while (!atEnd() && isWhitespace(current()) && current() != '\n') {
				nextChar();
			}
			emit(TokenType.WHITESPACE);
			return;
		}
		while (!atEnd() && isWhitespace(current())) {
			nextChar();
		}
		if (reportWhitespace) {
			emit(TokenType.WHITESPACE);
		}
	}

	private void consumeLineComment() {
		while (!atEnd() && current() != '\n') {
			nextChar();
		}
	}

	private void consumeBlockComment() {
		int startLine = line;
		int startColumn = column;
		nextChar();
		nextChar();
		while (true) {
			if (atEnd()) {
				addError("End-of-file inside block comment.");
				collector.addError(startLine, startColumn, "  Comment started here.");
				return;
			}
			char c = current();
			if (c == '*' && peek(1) == '/') {
				nextChar();
				nextChar();
				return;
			}
			if (c == '/' && peek(1) == '*') {
				// leave the '*' so that "/*/" still closes the comment
				addError("\"/*\" inside block comment.  Block comments cannot be nested.");
			}
			nextChar();
		}
	}

	private TokenType consumeNumber(boolean startedWithDot) {
		boolean isFloat = false;
		if (startedWithDot) {
			isFloat = true;
			consumeDigits();
		} else {
			consumeDigits();
			if (current() == '.') {
				nextChar();
				isFloat = true;
				consumeDigits();
			}
		}

		if (current() == 'e' || current() == 'E') {
			nextChar();
			isFloat = true;
			if (current() == '-' || current() == '+') {
				nextChar();
			}
			if (isDigit(current())) {
				consumeDigits();
			} else {
				addError("\"e\" must be followed by exponent.");
			}
		}

		if (isLetter(current()) && requireSpaceAfterNumber) {
			addError("Need space between number and identifier.");
		} else if (current() == '.' && isFloat) {
			addError("Already saw decimal point or exponent; can't have another one.");
		}
		return isFloat ? TokenType.FLOAT : TokenType.INTEGER;
	}

	private void consumeString(char delimiter) {
		nextChar();
		while (true) {
			if (atEnd()) {
				addError("Unexpected end of string.");
				return;
			}
			char c = current();
			if (c == '\n') {
				if (!allowMultilineStrings) {
					addError("String literals cannot cross line boundaries.");
					return;
				}
				nextChar();
			} else if (c == '\\') {
				nextChar();
				if (!atEnd() && ESCAPES.indexOf(current()) != -1) {
					nextChar();
				} else {
					addError("Invalid escape sequence in string literal.");
				}
			} else {
				nextChar();
				if (c == delimiter) {
					return;
				}
			}
		}
	}

	private void consumeDigits() {
		while (isDigit(current())) {
			nextChar();
		}
	}

	private boolean atEnd() {
		return pos >= text.length();
	}

	private char current() {
		return peek(0);
	}

	private char peek(int ahead) {
		int index = pos + ahead;
		return index < text.length() ? text.charAt(index) : '\0';
	}

	private void nextChar() {
		if (atEnd()) {
			return;
		}
		char c = text.charAt(pos);
		if (c == '\n') {
			++line;
			column = 0;
		} else if (c == '\t') {
			column += TAB_WIDTH - column % TAB_WIDTH;
		} else {
			++column;
		}
		++pos;
	}

	private void startToken() {
		tokenStartPos = pos;
		tokenStartLine = line;
		tokenStartColumn = column;
	}

	private void emit(TokenType type) {
		SourceLocation location = new SourceLocation(file, tokenStartPos, pos, tokenStartLine, tokenStartColumn, column);
		Token token = new Token(text.substring(tokenStartPos, pos), type, location);
		tokens.add(token);
		logger.finest("Recorded token " + token);
	}

	private void addError(String message) {
		collector.addError(line, column, message);
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u000B' || c == '\f';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isAlphanumeric(char c) {
		return isLetter(c) || isDigit(c);
	}

	/**
	 * @return whether text is a letter or underscore followed by letters, digits and underscores
	 */
	public static boolean isIdentifier(String text) {
		if (text == null || text.isEmpty() || !isLetter(text.charAt(0))) {
			return false;
		}
		for (int i = 1; i < text.length(); i++) {
			if (!isAlphanumeric(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Parses the text of an integer token. Accepts decimal, hexadecimal ({@code 0x} prefix) and octal (leading
	 * {@code 0}) forms.
	 *
	 * @return the value, or an empty result if text is malformed or its value exceeds max
	 */
	public static OptionalLong parseInteger(String text, long max) {
		int base = 10;
		int start = 0;
		if (text.length() > 2 && text.charAt(0) == '0' && (text.charAt(1) == 'x' || text.charAt(1) == 'X')) {
			base = 16;
			start = 2;
		} else if (text.length() > 1 && text.charAt(0) == '0') {
			base = 8;
			start = 1;
		}
		if (text.isEmpty()) {
			return OptionalLong.empty();
		}
		long result = 0;
		for (int i = start; i < text.length(); i++) {
			int digit = Character.digit(text.charAt(i), base);
			if (digit < 0) {
				return OptionalLong.empty();
			}
			if (digit > max || result > (max - digit) / base) {
				return OptionalLong.empty();
			}
			result = result * base + digit;
		}
		return OptionalLong.of(result);
	}

	/**
	 * @return whether the token at index is a chemical, or an integer coefficient directly followed by one
	 */
	public static boolean isChemical(TokenStream stream, int index) {
		TokenType type = stream.type(index);
		return type == TokenType.CHEMICAL ||
				(type == TokenType.INTEGER && stream.type(index + 1) == TokenType.CHEMICAL);
	}
}
