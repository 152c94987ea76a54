package lpp.lexer;

import lpp.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An indexable run of tokens bounded by a {@link TokenType#START} sentinel at index 0 and a
 * {@link TokenType#END} sentinel at the last index. The neighbours of a token are the tokens at index - 1 and
 * index + 1; reading past either end yields the nearest sentinel.
 */
public class TokenStream {

	private final Path file;
	private final List<Token> tokens;

	public TokenStream(Path file, List<Token> body) {
		this.file = file;
		this.tokens = new ArrayList<>(body.size() + 2);
		SourceLocation start = new SourceLocation(file, 0, 0, 1, 0, 0);
		this.tokens.add(Token.sentinel(TokenType.START, start));
		this.tokens.addAll(body);
		SourceLocation end = body.isEmpty() ? start : body.get(body.size() - 1).getLocation();
		this.tokens.add(Token.sentinel(TokenType.END, new SourceLocation(
				file, end.getEndOffset(), end.getEndOffset(), end.getLine(), end.getEndColumn(), end.getEndColumn())));
	}

	public Path getFile() {
		return file;
	}

	/**
	 * @return the total number of slots, sentinels included
	 */
	public int size() {
		return tokens.size();
	}

	public int firstIndex() {
		return 1;
	}

	public int endIndex() {
		return tokens.size() - 1;
	}

	public boolean isEmpty() {
		return tokens.size() == 2;
	}

	public Token get(int index) {
		if (index <= 0) {
			return tokens.get(0);
		}
		if (index >= tokens.size()) {
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(index);
	}

	public TokenType type(int index) {
		return get(index).getType();
	}

	/**
	 * Overwrites the slot at index, keeping the token's position in the stream.
	 */
	public void replace(int index, Token token) {
		if (index <= 0 || index >= endIndex()) {
			throw new IndexOutOfBoundsException("cannot replace sentinel slot " + index);
		}
		tokens.set(index, token);
	}

	/**
	 * @return the tokens from index (inclusive) up to the END sentinel (exclusive)
	 */
	public List<Token> from(int index) {
		int start = Integer.min(Integer.max(index, 1), endIndex());
		return Collections.unmodifiableList(tokens.subList(start, endIndex()));
	}

	/**
	 * @return the tokens between the sentinels
	 */
	public List<Token> body() {
		return from(firstIndex());
	}

	/**
	 * @return the next index after index whose token is not whitespace or a newline
	 */
	public int nextSignificant(int index) {
		int next = index + 1;
		while (next < endIndex() && isLayout(type(next))) {
			next++;
		}
		return Integer.min(next, endIndex());
	}

	/**
	 * @return a stream over the same file without whitespace and newline tokens
	 */
	public TokenStream withoutLayout() {
		List<Token> significant = new ArrayList<>();
		for (Token token : body()) {
			if (!isLayout(token.getType())) {
				significant.add(token);
			}
		}
		return new TokenStream(file, significant);
	}

	private static boolean isLayout(TokenType type) {
		return type == TokenType.WHITESPACE || type == TokenType.NEWLINE;
	}

	/**
	 * Builds a stream from runs of tokens taken from other streams, in order.
	 */
	public static TokenStream concat(Path file, List<List<Token>> runs) {
		List<Token> merged = new ArrayList<>();
		for (List<Token> run : runs) {
			merged.addAll(run);
		}
		return new TokenStream(file, merged);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			sb.append(token).append(System.lineSeparator());
		}
		return sb.toString();
	}
}
