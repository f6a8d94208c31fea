package org.javai.vero.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for Vero source text.
 * <p>
 * Keywords are recognized case-insensitively, identifiers keep their spelling.
 * Unknown characters and unterminated strings are reported as {@link LexError}s
 * and scanning resumes after the offending span, so the parser always receives
 * a complete, EOF-terminated token stream.
 */
public class VeroTokenizer {

	private final String input;
	private final List<VeroToken> tokens = new ArrayList<>();
	private final List<LexError> errors = new ArrayList<>();
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public VeroTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Convenience for {@code new VeroTokenizer(source).tokenize()}.
	 */
	public static TokenizeResult tokenize(String source) {
		return new VeroTokenizer(source).tokenize();
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return tokens (terminated by EOF) and lexical errors
	 */
	public TokenizeResult tokenize() {
		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			scanToken();
		}

		tokens.add(new VeroToken(TokenType.EOF, "", line, column));
		return new TokenizeResult(tokens, errors);
	}

	private void scanToken() {
		int startLine = line;
		int startColumn = column;
		char c = peek();

		TokenType punctuation = switch (c) {
			case '{' -> TokenType.LBRACE;
			case '}' -> TokenType.RBRACE;
			case '(' -> TokenType.LPAREN;
			case ')' -> TokenType.RPAREN;
			case '[' -> TokenType.LBRACKET;
			case ']' -> TokenType.RBRACKET;
			case '=' -> TokenType.EQUALS;
			case '.' -> TokenType.DOT;
			case ',' -> TokenType.COMMA;
			default -> null;
		};
		if (punctuation != null) {
			advance();
			add(punctuation, String.valueOf(c), startLine, startColumn);
			return;
		}

		if (c == '"' || c == '\'') {
			scanString(c);
		} else if (c == '@') {
			scanTag();
		} else if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
			scanNumber();
		} else if (isIdentifierStart(c)) {
			scanIdentifier();
		} else {
			advance();
			errors.add(new LexError("Unexpected character: '" + c + "'", startLine, startColumn));
		}
	}

	private void scanString(char quote) {
		int startLine = line;
		int startColumn = column;
		advance(); // opening quote

		StringBuilder sb = new StringBuilder();
		boolean terminated = false;
		while (!isAtEnd()) {
			char c = peek();
			if (c == quote) {
				advance();
				terminated = true;
				break;
			}
			if (c == '\n') {
				break;
			}
			advance();
			if (c == '\\' && !isAtEnd() && peek() != '\n') {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (!terminated) {
			errors.add(new LexError("Unterminated string", startLine, startColumn));
		}
		add(TokenType.STRING, sb.toString(), startLine, startColumn);
	}

	private void scanTag() {
		int startLine = line;
		int startColumn = column;
		advance(); // '@'

		if (isAtEnd() || !isIdentifierStart(peek())) {
			add(TokenType.AT, "@", startLine, startColumn);
			return;
		}
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		add(TokenType.TAG, input.substring(start, pos), startLine, startColumn);
	}

	private void scanNumber() {
		int startLine = line;
		int startColumn = column;
		int start = pos;

		if (peek() == '-') {
			advance();
		}
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
			advance(); // '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		add(TokenType.NUMBER_LITERAL, input.substring(start, pos), startLine, startColumn);
	}

	private void scanIdentifier() {
		int startLine = line;
		int startColumn = column;
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		TokenType type = TokenType.fromWord(value).orElse(TokenType.IDENTIFIER);
		add(type, value, startLine, startColumn);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
				advance();
			} else if (c == '#') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private void add(TokenType type, String value, int tokenLine, int tokenColumn) {
		tokens.add(new VeroToken(type, value, tokenLine, tokenColumn));
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
