package org.javai.vero.lexer;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Token kinds produced by {@link VeroTokenizer}.
 * <p>
 * Keyword constants carry their source spelling; keywords are matched
 * case-insensitively.
 */
public enum TokenType {

	// Structure
	PAGE("page"),
	FIELD("field"),
	FEATURE("feature"),
	SCENARIO("scenario"),
	USE("use"),
	PAGEACTIONS("pageactions"),
	FOR("for"),
	FIXTURE("fixture"),
	BEFORE("before"),
	AFTER("after"),
	EACH("each"),
	ALL("all"),

	// Variable types
	TEXT("text"),
	NUMBER("number"),
	FLAG("flag"),
	LIST("list"),

	// Statements
	CLICK("click"),
	FILL("fill"),
	WITH("with"),
	OPEN("open"),
	CHECK("check"),
	UNCHECK("uncheck"),
	SELECT("select"),
	FROM("from"),
	HOVER("hover"),
	PRESS("press"),
	SCROLL("scroll"),
	WAIT("wait"),
	REFRESH("refresh"),
	CLEAR("clear"),
	TAKE("take"),
	SCREENSHOT("screenshot"),
	LOG("log"),
	IF("if"),
	ELSE("else"),
	REPEAT("repeat"),
	TIMES("times"),
	VERIFY("verify"),
	IS("is"),
	NOT("not"),
	CONTAINS("contains"),
	DO("do"),
	PERFORM("perform"),
	RETURN("return"),
	RETURNS("returns"),
	SWITCH("switch"),
	CLOSE("close"),
	TO("to"),
	IN("in"),
	AND("and"),

	// Literals
	TRUE("true"),
	FALSE("false"),
	NULL("null"),
	STRING(null),
	NUMBER_LITERAL(null),
	IDENTIFIER(null),
	TAG(null),

	// Punctuation
	LBRACE(null),
	RBRACE(null),
	LPAREN(null),
	RPAREN(null),
	LBRACKET(null),
	RBRACKET(null),
	EQUALS(null),
	DOT(null),
	COMMA(null),
	AT(null),

	EOF(null);

	private static final Map<String, TokenType> KEYWORDS = Stream.of(values())
			.filter(TokenType::isKeyword)
			.collect(Collectors.toUnmodifiableMap(TokenType::keyword, Function.identity()));

	private final String keyword;

	TokenType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	public boolean isKeyword() {
		return keyword != null;
	}

	/**
	 * Looks up the keyword for a word, ignoring case.
	 */
	public static Optional<TokenType> fromWord(String word) {
		if (word == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
	}
}
