package org.javai.vero.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.vero.ast.ActionCall;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.Condition;
import org.javai.vero.ast.Expression;
import org.javai.vero.ast.Feature;
import org.javai.vero.ast.Field;
import org.javai.vero.ast.Fixture;
import org.javai.vero.ast.Hook;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.PageActions;
import org.javai.vero.ast.Program;
import org.javai.vero.ast.Scenario;
import org.javai.vero.ast.Selector;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.Target;
import org.javai.vero.ast.VarType;
import org.javai.vero.ast.Variable;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;

/**
 * Recursive-descent parser for Vero.
 * <p>
 * Each syntax error is recorded once and aborts the enclosing top-level declaration;
 * the parser then resumes at the next {@code page}, {@code pageactions}, {@code fixture}
 * or {@code feature} so sibling declarations are still parsed and reported.
 * <p>
 * Example usage:
 *
 * <pre>
 * TokenizeResult tokens = VeroTokenizer.tokenize(source);
 * ParseResult result = new VeroParser(tokens.tokens()).parse();
 * </pre>
 */
public class VeroParser {

	private static final Set<TokenType> VAR_TYPES = EnumSet.of(TokenType.TEXT, TokenType.NUMBER, TokenType.FLAG,
			TokenType.LIST);

	private static final BigDecimal MILLIS_PER_SECOND = BigDecimal.valueOf(1000);

	private final List<VeroToken> tokens;
	private final List<ParseError> errors = new ArrayList<>();
	private int pos = 0;

	public VeroParser(List<VeroToken> tokens) {
		List<VeroToken> source = tokens != null ? tokens : List.of();
		if (source.isEmpty() || source.get(source.size() - 1).type() != TokenType.EOF) {
			List<VeroToken> terminated = new ArrayList<>(source);
			int line = source.isEmpty() ? 1 : source.get(source.size() - 1).line();
			terminated.add(new VeroToken(TokenType.EOF, "", line, 1));
			source = terminated;
		}
		this.tokens = source;
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return the program built from every cleanly parsed declaration, plus all syntax errors
	 */
	public ParseResult parse() {
		List<Page> pages = new ArrayList<>();
		List<PageActions> pageActions = new ArrayList<>();
		List<Feature> features = new ArrayList<>();
		List<Fixture> fixtures = new ArrayList<>();

		while (!isAtEnd()) {
			int start = pos;
			try {
				if (check(TokenType.PAGE)) {
					pages.add(parsePage());
				} else if (check(TokenType.PAGEACTIONS)) {
					pageActions.add(parsePageActions());
				} else if (check(TokenType.FIXTURE)) {
					fixtures.add(parseFixture());
				} else if (isFeatureStart()) {
					features.add(parseFeature());
				} else {
					throw error("Expected 'page', 'pageactions', 'fixture' or 'feature'");
				}
			} catch (ParseFailure e) {
				synchronize(start);
			}
		}

		return new ParseResult(new Program(pages, pageActions, features, fixtures), errors);
	}

	// ==================== Declarations ====================

	private Page parsePage() {
		int line = consume(TokenType.PAGE, "Expected 'page'").line();
		String name = consume(TokenType.IDENTIFIER, "Expected page name").value();
		consume(TokenType.LBRACE, "Expected '{' after page name");

		List<Field> fields = new ArrayList<>();
		List<Variable> variables = new ArrayList<>();
		List<ActionDefinition> actions = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			if (check(TokenType.FIELD)) {
				fields.add(parseField());
			} else if (VAR_TYPES.contains(peek().type())) {
				variables.add(parsePageVariable());
			} else if (check(TokenType.IDENTIFIER)) {
				actions.add(parseActionDefinition());
			} else {
				throw error("Expected field, variable or action in page '" + name + "'");
			}
		}
		consume(TokenType.RBRACE, "Expected '}' to close page '" + name + "'");

		return new Page(name, fields, variables, actions, line);
	}

	private Field parseField() {
		int line = consume(TokenType.FIELD, "Expected 'field'").line();
		String name = name("Expected field name").value();
		consume(TokenType.EQUALS, "Expected '=' after field name");
		return new Field(name, parseSelector(), line);
	}

	private Selector parseSelector() {
		Selector.SelectorType type = Selector.SelectorType.AUTO;
		if (check(TokenType.IDENTIFIER)) {
			VeroToken kind = peek();
			type = Selector.SelectorType.fromKeyword(kind.value())
					.orElseThrow(() -> error("Unknown selector kind (expected css, xpath or testid)"));
			advance();
		}
		String value = consume(TokenType.STRING, "Expected selector string").value();
		return new Selector(type, value);
	}

	private Variable parsePageVariable() {
		VeroToken typeToken = advance();
		String name = name("Expected variable name").value();
		consume(TokenType.EQUALS, "Expected '=' after variable name");
		Expression value = parseExpression();
		return new Variable(toVarType(typeToken), name, value, typeToken.line());
	}

	private ActionDefinition parseActionDefinition() {
		VeroToken nameToken = consume(TokenType.IDENTIFIER, "Expected action name");

		List<String> parameters = new ArrayList<>();
		if (match(TokenType.WITH)) {
			parameters.add(name("Expected parameter name").value());
			while (match(TokenType.COMMA)) {
				parameters.add(name("Expected parameter name").value());
			}
		}

		VarType returnType = null;
		if (match(TokenType.RETURNS)) {
			if (!VAR_TYPES.contains(peek().type())) {
				throw error("Expected return type (text, number, flag or list)");
			}
			returnType = toVarType(advance());
		}

		List<Statement> statements = parseBlock("action '" + nameToken.value() + "'");
		return new ActionDefinition(nameToken.value(), parameters, returnType, statements, nameToken.line());
	}

	private PageActions parsePageActions() {
		int line = consume(TokenType.PAGEACTIONS, "Expected 'pageactions'").line();
		String name = consume(TokenType.IDENTIFIER, "Expected page actions name").value();
		consume(TokenType.FOR, "Expected 'for' after page actions name");
		String forPage = consume(TokenType.IDENTIFIER, "Expected page name after 'for'").value();
		consume(TokenType.LBRACE, "Expected '{' after page name");

		List<ActionDefinition> actions = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			if (!check(TokenType.IDENTIFIER)) {
				throw error("Expected action definition in page actions '" + name + "'");
			}
			actions.add(parseActionDefinition());
		}
		consume(TokenType.RBRACE, "Expected '}' to close page actions '" + name + "'");

		return new PageActions(name, forPage, actions, line);
	}

	private Fixture parseFixture() {
		int line = consume(TokenType.FIXTURE, "Expected 'fixture'").line();
		String name = consume(TokenType.IDENTIFIER, "Expected fixture name").value();
		consume(TokenType.LBRACE, "Expected '{' after fixture name");

		List<Statement> setup = new ArrayList<>();
		List<Statement> teardown = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			if (peek().isWord("setup")) {
				advance();
				setup.addAll(parseBlock("setup"));
			} else if (peek().isWord("teardown")) {
				advance();
				teardown.addAll(parseBlock("teardown"));
			} else {
				throw error("Expected 'setup' or 'teardown' in fixture '" + name + "'");
			}
		}
		consume(TokenType.RBRACE, "Expected '}' to close fixture '" + name + "'");

		return new Fixture(name, setup, teardown, line);
	}

	private Feature parseFeature() {
		int line = peek().line();
		List<Feature.Annotation> annotations = new ArrayList<>();
		while (check(TokenType.IDENTIFIER)) {
			annotations.add(Feature.Annotation.fromKeyword(peek().value())
					.orElseThrow(() -> error("Unknown feature annotation")));
			advance();
		}
		consume(TokenType.FEATURE, "Expected 'feature'");
		String name = consume(TokenType.IDENTIFIER, "Expected feature name").value();
		consume(TokenType.LBRACE, "Expected '{' after feature name");

		List<Feature.Use> uses = new ArrayList<>();
		List<Hook> hooks = new ArrayList<>();
		List<Scenario> scenarios = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			if (check(TokenType.USE)) {
				advance();
				do {
					VeroToken used = consume(TokenType.IDENTIFIER, "Expected page name after 'use'");
					uses.add(new Feature.Use(used.value(), used.line()));
				} while (match(TokenType.COMMA));
			} else if (check(TokenType.BEFORE) || check(TokenType.AFTER)) {
				hooks.add(parseHook());
			} else if (isScenarioStart()) {
				scenarios.add(parseScenario());
			} else {
				throw error("Expected 'use', hook or scenario in feature '" + name + "'");
			}
		}
		consume(TokenType.RBRACE, "Expected '}' to close feature '" + name + "'");

		return new Feature(name, annotations, uses, hooks, scenarios, line);
	}

	private Hook parseHook() {
		VeroToken timing = advance();
		boolean before = timing.type() == TokenType.BEFORE;
		Hook.HookType type;
		if (match(TokenType.EACH)) {
			type = before ? Hook.HookType.BEFORE_EACH : Hook.HookType.AFTER_EACH;
		} else if (match(TokenType.ALL)) {
			type = before ? Hook.HookType.BEFORE_ALL : Hook.HookType.AFTER_ALL;
		} else {
			throw error("Expected 'each' or 'all' after '" + timing.value() + "'");
		}
		List<Statement> statements = parseBlock(type.keywords() + " hook");
		return new Hook(type, statements, timing.line());
	}

	private Scenario parseScenario() {
		int line = peek().line();
		List<Scenario.Annotation> annotations = new ArrayList<>();
		while (check(TokenType.IDENTIFIER)) {
			annotations.add(Scenario.Annotation.fromKeyword(peek().value())
					.orElseThrow(() -> error("Unknown scenario annotation")));
			advance();
		}
		consume(TokenType.SCENARIO, "Expected 'scenario'");
		String name = consume(TokenType.STRING, "Expected scenario name string").value();

		Set<String> tags = new LinkedHashSet<>();
		while (check(TokenType.TAG) || check(TokenType.AT)) {
			if (check(TokenType.AT)) {
				throw error("Expected tag name after '@'");
			}
			tags.add(advance().value());
		}

		List<Statement> statements = parseBlock("scenario \"" + name + "\"");
		return new Scenario(name, annotations, tags, statements, line);
	}

	// ==================== Statements ====================

	private List<Statement> parseBlock(String owner) {
		consume(TokenType.LBRACE, "Expected '{' to open " + owner);
		List<Statement> statements = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd()) {
			statements.add(parseStatement());
		}
		consume(TokenType.RBRACE, "Expected '}' to close " + owner);
		return statements;
	}

	private Statement parseStatement() {
		VeroToken token = peek();
		int line = token.line();

		switch (token.type()) {
			case CLICK -> {
				advance();
				return new Statement.Click(parseTarget(), Statement.ClickKind.SINGLE, line);
			}
			case FILL -> {
				advance();
				Target target = parseTarget();
				consume(TokenType.WITH, "Expected 'with' after fill target");
				return new Statement.Fill(target, parseExpression(), line);
			}
			case OPEN -> {
				advance();
				Expression url = parseExpression();
				if (match(TokenType.IN)) {
					consumeWord("new", "Expected 'new' after 'in'");
					consumeWord("tab", "Expected 'tab' after 'in new'");
					return new Statement.OpenInNewTab(url, line);
				}
				return new Statement.Open(url, line);
			}
			case CHECK -> {
				advance();
				return new Statement.Check(parseTarget(), line);
			}
			case UNCHECK -> {
				advance();
				return new Statement.Uncheck(parseTarget(), line);
			}
			case SELECT -> {
				advance();
				Expression option = parseExpression();
				consume(TokenType.FROM, "Expected 'from' after select option");
				return new Statement.Select(option, parseTarget(), line);
			}
			case HOVER -> {
				advance();
				return new Statement.Hover(parseTarget(), line);
			}
			case CLEAR -> {
				advance();
				return new Statement.Clear(parseTarget(), line);
			}
			case PRESS -> {
				advance();
				return new Statement.Press(consume(TokenType.STRING, "Expected key name string").value(), line);
			}
			case SCROLL -> {
				advance();
				return parseScroll(line);
			}
			case WAIT -> {
				advance();
				return parseWait(line);
			}
			case DO, PERFORM -> {
				advance();
				return new Statement.Perform(parseActionCall(), line);
			}
			case REFRESH -> {
				advance();
				return new Statement.Refresh(line);
			}
			case TAKE -> {
				advance();
				consume(TokenType.SCREENSHOT, "Expected 'screenshot' after 'take'");
				String filename = check(TokenType.STRING) ? advance().value() : null;
				return new Statement.TakeScreenshot(filename, line);
			}
			case LOG -> {
				advance();
				return new Statement.Log(parseExpression(), line);
			}
			case IF -> {
				return parseIf();
			}
			case REPEAT -> {
				advance();
				Expression count = parseExpression();
				consume(TokenType.TIMES, "Expected 'times' after repeat count");
				return new Statement.Repeat(count, parseBlock("repeat"), line);
			}
			case VERIFY -> {
				advance();
				return parseVerify(line);
			}
			case RETURN -> {
				advance();
				return parseReturn(line);
			}
			case SWITCH -> {
				advance();
				return parseSwitch(line);
			}
			case FOR -> {
				advance();
				consume(TokenType.EACH, "Expected 'each' after 'for'");
				String item = name("Expected loop variable name").value();
				consume(TokenType.IN, "Expected 'in' after loop variable");
				Expression collection = parseExpression();
				return new Statement.ForEach(item, collection, parseBlock("for each"), line);
			}
			case CLOSE -> {
				advance();
				consumeWord("tab", "Expected 'tab' after 'close'");
				return new Statement.CloseTab(line);
			}
			case TEXT, NUMBER, FLAG, LIST -> {
				return parseVariableDeclaration();
			}
			case IDENTIFIER -> {
				if ((token.isWord("right") || token.isWord("double")) && peekNext().type() == TokenType.CLICK) {
					advance();
					advance();
					Statement.ClickKind kind = token.isWord("right") ? Statement.ClickKind.RIGHT
							: Statement.ClickKind.DOUBLE;
					return new Statement.Click(parseTarget(), kind, line);
				}
				if ((token.isWord("accept") || token.isWord("dismiss")) && peekNext().isWord("dialog")) {
					advance();
					advance();
					if (token.isWord("dismiss")) {
						return new Statement.DismissDialog(line);
					}
					Expression response = match(TokenType.WITH) ? parseExpression() : null;
					return new Statement.AcceptDialog(response, line);
				}
				if (token.isWord("upload")) {
					advance();
					List<Expression> files = new ArrayList<>();
					files.add(parseExpression());
					while (match(TokenType.COMMA)) {
						files.add(parseExpression());
					}
					consume(TokenType.TO, "Expected 'to' after upload files");
					return new Statement.Upload(files, parseTarget(), line);
				}
				throw error("Unexpected statement");
			}
			default -> throw error("Unexpected statement");
		}
	}

	private Statement parseScroll(int line) {
		if (peek().isWord("up")) {
			advance();
			return new Statement.Scroll(Statement.ScrollDirection.UP, null, line);
		}
		if (peek().isWord("down")) {
			advance();
			return new Statement.Scroll(Statement.ScrollDirection.DOWN, null, line);
		}
		if (match(TokenType.TO)) {
			return new Statement.Scroll(null, parseTarget(), line);
		}
		throw error("Expected 'up', 'down' or 'to' after 'scroll'");
	}

	private Statement parseWait(int line) {
		if (match(TokenType.FOR)) {
			return new Statement.WaitFor(parseTarget(), line);
		}
		if (check(TokenType.NUMBER_LITERAL)) {
			BigDecimal amount = new BigDecimal(advance().value());
			if (peek().isWord("milliseconds")) {
				advance();
				return new Statement.Wait(amount.longValue(), line);
			}
			if (peek().isWord("seconds")) {
				advance();
			}
			return new Statement.Wait(amount.multiply(MILLIS_PER_SECOND).longValue(), line);
		}
		return new Statement.Wait(null, line);
	}

	private Statement parseIf() {
		int line = consume(TokenType.IF, "Expected 'if'").line();
		Target subject = parseTarget();
		Condition condition = parseCondition();
		List<Statement> thenStatements = parseBlock("if");
		List<Statement> elseStatements = List.of();
		if (match(TokenType.ELSE)) {
			elseStatements = check(TokenType.IF) ? List.of(parseIf()) : parseBlock("else");
		}
		return new Statement.If(subject, condition, thenStatements, elseStatements, line);
	}

	private Statement parseVerify(int line) {
		VeroToken token = peek();
		if ((token.isWord("url") || token.isWord("title")) && isMatchOperator(peekNext())) {
			advance();
			Statement.MatchOperator operator = advance().type() == TokenType.CONTAINS
					? Statement.MatchOperator.CONTAINS
					: Statement.MatchOperator.EQUALS;
			Expression value = parseExpression();
			return token.isWord("url")
					? new Statement.VerifyUrl(operator, value, line)
					: new Statement.VerifyTitle(operator, value, line);
		}
		Target subject = parseTarget();
		if (peek().isWord("has")) {
			advance();
			return parseVerifyHas(subject, line);
		}
		return new Statement.Verify(subject, parseCondition(), line);
	}

	private Statement parseVerifyHas(Target subject, int line) {
		Statement.HasKind kind = null;
		for (Statement.HasKind candidate : Statement.HasKind.values()) {
			if (peek().isWord(candidate.keyword())) {
				kind = candidate;
			}
		}
		if (kind == null) {
			throw error("Expected 'count', 'value', 'attribute' or 'class' after 'has'");
		}
		advance();
		Expression attribute = kind == Statement.HasKind.ATTRIBUTE ? parseExpression() : null;
		return new Statement.VerifyHas(subject, kind, attribute, parseExpression(), line);
	}

	private boolean isMatchOperator(VeroToken token) {
		return token.type() == TokenType.CONTAINS || token.type() == TokenType.IS || token.isWord("equals");
	}

	private Condition parseCondition() {
		if (match(TokenType.IS)) {
			boolean negated = match(TokenType.NOT);
			if (match(TokenType.CONTAINS)) {
				return new Condition.ContainsCondition(negated, parseExpression());
			}
			if (check(TokenType.IDENTIFIER) && peekNext().type() != TokenType.DOT) {
				Optional<Condition.ElementState> state = Condition.ElementState.fromKeyword(peek().value());
				if (state.isPresent()) {
					advance();
					return new Condition.StateCondition(negated, state.get());
				}
			}
			return new Condition.EqualsCondition(negated, parseExpression());
		}
		if (match(TokenType.NOT)) {
			consume(TokenType.CONTAINS, "Expected 'contains' after 'not'");
			return new Condition.ContainsCondition(true, parseExpression());
		}
		if (match(TokenType.CONTAINS)) {
			return new Condition.ContainsCondition(false, parseExpression());
		}
		throw error("Expected 'is' or 'contains'");
	}

	private Statement parseReturn(int line) {
		VeroToken token = peek();
		if (peekNext().isWord("of")) {
			Statement.ReturnKind kind = null;
			if (token.isWord("visible")) {
				kind = Statement.ReturnKind.VISIBLE;
			} else if (token.type() == TokenType.TEXT) {
				kind = Statement.ReturnKind.TEXT;
			} else if (token.isWord("value")) {
				kind = Statement.ReturnKind.VALUE;
			}
			if (kind != null) {
				advance();
				advance();
				return new Statement.Return(kind, parseTarget(), null, line);
			}
		}
		return new Statement.Return(Statement.ReturnKind.EXPRESSION, null, parseExpression(), line);
	}

	private Statement parseSwitch(int line) {
		consume(TokenType.TO, "Expected 'to' after 'switch'");
		if (peek().isWord("frame")) {
			advance();
			return new Statement.SwitchToFrame(parseSelector(), line);
		}
		if (peek().isWord("main")) {
			advance();
			consumeWord("frame", "Expected 'frame' after 'switch to main'");
			return new Statement.SwitchToMainFrame(line);
		}
		if (peek().isWord("new")) {
			advance();
			VeroToken tab = consumeWord("tab", "Expected 'tab' after 'switch to new'");
			Expression url = null;
			if (peek().line() == tab.line() && startsInlineExpression()) {
				url = parseExpression();
			}
			return new Statement.SwitchToNewTab(url, line);
		}
		consumeWord("tab", "Expected 'tab', 'new tab', 'frame' or 'main frame' after 'switch to'");
		return new Statement.SwitchToTab(parseExpression(), line);
	}

	private boolean startsInlineExpression() {
		VeroToken token = peek();
		return switch (token.type()) {
			case STRING, NUMBER_LITERAL, LBRACKET -> true;
			case IDENTIFIER -> peekNext().type() != TokenType.CLICK;
			case TEXT, NUMBER, FLAG, LIST -> true;
			default -> false;
		};
	}

	private Statement parseVariableDeclaration() {
		VeroToken typeToken = advance();
		String name = name("Expected variable name").value();
		consume(TokenType.EQUALS, "Expected '=' after variable name");
		VarType type = toVarType(typeToken);
		if (match(TokenType.DO) || match(TokenType.PERFORM)) {
			return new Statement.VariableDeclaration(type, name, null, parseActionCall(), typeToken.line());
		}
		return new Statement.VariableDeclaration(type, name, parseExpression(), null, typeToken.line());
	}

	private ActionCall parseActionCall() {
		String first = consume(TokenType.IDENTIFIER, "Expected action name").value();
		String page = null;
		String action = first;
		if (match(TokenType.DOT)) {
			page = first;
			action = consume(TokenType.IDENTIFIER, "Expected action name after '.'").value();
		}

		List<Expression> arguments = new ArrayList<>();
		if (match(TokenType.WITH)) {
			arguments.add(parseExpression());
			while (match(TokenType.COMMA) || match(TokenType.AND)) {
				arguments.add(parseExpression());
			}
		}
		return new ActionCall(page, action, arguments);
	}

	private Target parseTarget() {
		if (check(TokenType.STRING)) {
			return new Target.TextTarget(advance().value());
		}
		if (isName(peek())) {
			String first = advance().value();
			if (match(TokenType.DOT)) {
				String field = name("Expected field name after '.'").value();
				return new Target.PageFieldTarget(first, field);
			}
			return new Target.FieldTarget(first);
		}
		throw error("Expected target (Page.field, field or \"text\")");
	}

	private Expression parseExpression() {
		VeroToken token = peek();
		switch (token.type()) {
			case STRING -> {
				advance();
				return new Expression.StringLiteral(token.value());
			}
			case NUMBER_LITERAL -> {
				advance();
				return new Expression.NumberLiteral(new BigDecimal(token.value()));
			}
			case TRUE -> {
				advance();
				return new Expression.BooleanLiteral(true);
			}
			case FALSE -> {
				advance();
				return new Expression.BooleanLiteral(false);
			}
			case NULL -> {
				advance();
				return new Expression.NullLiteral();
			}
			case LBRACKET -> {
				advance();
				List<Expression> elements = new ArrayList<>();
				if (!check(TokenType.RBRACKET)) {
					elements.add(parseExpression());
					while (match(TokenType.COMMA)) {
						elements.add(parseExpression());
					}
				}
				consume(TokenType.RBRACKET, "Expected ']' to close list");
				return new Expression.ListLiteral(elements);
			}
			case IDENTIFIER, TEXT, NUMBER, FLAG, LIST -> {
				advance();
				if (match(TokenType.DOT)) {
					String name = name("Expected variable name after '.'").value();
					return new Expression.VariableReference(token.value(), name);
				}
				return Expression.VariableReference.local(token.value());
			}
			default -> throw error("Expected expression");
		}
	}

	// ==================== Helpers ====================

	private boolean isFeatureStart() {
		int i = pos;
		while (tokens.get(i).type() == TokenType.IDENTIFIER
				&& Feature.Annotation.fromKeyword(tokens.get(i).value()).isPresent()) {
			i++;
		}
		return tokens.get(i).type() == TokenType.FEATURE;
	}

	private boolean isScenarioStart() {
		int i = pos;
		while (tokens.get(i).type() == TokenType.IDENTIFIER
				&& Scenario.Annotation.fromKeyword(tokens.get(i).value()).isPresent()) {
			i++;
		}
		return tokens.get(i).type() == TokenType.SCENARIO;
	}

	private boolean isTopLevelStart() {
		return check(TokenType.PAGE) || check(TokenType.PAGEACTIONS) || check(TokenType.FIXTURE) || isFeatureStart();
	}

	/**
	 * Skips to the next top-level declaration. Always makes progress when the failed
	 * declaration did not consume anything.
	 */
	private void synchronize(int declarationStart) {
		if (pos == declarationStart) {
			advance();
		}
		while (!isAtEnd() && !isTopLevelStart()) {
			advance();
		}
	}

	private static VarType toVarType(VeroToken token) {
		return switch (token.type()) {
			case TEXT -> VarType.TEXT;
			case NUMBER -> VarType.NUMBER;
			case FLAG -> VarType.FLAG;
			case LIST -> VarType.LIST;
			default -> throw new IllegalArgumentException("Not a variable type: " + token);
		};
	}

	private VeroToken consume(TokenType type, String message) {
		if (check(type)) {
			return advance();
		}
		throw error(message);
	}

	/**
	 * Names may be spelled like the variable type keywords: {@code field text = "#t"} declares a field named text.
	 */
	private VeroToken name(String message) {
		if (isName(peek())) {
			return advance();
		}
		throw error(message);
	}

	private static boolean isName(VeroToken token) {
		return token.type() == TokenType.IDENTIFIER || VAR_TYPES.contains(token.type());
	}

	private VeroToken consumeWord(String word, String message) {
		if (peek().isWord(word)) {
			return advance();
		}
		throw error(message);
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}

	private VeroToken peek() {
		return tokens.get(pos);
	}

	private VeroToken peekNext() {
		return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
	}

	private VeroToken advance() {
		VeroToken token = tokens.get(pos);
		if (!isAtEnd()) {
			pos++;
		}
		return token;
	}

	private ParseFailure error(String message) {
		VeroToken token = peek();
		String found = token.type() == TokenType.EOF ? "end of input" : "'" + token.value() + "'";
		errors.add(new ParseError(message + " but found " + found, token.line(), token.column()));
		return new ParseFailure();
	}

	/**
	 * Unwinds the current top-level declaration after an error has been recorded.
	 */
	private static final class ParseFailure extends RuntimeException {

		ParseFailure() {
			super(null, null, false, false);
		}
	}
}
