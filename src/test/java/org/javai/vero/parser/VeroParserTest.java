package org.javai.vero.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.List;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.Condition;
import org.javai.vero.ast.Expression;
import org.javai.vero.ast.Feature;
import org.javai.vero.ast.Hook;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.Program;
import org.javai.vero.ast.Scenario;
import org.javai.vero.ast.Selector;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.Target;
import org.javai.vero.ast.VarType;
import org.javai.vero.testsupport.VeroSources;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VeroParserTest {

	private static List<Statement> scenarioStatements(String body) {
		Program program = VeroSources.program("feature F {\n  scenario \"s\" {\n" + body + "\n  }\n}\n");
		return program.features().get(0).scenarios().get(0).statements();
	}

	private static Statement single(String statement) {
		List<Statement> statements = scenarioStatements(statement);
		assertThat(statements).hasSize(1);
		return statements.get(0);
	}

	private static List<ParseError> errorsOf(String source) {
		return VeroSources.parse(source).errors();
	}

	@Nested
	class Declarations {

		@Test
		void parsesSampleProgramCleanly() {
			ParseResult result = VeroSources.parse(VeroSources.load("dashboard.vero"));

			assertThat(result.errors()).isEmpty();
			Program program = result.program();
			assertThat(program.pages()).extracting(Page::name).containsExactly("LoginPage", "DashboardPage");
			assertThat(program.pageActions()).hasSize(1);
			assertThat(program.pageActions().get(0).forPage()).isEqualTo("DashboardPage");
			assertThat(program.fixtures()).hasSize(1);
			assertThat(program.features()).hasSize(1);
		}

		@Test
		void parsesPageFieldsVariablesAndActions() {
			Program program = VeroSources.program(VeroSources.load("dashboard.vero"));
			Page login = program.findPage("LoginPage").orElseThrow();

			assertThat(login.fields()).hasSize(4);
			assertThat(login.findField("email").orElseThrow().selector()).isEqualTo(Selector.auto("#email"));
			assertThat(login.findField("password").orElseThrow().selector().type())
					.isEqualTo(Selector.SelectorType.CSS);
			assertThat(login.findField("submit").orElseThrow().selector())
					.isEqualTo(new Selector(Selector.SelectorType.TESTID, "login-submit"));
			assertThat(login.variables()).hasSize(1);
			assertThat(login.variables().get(0).type()).isEqualTo(VarType.TEXT);

			ActionDefinition loginAction = login.findAction("login").orElseThrow();
			assertThat(loginAction.parameters()).containsExactly("user", "pass");
			assertThat(loginAction.returnType()).isNull();
			assertThat(loginAction.statements()).hasSize(3);
			assertThat(login.findAction("bannerText").orElseThrow().returnType()).isEqualTo(VarType.TEXT);
		}

		@Test
		void parsesFeatureUsesHooksAnnotationsAndTags() {
			Feature feature = VeroSources.program(VeroSources.load("dashboard.vero")).features().get(0);

			assertThat(feature.hasAnnotation(Feature.Annotation.SERIAL)).isTrue();
			assertThat(feature.uses()).extracting(Feature.Use::name).containsExactly("LoggedIn", "DashboardPage");
			assertThat(feature.hooks()).extracting(Hook::type)
					.containsExactly(Hook.HookType.BEFORE_EACH, Hook.HookType.AFTER_ALL);

			Scenario tabs = feature.scenarios().get(0);
			assertThat(tabs.name()).isEqualTo("Help opens in a new tab");
			assertThat(tabs.tags()).containsExactly("smoke", "tabs");
			assertThat(feature.scenarios().get(1).hasAnnotation(Scenario.Annotation.SLOW)).isTrue();
		}

		@ParameterizedTest
		@ValueSource(strings = {"page", "PAGE", "Page"})
		void keywordCaseDoesNotMatter(String keyword) {
			String field = keyword.equals("PAGE") ? "FIELD" : keyword.equals("Page") ? "Field" : "field";
			ParseResult result = VeroSources.parse(keyword + " Home {\n  " + field + " x = \"#x\"\n}\n");

			assertThat(result.errors()).isEmpty();
			assertThat(result.program().pages()).extracting(Page::name).containsExactly("Home");
		}

		@Test
		void parsesFixture() {
			Program program = VeroSources.program(VeroSources.load("dashboard.vero"));

			assertThat(program.fixtures().get(0).name()).isEqualTo("LoggedIn");
			assertThat(program.fixtures().get(0).setup()).hasSize(2);
			assertThat(program.fixtures().get(0).teardown()).hasSize(1);
		}
	}

	@Nested
	class Statements {

		@Test
		void clickVariants() {
			List<Statement> statements = scenarioStatements("click Home.a\nright click Home.a\ndouble click \"Go\"");

			assertThat(statements).extracting(s -> ((Statement.Click) s).kind()).containsExactly(
					Statement.ClickKind.SINGLE, Statement.ClickKind.RIGHT, Statement.ClickKind.DOUBLE);
			assertThat(((Statement.Click) statements.get(2)).target()).isEqualTo(new Target.TextTarget("Go"));
		}

		@Test
		void fillWithExpression() {
			Statement.Fill fill = (Statement.Fill) single("fill Login.email with \"a@b.c\"");

			assertThat(fill.target()).isEqualTo(new Target.PageFieldTarget("Login", "email"));
			assertThat(fill.value()).isEqualTo(new Expression.StringLiteral("a@b.c"));
		}

		@Test
		void waitVariants() {
			List<Statement> statements = scenarioStatements(
					"wait 2 seconds\nwait 500 milliseconds\nwait 1.5\nwait\nwait for Home.spinner");

			assertThat(((Statement.Wait) statements.get(0)).millis()).isEqualTo(2000L);
			assertThat(((Statement.Wait) statements.get(1)).millis()).isEqualTo(500L);
			assertThat(((Statement.Wait) statements.get(2)).millis()).isEqualTo(1500L);
			assertThat(((Statement.Wait) statements.get(3)).millis()).isNull();
			assertThat(statements.get(4)).isInstanceOf(Statement.WaitFor.class);
		}

		@Test
		void tabStatements() {
			List<Statement> statements = scenarioStatements("switch to new tab\n"
					+ "switch to new tab \"https://example.com\"\n"
					+ "switch to tab 2\n"
					+ "open \"https://example.com/help\" in new tab\n"
					+ "close tab");

			assertThat(((Statement.SwitchToNewTab) statements.get(0)).url()).isNull();
			assertThat(((Statement.SwitchToNewTab) statements.get(1)).url())
					.isEqualTo(new Expression.StringLiteral("https://example.com"));
			assertThat(((Statement.SwitchToTab) statements.get(2)).index())
					.isEqualTo(new Expression.NumberLiteral(new BigDecimal("2")));
			assertThat(statements.get(3)).isInstanceOf(Statement.OpenInNewTab.class);
			assertThat(statements.get(4)).isInstanceOf(Statement.CloseTab.class);
			assertThat(statements).allMatch(Statement::changesTab);
		}

		@Test
		void ifElseIfChain() {
			Statement.If statement = (Statement.If) single(
					"if Home.banner is visible {\n click Home.a\n} else if Home.banner contains \"x\" {\n"
							+ " refresh\n} else {\n log \"none\"\n}");

			assertThat(statement.condition())
					.isEqualTo(new Condition.StateCondition(false, Condition.ElementState.VISIBLE));
			Statement.If elseIf = (Statement.If) statement.elseStatements().get(0);
			assertThat(elseIf.condition()).isInstanceOf(Condition.ContainsCondition.class);
			assertThat(elseIf.elseStatements()).singleElement().isInstanceOf(Statement.Log.class);
		}

		@Test
		void verifyConditions() {
			List<Statement> statements = scenarioStatements("verify Home.a is not visible\n"
					+ "verify Home.a is \"Hello\"\n"
					+ "verify Home.a not contains \"x\"\n"
					+ "verify url contains \"/home\"\n"
					+ "verify title equals \"Home\"");

			assertThat(((Statement.Verify) statements.get(0)).condition())
					.isEqualTo(new Condition.StateCondition(true, Condition.ElementState.VISIBLE));
			assertThat(((Statement.Verify) statements.get(1)).condition())
					.isEqualTo(new Condition.EqualsCondition(false, new Expression.StringLiteral("Hello")));
			assertThat(((Statement.Verify) statements.get(2)).condition().negated()).isTrue();
			assertThat(((Statement.VerifyUrl) statements.get(3)).operator())
					.isEqualTo(Statement.MatchOperator.CONTAINS);
			assertThat(((Statement.VerifyTitle) statements.get(4)).operator())
					.isEqualTo(Statement.MatchOperator.EQUALS);
		}

		@Test
		void variableDeclarationFromActionCall() {
			Statement.VariableDeclaration declaration = (Statement.VariableDeclaration) single(
					"text total = perform Cart.total with 1, \"EUR\"");

			assertThat(declaration.value()).isNull();
			assertThat(declaration.call().qualifiedName()).isEqualTo("Cart.total");
			assertThat(declaration.call().arguments()).hasSize(2);
		}

		@Test
		void actionArgumentsMaySeparateWithAnd() {
			Statement.Perform perform = (Statement.Perform) single("do Login.login with \"a\" and \"b\"");

			assertThat(perform.call().arguments()).hasSize(2);
		}

		@Test
		void returnForms() {
			Program program = VeroSources.program("page P {\n  field a = \"#a\"\n"
					+ "  one returns flag {\n    return visible of a\n  }\n"
					+ "  two returns text {\n    return value of a\n  }\n"
					+ "  three returns list {\n    return [1, 2]\n  }\n}\n");
			List<ActionDefinition> actions = program.pages().get(0).actions();

			assertThat(((Statement.Return) actions.get(0).statements().get(0)).kind())
					.isEqualTo(Statement.ReturnKind.VISIBLE);
			assertThat(((Statement.Return) actions.get(1).statements().get(0)).kind())
					.isEqualTo(Statement.ReturnKind.VALUE);
			Statement.Return list = (Statement.Return) actions.get(2).statements().get(0);
			assertThat(list.kind()).isEqualTo(Statement.ReturnKind.EXPRESSION);
			assertThat(list.expression()).isInstanceOf(Expression.ListLiteral.class);
		}

		@Test
		void frameStatements() {
			List<Statement> statements = scenarioStatements("switch to frame \"#payment\"\n"
					+ "switch to frame css \"iframe.ad\"\nswitch to main frame");

			assertThat(((Statement.SwitchToFrame) statements.get(0)).selector())
					.isEqualTo(new Selector(Selector.SelectorType.AUTO, "#payment"));
			assertThat(((Statement.SwitchToFrame) statements.get(1)).selector().type())
					.isEqualTo(Selector.SelectorType.CSS);
			assertThat(statements.get(2)).isInstanceOf(Statement.SwitchToMainFrame.class);
			assertThat(statements).allMatch(Statement::changesFrame).noneMatch(Statement::changesTab);
		}

		@Test
		void dialogStatements() {
			List<Statement> statements = scenarioStatements("accept dialog\naccept dialog with \"yes\"\ndismiss dialog");

			assertThat(((Statement.AcceptDialog) statements.get(0)).response()).isNull();
			assertThat(((Statement.AcceptDialog) statements.get(1)).response())
					.isEqualTo(new Expression.StringLiteral("yes"));
			assertThat(statements.get(2)).isInstanceOf(Statement.DismissDialog.class);
		}

		@Test
		void verifyHasForms() {
			List<Statement> statements = scenarioStatements("verify Home.rows has count 3\n"
					+ "verify Home.name has value expected\n"
					+ "verify Home.link has attribute \"href\" \"/home\"\n"
					+ "verify Home.tab has class \"active\"");

			assertThat(statements).extracting(s -> ((Statement.VerifyHas) s).kind()).containsExactly(
					Statement.HasKind.COUNT, Statement.HasKind.VALUE, Statement.HasKind.ATTRIBUTE,
					Statement.HasKind.CLASS);
			Statement.VerifyHas attribute = (Statement.VerifyHas) statements.get(2);
			assertThat(attribute.attribute()).isEqualTo(new Expression.StringLiteral("href"));
			assertThat(attribute.value()).isEqualTo(new Expression.StringLiteral("/home"));
			assertThat(((Statement.VerifyHas) statements.get(1)).value())
					.isEqualTo(new Expression.VariableReference(null, "expected"));
			assertThat(((Statement.VerifyHas) statements.get(0)).attribute()).isNull();
		}

		@Test
		void uploadOneOrManyFiles() {
			List<Statement> statements = scenarioStatements("upload \"a.pdf\" to Form.file\n"
					+ "upload \"a.pdf\", \"b.pdf\" to Form.file");

			assertThat(((Statement.Upload) statements.get(0)).files()).hasSize(1);
			Statement.Upload many = (Statement.Upload) statements.get(1);
			assertThat(many.files()).hasSize(2);
			assertThat(many.target()).isEqualTo(new Target.PageFieldTarget("Form", "file"));
		}

		@Test
		void forEachBlock() {
			Statement.ForEach loop = (Statement.ForEach) single("for each term in [\"a\", \"b\"] {\n log term\n}");

			assertThat(loop.item()).isEqualTo("term");
			assertThat(loop.collection()).isInstanceOf(Expression.ListLiteral.class);
			assertThat(loop.statements()).singleElement().isInstanceOf(Statement.Log.class);
			assertThat(loop.blocks()).containsExactly(loop.statements());
		}

		@Test
		void typeKeywordsDoubleAsNames() {
			Program program = VeroSources.program("page P {\n  field text = \"#t\"\n  list number = [1]\n"
					+ "  go with flag, list {\n    click text\n    log flag\n  }\n}\n"
					+ "feature F {\n  scenario \"s\" {\n    text list = P.number\n    click P.text\n"
					+ "    log list\n    fill P.text with text\n  }\n}\n");
			Page page = program.pages().get(0);
			List<Statement> statements = program.features().get(0).scenarios().get(0).statements();

			assertThat(page.fields()).extracting(f -> f.name()).containsExactly("text");
			assertThat(page.variables()).extracting(v -> v.name()).containsExactly("number");
			assertThat(page.actions().get(0).parameters()).containsExactly("flag", "list");
			assertThat(((Statement.Click) page.actions().get(0).statements().get(0)).target())
					.isEqualTo(new Target.FieldTarget("text"));
			assertThat(((Statement.VariableDeclaration) statements.get(0)).value())
					.isEqualTo(new Expression.VariableReference("P", "number"));
			assertThat(((Statement.Click) statements.get(1)).target())
					.isEqualTo(new Target.PageFieldTarget("P", "text"));
			assertThat(((Statement.Log) statements.get(2)).message())
					.isEqualTo(new Expression.VariableReference(null, "list"));
			assertThat(((Statement.Fill) statements.get(3)).value())
					.isEqualTo(new Expression.VariableReference(null, "text"));
		}

		@Test
		void repeatBlock() {
			Statement.Repeat repeat = (Statement.Repeat) single("repeat 3 times {\n scroll down\n press \"Tab\"\n}");

			assertThat(repeat.statements()).hasSize(2);
		}
	}

	@Nested
	class Errors {

		@Test
		void missingClosingBraceFails() {
			List<ParseError> errors = errorsOf("page Home {\n  field x = \"#x\"\n");

			assertThat(errors).singleElement()
					.extracting(ParseError::message)
					.isEqualTo("Expected '}' to close page 'Home' but found end of input");
		}

		@Test
		void removingAnyClosingBraceFails() {
			String source = VeroSources.load("dashboard.vero");
			assertThat(errorsOf(source)).isEmpty();

			int removed = 0;
			for (int i = source.indexOf('}'); i >= 0; i = source.indexOf('}', i + 1)) {
				String broken = source.substring(0, i) + source.substring(i + 1);
				assertThat(errorsOf(broken)).as("without the '}' at offset %d", i).isNotEmpty();
				removed++;
			}
			assertThat(removed).isGreaterThan(10);
		}

		@Test
		void missingWithAfterFill() {
			List<ParseError> errors = errorsOf("feature F {\n scenario \"s\" {\n fill Home.a \"x\"\n }\n}");

			assertThat(errors).singleElement().satisfies(e -> {
				assertThat(e.message()).startsWith("Expected 'with' after fill target");
				assertThat(e.line()).isEqualTo(3);
			});
		}

		@Test
		void missingFromAfterSelectOption() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n select \"a\" Home.list\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'from'");
		}

		@Test
		void missingTimesAfterRepeatCount() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n repeat 3 {\n }\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'times'");
		}

		@Test
		void unknownSwitchTarget() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n switch to window 2\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'tab', 'new tab', 'frame' or 'main frame' after 'switch to'");
		}

		@Test
		void unknownElementProperty() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n verify Home.a has width 3\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'count', 'value', 'attribute' or 'class' after 'has'");
		}

		@Test
		void uploadNeedsATarget() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n upload \"a.pdf\" Home.file\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'to' after upload files");
		}

		@Test
		void forEachNeedsIn() {
			assertThat(errorsOf("feature F {\n scenario \"s\" {\n for each x of items {\n }\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'in' after loop variable");
		}

		@Test
		void hookNeedsEachOrAll() {
			assertThat(errorsOf("feature F {\n before {\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'each' or 'all' after 'before'");
		}

		@Test
		void bareAtSignIsASyntaxError() {
			assertThat(errorsOf("feature F {\n scenario \"s\" @ {\n }\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.isEqualTo("Expected tag name after '@' but found '@'");
		}

		@Test
		void unknownSelectorKind() {
			assertThat(errorsOf("page P {\n field a = id \"x\"\n}"))
					.singleElement().extracting(ParseError::message).asString()
					.startsWith("Unknown selector kind");
		}

		@Test
		void recoversAtNextDeclaration() {
			ParseResult result = VeroSources.parse("page Broken {\n field = \"#x\"\n}\n"
					+ "page Good {\n field y = \"#y\"\n}\n"
					+ "feature F {\n scenario \"s\" {\n click Good.y\n }\n}\n");

			assertThat(result.errors()).hasSize(1);
			assertThat(result.program().pages()).extracting(Page::name).containsExactly("Good");
			assertThat(result.program().features()).hasSize(1);
		}

		@Test
		void reportsOneErrorPerBrokenDeclaration() {
			ParseResult result = VeroSources.parse("page A {\n field = \"#x\"\n}\n"
					+ "page B {\n 42\n}\n");

			assertThat(result.errors()).hasSize(2);
			assertThat(result.errors()).extracting(ParseError::line).containsExactly(2, 5);
		}

		@Test
		void strayTopLevelTokens() {
			ParseResult result = VeroSources.parse("click Home.a\npage Home {\n}\n");

			assertThat(result.errors()).singleElement().extracting(ParseError::message).asString()
					.startsWith("Expected 'page', 'pageactions', 'fixture' or 'feature'");
			assertThat(result.program().pages()).hasSize(1);
		}
	}
}
