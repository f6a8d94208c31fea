package org.javai.vero.transpile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.commons.lang3.StringUtils;
import org.javai.vero.ast.Program;
import org.javai.vero.testsupport.VeroSources;
import org.javai.vero.validate.SemanticValidator;
import org.javai.vero.validate.ValidationResult;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TranspilerTest {

	private final Transpiler transpiler = new Transpiler();

	private static TranspileResult transpile(Transpiler transpiler, String source) {
		Program program = VeroSources.program(source);
		SemanticValidator validator = new SemanticValidator();
		ValidationResult validation = validator.validate(program);
		assertThat(validation.errors()).as("validation errors").isEmpty();
		return transpiler.transpile(program, validator.getSymbolTable());
	}

	private String testFile(String source, String feature) {
		return transpile(transpiler, source).tests().get(feature);
	}

	@Nested
	class NewTabEndToEnd {

		private final String code = testFile(VeroSources.load("home-tabs.vero"), "T");

		@Test
		void racesPopupDetectionAgainstPageEvent() {
			assertThat(code).contains("Promise.race");
			assertThat(code).contains("waitForEvent('page'");
			assertThat(code).contains("const newTabTimeoutMs = 5000");
		}

		@Test
		void activatesAndRebindsTheNewPage() {
			assertThat(code).contains("bringToFront()");
			assertThat(code).contains("waitForLoadState('domcontentloaded')");
			assertThat(StringUtils.countMatches(code, "new HomePage(page)")).isGreaterThanOrEqualTo(2);
		}

		@Test
		void instantiatesOncePerPageBeforeAndAfterTheSwitch() {
			int declared = code.indexOf("let homePage = new HomePage(page);");
			int firstClick = code.indexOf("await homePage.launch.click();");
			int rebound = code.indexOf("homePage = new HomePage(page);", declared + 1);
			int secondClick = code.indexOf("await homePage.next.click();");

			assertThat(declared).isNotNegative();
			assertThat(firstClick).isGreaterThan(declared);
			assertThat(rebound).isGreaterThan(firstClick);
			assertThat(secondClick).isGreaterThan(rebound);
		}

		@Test
		void writesHeaderAndStructure() {
			assertThat(code).startsWith("import { test, expect, Page } from '@playwright/test';\n"
					+ "import { HomePage } from '../pages/HomePage';\n\n"
					+ "test.describe('T', () => {\n"
					+ "  test('s', async ({ page }, testInfo) => {\n"
					+ "    let homePage = new HomePage(page);\n"
					+ "    await test.step('Click HomePage.launch', async () => {\n"
					+ "      await homePage.launch.click();\n"
					+ "    });\n"
					+ "    await test.step('Switch to new tab', async () => {\n");
			assertThat(code).endsWith("  });\n});\n");
		}

		@Test
		void generatesThePageObject() {
			String pageObject = transpile(transpiler, VeroSources.load("home-tabs.vero")).pages().get("HomePage");

			assertThat(pageObject).isEqualTo("""
					import { FrameLocator, Locator, Page } from '@playwright/test';

					export class HomePage {
					  page!: Page;
					  root!: Page | FrameLocator;
					  launch!: Locator;
					  next!: Locator;

					  constructor(page: Page, root: Page | FrameLocator = page) {
					    this.attach(page, root);
					  }

					  attach(page: Page, root: Page | FrameLocator = page): void {
					    this.page = page;
					    this.root = root;
					    this.launch = root.getByText('Launch');
					    this.next = root.getByText('Next');
					  }
					}
					""");
		}
	}

	@Test
	void everyTabOperationRebindsEveryObject() {
		String code = testFile("page A {\n  field x = \"#x\"\n}\npage B {\n  field y = \"#y\"\n}\n"
				+ "feature F {\n  scenario \"s\" {\n    click A.x\n    click B.y\n"
				+ "    switch to new tab\n    switch to tab 1\n    close tab\n  }\n}\n", "F");

		assertThat(StringUtils.countMatches(code, "new A(page)")).isEqualTo(4);
		assertThat(StringUtils.countMatches(code, "new B(page)")).isEqualTo(4);
		assertThat(StringUtils.countMatches(code, "page = ")).isEqualTo(3);
	}

	@Nested
	class SampleProgram {

		private final TranspileResult result = transpile(transpiler, VeroSources.load("dashboard.vero"));

		@Test
		void producesOneUnitPerDeclaration() {
			assertThat(result.pages()).containsOnlyKeys("LoginPage", "DashboardPage");
			assertThat(result.pageActions()).containsOnlyKeys("DashboardActions");
			assertThat(result.tests()).containsOnlyKeys("Dashboard");
			assertThat(result.unitCount()).isEqualTo(4);
		}

		@Test
		void pageObjectHasLocatorsVariablesAndActions() {
			String login = result.pages().get("LoginPage");

			assertThat(login).startsWith("import { FrameLocator, Locator, Page } from '@playwright/test';\n");
			assertThat(login).contains("this.email = root.locator('#email');");
			assertThat(login).contains("this.password = root.locator('input[name=password]');");
			assertThat(login).contains("this.submit = root.getByTestId('login-submit');");
			assertThat(login).contains("this.banner = root.getByText('Welcome back');");
			assertThat(login).contains("greeting = 'Welcome';");
			assertThat(login).contains("async login(user: any, pass: any): Promise<void> {\n"
					+ "    await this.email.fill(String(user));\n"
					+ "    await this.password.fill(String(pass));\n"
					+ "    await this.submit.click();\n"
					+ "  }");
			assertThat(login).contains("async bannerText(): Promise<string> {\n"
					+ "    return (await this.banner.textContent()) ?? '';\n");
		}

		@Test
		void autoSelectorsWithTagQualifiersAreLocators() {
			String dashboard = result.pages().get("DashboardPage");

			assertThat(dashboard).contains("this.heading = root.locator('h1.title');");
			assertThat(dashboard).contains("this.menu = root.locator('xpath=//nav/ul');");
		}

		@Test
		void pageActionsDelegateToTheirPage() {
			String actions = result.pageActions().get("DashboardActions");

			assertThat(actions).contains("import { DashboardPage } from '../pages/DashboardPage';");
			assertThat(actions).contains("private _dashboardPage?: DashboardPage;");
			assertThat(actions).contains("get dashboardPage(): DashboardPage {\n"
					+ "    if (!this._dashboardPage) {\n"
					+ "      this._dashboardPage = new DashboardPage(this.page, this.root);\n"
					+ "    }\n"
					+ "    return this._dashboardPage;\n"
					+ "  }");
			assertThat(actions).contains("this._dashboardPage = undefined;");
			assertThat(actions).contains("async openHelp(): Promise<void> {\n"
					+ "    await this.dashboardPage.helpLink.click();\n");
		}

		@Test
		void testFileImportsEveryObjectItUses() {
			String code = result.tests().get("Dashboard");

			assertThat(code).contains("import { DashboardPage } from '../pages/DashboardPage';");
			assertThat(code).contains("import { LoginPage } from '../pages/LoginPage';");
			assertThat(code).contains("import { DashboardActions } from '../pageActions/DashboardActions';");
		}

		@Test
		void serialFeatureConfiguresSerialMode() {
			assertThat(result.tests().get("Dashboard"))
					.contains("test.describe('Dashboard', () => {\n  test.describe.configure({ mode: 'serial' });");
		}

		@Test
		void hooksRunInLifecycleOrder() {
			String code = result.tests().get("Dashboard");

			int fixtureSetup = code.indexOf("await loginPage.login('user@example.com', 'secret');");
			int beforeEach = code.indexOf("await dashboardPage.heading.waitFor({ state: 'visible' });");
			int fixtureTeardown = code.indexOf("console.log('done');");
			int afterAll = code.indexOf("test.afterAll(async ({ browser }) => {");
			int firstTest = code.indexOf("test('Help opens in a new tab @smoke @tabs'");

			assertThat(fixtureSetup).isPositive();
			assertThat(code.indexOf("await page.goto('https://example.com/login');")).isLessThan(fixtureSetup);
			assertThat(beforeEach).isGreaterThan(fixtureSetup);
			assertThat(fixtureTeardown).isGreaterThan(beforeEach);
			assertThat(afterAll).isGreaterThan(fixtureTeardown);
			assertThat(firstTest).isGreaterThan(afterAll);
		}

		@Test
		void suiteHooksOpenTheirOwnPage() {
			assertThat(result.tests().get("Dashboard")).contains("test.afterAll(async ({ browser }) => {\n"
					+ "    const context = await browser.newContext();\n"
					+ "    let page = await context.newPage();\n"
					+ "    try {\n");
		}

		@Test
		void scenarioStatements() {
			String code = result.tests().get("Dashboard");

			assertThat(code).contains("await dashboardActions.openHelp();");
			assertThat(code).contains("await expect.poll(() => page.url()).toContain('help');");
			assertThat(code).contains("test.slow();");
			assertThat(code).contains("let message = loginPage.greeting;");
			assertThat(code).contains("await expect(dashboardPage.heading).toContainText(String(message));");
			assertThat(code).contains("if (await dashboardPage.menu.isVisible()) {");
			assertThat(code).contains("} else {");
			assertThat(code).contains("for (let i = 0; i < 2; i++) {");
			assertThat(code).contains("await page.mouse.wheel(0, 500);");
			assertThat(code).contains("const requestedTab = 1;");
		}

		@Test
		void everyScenarioAttachesEvidence() {
			String code = result.tests().get("Dashboard");

			assertThat(StringUtils.countMatches(code, "await test.step('Capture Evidence Screenshot'")).isEqualTo(2);
			assertThat(code).contains("await testInfo.attach('evidence-screenshot.png', "
					+ "{ body: screenshot, contentType: 'image/png' });");
		}
	}

	@Nested
	class Options {

		@Test
		void evidenceScreenshotCanBeDisabled() {
			Transpiler plain = new Transpiler(TranspilerOptions.defaults().withEvidenceScreenshot(false));

			String code = transpile(plain, VeroSources.load("home-tabs.vero")).tests().get("T");

			assertThat(code).doesNotContain("Capture Evidence Screenshot");
		}

		@Test
		void moduleDirectoriesAreConfigurable() {
			Transpiler custom = new Transpiler(new TranspilerOptions(5000, 5000, 150, "po", "flows", false));

			String code = transpile(custom, VeroSources.load("dashboard.vero")).tests().get("Dashboard");

			assertThat(code).contains("import { LoginPage } from '../po/LoginPage';");
			assertThat(code).contains("import { DashboardActions } from '../flows/DashboardActions';");
			assertThat(custom.getOptions().pageObjectDir()).isEqualTo("po");
		}

		@Test
		void rejectsNonPositiveTimeouts() {
			assertThatThrownBy(() -> TranspilerOptions.defaults().withNewTabTimeoutMs(0))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("newTabTimeoutMs must be positive but was 0");
		}
	}

	@Nested
	class Annotations {

		@Test
		void featureAndScenarioModifiers() {
			String code = testFile("skip feature F {\n  fixme scenario \"a\" {\n    refresh\n  }\n"
					+ "  only scenario \"b\" {\n    refresh\n  }\n  skip scenario \"c\" {\n    refresh\n  }\n}\n", "F");

			assertThat(code).contains("test.describe.skip('F', () => {");
			assertThat(code).contains("test.fixme('a', async ({ page }, testInfo) => {");
			assertThat(code).contains("test.only('b', async ({ page }, testInfo) => {");
			assertThat(code).contains("test.skip('c', async ({ page }, testInfo) => {");
		}
	}

	@Test
	void undeclaredVariablesAreEmittedAsIdentifiers() {
		String code = testFile("feature T {\n  scenario \"s\" {\n    verify \"msg\" is contains expectedText\n  }\n}\n",
				"T");

		assertThat(code).contains("await expect(page.getByText('msg')).toContainText(String(expectedText));");
	}

	@Test
	void beforeAllHookRunsInAFreshContext() {
		String code = testFile("feature T {\n  before all {\n    open \"https://example.com\"\n  }\n"
				+ "  scenario \"s\" {\n    refresh\n  }\n}\n", "T");

		assertThat(code).contains("test.beforeAll(async ({ browser }) => {");
		assertThat(code).contains("await page.goto('https://example.com');");
		assertThat(code).contains("    } finally {\n      await context.close();\n    }\n");
	}

	@Test
	void tabChangeInsidePageActionReattachesThatObject() {
		String pageObject = transpile(transpiler, "page P {\n  field help = \"a.help\"\n"
				+ "  openHelp {\n    click help\n    switch to new tab\n  }\n}\n").pages().get("P");

		assertThat(pageObject).contains("await this.help.click();");
		assertThat(pageObject).contains("const newTabTimeoutMs = 5000;");
		assertThat(pageObject).contains("this.attach(newPage);");
		assertThat(pageObject).doesNotContain("test.step");
	}

	@Test
	void literalTabIndexOutOfRangeFailsSynthesis() {
		Program program = VeroSources.program("feature T {\n  scenario \"s\" {\n    switch to tab 0\n  }\n}\n");

		assertThatThrownBy(() -> transpiler.transpile(program))
				.isInstanceOf(VeroTranspileException.class)
				.hasMessageContaining("positive integer")
				.satisfies(e -> assertThat(((VeroTranspileException) e).getLine()).isEqualTo(3));
	}

	@Nested
	class ContextChangingActions {

		private static final String HOME_WITH_HELP = """
				page HomePage {
				  field launch = "Launch"
				  field next = "Next"
				  openHelp {
				    click launch
				    switch to new tab
				  }
				}
				page Sidebar {
				  field toggle = "#toggle"
				}
				""";

		@Test
		void testFollowsTheTabAPageActionSwitchedTo() {
			String code = testFile(HOME_WITH_HELP + "feature T {\n  scenario \"s\" {\n    click Sidebar.toggle\n"
					+ "    do HomePage.openHelp\n    click HomePage.next\n  }\n}\n", "T");

			assertThat(code).contains("    await test.step('Perform HomePage.openHelp', async () => {\n"
					+ "      await homePage.openHelp();\n"
					+ "      page = homePage.page;\n"
					+ "      sidebar = new Sidebar(page);\n"
					+ "      homePage = new HomePage(page);\n"
					+ "    });\n"
					+ "    await test.step('Click HomePage.next', async () => {\n"
					+ "      await homePage.next.click();\n");
		}

		@Test
		void assignedResultOfATabChangingActionAlsoRebinds() {
			String code = testFile("page P {\n  field a = \"#a\"\n  go returns flag {\n    close tab\n"
					+ "    return true\n  }\n}\nfeature T {\n  scenario \"s\" {\n    flag done = do P.go\n"
					+ "  }\n}\n", "T");

			assertThat(code).contains("    let done = await p.go();\n    page = p.page;\n    p = new P(page);\n");
		}

		@Test
		void pageActionCallingAnotherPageFollowsItsTabChange() {
			String portal = transpile(transpiler, HOME_WITH_HELP
					+ "page Portal {\n  field home = \"#home\"\n  help {\n    do HomePage.openHelp\n  }\n}\n")
					.pages().get("Portal");

			assertThat(portal).contains("    {\n      await this.homePage.openHelp();\n"
					+ "      this.attach(this.homePage.page, this.homePage.root);\n    }\n");
		}

		@Test
		void ordinaryActionCallsStayPlainSteps() {
			String code = testFile(HOME_WITH_HELP + "page Form {\n  field ok = \"#ok\"\n  submit {\n    click ok\n"
					+ "  }\n}\nfeature T {\n  scenario \"s\" {\n    do Form.submit\n  }\n}\n", "T");

			assertThat(code).contains("await form.submit();");
			assertThat(code).doesNotContain("page = form.page;");
		}
	}

	@Nested
	class Collaborators {

		@Test
		void mutuallyReferencingPagesAreCreatedOnDemand() {
			TranspileResult result = transpile(transpiler, "page A {\n  field go = \"#go\"\n  goB {\n    do B.back\n"
					+ "  }\n}\npage B {\n  field x = \"#x\"\n  back {\n    do A.goB\n  }\n}\n");
			String a = result.pages().get("A");

			assertThat(a).contains("private _b?: B;");
			assertThat(a).contains("  attach(page: Page, root: Page | FrameLocator = page): void {\n"
					+ "    this.page = page;\n"
					+ "    this.root = root;\n"
					+ "    this.go = root.locator('#go');\n"
					+ "    this._b = undefined;\n"
					+ "  }");
			assertThat(a).contains("      this._b = new B(this.page, this.root);");
			assertThat(a).contains("await this.b.back();");
			assertThat(a).doesNotContain("this.b = new B(");
			assertThat(result.pages().get("B")).contains("private _a?: A;").doesNotContain("this.a = new A(");
		}

		@Test
		void pageCallingItsOwnBundleDoesNotConstructEagerly() {
			TranspileResult result = transpile(transpiler, "page Home {\n  field x = \"#x\"\n  run {\n"
					+ "    do HomeFlows.go\n  }\n}\npageactions HomeFlows for Home {\n  go {\n    click x\n  }\n}\n");

			assertThat(result.pages().get("Home"))
					.contains("get homeFlows(): HomeFlows {")
					.contains("await this.homeFlows.go();")
					.doesNotContain("new HomeFlows(page)");
			assertThat(result.pageActions().get("HomeFlows"))
					.contains("get home(): Home {")
					.contains("await this.home.x.click();")
					.doesNotContain("new Home(page)");
		}
	}

	@Nested
	class Frames {

		private static final String CHECKOUT = """
				page Checkout {
				  field card = "#card"
				  field pay = "Pay"
				  enterPayment {
				    switch to frame css "iframe.payment"
				  }
				  leavePayment {
				    switch to main frame
				  }
				}
				""";

		@Test
		void scenarioTracksTheCurrentFrame() {
			String code = testFile(CHECKOUT + "feature F {\n  scenario \"s\" {\n    switch to frame \"#payment\"\n"
					+ "    fill Checkout.card with \"4242\"\n    switch to main frame\n    click Checkout.pay\n"
					+ "    click \"Done\"\n  }\n}\n", "F");

			assertThat(code).startsWith("import { test, expect, FrameLocator, Page } from '@playwright/test';\n");
			assertThat(code).contains("    let root: Page | FrameLocator = page;\n"
					+ "    let checkout = new Checkout(page, root);\n"
					+ "    await test.step('Switch to frame #payment', async () => {\n"
					+ "      root = root.frameLocator('#payment');\n"
					+ "      checkout = new Checkout(page, root);\n"
					+ "    });\n");
			assertThat(code).contains("await checkout.card.fill('4242');");
			assertThat(code).contains("      root = page;\n      checkout = new Checkout(page, root);\n");
			assertThat(code).contains("await root.getByText('Done').click();");
		}

		@Test
		void pageObjectReattachesToTheFrame() {
			String checkout = transpile(transpiler, CHECKOUT).pages().get("Checkout");

			assertThat(checkout).contains("this.attach(this.page, this.root.frameLocator('iframe.payment'));");
			assertThat(checkout).contains("async leavePayment(): Promise<void> {\n    {\n      this.attach(this.page);\n");
		}

		@Test
		void scenarioAdoptsTheFrameAnActionEntered() {
			String code = testFile(CHECKOUT + "feature F {\n  scenario \"s\" {\n    do Checkout.enterPayment\n"
					+ "    fill Checkout.card with \"4242\"\n  }\n}\n", "F");

			assertThat(code).contains("      await checkout.enterPayment();\n"
					+ "      page = checkout.page;\n"
					+ "      root = checkout.root;\n"
					+ "      checkout = new Checkout(page, root);\n");
		}

		@Test
		void newTabLeavesTheFrame() {
			String code = testFile(CHECKOUT + "feature F {\n  scenario \"s\" {\n    switch to frame \"pay\"\n"
					+ "    close tab\n    click Checkout.pay\n  }\n}\n", "F");

			assertThat(code).contains("root = root.frameLocator('iframe[name=\"pay\"]');");
			assertThat(code).contains("      page = fallbackPage;\n      root = page;\n"
					+ "      checkout = new Checkout(page, root);\n");
		}

		@Test
		void scenariosWithoutFramesKeepThePlainForm() {
			String code = testFile(CHECKOUT + "feature F {\n  scenario \"s\" {\n    click Checkout.pay\n  }\n}\n", "F");

			assertThat(code).startsWith("import { test, expect, Page } from '@playwright/test';\n");
			assertThat(code).contains("let checkout = new Checkout(page);").doesNotContain("root");
		}
	}

	@Nested
	class MoreStatements {

		private static final String FORM = """
				page Form {
				  field file = "#file"
				  field search = "#search"
				  field rows = "tr.row"
				  field name = "#name"
				  field link = "#home"
				}
				""";

		private String scenario(String statements) {
			return testFile(FORM + "feature F {\n  scenario \"s\" {\n" + statements + "\n  }\n}\n", "F");
		}

		@Test
		void dialogsArmAOneShotHandler() {
			String code = scenario("accept dialog with \"yes\"\ndismiss dialog\naccept dialog");

			assertThat(code).contains("    await test.step('Accept next dialog with yes', async () => {\n"
					+ "      page.once('dialog', (dialog) => dialog.accept('yes'));\n");
			assertThat(code).contains("page.once('dialog', (dialog) => dialog.dismiss());");
			assertThat(code).contains("page.once('dialog', (dialog) => dialog.accept());");
		}

		@Test
		void elementPropertyAssertions() {
			String code = scenario("number n = 2\nverify Form.rows has count 3\nverify Form.rows has count n\n"
					+ "verify Form.name has value \"Ada\"\nverify Form.link has attribute \"href\" \"/home\"\n"
					+ "verify Form.link has class \"active\"");

			assertThat(code).contains("await expect(form.rows).toHaveCount(3);");
			assertThat(code).contains("await expect(form.rows).toHaveCount(Number(n));");
			assertThat(code).contains("await expect(form.name).toHaveValue('Ada');");
			assertThat(code).contains("await expect(form.link).toHaveAttribute('href', '/home');");
			assertThat(code).contains("await expect(form.link).toHaveClass(/(^|\\s)active(\\s|$)/);");
			assertThat(code).contains("test.step('Verify Form.link has attribute href /home'");
		}

		@Test
		void classNamesAreMatchedLiterally() {
			String code = scenario("verify Form.link has class \"is.open\"");

			assertThat(code).contains("toHaveClass(/(^|\\s)is\\.open(\\s|$)/)");
		}

		@Test
		void uploadsOneOrManyFiles() {
			String code = scenario("upload \"a.pdf\" to Form.file\nupload \"a.pdf\", \"b.pdf\" to Form.file");

			assertThat(code).contains("await form.file.setInputFiles('a.pdf');");
			assertThat(code).contains("await form.file.setInputFiles(['a.pdf', 'b.pdf']);");
		}

		@Test
		void forEachIteratesAList() {
			String code = scenario("list terms = [\"a\", \"b\"]\nfor each term in terms {\n  fill Form.search with term\n}");

			assertThat(code).contains("    let terms = ['a', 'b'];\n    for (const term of terms) {\n"
					+ "      await test.step('Fill Form.search', async () => {\n"
					+ "        await form.search.fill(String(term));\n");
		}

		@Test
		void loopCounterAvoidsNamesTheScenarioUses() {
			String code = scenario("number i = 3\nrepeat 2 times {\n  log i\n}");

			assertThat(code).contains("for (let j = 0; j < 2; j++) {");
			assertThat(code).contains("console.log(i);");
		}
	}

	@Test
	void eachFixtureGetsItsOwnHooks() {
		String code = testFile("fixture A {\n  setup {\n    text note = \"a\"\n    log note\n  }\n}\n"
				+ "fixture B {\n  setup {\n    text note = \"b\"\n    log note\n  }\n}\n"
				+ "feature F {\n  use A, B\n  scenario \"s\" {\n    refresh\n  }\n}\n", "F");

		assertThat(StringUtils.countMatches(code, "test.beforeEach(async ({ page }) => {")).isEqualTo(2);
		assertThat(StringUtils.countMatches(code, "let note = ")).isEqualTo(2);
	}

	@Test
	void reservedObjectNamesAreRenamed() {
		assertThat(EmitContext.variableName("HomePage")).isEqualTo("homePage");
		assertThat(EmitContext.variableName("Page")).isEqualTo("pageObject");
		assertThat(EmitContext.variableName("Test")).isEqualTo("testObject");
	}
}
