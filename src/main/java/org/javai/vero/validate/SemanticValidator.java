package org.javai.vero.validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionCall;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.AstWalker;
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
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.Target;
import org.javai.vero.ast.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves every page, field, action and variable reference of a program and enforces the
 * tab- and frame-context rules, including for actions that switch tabs or frames indirectly. All problems are collected; validation never stops at the first error.
 * <p>
 * Pages are auto-resolved from the references found in statements. A feature's explicit
 * {@code use} list is a hint: it only sharpens the message of an unresolved page.
 * <p>
 * Instances remember the symbol table of the most recent {@link #validate(Program)} call for the
 * tooling accessors. Use one instance per thread.
 */
public class SemanticValidator {

	private static final Logger logger = LoggerFactory.getLogger(SemanticValidator.class);

	private final SuggestionEngine suggestions;
	private SymbolTable symbolTable = SymbolTable.empty();

	public SemanticValidator() {
		this(new SuggestionEngine());
	}

	public SemanticValidator(SuggestionEngine suggestions) {
		this.suggestions = Objects.requireNonNull(suggestions, "suggestions must not be null");
	}

	public ValidationResult validate(Program program) {
		Objects.requireNonNull(program, "program must not be null");
		SymbolTable table = SymbolTable.from(program);
		ValidationPass pass = new ValidationPass(table);
		pass.run(program);
		this.symbolTable = table;

		ValidationResult result = ValidationResult.of(pass.errors, pass.warnings);
		logger.debug("Validated {} page(s), {} feature(s): {} error(s), {} warning(s)",
				program.pages().size(), program.features().size(), result.errorCount(), result.warnings().size());
		return result;
	}

	public List<String> getPageNames() {
		return symbolTable.pageNames();
	}

	public List<String> getPageActionsNames() {
		return symbolTable.pageActionsNames();
	}

	public List<String> getFieldsForPage(String pageName) {
		return symbolTable.fieldsForPage(pageName);
	}

	public SymbolTable getSymbolTable() {
		return symbolTable;
	}

	private enum ContextKind {
		PAGE,
		PAGE_ACTIONS,
		FIXTURE,
		FEATURE
	}

	/**
	 * Where a statement list lives.
	 *
	 * @param owner enclosing page or page-actions name, used to resolve unqualified calls
	 * @param page the page whose fields unqualified targets name, or {@code null}
	 * @param parameters parameters of the enclosing action
	 * @param feature enclosing feature, for the use list
	 * @param hook enclosing hook type, or {@code null}
	 */
	private record Context(ContextKind kind, String owner, Page page, List<String> parameters, Feature feature,
			Hook.HookType hook, String description) {

		static Context action(ContextKind kind, String owner, Page page, ActionDefinition action) {
			String where = (kind == ContextKind.PAGE_ACTIONS ? "page actions '" : "page '") + owner + "'";
			return new Context(kind, owner, page, action.parameters(), null, null, where);
		}

		static Context feature(Feature feature, Hook.HookType hook) {
			String where = hook != null ? "'" + hook.keywords() + "' hook of feature '" + feature.name() + "'"
					: "feature '" + feature.name() + "'";
			return new Context(ContextKind.FEATURE, null, null, List.of(), feature, hook, where);
		}

		static Context fixture(Fixture fixture) {
			return new Context(ContextKind.FIXTURE, null, null, List.of(), null, null,
					"fixture '" + fixture.name() + "'");
		}

		boolean inAction() {
			return kind == ContextKind.PAGE || kind == ContextKind.PAGE_ACTIONS;
		}

		boolean forbidsTabOperations() {
			return kind == ContextKind.PAGE_ACTIONS || (hook != null && hook.isSuiteLevel());
		}

		boolean notInUseList(String name) {
			return feature != null && !feature.uses().isEmpty()
					&& feature.uses().stream().noneMatch(use -> use.name().equals(name));
		}
	}

	/**
	 * Block-structured set of declared local names.
	 */
	private static final class Scope {

		private final Deque<Set<String>> frames = new ArrayDeque<>();

		void push() {
			frames.push(new HashSet<>());
		}

		void pop() {
			frames.pop();
		}

		void declare(String name) {
			frames.peek().add(name);
		}

		boolean isDeclaredInCurrentFrame(String name) {
			return frames.peek().contains(name);
		}

		int depth() {
			return frames.size();
		}

		boolean isDeclared(String name) {
			return frames.stream().anyMatch(frame -> frame.contains(name));
		}

		Set<String> names() {
			Set<String> all = new LinkedHashSet<>();
			frames.forEach(all::addAll);
			return all;
		}
	}

	/**
	 * Per-call state.
	 */
	private final class ValidationPass {

		private final SymbolTable table;
		private final List<Diagnostic> errors = new ArrayList<>();
		private final List<Diagnostic> warnings = new ArrayList<>();

		ValidationPass(SymbolTable table) {
			this.table = table;
		}

		void run(Program program) {
			checkDuplicates(program.pages(), Page::name, Page::line, "Page");
			checkDuplicates(program.pageActions(), PageActions::name, PageActions::line, "Page actions");
			checkDuplicates(program.fixtures(), Fixture::name, Fixture::line, "Fixture");
			checkDuplicates(program.features(), Feature::name, Feature::line, "Feature");

			for (Page page : program.pages()) {
				checkPage(page);
			}
			for (PageActions bundle : program.pageActions()) {
				checkPageActions(bundle);
			}
			for (Fixture fixture : program.fixtures()) {
				checkStatements(fixture.setup(), Context.fixture(fixture), new Scope());
				checkStatements(fixture.teardown(), Context.fixture(fixture), new Scope());
			}
			for (Feature feature : program.features()) {
				checkFeature(feature);
			}
		}

		// ==================== Declarations ====================

		private <T> void checkDuplicates(List<T> items, Function<T, String> name, Function<T, Integer> line,
				String kind) {
			checkDuplicates(items, name, line, kind, null);
		}

		private <T> void checkDuplicates(List<T> items, Function<T, String> name, Function<T, Integer> line,
				String kind, String owner) {
			Set<String> seen = new HashSet<>();
			for (T item : items) {
				String itemName = name.apply(item);
				if (!seen.add(itemName)) {
					String qualified = owner != null ? owner + "." + itemName : itemName;
					error(ErrorCode.DUPLICATE_DEFINITION, kind + " '" + qualified + "' is already defined",
							line.apply(item), List.of());
				}
			}
		}

		private void checkPage(Page page) {
			checkDuplicates(page.fields(), Field::name, Field::line, "Field", page.name());
			checkDuplicates(page.actions(), ActionDefinition::name, ActionDefinition::line, "Action", page.name());
			for (Variable variable : page.variables()) {
				if (page.findField(variable.name()).isPresent()) {
					error(ErrorCode.DUPLICATE_DEFINITION, "Variable '" + variable.name()
							+ "' clashes with a field of page '" + page.name() + "'", variable.line(), List.of());
				}
			}
			for (Variable variable : page.variables()) {
				page.findAction(variable.name()).ifPresent(action -> error(ErrorCode.DUPLICATE_DEFINITION,
						"Variable '" + variable.name() + "' clashes with an action of page '" + page.name() + "'",
						variable.line(), List.of()));
			}
			for (Field field : page.fields()) {
				page.findAction(field.name()).ifPresent(action -> error(ErrorCode.DUPLICATE_DEFINITION,
						"Field '" + field.name() + "' clashes with an action of page '" + page.name() + "'",
						field.line(), List.of()));
			}
			Set<String> accessors = accessorNames(page.name(), page.actions(), null);
			for (Field field : page.fields()) {
				checkMemberName(field.name(), "Field", page.name(), accessors, field.line());
			}
			for (Variable variable : page.variables()) {
				checkMemberName(variable.name(), "Variable", page.name(), accessors, variable.line());
			}
			for (ActionDefinition action : page.actions()) {
				checkMemberName(action.name(), "Action", page.name(), accessors, action.line());
				checkParameters(action);
				checkStatements(action.statements(), Context.action(ContextKind.PAGE, page.name(), page, action),
						new Scope());
			}
		}

		/**
		 * Accessor names the generated class declares for the pages and bundles its actions reach.
		 */
		private Set<String> accessorNames(String self, List<ActionDefinition> actions, String forPage) {
			Set<String> owners = new LinkedHashSet<>();
			if (forPage != null) {
				owners.add(forPage);
			}
			for (ActionDefinition action : actions) {
				owners.addAll(AstWalker.referencedOwners(action.statements()));
			}
			owners.remove(self);
			return owners.stream()
					.filter(name -> table.isPage(name) || table.isPageActions(name))
					.map(ReservedNames::objectVariable)
					.collect(Collectors.toCollection(LinkedHashSet::new));
		}

		private void checkMemberName(String name, String kind, String owner, Set<String> accessors, int line) {
			if (ReservedNames.isReservedMember(name)) {
				error(ErrorCode.RESERVED_NAME, kind + " '" + owner + "." + name
						+ "' uses a name reserved by the generated class", line, List.of());
			} else if (accessors.contains(name)) {
				error(ErrorCode.DUPLICATE_DEFINITION, kind + " '" + owner + "." + name
						+ "' clashes with the accessor for a page object '" + owner + "' uses", line, List.of());
			}
		}

		private void checkParameters(ActionDefinition action) {
			Set<String> seen = new HashSet<>();
			for (String parameter : action.parameters()) {
				if (ReservedNames.isReservedLocal(parameter)) {
					error(ErrorCode.RESERVED_NAME, "Parameter '" + parameter + "' of action '" + action.name()
							+ "' uses a name reserved by the generated code", action.line(), List.of());
				} else if (!seen.add(parameter)) {
					error(ErrorCode.DUPLICATE_DEFINITION, "Parameter '" + parameter + "' is declared twice in action '"
							+ action.name() + "'", action.line(), List.of());
				}
			}
		}

		private void checkPageActions(PageActions bundle) {
			checkDuplicates(bundle.actions(), ActionDefinition::name, ActionDefinition::line, "Action",
					bundle.name());
			Page page = table.findPage(bundle.forPage()).orElse(null);
			if (page == null) {
				error(ErrorCode.INVALID_PAGEACTIONS_FOR, "Page actions '" + bundle.name()
								+ "' is declared for undefined page '" + bundle.forPage() + "'",
						bundle.line(), suggestions.suggest(bundle.forPage(), table.pageNames()));
			}
			Set<String> accessors = accessorNames(bundle.name(), bundle.actions(), bundle.forPage());
			for (ActionDefinition action : bundle.actions()) {
				checkMemberName(action.name(), "Action", bundle.name(), accessors, action.line());
				checkParameters(action);
				checkStatements(action.statements(),
						Context.action(ContextKind.PAGE_ACTIONS, bundle.name(), page, action), new Scope());
			}
		}

		private void checkFeature(Feature feature) {
			for (Feature.Use use : feature.uses()) {
				String name = use.name();
				if (!table.isPage(name) && !table.isPageActions(name) && !table.isFixture(name)) {
					List<String> pool = new ArrayList<>(table.pageNames());
					pool.addAll(table.pageActionsNames());
					pool.addAll(table.fixtureNames());
					error(ErrorCode.UNDEFINED_PAGE, "'" + name + "' in use list of feature '" + feature.name()
							+ "' is not a defined page, page actions or fixture", use.line(),
							suggestions.suggest(name, pool));
				}
			}
			for (Hook hook : feature.hooks()) {
				checkStatements(hook.statements(), Context.feature(feature, hook.type()), new Scope());
			}
			for (Scenario scenario : feature.scenarios()) {
				checkStatements(scenario.statements(), Context.feature(feature, null), new Scope());
			}
		}

		// ==================== Statements ====================

		private void checkStatements(List<Statement> statements, Context context, Scope scope) {
			scope.push();
			for (Statement statement : statements) {
				checkStatement(statement, context, scope);
				if (statement instanceof Statement.ForEach forEach) {
					scope.push();
					declareLocal(forEach.item(), "Loop variable", forEach.line(), context, scope);
					checkStatements(forEach.statements(), context, scope);
					scope.pop();
				} else {
					for (List<Statement> block : statement.blocks()) {
						checkStatements(block, context, scope);
					}
				}
				if (statement instanceof Statement.VariableDeclaration declaration) {
					declareLocal(declaration.name(), "Variable", declaration.line(), context, scope);
				}
			}
			scope.pop();
		}

		/**
		 * Locals share a TypeScript block with their siblings, the action's parameters (at the top
		 * level of an action body) and, in tests and hooks, the page object variables.
		 */
		private void declareLocal(String name, String kind, int line, Context context, Scope scope) {
			if (ReservedNames.isReservedLocal(name)) {
				error(ErrorCode.RESERVED_NAME, kind + " '" + name + "' uses a name reserved by the generated code",
						line, List.of());
			} else if (!context.inAction() && objectVariables().contains(name)) {
				error(ErrorCode.DUPLICATE_DEFINITION, kind + " '" + name
						+ "' clashes with a page object variable in " + context.description(), line, List.of());
			} else if (scope.isDeclaredInCurrentFrame(name)
					|| (scope.depth() == 1 && context.parameters().contains(name))) {
				error(ErrorCode.DUPLICATE_DEFINITION, kind + " '" + name + "' is already declared in "
						+ context.description(), line, List.of());
			}
			scope.declare(name);
		}

		private Set<String> objectVariables() {
			Set<String> names = new HashSet<>();
			table.pageNames().forEach(name -> names.add(ReservedNames.objectVariable(name)));
			table.pageActionsNames().forEach(name -> names.add(ReservedNames.objectVariable(name)));
			return names;
		}

		private void checkStatement(Statement statement, Context context, Scope scope) {
			if (statement.changesContext() && context.forbidsTabOperations()) {
				error(ErrorCode.INVALID_TAB_CONTEXT, contextOperationName(statement) + " is not allowed in "
						+ context.description(), statement.line(), List.of());
			}
			if (statement instanceof Statement.SwitchToTab switchToTab) {
				checkTabIndex(switchToTab);
			}
			if (statement instanceof Statement.Return && !context.inAction()) {
				error(ErrorCode.RETURN_OUTSIDE_ACTION, "'return' is only allowed inside an action body, not in "
						+ context.description(), statement.line(), List.of());
			}

			Target subject = null;
			Condition condition = null;
			if (statement instanceof Statement.Verify verify) {
				subject = verify.subject();
				condition = verify.condition();
			} else if (statement instanceof Statement.If ifStatement) {
				subject = ifStatement.subject();
				condition = ifStatement.condition();
			}

			AstWalker.References references = AstWalker.references(statement);
			for (Target target : references.targets()) {
				boolean valueSubject = target == subject;
				checkTarget(target, valueSubject, context, scope, statement.line());
			}
			if (subject != null && condition instanceof Condition.StateCondition state) {
				checkStateCondition(subject, state, context, scope, statement.line());
			}
			for (Expression expression : references.expressions()) {
				checkExpression(expression, context, scope, statement.line());
			}
			if (references.call() != null) {
				checkCall(references.call(), context, statement.line());
				checkIndirectContextChange(references.call(), context, statement.line());
			}
		}

		/**
		 * Unqualified calls inside a bundle resolve to the bundle's own actions, whose tab operations
		 * are reported where they appear.
		 */
		private void checkIndirectContextChange(ActionCall call, Context context, int line) {
			if (call.isQualified() && context.forbidsTabOperations() && table.changesContext(call, context.owner())) {
				error(ErrorCode.INVALID_TAB_CONTEXT, "Action '" + call.qualifiedName()
						+ "' switches tabs or frames, which is not allowed in " + context.description(), line,
						List.of());
			}
		}

		private void checkTabIndex(Statement.SwitchToTab switchToTab) {
			Expression index = switchToTab.index();
			boolean literal = !(index instanceof Expression.VariableReference);
			boolean valid = index instanceof Expression.NumberLiteral number && number.isPositiveInteger();
			if (literal && !valid) {
				error(ErrorCode.INVALID_TAB_INDEX, "SWITCH TO TAB requires a positive integer index (1-based)",
						switchToTab.line(), List.of());
			}
		}

		private void checkTarget(Target target, boolean valueSubject, Context context, Scope scope, int line) {
			if (target instanceof Target.PageFieldTarget pageField) {
				checkPageFieldTarget(pageField, valueSubject, context, line);
			} else if (target instanceof Target.FieldTarget field) {
				checkFieldTarget(field, context, scope, line);
			}
		}

		private void checkPageFieldTarget(Target.PageFieldTarget target, boolean valueSubject, Context context,
				int line) {
			Optional<Page> page = table.findPage(target.page());
			if (page.isEmpty()) {
				reportUndefinedPage(target.page(), context, line);
				return;
			}
			List<String> fields = table.fieldsForPage(target.page());
			if (fields.contains(target.field())) {
				return;
			}
			List<String> variables = table.variablesForPage(target.page());
			if (valueSubject && variables.contains(target.field())) {
				return;
			}
			List<String> pool = new ArrayList<>(fields);
			if (valueSubject) {
				pool.addAll(variables);
			}
			error(ErrorCode.UNDEFINED_FIELD, "Field '" + target.field() + "' is not defined on page '"
					+ target.page() + "'", line, suggestions.suggest(target.field(), pool));
		}

		private void checkFieldTarget(Target.FieldTarget target, Context context, Scope scope, int line) {
			String name = target.field();
			if (context.inAction()) {
				if (context.page() == null || isLocalName(name, context, scope)) {
					return;
				}
				if (context.page().findField(name).isPresent()) {
					return;
				}
				List<String> pool = new ArrayList<>(table.fieldsForPage(context.page().name()));
				pool.addAll(visibleNames(context, scope));
				error(ErrorCode.UNDEFINED_FIELD, "Field '" + name + "' is not defined on page '"
						+ context.page().name() + "'", line, suggestions.suggest(name, pool));
			} else if (!scope.isDeclared(name)) {
				reportUndefinedVariable(name, context, scope, line);
			}
		}

		private void checkStateCondition(Target subject, Condition.StateCondition state, Context context,
				Scope scope, int line) {
			String valueName = null;
			if (subject instanceof Target.FieldTarget field) {
				boolean isElement = context.inAction() && context.page() != null
						&& context.page().findField(field.field()).isPresent()
						&& !scope.isDeclared(field.field()) && !context.parameters().contains(field.field());
				boolean isValue = context.inAction() ? isLocalName(field.field(), context, scope)
						: scope.isDeclared(field.field());
				if (isValue && !isElement) {
					valueName = field.field();
				}
			} else if (subject instanceof Target.PageFieldTarget pageField) {
				if (!table.fieldsForPage(pageField.page()).contains(pageField.field())
						&& table.variablesForPage(pageField.page()).contains(pageField.field())) {
					valueName = pageField.describe();
				}
			}
			if (valueName != null) {
				error(ErrorCode.INVALID_CONDITION, "'is " + (state.negated() ? "not " : "") + state.state().keyword()
						+ "' needs an element, but '" + valueName + "' is a variable", line, List.of());
			}
		}

		private void checkExpression(Expression expression, Context context, Scope scope, int line) {
			if (expression instanceof Expression.ListLiteral list) {
				for (Expression element : list.elements()) {
					checkExpression(element, context, scope, line);
				}
				return;
			}
			if (!(expression instanceof Expression.VariableReference ref)) {
				return;
			}
			if (ref.isQualified()) {
				if (table.findPage(ref.page()).isEmpty()) {
					reportUndefinedPage(ref.page(), context, line);
					return;
				}
				List<String> pool = new ArrayList<>(table.variablesForPage(ref.page()));
				pool.addAll(table.fieldsForPage(ref.page()));
				if (!pool.contains(ref.name())) {
					error(ErrorCode.UNDEFINED_FIELD, "'" + ref.name() + "' is not a variable or field of page '"
							+ ref.page() + "'", line, suggestions.suggest(ref.name(), pool));
				}
			} else if (!isLocalName(ref.name(), context, scope)) {
				reportUndefinedVariable(ref.name(), context, scope, line);
			}
		}

		private void checkCall(ActionCall call, Context context, int line) {
			String owner = call.isQualified() ? call.page() : context.owner();
			if (owner == null) {
				List<String> pool = new ArrayList<>();
				for (String name : table.pageActionsNames()) {
					table.actionsOf(name).ifPresent(actions -> actions.forEach(a -> pool.add(a.name())));
				}
				error(ErrorCode.UNDEFINED_ACTION, "Action '" + call.action()
						+ "' must be qualified with a page or page actions name in " + context.description(),
						line, suggestions.suggest(call.action(), pool));
				return;
			}
			Optional<List<ActionDefinition>> actions = table.actionsOf(owner);
			if (actions.isEmpty()) {
				List<String> pool = new ArrayList<>(table.pageActionsNames());
				pool.addAll(table.pageNames());
				error(ErrorCode.UNDEFINED_PAGEACTIONS, "Page actions '" + owner + "' is not defined", line,
						suggestions.suggest(owner, pool));
				return;
			}
			Optional<ActionDefinition> action = actions.get().stream()
					.filter(a -> a.name().equals(call.action()))
					.findFirst();
			if (action.isEmpty()) {
				List<String> pool = actions.get().stream().map(ActionDefinition::name).collect(Collectors.toList());
				error(ErrorCode.UNDEFINED_ACTION, "Action '" + call.action() + "' is not defined in '" + owner + "'",
						line, suggestions.suggest(call.action(), pool));
				return;
			}
			int expected = action.get().parameters().size();
			int actual = call.arguments().size();
			if (expected != actual) {
				error(ErrorCode.ARGUMENT_COUNT_MISMATCH, "Action '" + owner + "." + call.action() + "' expects "
						+ expected + " argument(s) but got " + actual, line, List.of());
			}
		}

		// ==================== Helpers ====================

		private boolean isLocalName(String name, Context context, Scope scope) {
			if (scope.isDeclared(name) || context.parameters().contains(name)) {
				return true;
			}
			return context.page() != null && table.variablesForPage(context.page().name()).contains(name);
		}

		private Set<String> visibleNames(Context context, Scope scope) {
			Set<String> names = new LinkedHashSet<>(scope.names());
			names.addAll(context.parameters());
			if (context.page() != null) {
				names.addAll(table.variablesForPage(context.page().name()));
			}
			return names;
		}

		private void reportUndefinedPage(String name, Context context, int line) {
			String qualifier = context.notInUseList(name) ? " (not in USE list)" : "";
			error(ErrorCode.UNDEFINED_PAGE, "Page '" + name + "' is not defined" + qualifier, line,
					suggestions.suggest(name, table.pageNames()));
		}

		private void reportUndefinedVariable(String name, Context context, Scope scope, int line) {
			warning(ErrorCode.UNDEFINED_VARIABLE, "Variable '" + name + "' is not declared in "
					+ context.description(), line, suggestions.suggest(name, visibleNames(context, scope)));
		}

		private void error(ErrorCode code, String message, int line, List<String> suggested) {
			errors.add(new Diagnostic(code, Severity.ERROR, message, line, suggested));
		}

		private void warning(ErrorCode code, String message, int line, List<String> suggested) {
			warnings.add(new Diagnostic(code, Severity.WARNING, message, line, suggested));
		}
	}

	/**
	 * Source spelling of a tab- or frame-changing statement, for messages.
	 */
	static String contextOperationName(Statement statement) {
		if (statement instanceof Statement.SwitchToFrame) {
			return "SWITCH TO FRAME";
		}
		if (statement instanceof Statement.SwitchToMainFrame) {
			return "SWITCH TO MAIN FRAME";
		}
		if (statement instanceof Statement.SwitchToNewTab) {
			return "SWITCH TO NEW TAB";
		}
		if (statement instanceof Statement.SwitchToTab) {
			return "SWITCH TO TAB";
		}
		if (statement instanceof Statement.OpenInNewTab) {
			return "OPEN IN NEW TAB";
		}
		return "CLOSE TAB";
	}
}
