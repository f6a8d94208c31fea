package org.javai.vero.validate;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionCall;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.AstWalker;
import org.javai.vero.ast.Field;
import org.javai.vero.ast.Fixture;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.PageActions;
import org.javai.vero.ast.Program;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.Variable;

/**
 * Name-indexed side table over a program's declarations. When a name is declared twice the
 * first declaration wins; duplicates are reported by the validator.
 * <p>
 * Built as a pure function of the AST and never mutated afterwards, so it can be handed to the
 * transpiler alongside the program.
 * <p>
 * The table also records which actions change the browsing context (active tab or frame), either
 * directly or through the actions they call, at any depth.
 */
public final class SymbolTable {

	private static final SymbolTable EMPTY = new SymbolTable(Map.of(), Map.of(), Map.of());

	private final Map<String, Page> pages;
	private final Map<String, PageActions> pageActions;
	private final Map<String, Fixture> fixtures;
	private final Set<ActionDefinition> contextChanging;
	private final Set<ActionDefinition> frameChanging;

	private SymbolTable(Map<String, Page> pages, Map<String, PageActions> pageActions, Map<String, Fixture> fixtures) {
		this.pages = Collections.unmodifiableMap(pages);
		this.pageActions = Collections.unmodifiableMap(pageActions);
		this.fixtures = Collections.unmodifiableMap(fixtures);
		Map<ActionDefinition, String> owners = new IdentityHashMap<>();
		pages.values().forEach(page -> page.actions().forEach(a -> owners.putIfAbsent(a, page.name())));
		pageActions.values().forEach(bundle -> bundle.actions().forEach(a -> owners.putIfAbsent(a, bundle.name())));
		this.contextChanging = reaching(owners, Statement::changesContext);
		this.frameChanging = reaching(owners, Statement::changesFrame);
	}

	public static SymbolTable empty() {
		return EMPTY;
	}

	public static SymbolTable from(Program program) {
		Map<String, Page> pages = new LinkedHashMap<>();
		for (Page page : program.pages()) {
			pages.putIfAbsent(page.name(), page);
		}
		Map<String, PageActions> pageActions = new LinkedHashMap<>();
		for (PageActions bundle : program.pageActions()) {
			pageActions.putIfAbsent(bundle.name(), bundle);
		}
		Map<String, Fixture> fixtures = new LinkedHashMap<>();
		for (Fixture fixture : program.fixtures()) {
			fixtures.putIfAbsent(fixture.name(), fixture);
		}
		return new SymbolTable(pages, pageActions, fixtures);
	}

	public List<String> pageNames() {
		return List.copyOf(pages.keySet());
	}

	public List<String> pageActionsNames() {
		return List.copyOf(pageActions.keySet());
	}

	public List<String> fixtureNames() {
		return List.copyOf(fixtures.keySet());
	}

	public Optional<Page> findPage(String name) {
		return Optional.ofNullable(pages.get(name));
	}

	public Optional<PageActions> findPageActions(String name) {
		return Optional.ofNullable(pageActions.get(name));
	}

	public Optional<Fixture> findFixture(String name) {
		return Optional.ofNullable(fixtures.get(name));
	}

	public boolean isPage(String name) {
		return pages.containsKey(name);
	}

	public boolean isPageActions(String name) {
		return pageActions.containsKey(name);
	}

	public boolean isFixture(String name) {
		return fixtures.containsKey(name);
	}

	/**
	 * Field names of a page in declaration order, or an empty list for an unknown page.
	 */
	public List<String> fieldsForPage(String pageName) {
		Page page = pages.get(pageName);
		if (page == null) {
			return List.of();
		}
		return page.fields().stream().map(Field::name).collect(Collectors.toList());
	}

	public List<String> variablesForPage(String pageName) {
		Page page = pages.get(pageName);
		if (page == null) {
			return List.of();
		}
		return page.variables().stream().map(Variable::name).collect(Collectors.toList());
	}

	/**
	 * Actions callable through {@code owner}: a page-actions bundle takes precedence over a page of the
	 * same name.
	 */
	public Optional<List<ActionDefinition>> actionsOf(String owner) {
		PageActions bundle = pageActions.get(owner);
		if (bundle != null) {
			return Optional.of(bundle.actions());
		}
		Page page = pages.get(owner);
		if (page != null) {
			return Optional.of(page.actions());
		}
		return Optional.empty();
	}

	public Optional<ActionDefinition> findAction(String owner, String action) {
		return actionsOf(owner).flatMap(actions -> actions.stream()
				.filter(a -> a.name().equals(action))
				.findFirst());
	}

	/**
	 * The action a call resolves to; unqualified calls resolve against {@code enclosingOwner}.
	 */
	public Optional<ActionDefinition> resolve(ActionCall call, String enclosingOwner) {
		String owner = call.isQualified() ? call.page() : enclosingOwner;
		return owner == null ? Optional.empty() : findAction(owner, call.action());
	}

	/**
	 * Whether running the called action can leave a different tab or frame current.
	 */
	public boolean changesContext(ActionCall call, String enclosingOwner) {
		return resolve(call, enclosingOwner).filter(contextChanging::contains).isPresent();
	}

	public boolean changesFrame(ActionCall call, String enclosingOwner) {
		return resolve(call, enclosingOwner).filter(frameChanging::contains).isPresent();
	}

	/**
	 * Whether the statements switch frames themselves or call an action that does.
	 */
	public boolean reachesFrameChange(List<Statement> statements, String enclosingOwner) {
		return AstWalker.anyMatch(statements, s -> s.changesFrame() || callOf(s)
				.map(call -> changesFrame(call, enclosingOwner))
				.orElse(false));
	}

	private static Optional<ActionCall> callOf(Statement statement) {
		return Optional.ofNullable(AstWalker.references(statement).call());
	}

	/**
	 * Least fixpoint: an action is marked when one of its statements matches {@code direct} or
	 * calls an action that is already marked. Call cycles terminate because marks only grow.
	 */
	private Set<ActionDefinition> reaching(Map<ActionDefinition, String> owners, Predicate<Statement> direct) {
		Set<ActionDefinition> marked = Collections.newSetFromMap(new IdentityHashMap<>());
		owners.keySet().stream()
				.filter(action -> AstWalker.anyMatch(action.statements(), direct))
				.forEach(marked::add);
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Map.Entry<ActionDefinition, String> entry : owners.entrySet()) {
				ActionDefinition action = entry.getKey();
				if (marked.contains(action)) {
					continue;
				}
				boolean reaches = AstWalker.anyMatch(action.statements(), s -> callOf(s)
						.flatMap(call -> resolve(call, entry.getValue()))
						.filter(marked::contains)
						.isPresent());
				if (reaches) {
					marked.add(action);
					changed = true;
				}
			}
		}
		return Collections.unmodifiableSet(marked);
	}
}
