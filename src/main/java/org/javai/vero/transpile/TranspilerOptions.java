package org.javai.vero.transpile;

import java.util.Objects;

/**
 * Code generation settings. Timeouts apply to the emitted tab-management code.
 *
 * @param newTabTimeoutMs how long {@code switch to new tab} waits for a tab opened by the page
 * @param switchTabTimeoutMs how long {@code switch to tab} waits for the requested index to exist
 * @param tabPollIntervalMs poll interval of the tab-index wait
 * @param pageObjectDir directory of page object modules, relative to the generated tests
 * @param pageActionsDir directory of page-actions modules, relative to the generated tests
 * @param evidenceScreenshot whether every scenario ends with an evidence screenshot step
 */
public record TranspilerOptions(long newTabTimeoutMs, long switchTabTimeoutMs, long tabPollIntervalMs,
		String pageObjectDir, String pageActionsDir, boolean evidenceScreenshot) {

	public static final long DEFAULT_NEW_TAB_TIMEOUT_MS = 5000;
	public static final long DEFAULT_SWITCH_TAB_TIMEOUT_MS = 5000;
	public static final long DEFAULT_TAB_POLL_INTERVAL_MS = 150;
	public static final String DEFAULT_PAGE_OBJECT_DIR = "pages";
	public static final String DEFAULT_PAGE_ACTIONS_DIR = "pageActions";

	public TranspilerOptions {
		requirePositive(newTabTimeoutMs, "newTabTimeoutMs");
		requirePositive(switchTabTimeoutMs, "switchTabTimeoutMs");
		requirePositive(tabPollIntervalMs, "tabPollIntervalMs");
		Objects.requireNonNull(pageObjectDir, "pageObjectDir must not be null");
		Objects.requireNonNull(pageActionsDir, "pageActionsDir must not be null");
	}

	public static TranspilerOptions defaults() {
		return new TranspilerOptions(DEFAULT_NEW_TAB_TIMEOUT_MS, DEFAULT_SWITCH_TAB_TIMEOUT_MS,
				DEFAULT_TAB_POLL_INTERVAL_MS, DEFAULT_PAGE_OBJECT_DIR, DEFAULT_PAGE_ACTIONS_DIR, true);
	}

	public TranspilerOptions withEvidenceScreenshot(boolean enabled) {
		return new TranspilerOptions(newTabTimeoutMs, switchTabTimeoutMs, tabPollIntervalMs, pageObjectDir,
				pageActionsDir, enabled);
	}

	public TranspilerOptions withNewTabTimeoutMs(long timeoutMs) {
		return new TranspilerOptions(timeoutMs, switchTabTimeoutMs, tabPollIntervalMs, pageObjectDir,
				pageActionsDir, evidenceScreenshot);
	}

	private static void requirePositive(long value, String name) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive but was " + value);
		}
	}
}
