package org.javai.vero.config;

import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.javai.vero.transpile.TranspilerOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@code vero.yml} configuration files.
 * Keys that are absent fall back to {@link VeroConfig#defaults()}.
 */
public class VeroConfigLoader {

	public static final String DEFAULTS_RESOURCE = "META-INF/vero-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load the defaults bundled on the classpath.
	 */
	public VeroConfig loadDefaults() {
		ClassLoader loader = VeroConfigLoader.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				throw new VeroConfigException("Missing classpath resource: " + DEFAULTS_RESOURCE);
			}
			return parse(in);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read classpath resource: " + DEFAULTS_RESOURCE, e);
		}
	}

	/**
	 * Parse a configuration file from a path.
	 */
	public VeroConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to read configuration from path: " + path, e);
		}
	}

	/**
	 * Parse configuration from an input stream.
	 */
	public VeroConfig parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildConfig(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to parse configuration from input stream", e);
		}
	}

	/**
	 * Parse configuration from a reader.
	 */
	public VeroConfig parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildConfig(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to parse configuration from reader", e);
		}
	}

	/**
	 * Parse configuration from a string.
	 */
	public VeroConfig parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildConfig(data);
		} catch (VeroConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new VeroConfigException("Failed to parse configuration from string", e);
		}
	}

	private VeroConfig buildConfig(Map<String, Object> data) {
		VeroConfig defaults = VeroConfig.defaults();
		if (data == null) {
			return defaults;
		}
		Map<String, Object> transpilerMap = section(data, "transpiler");
		Map<String, Object> validatorMap = section(data, "validator");

		TranspilerOptions base = defaults.transpiler();
		TranspilerOptions transpiler;
		try {
			transpiler = new TranspilerOptions(
				toLong(transpilerMap, "new_tab_timeout_ms", base.newTabTimeoutMs()),
				toLong(transpilerMap, "switch_tab_timeout_ms", base.switchTabTimeoutMs()),
				toLong(transpilerMap, "tab_poll_interval_ms", base.tabPollIntervalMs()),
				toString(transpilerMap, "page_object_dir", base.pageObjectDir()),
				toString(transpilerMap, "page_actions_dir", base.pageActionsDir()),
				toBoolean(transpilerMap, "evidence_screenshot", base.evidenceScreenshot())
			);
		} catch (IllegalArgumentException e) {
			throw new VeroConfigException("Invalid transpiler configuration: " + e.getMessage(), e);
		}

		int maxSuggestions = toInt(validatorMap, "max_suggestions", defaults.maxSuggestions());
		int maxDistance = toInt(validatorMap, "max_suggestion_distance", defaults.maxSuggestionDistance());
		if (maxSuggestions < 0 || maxDistance < 0) {
			throw new VeroConfigException("validator.max_suggestions and validator.max_suggestion_distance must not be negative");
		}
		return new VeroConfig(transpiler, maxSuggestions, maxDistance);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Map<String, Object> data, String name) {
		Object value = data.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new VeroConfigException("Section '" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private long toLong(Map<String, Object> map, String key, long fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Number)) {
			throw new VeroConfigException("'" + key + "' must be a number but was: " + value);
		}
		try {
			return new BigDecimal(value.toString()).longValueExact();
		} catch (ArithmeticException | NumberFormatException e) {
			throw new VeroConfigException("'" + key + "' must be a whole number in range but was: " + value, e);
		}
	}

	private int toInt(Map<String, Object> map, String key, int fallback) {
		long value = toLong(map, key, fallback);
		try {
			return Math.toIntExact(value);
		} catch (ArithmeticException e) {
			throw new VeroConfigException("'" + key + "' is out of range: " + value, e);
		}
	}

	private String toString(Map<String, Object> map, String key, String fallback) {
		Object value = map.get(key);
		return value != null ? value.toString() : fallback;
	}

	private boolean toBoolean(Map<String, Object> map, String key, boolean fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Boolean)) {
			throw new VeroConfigException("'" + key + "' must be true or false but was: " + value);
		}
		return (Boolean) value;
	}
}
