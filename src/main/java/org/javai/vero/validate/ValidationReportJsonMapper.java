package org.javai.vero.validate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Converts a {@link ValidationResult} into the JSON report consumed by editor tooling.
 */
public final class ValidationReportJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ValidationReportJsonMapper() {
	}

	public static ObjectNode toJson(ValidationResult result) {
		ObjectNode node = mapper.createObjectNode();
		node.put("valid", result.valid());
		node.put("errorCount", result.errorCount());
		node.set("errors", toJsonArray(result.errors()));
		node.set("warnings", toJsonArray(result.warnings()));
		return node;
	}

	public static ArrayNode toJsonArray(List<Diagnostic> diagnostics) {
		ArrayNode array = mapper.createArrayNode();
		for (Diagnostic diagnostic : diagnostics) {
			ObjectNode dNode = array.addObject();
			dNode.put("code", diagnostic.code().name());
			dNode.put("severity", diagnostic.severity().name());
			dNode.put("message", diagnostic.message());
			dNode.put("line", diagnostic.line());
			if (diagnostic.hasSuggestions()) {
				ArrayNode suggestions = dNode.putArray("suggestions");
				diagnostic.suggestions().forEach(suggestions::add);
			}
		}
		return array;
	}

	public static String toJsonString(ValidationResult result) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render validation report: " + e.getMessage(), e);
		}
	}
}
