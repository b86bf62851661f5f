package my.spendpilot.app.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.spendpilot.app.action.ActionEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks reasoning output against the plan schema and turns it into action envelopes.
 * Types are not checked here; the action validator drops the unknown ones.
 */
@Component
public class ReasoningPlanParser {
	private static final Logger logger = LoggerFactory.getLogger(ReasoningPlanParser.class);
	static final String PLAN_SCHEMA_JSON = """
			{
			  "$schema": "https://json-schema.org/draft/2020-12/schema",
			  "type": "object",
			  "required": ["actions"],
			  "properties": {
			    "note": {"type": ["string", "null"]},
			    "actions": {
			      "type": "array",
			      "items": {
			        "type": "object",
			        "required": ["type", "params"],
			        "properties": {
			          "type": {"type": "string", "minLength": 1},
			          "params": {"type": "object"}
			        }
			      }
			    }
			  }
			}
			""";

	private final ObjectMapper objectMapper;
	private final JsonSchema planSchema;

	public ReasoningPlanParser() {
		this.objectMapper = new ObjectMapper();
		this.planSchema = buildPlanSchema(objectMapper);
	}

	public ReasoningPlan parse(String raw) {
		JsonNode root = parseJson(raw);
		Set<ValidationMessage> errors = planSchema.validate(root);
		if (!errors.isEmpty()) {
			String summary = errors.stream()
					.map(ValidationMessage::getMessage)
					.sorted()
					.collect(Collectors.joining("; "));
			throw new ReasoningOutputException("Plan JSON did not match schema: " + summary);
		}
		JsonNode noteNode = root.get("note");
		String note = noteNode == null || noteNode.isNull() ? null : noteNode.asText();
		List<ActionEnvelope> actions = new ArrayList<>();
		for (JsonNode item : root.get("actions")) {
			Map<String, Object> params = objectMapper.convertValue(item.get("params"),
					new TypeReference<Map<String, Object>>() {});
			actions.add(new ActionEnvelope(item.get("type").asText(), params));
		}
		return new ReasoningPlan(note, actions);
	}

	private JsonNode parseJson(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new ReasoningOutputException("Empty plan output");
		}
		String trimmed = stripFences(raw.trim());
		try {
			return objectMapper.readTree(trimmed);
		} catch (Exception ex) {
			throw new ReasoningOutputException("Plan output is not valid JSON", ex);
		}
	}

	private String stripFences(String value) {
		if (!value.startsWith("```")) {
			return value;
		}
		int firstNewline = value.indexOf('\n');
		int lastFence = value.lastIndexOf("```");
		if (firstNewline < 0 || lastFence <= firstNewline) {
			return value;
		}
		return value.substring(firstNewline + 1, lastFence).trim();
	}

	private JsonSchema buildPlanSchema(ObjectMapper mapper) {
		try {
			JsonNode schemaNode = mapper.readTree(PLAN_SCHEMA_JSON);
			return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
		} catch (Exception ex) {
			logger.error("Failed to load reasoning plan JSON schema", ex);
			throw new IllegalStateException("Failed to load reasoning plan schema");
		}
	}
}
