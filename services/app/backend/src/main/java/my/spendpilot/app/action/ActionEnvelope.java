package my.spendpilot.app.action;

import java.util.Map;

/**
 * Wire form of an action: {@code {type, params}}.
 */
public record ActionEnvelope(String type, Map<String, Object> params) {
	public ActionEnvelope {
		params = params == null ? Map.of() : params;
	}
}
