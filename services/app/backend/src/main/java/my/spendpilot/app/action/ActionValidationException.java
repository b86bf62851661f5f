package my.spendpilot.app.action;

/**
 * A proposed action is malformed. Aborts the whole batch it belongs to.
 */
public class ActionValidationException extends RuntimeException {
	private final String actionType;

	public ActionValidationException(String actionType, String message) {
		super(actionType == null ? message : actionType + ": " + message);
		this.actionType = actionType;
	}

	public String getActionType() {
		return actionType;
	}
}
