package my.spendpilot.app.llm;

/**
 * The reasoning service answered, but the answer is not a usable plan.
 */
public class ReasoningOutputException extends RuntimeException {
	public ReasoningOutputException(String message) {
		super(message);
	}

	public ReasoningOutputException(String message, Throwable cause) {
		super(message, cause);
	}
}
