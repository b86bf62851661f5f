package my.spendpilot.app.llm;

/**
 * Optional advisory collaborator that may propose an alternative action plan.
 */
public interface ReasoningClient {
	/**
	 * Sends the structured run input and returns the raw JSON plan text.
	 */
	ReasoningReply proposePlan(String runInputJson);
}
