package my.spendpilot.app.llm;

public class NoopReasoningClient implements ReasoningClient {
	@Override
	public ReasoningReply proposePlan(String runInputJson) {
		throw new ReasoningRequestException("Reasoning disabled", null, false, null);
	}
}
