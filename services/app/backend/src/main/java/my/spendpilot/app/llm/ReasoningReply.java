package my.spendpilot.app.llm;

public record ReasoningReply(String output, String model) {
}
