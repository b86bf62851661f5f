package my.spendpilot.app.dispatch;

public record DispatchResult(
		DispatchStatus status,
		int attempts,
		Integer statusCode,
		boolean retryable,
		String responseJson,
		String error
) {
	public static DispatchResult skipped() {
		return new DispatchResult(DispatchStatus.SKIPPED, 0, null, false, null, null);
	}

	public boolean isSuccess() {
		return status == DispatchStatus.SUCCEEDED || status == DispatchStatus.REPLAYED;
	}
}
