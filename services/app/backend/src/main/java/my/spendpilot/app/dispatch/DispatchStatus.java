package my.spendpilot.app.dispatch;

public enum DispatchStatus {
	SUCCEEDED,
	REPLAYED,
	FAILED,
	SKIPPED
}
