package my.spendpilot.app.model;

public enum AssetState {
	UNUSED,
	READY
}
