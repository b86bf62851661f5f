package my.spendpilot.app.model;

public enum WindowKey {
	YESTERDAY,
	LAST_3D,
	LAST_7D,
	LAST_30D,
	TODAY
}
