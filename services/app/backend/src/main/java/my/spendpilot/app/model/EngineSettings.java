package my.spendpilot.app.model;

public record EngineSettings(HealthScoreSettings health, RebalanceSettings rebalance) {
	public static EngineSettings defaults() {
		return new EngineSettings(HealthScoreSettings.defaults(), RebalanceSettings.defaults());
	}
}
