package my.spendpilot.app.config;

import my.spendpilot.app.model.EngineSettings;
import my.spendpilot.app.model.HealthScoreSettings;
import my.spendpilot.app.model.RebalanceSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {
	private final EngineConfig config = new EngineConfig();

	@Test
	void missingOverridesKeepDefaults() {
		EngineSettings settings = config.engineSettings(properties(null));

		assertThat(settings).isEqualTo(EngineSettings.defaults());
	}

	@Test
	void overridesReplaceOnlyTheGivenValues() {
		AppProperties.Engine engine = new AppProperties.Engine(50, null, null, null, null, 1.5, null,
				500L, 20_000L, null, null, null, null, 10);

		EngineSettings settings = config.engineSettings(properties(engine));

		HealthScoreSettings health = settings.health();
		RebalanceSettings rebalance = settings.rebalance();
		assertThat(health.costGapWeight()).isEqualTo(50);
		assertThat(health.trendWeight()).isEqualTo(15);
		assertThat(health.ctrFloorPct()).isEqualTo(1.5);
		assertThat(rebalance.minBudgetCents()).isEqualTo(500);
		assertThat(rebalance.maxBudgetCents()).isEqualTo(20_000);
		assertThat(rebalance.maxStepUp()).isEqualTo(0.30);
		assertThat(rebalance.maxActions()).isEqualTo(10);
	}

	@Test
	void inconsistentBudgetBoundsFailStartup() {
		AppProperties.Engine engine = new AppProperties.Engine(null, null, null, null, null, null, null,
				5_000L, 1_000L, null, null, null, null, null);

		assertThatThrownBy(() -> config.engineSettings(properties(engine)))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("min=5000");
	}

	@Test
	void inconsistentNewUnitBoundsFailStartup() {
		AppProperties.Engine engine = new AppProperties.Engine(null, null, null, null, null, null, null,
				null, null, null, null, 3_000L, 2_000L, null);

		assertThatThrownBy(() -> config.engineSettings(properties(engine)))
				.isInstanceOf(IllegalStateException.class);
	}

	private static AppProperties properties(AppProperties.Engine engine) {
		return new AppProperties(null, null, engine, null, null, null, null, null);
	}
}
