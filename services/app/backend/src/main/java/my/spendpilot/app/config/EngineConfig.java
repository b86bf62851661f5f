package my.spendpilot.app.config;

import my.spendpilot.app.model.EngineSettings;
import my.spendpilot.app.model.HealthScoreSettings;
import my.spendpilot.app.model.RebalanceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Merges the built-in engine thresholds with the {@code app.engine} overrides into one immutable value.
 */
@Configuration
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	@Bean
	public EngineSettings engineSettings(AppProperties properties) {
		EngineSettings settings = merge(properties.engine());
		RebalanceSettings rebalance = settings.rebalance();
		if (rebalance.minBudgetCents() <= 0 || rebalance.minBudgetCents() > rebalance.maxBudgetCents()) {
			throw new IllegalStateException("app.engine budget bounds are inconsistent: min="
					+ rebalance.minBudgetCents() + ", max=" + rebalance.maxBudgetCents());
		}
		if (rebalance.newUnitMinCents() > rebalance.newUnitMaxCents()) {
			throw new IllegalStateException("app.engine new unit bounds are inconsistent");
		}
		logger.info("Engine settings: budget [{}, {}], step up {}, step down {}, max actions {}",
				rebalance.minBudgetCents(), rebalance.maxBudgetCents(),
				rebalance.maxStepUp(), rebalance.maxStepDown(), rebalance.maxActions());
		return settings;
	}

	static EngineSettings merge(AppProperties.Engine overrides) {
		HealthScoreSettings health = HealthScoreSettings.defaults();
		RebalanceSettings rebalance = RebalanceSettings.defaults();
		if (overrides == null) {
			return new EngineSettings(health, rebalance);
		}
		HealthScoreSettings mergedHealth = new HealthScoreSettings(
				pick(overrides.costGapWeight(), health.costGapWeight()),
				health.smallCostGapBonus(),
				pick(overrides.trendWeight(), health.trendWeight()),
				pick(overrides.ctrPenalty(), health.ctrPenalty()),
				pick(overrides.cpmPenalty(), health.cpmPenalty()),
				pick(overrides.frequencyPenalty(), health.frequencyPenalty()),
				pick(overrides.ctrFloorPct(), health.ctrFloorPct()),
				health.cpmPeerMultiplier(),
				pick(overrides.frequencyCeiling(), health.frequencyCeiling()),
				health.fullConfidenceImpressions(),
				health.lowConfidenceImpressions(),
				health.minConfidenceFactor(),
				health.todayMinImpressions(),
				health.qualityMinResults(),
				health.veryGoodThreshold(),
				health.goodThreshold(),
				health.neutralThreshold(),
				health.slightlyBadThreshold(),
				health.scoreLimit()
		);
		RebalanceSettings mergedRebalance = new RebalanceSettings(
				pick(overrides.minBudgetCents(), rebalance.minBudgetCents()),
				pick(overrides.maxBudgetCents(), rebalance.maxBudgetCents()),
				pick(overrides.maxStepUp(), rebalance.maxStepUp()),
				pick(overrides.maxStepDown(), rebalance.maxStepDown()),
				rebalance.corridorLow(),
				rebalance.corridorHigh(),
				pick(overrides.newUnitMinCents(), rebalance.newUnitMinCents()),
				pick(overrides.newUnitMaxCents(), rebalance.newUnitMaxCents()),
				rebalance.maxAssetsPerNewUnit(),
				rebalance.maxNewUnitsPerDirection(),
				rebalance.readyAssetMaxCostRatio(),
				rebalance.eaterSpendShare(),
				rebalance.eaterCostRatio(),
				rebalance.underspendIncrease(),
				rebalance.pauseCostRatio(),
				pick(overrides.maxActions(), rebalance.maxActions())
		);
		return new EngineSettings(mergedHealth, mergedRebalance);
	}

	private static int pick(Integer value, int fallback) {
		return value == null ? fallback : value;
	}

	private static long pick(Long value, long fallback) {
		return value == null ? fallback : value;
	}

	private static double pick(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
