package my.spendpilot.app.service;

import my.spendpilot.app.model.ActionHint;
import my.spendpilot.app.model.AlertSeverity;
import my.spendpilot.app.model.FusionBranch;
import my.spendpilot.app.model.HealthAssessment;
import my.spendpilot.app.model.HealthClass;
import my.spendpilot.app.model.HealthDiagnostics;
import my.spendpilot.app.model.Ranking;
import my.spendpilot.app.model.RiskSignal;
import my.spendpilot.app.model.TrendDelta;
import my.spendpilot.app.model.UnifiedAssessment;
import my.spendpilot.app.model.UnifiedLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskFusionEngineTest {
	private final RiskFusionEngine engine = new RiskFusionEngine();

	@Test
	void missingSignalPassesHealthThrough() {
		UnifiedAssessment result = engine.fuse(health(HealthClass.GOOD), null);

		assertThat(result.level()).isEqualTo(UnifiedLevel.GOOD);
		assertThat(result.alert()).isEqualTo(AlertSeverity.NONE);
		assertThat(result.scoringAvailable()).isFalse();
		assertThat(result.branch()).isEqualTo(FusionBranch.PASS_THROUGH);
	}

	@Test
	void invalidSignalWarnsAndFallsBackToHealth() {
		RiskSignal invalid = new RiskSignal("u1", 0, false, "stale data", null, null, null,
				null, null, null, 0.0, null);

		UnifiedAssessment result = engine.fuse(health(HealthClass.SLIGHTLY_BAD), invalid);

		assertThat(result.level()).isEqualTo(UnifiedLevel.SLIGHTLY_BAD);
		assertThat(result.alert()).isEqualTo(AlertSeverity.WARNING);
		assertThat(result.scoringAvailable()).isFalse();
		assertThat(result.reasoning()).contains("stale data");
	}

	@Test
	void criticalSignalOnHealthyUnitIsPreventive() {
		RiskSignal signal = signal(new TrendDelta(30.0, 0.0), TrendDelta.flat(), TrendDelta.flat(),
				Ranking.AVERAGE, 1.0);

		UnifiedAssessment result = engine.fuse(health(HealthClass.VERY_GOOD), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.PREVENTIVE_HIGH_RISK);
		assertThat(result.alert()).isEqualTo(AlertSeverity.WARNING);
		assertThat(result.hint()).isEqualTo(ActionHint.REDUCE_BUDGET_30);
		assertThat(result.branch()).isEqualTo(FusionBranch.CRITICAL_OVERRIDE);
	}

	@Test
	void criticalSignalOnWeakUnitIsCritical() {
		RiskSignal signal = signal(TrendDelta.flat(), TrendDelta.flat(), TrendDelta.flat(),
				Ranking.BELOW_AVERAGE_10, 1.0);

		UnifiedAssessment result = engine.fuse(health(HealthClass.NEUTRAL), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.CRITICAL);
		assertThat(result.alert()).isEqualTo(AlertSeverity.CRITICAL);
		assertThat(result.hint()).isEqualTo(ActionHint.REDUCE_BUDGET_50);
		assertThat(result.reasoning()).contains("bottom-decile ranking");
	}

	@Test
	void criticalWinsOverMediumReasons() {
		RiskSignal signal = signal(TrendDelta.flat(), new TrendDelta(8.0, 0.0), TrendDelta.flat(),
				Ranking.AVERAGE, 2.5);

		UnifiedAssessment result = engine.fuse(health(HealthClass.BAD), signal);

		assertThat(result.branch()).isEqualTo(FusionBranch.CRITICAL_OVERRIDE);
		assertThat(result.level()).isEqualTo(UnifiedLevel.CRITICAL);
	}

	@Test
	void mediumSignalFreezesGrowth() {
		RiskSignal signal = signal(TrendDelta.flat(), TrendDelta.flat(), new TrendDelta(6.0, 0.0),
				Ranking.AVERAGE, 1.0);

		UnifiedAssessment result = engine.fuse(health(HealthClass.GOOD), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.MEDIUM_RISK);
		assertThat(result.alert()).isEqualTo(AlertSeverity.INFO);
		assertThat(result.hint()).isEqualTo(ActionHint.FREEZE_GROWTH);
		assertThat(result.branch()).isEqualTo(FusionBranch.MEDIUM_SIGNAL);
	}

	@Test
	void mediumSignalKeepsBadUnitsBad() {
		RiskSignal signal = signal(TrendDelta.flat(), TrendDelta.flat(), TrendDelta.flat(),
				Ranking.BELOW_AVERAGE_35, 1.0);

		UnifiedAssessment result = engine.fuse(health(HealthClass.BAD), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.BAD);
		assertThat(result.branch()).isEqualTo(FusionBranch.MEDIUM_SIGNAL);
	}

	@Test
	void stableSignalConfirmsGoodUnit() {
		RiskSignal signal = signal(new TrendDelta(3.0, 1.0), new TrendDelta(-2.0, 0.5), new TrendDelta(1.0, 0.0),
				Ranking.ABOVE_AVERAGE, 1.2);

		UnifiedAssessment result = engine.fuse(health(HealthClass.GOOD), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.EXCELLENT);
		assertThat(result.hint()).isEqualTo(ActionHint.SCALE_UP_30);
		assertThat(result.branch()).isEqualTo(FusionBranch.POSITIVE_CONFIRMATION);
	}

	@Test
	void unknownRankingBlocksPositiveConfirmation() {
		RiskSignal signal = signal(TrendDelta.flat(), TrendDelta.flat(), TrendDelta.flat(),
				Ranking.UNKNOWN, 1.0);

		UnifiedAssessment result = engine.fuse(health(HealthClass.VERY_GOOD), signal);

		assertThat(result.level()).isEqualTo(UnifiedLevel.VERY_GOOD);
		assertThat(result.branch()).isEqualTo(FusionBranch.DEFAULT);
		assertThat(result.scoringAvailable()).isTrue();
	}

	private static HealthAssessment health(HealthClass healthClass) {
		return new HealthAssessment("u1", 0, healthClass,
				new HealthDiagnostics(100.0, 1.0, 0, 0.0, 0, 0, 1.0, List.of()));
	}

	private static RiskSignal signal(TrendDelta d1, TrendDelta d3, TrendDelta d7, Ranking ranking, double frequency) {
		return new RiskSignal("u1", 10, true, null, d1, d3, d7, ranking, ranking, ranking, frequency, null);
	}
}
