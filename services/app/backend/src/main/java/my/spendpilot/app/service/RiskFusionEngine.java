package my.spendpilot.app.service;

import my.spendpilot.app.model.ActionHint;
import my.spendpilot.app.model.AlertSeverity;
import my.spendpilot.app.model.FusionBranch;
import my.spendpilot.app.model.HealthAssessment;
import my.spendpilot.app.model.HealthClass;
import my.spendpilot.app.model.Ranking;
import my.spendpilot.app.model.RiskSignal;
import my.spendpilot.app.model.TrendDelta;
import my.spendpilot.app.model.UnifiedAssessment;
import my.spendpilot.app.model.UnifiedLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Merges a health assessment with the external risk signal. Rules are checked in priority order and the first match wins.
 */
@Service
public class RiskFusionEngine {
	private static final double CRITICAL_CPM_1D = 25.0;
	private static final double CRITICAL_CPM_3D = 15.0;
	private static final double CRITICAL_CPM_7D = 10.0;
	private static final double CRITICAL_CTR_1D = -20.0;
	private static final double CRITICAL_CTR_3D = -15.0;
	private static final double CRITICAL_CTR_7D = -10.0;
	private static final double CRITICAL_FREQUENCY = 2.2;

	private static final double MEDIUM_CPM_3D = 7.0;
	private static final double MEDIUM_CPM_7D = 5.0;
	private static final double MEDIUM_CTR_3D = -10.0;
	private static final double MEDIUM_CTR_7D = -7.0;
	private static final double MEDIUM_FREQUENCY = 1.8;

	private static final double STABLE_CPM_1D = 10.0;
	private static final double STABLE_CPM_3D = 7.0;
	private static final double STABLE_CPM_7D = 5.0;

	public UnifiedAssessment fuse(HealthAssessment health, RiskSignal signal) {
		if (health == null) {
			throw new IllegalArgumentException("Health assessment is required");
		}
		HealthClass healthClass = health.healthClass();
		UnifiedLevel healthLevel = UnifiedLevel.of(healthClass);
		if (signal == null) {
			return new UnifiedAssessment(health.unitId(), healthLevel, AlertSeverity.NONE, ActionHint.NONE,
					"Risk signal unavailable; health score only", false, FusionBranch.PASS_THROUGH, health);
		}
		if (!signal.valid()) {
			String reason = signal.invalidReason() == null || signal.invalidReason().isBlank()
					? "unspecified"
					: signal.invalidReason();
			return new UnifiedAssessment(health.unitId(), healthLevel, AlertSeverity.WARNING, ActionHint.NONE,
					"Risk signal invalid (" + reason + "); health score only", false, FusionBranch.PASS_THROUGH, health);
		}

		List<String> critical = criticalReasons(signal);
		if (!critical.isEmpty()) {
			String joined = String.join(", ", critical);
			if (healthClass.isGoodOrBetter()) {
				return new UnifiedAssessment(health.unitId(), UnifiedLevel.PREVENTIVE_HIGH_RISK, AlertSeverity.WARNING,
						ActionHint.REDUCE_BUDGET_30,
						"Health score is " + healthClass + " but risk signal shows " + joined,
						true, FusionBranch.CRITICAL_OVERRIDE, health);
			}
			return new UnifiedAssessment(health.unitId(), UnifiedLevel.CRITICAL, AlertSeverity.CRITICAL,
					ActionHint.REDUCE_BUDGET_50,
					"Health score " + healthClass + " confirmed by risk signal: " + joined,
					true, FusionBranch.CRITICAL_OVERRIDE, health);
		}

		List<String> medium = mediumReasons(signal);
		if (!medium.isEmpty()) {
			UnifiedLevel level = healthClass == HealthClass.BAD ? UnifiedLevel.BAD : UnifiedLevel.MEDIUM_RISK;
			return new UnifiedAssessment(health.unitId(), level, AlertSeverity.INFO, ActionHint.FREEZE_GROWTH,
					"Early warning: " + String.join(", ", medium),
					true, FusionBranch.MEDIUM_SIGNAL, health);
		}

		if (healthClass.isGoodOrBetter() && isStable(signal) && rankingsHealthy(signal)) {
			return new UnifiedAssessment(health.unitId(), UnifiedLevel.EXCELLENT, AlertSeverity.NONE,
					ActionHint.SCALE_UP_30,
					"Health score " + healthClass + " with stable trends and healthy rankings",
					true, FusionBranch.POSITIVE_CONFIRMATION, health);
		}

		return new UnifiedAssessment(health.unitId(), healthLevel, AlertSeverity.NONE, ActionHint.NONE,
				"Health score " + healthClass + ", no risk override",
				true, FusionBranch.DEFAULT, health);
	}

	private List<String> criticalReasons(RiskSignal signal) {
		List<String> reasons = new ArrayList<>();
		if (signal.rankings().stream().anyMatch(Ranking::isBottomDecile)) {
			reasons.add("bottom-decile ranking");
		}
		TrendDelta d1 = signal.day1();
		TrendDelta d3 = signal.day3();
		TrendDelta d7 = signal.day7();
		if (d1.cpmChangePct() > CRITICAL_CPM_1D || d1.ctrChangePct() < CRITICAL_CTR_1D) {
			reasons.add("1d trend " + formatTrend(d1));
		}
		if (d3.cpmChangePct() > CRITICAL_CPM_3D || d3.ctrChangePct() < CRITICAL_CTR_3D) {
			reasons.add("3d trend " + formatTrend(d3));
		}
		if (d7.cpmChangePct() > CRITICAL_CPM_7D || d7.ctrChangePct() < CRITICAL_CTR_7D) {
			reasons.add("7d trend " + formatTrend(d7));
		}
		if (signal.frequency7d() > CRITICAL_FREQUENCY) {
			reasons.add("frequency " + formatNumber(signal.frequency7d()));
		}
		return reasons;
	}

	private List<String> mediumReasons(RiskSignal signal) {
		List<String> reasons = new ArrayList<>();
		if (signal.rankings().stream().anyMatch(Ranking::isBelowAverage)) {
			reasons.add("below-average ranking");
		}
		TrendDelta d3 = signal.day3();
		TrendDelta d7 = signal.day7();
		if (d3.cpmChangePct() > MEDIUM_CPM_3D || d3.ctrChangePct() < MEDIUM_CTR_3D) {
			reasons.add("3d trend " + formatTrend(d3));
		}
		if (d7.cpmChangePct() > MEDIUM_CPM_7D || d7.ctrChangePct() < MEDIUM_CTR_7D) {
			reasons.add("7d trend " + formatTrend(d7));
		}
		if (signal.frequency7d() > MEDIUM_FREQUENCY) {
			reasons.add("frequency " + formatNumber(signal.frequency7d()));
		}
		return reasons;
	}

	private boolean isStable(RiskSignal signal) {
		return Math.abs(signal.day1().cpmChangePct()) < STABLE_CPM_1D
				&& Math.abs(signal.day3().cpmChangePct()) < STABLE_CPM_3D
				&& Math.abs(signal.day7().cpmChangePct()) < STABLE_CPM_7D
				&& signal.frequency7d() < MEDIUM_FREQUENCY;
	}

	private boolean rankingsHealthy(RiskSignal signal) {
		return signal.rankings().stream().allMatch(Ranking::isAverageOrBetter);
	}

	private static String formatTrend(TrendDelta delta) {
		return "cpm " + formatNumber(delta.cpmChangePct()) + "%, ctr " + formatNumber(delta.ctrChangePct()) + "%";
	}

	private static String formatNumber(double value) {
		return String.format(Locale.ROOT, "%+.1f", value);
	}
}
