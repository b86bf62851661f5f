package my.spendpilot.app.service;

import my.spendpilot.app.model.HealthAssessment;
import my.spendpilot.app.model.HealthClass;
import my.spendpilot.app.model.HealthDiagnostics;
import my.spendpilot.app.model.HealthScoreSettings;
import my.spendpilot.app.model.MetricsWindow;
import my.spendpilot.app.model.Objective;
import my.spendpilot.app.model.UnitMetrics;
import my.spendpilot.app.model.WindowKey;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Scores one unit's recent cost efficiency from its windowed metrics.
 */
@Service
public class HealthScoreEngine {

	public HealthAssessment assess(HealthScoreInput input, HealthScoreSettings settings) {
		if (input == null || input.metrics() == null) {
			throw new IllegalArgumentException("Health score input requires unit metrics");
		}
		HealthScoreSettings config = settings == null ? HealthScoreSettings.defaults() : settings;
		UnitMetrics metrics = input.metrics();
		MetricsWindow yesterday = metrics.window(WindowKey.YESTERDAY);
		List<String> notes = new ArrayList<>();

		double costYesterday = effectiveCost(yesterday, input.objective(), config);
		Double costRatio = null;
		int costGap = 0;
		if (input.targetCostCents() > 0) {
			costRatio = costYesterday / input.targetCostCents();
			costGap = costGapPoints(costRatio, config);
			notes.add("cost_ratio=" + formatRatio(costRatio));
		}

		double trend = trendPoints(metrics, input.objective(), config, notes);
		int diagnostic = diagnosticPenalty(metrics, input.peerMedianCpm(), config, notes);
		int today = todayCompensation(metrics, input.objective(), costYesterday, costGap, config, notes);

		double raw = costGap + trend + diagnostic + today;
		double volumeFactor = 1.0;
		if (yesterday.impressions() < config.fullConfidenceImpressions()) {
			volumeFactor = volumeFactor(yesterday.impressions(), config);
			raw = raw * volumeFactor;
			notes.add("volume_factor=" + formatRatio(volumeFactor));
		}
		int score = (int) Math.round(raw);
		score = Math.max(-config.scoreLimit(), Math.min(config.scoreLimit(), score));
		HealthClass healthClass = config.classify(score);

		HealthDiagnostics diagnostics = new HealthDiagnostics(
				costYesterday,
				costRatio,
				costGap,
				trend,
				diagnostic,
				today,
				volumeFactor,
				notes
		);
		return new HealthAssessment(input.unitId(), score, healthClass, diagnostics);
	}

	/**
	 * Spend per result. A window without results costs infinitely much.
	 */
	public static double effectiveCost(MetricsWindow window, Objective objective, HealthScoreSettings settings) {
		if (window == null) {
			return Double.POSITIVE_INFINITY;
		}
		long results = objective == null ? 0 : objective.results(window.conversions(), settings.qualityMinResults());
		if (results <= 0) {
			return Double.POSITIVE_INFINITY;
		}
		return (double) window.spendCents() / results;
	}

	/**
	 * Median CPM of yesterday's windows that actually delivered.
	 */
	public static double peerMedianCpm(Collection<UnitMetrics> peers) {
		if (peers == null || peers.isEmpty()) {
			return 0.0;
		}
		List<Double> values = new ArrayList<>();
		for (UnitMetrics peer : peers) {
			if (peer == null) {
				continue;
			}
			MetricsWindow yesterday = peer.window(WindowKey.YESTERDAY);
			if (yesterday.impressions() > 0 && yesterday.cpmCents() > 0) {
				values.add(yesterday.cpmCents());
			}
		}
		if (values.isEmpty()) {
			return 0.0;
		}
		values.sort(Double::compareTo);
		int middle = values.size() / 2;
		if (values.size() % 2 == 1) {
			return values.get(middle);
		}
		return (values.get(middle - 1) + values.get(middle)) / 2.0;
	}

	static int costGapPoints(double ratio, HealthScoreSettings settings) {
		int max = settings.costGapWeight();
		int twoThirds = (int) Math.round(max * 2.0 / 3.0);
		if (ratio <= 0.7) {
			return max;
		}
		if (ratio <= 0.9) {
			return twoThirds;
		}
		if (ratio <= 1.1) {
			return settings.smallCostGapBonus();
		}
		if (ratio <= 1.3) {
			return -twoThirds;
		}
		return -max;
	}

	static double volumeFactor(long impressions, HealthScoreSettings settings) {
		long full = settings.fullConfidenceImpressions();
		long low = settings.lowConfidenceImpressions();
		double min = settings.minConfidenceFactor();
		if (impressions >= full) {
			return 1.0;
		}
		if (impressions <= low || full <= low) {
			return min;
		}
		return min + (1.0 - min) * (impressions - low) / (double) (full - low);
	}

	private double trendPoints(UnitMetrics metrics, Objective objective, HealthScoreSettings settings, List<String> notes) {
		double cost3 = effectiveCost(metrics.window(WindowKey.LAST_3D), objective, settings);
		double cost7 = effectiveCost(metrics.window(WindowKey.LAST_7D), objective, settings);
		double cost30 = effectiveCost(metrics.window(WindowKey.LAST_30D), objective, settings);
		double trend = 0.0;
		if (Double.isFinite(cost3) && Double.isFinite(cost7)) {
			double points = cost3 < cost7 ? settings.trendWeight() : -settings.trendWeight() / 2.0;
			trend += points;
			notes.add(points > 0 ? "trend_3d_improving" : "trend_3d_worsening");
		}
		if (Double.isFinite(cost7) && Double.isFinite(cost30)) {
			double points = cost7 < cost30 ? settings.trendWeight() : -settings.trendWeight() / 2.0;
			trend += points;
			notes.add(points > 0 ? "trend_7d_improving" : "trend_7d_worsening");
		}
		return trend;
	}

	private int diagnosticPenalty(UnitMetrics metrics, double peerMedianCpm, HealthScoreSettings settings, List<String> notes) {
		MetricsWindow yesterday = metrics.window(WindowKey.YESTERDAY);
		MetricsWindow month = metrics.window(WindowKey.LAST_30D);
		int penalty = 0;
		if (yesterday.impressions() > 0 && yesterday.ctrPct() < settings.ctrFloorPct()) {
			penalty -= settings.ctrPenalty();
			notes.add("low_ctr");
		}
		if (peerMedianCpm > 0 && yesterday.cpmCents() > peerMedianCpm * settings.cpmPeerMultiplier()) {
			penalty -= settings.cpmPenalty();
			notes.add("high_cpm");
		}
		if (month.frequency() > settings.frequencyCeiling()) {
			penalty -= settings.frequencyPenalty();
			notes.add("high_frequency");
		}
		return penalty;
	}

	private int todayCompensation(UnitMetrics metrics,
								  Objective objective,
								  double costYesterday,
								  int costGap,
								  HealthScoreSettings settings,
								  List<String> notes) {
		MetricsWindow today = metrics.window(WindowKey.TODAY);
		if (today.impressions() < settings.todayMinImpressions()) {
			return 0;
		}
		double costToday = effectiveCost(today, objective, settings);
		if (!Double.isFinite(costToday) || !Double.isFinite(costYesterday) || costYesterday <= 0) {
			return 0;
		}
		int penalty = Math.abs(Math.min(0, costGap));
		double ratio = costToday / costYesterday;
		int compensation = 0;
		if (ratio <= 0.5) {
			compensation = penalty + 15;
		} else if (ratio <= 0.7) {
			compensation = (int) Math.round(penalty * 0.6) + 10;
		} else if (ratio <= 0.9) {
			compensation = 5;
		}
		if (compensation > 0) {
			notes.add("today_compensation=" + compensation);
		}
		return compensation;
	}

	private static String formatRatio(double value) {
		if (!Double.isFinite(value)) {
			return "inf";
		}
		return String.format(Locale.ROOT, "%.2f", value);
	}

	public record HealthScoreInput(
			String unitId,
			Objective objective,
			UnitMetrics metrics,
			long targetCostCents,
			double peerMedianCpm
	) {
	}
}
