package my.spendpilot.app.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the metrics aggregator knows about one tenant's ad account for the current run.
 */
public record TenantSnapshot(
		String tenantId,
		String adAccountId,
		List<AdServingUnit> units,
		List<Direction> directions,
		List<UnitMetrics> metrics,
		List<CreativeAsset> assets
) {
	public TenantSnapshot {
		units = units == null ? List.of() : List.copyOf(units);
		directions = directions == null ? List.of() : List.copyOf(directions);
		metrics = metrics == null ? List.of() : List.copyOf(metrics);
		assets = assets == null ? List.of() : List.copyOf(assets);
	}

	public boolean hasSpend() {
		return metrics.stream().anyMatch(UnitMetrics::hasAnySpend);
	}

	/**
	 * Per-run arena keyed by unit id.
	 */
	public Map<String, UnitMetrics> metricsByUnit() {
		Map<String, UnitMetrics> byUnit = new LinkedHashMap<>();
		for (UnitMetrics unitMetrics : metrics) {
			if (unitMetrics != null && unitMetrics.unitId() != null) {
				byUnit.put(unitMetrics.unitId(), unitMetrics);
			}
		}
		return byUnit;
	}
}
