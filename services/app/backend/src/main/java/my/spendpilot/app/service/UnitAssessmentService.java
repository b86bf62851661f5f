package my.spendpilot.app.service;

import my.spendpilot.app.model.AdServingUnit;
import my.spendpilot.app.model.Direction;
import my.spendpilot.app.model.HealthAssessment;
import my.spendpilot.app.model.HealthScoreSettings;
import my.spendpilot.app.model.RiskSignal;
import my.spendpilot.app.model.TenantSnapshot;
import my.spendpilot.app.model.UnifiedAssessment;
import my.spendpilot.app.model.UnitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every active unit of a snapshot and fuses the score with the unit's risk signal.
 */
@Service
public class UnitAssessmentService {
	private static final Logger logger = LoggerFactory.getLogger(UnitAssessmentService.class);

	private final HealthScoreEngine healthScoreEngine;
	private final RiskFusionEngine riskFusionEngine;

	public UnitAssessmentService(HealthScoreEngine healthScoreEngine, RiskFusionEngine riskFusionEngine) {
		this.healthScoreEngine = healthScoreEngine;
		this.riskFusionEngine = riskFusionEngine;
	}

	public Map<String, UnifiedAssessment> assess(TenantSnapshot snapshot,
												 List<RiskSignal> signals,
												 HealthScoreSettings settings) {
		Map<String, UnitMetrics> metrics = snapshot.metricsByUnit();
		Map<String, RiskSignal> signalsByUnit = new LinkedHashMap<>();
		if (signals != null) {
			for (RiskSignal signal : signals) {
				if (signal != null && signal.unitId() != null) {
					signalsByUnit.put(signal.unitId(), signal);
				}
			}
		}
		double peerMedianCpm = HealthScoreEngine.peerMedianCpm(metrics.values());

		Map<String, UnifiedAssessment> assessments = new LinkedHashMap<>();
		for (AdServingUnit unit : snapshot.units()) {
			if (unit == null || unit.unitId() == null || !unit.isActive()) {
				continue;
			}
			UnitMetrics unitMetrics = metrics.get(unit.unitId());
			if (unitMetrics == null) {
				logger.debug("No metrics for unit {}, not assessed", unit.unitId());
				continue;
			}
			Direction direction = directionFor(unit, snapshot.directions());
			HealthAssessment health = healthScoreEngine.assess(
					new HealthScoreEngine.HealthScoreInput(
							unit.unitId(),
							unit.objective(),
							unitMetrics,
							BudgetRebalancer.targetCost(unit, direction),
							peerMedianCpm
					),
					settings
			);
			assessments.put(unit.unitId(), riskFusionEngine.fuse(health, signalsByUnit.get(unit.unitId())));
		}
		return assessments;
	}

	private Direction directionFor(AdServingUnit unit, List<Direction> directions) {
		Direction byCampaign = null;
		for (Direction direction : directions) {
			if (unit.directionId() != null && unit.directionId().equals(direction.directionId())) {
				return direction;
			}
			if (byCampaign == null && unit.campaignId() != null && unit.campaignId().equals(direction.campaignId())) {
				byCampaign = direction;
			}
		}
		return byCampaign;
	}
}
