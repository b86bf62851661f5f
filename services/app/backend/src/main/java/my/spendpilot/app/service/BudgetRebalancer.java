package my.spendpilot.app.service;

import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.model.AdServingUnit;
import my.spendpilot.app.model.AssetState;
import my.spendpilot.app.model.CreativeAsset;
import my.spendpilot.app.model.DecisionKind;
import my.spendpilot.app.model.Direction;
import my.spendpilot.app.model.DirectionBudget;
import my.spendpilot.app.model.EngineSettings;
import my.spendpilot.app.model.HealthScoreSettings;
import my.spendpilot.app.model.MetricsWindow;
import my.spendpilot.app.model.RebalanceSettings;
import my.spendpilot.app.model.SubComponentSpend;
import my.spendpilot.app.model.UnifiedAssessment;
import my.spendpilot.app.model.UnifiedLevel;
import my.spendpilot.app.model.UnitDecision;
import my.spendpilot.app.model.UnitMetrics;
import my.spendpilot.app.model.WindowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns unified assessments into budget actions, one campaign at a time, and keeps each
 * direction's active budgets inside its corridor.
 */
@Service
public class BudgetRebalancer {
	private static final Logger logger = LoggerFactory.getLogger(BudgetRebalancer.class);
	private static final double EPSILON = 1e-9;
	private static final Set<UnifiedLevel> NO_TOP_UP = EnumSet.of(
			UnifiedLevel.MEDIUM_RISK,
			UnifiedLevel.PREVENTIVE_HIGH_RISK,
			UnifiedLevel.CRITICAL
	);
	private static final Set<UnifiedLevel> WATERFALL_LEVELS = EnumSet.of(
			UnifiedLevel.SLIGHTLY_BAD,
			UnifiedLevel.BAD,
			UnifiedLevel.CRITICAL
	);

	public RebalancePlan rebalance(RebalanceInput input, EngineSettings settings) {
		if (input == null) {
			return new RebalancePlan(List.of(), List.of(), List.of(), List.of());
		}
		EngineSettings config = settings == null ? EngineSettings.defaults() : settings;
		Map<String, Direction> directionsById = new LinkedHashMap<>();
		Map<String, Direction> directionsByCampaign = new LinkedHashMap<>();
		for (Direction direction : input.directions()) {
			if (direction.directionId() != null) {
				directionsById.put(direction.directionId(), direction);
			}
			if (direction.campaignId() != null) {
				directionsByCampaign.put(direction.campaignId(), direction);
			}
		}

		Map<String, List<AdServingUnit>> byCampaign = new LinkedHashMap<>();
		for (AdServingUnit unit : input.units()) {
			if (unit == null || !unit.isActive() || unit.campaignId() == null) {
				continue;
			}
			byCampaign.computeIfAbsent(unit.campaignId(), key -> new ArrayList<>()).add(unit);
		}

		List<AdAction> actions = new ArrayList<>();
		List<UnitDecision> decisions = new ArrayList<>();
		List<DirectionBudget> budgets = new ArrayList<>();
		List<String> notes = new ArrayList<>();
		for (Map.Entry<String, List<AdServingUnit>> entry : byCampaign.entrySet()) {
			String campaignId = entry.getKey();
			List<AdServingUnit> units = entry.getValue();
			Direction direction = resolveDirection(units, campaignId, directionsById, directionsByCampaign);
			rebalanceCampaign(campaignId, units, direction, input, config, actions, decisions, budgets, notes);
		}
		return new RebalancePlan(List.copyOf(actions), List.copyOf(decisions), List.copyOf(budgets), List.copyOf(notes));
	}

	private void rebalanceCampaign(String campaignId,
								   List<AdServingUnit> units,
								   Direction direction,
								   RebalanceInput input,
								   EngineSettings config,
								   List<AdAction> actions,
								   List<UnitDecision> decisions,
								   List<DirectionBudget> budgets,
								   List<String> notes) {
		RebalanceSettings limits = config.rebalance();
		long currentTotal = units.stream().mapToLong(AdServingUnit::dailyBudgetCents).sum();
		boolean underspending = direction != null
				&& direction.envelopeCents() > 0
				&& currentTotal < limits.corridorLow() * direction.envelopeCents();

		List<UnitState> states = new ArrayList<>();
		for (AdServingUnit unit : units) {
			UnitState state = decide(unit, direction, input, config, underspending);
			state.keepWithinBounds(limits);
			states.add(state);
		}

		List<NewUnit> created = new ArrayList<>();
		long freed = states.stream().mapToLong(state -> state.freed).sum();
		Reanimation reanimation = direction == null ? null : new Reanimation(direction, input.assets(), limits);
		if (reanimation != null) {
			long pool = states.stream().filter(state -> state.routeToWaterfall).mapToLong(state -> state.freed).sum();
			if (pool > 0) {
				created.addAll(reanimation.allocate(pool, bestSource(states), false));
				if (created.isEmpty()) {
					notes.add("No reanimation source for direction " + direction.directionId());
				}
			}
		}

		if (!input.reportOnly() && direction != null && direction.envelopeCents() > 0) {
			conserve(states, created, reanimation, direction, limits, notes);
		}

		List<AdAction> mutations = new ArrayList<>();
		for (UnitState state : states) {
			if (state.paused) {
				mutations.add(new AdAction.PauseUnit(state.unit.unitId()));
			} else if (state.proposed != state.current) {
				mutations.add(new AdAction.UpdateUnitBudget(state.unit.unitId(), state.proposed));
			}
			mutations.addAll(state.eaterActions);
			decisions.add(state.toDecision());
		}
		for (NewUnit unit : created) {
			mutations.add(unit.action());
		}
		if (!mutations.isEmpty()) {
			actions.add(new AdAction.StatusRead(campaignId));
			actions.addAll(mutations);
		}

		if (direction != null) {
			long proposedTotal = activeTotal(states) + createdTotal(created);
			long envelope = direction.envelopeCents();
			boolean within = envelope <= 0
					|| (proposedTotal >= limits.corridorLow() * envelope - EPSILON
					&& proposedTotal <= limits.corridorHigh() * envelope + EPSILON);
			if (!within && !input.reportOnly()) {
				logger.info("Direction {} stays outside its corridor (proposed={}, envelope={})",
						direction.directionId(), proposedTotal, envelope);
				notes.add("Direction " + direction.directionId() + " cannot reach its corridor within step limits");
			}
			budgets.add(new DirectionBudget(direction.directionId(), envelope, currentTotal, proposedTotal, freed,
					createdTotal(created), within));
		}
	}

	private UnitState decide(AdServingUnit unit,
							 Direction direction,
							 RebalanceInput input,
							 EngineSettings config,
							 boolean underspending) {
		RebalanceSettings limits = config.rebalance();
		HealthScoreSettings health = config.health();
		UnitState state = new UnitState(unit, input.assessments().get(unit.unitId()));
		if (state.assessment == null) {
			state.hold("not assessed");
			return state;
		}
		UnitMetrics metrics = input.metrics().get(unit.unitId());
		MetricsWindow yesterday = metrics == null ? MetricsWindow.empty() : metrics.window(WindowKey.YESTERDAY);
		if (!yesterday.hasDelivery()) {
			state.hold("no delivery yesterday");
			return state;
		}
		state.delivering = true;
		long target = targetCost(unit, direction);
		int score = state.assessment.health().score();

		switch (state.assessment.level()) {
			case EXCELLENT -> increase(state, limits.maxStepUp(), "scale up confirmed by risk signal", limits);
			case VERY_GOOD -> increase(state, veryGoodStep(score, limits), "very good health", limits);
			case GOOD -> {
				if (underspending) {
					increase(state, Math.min(limits.underspendIncrease(), limits.maxStepUp()),
							"direction under its envelope", limits);
				} else {
					state.hold("good, holding");
				}
			}
			case NEUTRAL -> {
				state.hold("neutral, holding");
				detectBudgetEater(state, metrics, target, limits);
			}
			case MEDIUM_RISK -> {
				state.hold("growth frozen on medium risk");
				detectBudgetEater(state, metrics, target, limits);
			}
			case SLIGHTLY_BAD -> {
				cut(state, slightlyBadCut(score, health, limits), "slightly bad health", limits);
				detectBudgetEater(state, metrics, target, limits);
			}
			case PREVENTIVE_HIGH_RISK -> {
				cut(state, Math.min(0.30, limits.maxStepDown()), "preventive cut on high risk signal", limits);
				detectBudgetEater(state, metrics, target, limits);
			}
			case CRITICAL -> {
				cut(state, limits.maxStepDown(), "critical risk", limits);
				detectBudgetEater(state, metrics, target, limits);
			}
			case BAD -> {
				if (shouldPause(unit, yesterday, target, health, limits)) {
					state.pause("bad health, cost far above target or no results");
				} else {
					cut(state, limits.maxStepDown(), "bad health", limits);
					detectBudgetEater(state, metrics, target, limits);
				}
			}
		}
		state.routeToWaterfall = WATERFALL_LEVELS.contains(state.assessment.level()) && state.freed > 0;
		return state;
	}

	private void conserve(List<UnitState> states,
						  List<NewUnit> created,
						  Reanimation reanimation,
						  Direction direction,
						  RebalanceSettings limits,
						  List<String> notes) {
		long envelope = direction.envelopeCents();
		double low = limits.corridorLow() * envelope;
		double high = limits.corridorHigh() * envelope;
		long total = activeTotal(states) + createdTotal(created);
		if (total > high) {
			trim(states, total - envelope, limits);
			return;
		}
		if (total >= low) {
			return;
		}
		topUp(states, envelope - total, limits);
		total = activeTotal(states) + createdTotal(created);
		if (total < low && reanimation != null) {
			long deficit = envelope - total;
			boolean roomForMinimum = total + limits.newUnitMinCents() <= high;
			List<NewUnit> extra = reanimation.allocate(deficit, bestSource(states), roomForMinimum);
			if (!extra.isEmpty()) {
				notes.add("Added " + extra.size() + " reanimation unit(s) to refill direction " + direction.directionId());
			}
			created.addAll(extra);
		}
	}

	private void trim(List<UnitState> states, long excess, RebalanceSettings limits) {
		List<UnitState> candidates = states.stream()
				.filter(state -> !state.paused && state.assessment != null)
				.sorted(Comparator.comparingInt((UnitState state) -> state.assessment.level().strength())
						.thenComparingInt(state -> state.assessment.health().score()))
				.toList();
		long remaining = excess;
		for (UnitState state : candidates) {
			if (remaining <= 0) {
				break;
			}
			long floor = Math.max(limits.minBudgetCents(), ceil(state.current * (1.0 - limits.maxStepDown())));
			long reducible = state.proposed - floor;
			if (reducible <= 0) {
				continue;
			}
			long cut = Math.min(reducible, remaining);
			state.proposed -= cut;
			remaining -= cut;
			if (state.kind == DecisionKind.INCREASE && state.proposed <= state.current) {
				state.kind = DecisionKind.HOLD;
			}
			state.adjusted(DecisionKind.TRIM, "trimmed to keep direction within envelope");
		}
	}

	private void topUp(List<UnitState> states, long deficit, RebalanceSettings limits) {
		List<UnitState> candidates = states.stream()
				.filter(state -> !state.paused && state.delivering && state.assessment != null)
				.filter(state -> state.kind == DecisionKind.HOLD || state.kind == DecisionKind.INCREASE)
				.filter(state -> !NO_TOP_UP.contains(state.assessment.level()))
				.sorted(Comparator.comparingInt((UnitState state) -> state.assessment.level().strength()).reversed()
						.thenComparing(Comparator.comparingInt((UnitState state) -> state.assessment.health().score()).reversed()))
				.toList();
		long remaining = deficit;
		for (UnitState state : candidates) {
			if (remaining <= 0) {
				break;
			}
			long ceiling = Math.min(limits.maxBudgetCents(), floor(state.current * (1.0 + limits.maxStepUp())));
			long headroom = ceiling - state.proposed;
			if (headroom <= 0) {
				continue;
			}
			long add = Math.min(headroom, remaining);
			state.proposed += add;
			remaining -= add;
			state.adjusted(DecisionKind.TOP_UP, "topped up to refill direction envelope");
		}
	}

	private void increase(UnitState state, double pct, String reason, RebalanceSettings limits) {
		long ceiling = floor(state.current * (1.0 + Math.min(pct, limits.maxStepUp())));
		long proposed = Math.min(limits.maxBudgetCents(), ceiling);
		if (proposed <= state.current) {
			state.hold(reason + ", already at maximum");
			return;
		}
		state.proposed = proposed;
		state.kind = DecisionKind.INCREASE;
		state.reason = reason;
	}

	private void cut(UnitState state, double pct, String reason, RebalanceSettings limits) {
		long reduced = ceil(state.current * (1.0 - Math.min(pct, limits.maxStepDown())));
		long proposed = Math.max(limits.minBudgetCents(), reduced);
		if (proposed >= state.current) {
			state.hold(reason + ", already at minimum");
			return;
		}
		state.proposed = proposed;
		state.freed = state.current - proposed;
		state.kind = DecisionKind.DECREASE;
		state.reason = reason;
	}

	private void detectBudgetEater(UnitState state, UnitMetrics metrics, long target, RebalanceSettings limits) {
		if (state.paused || metrics == null || target <= 0) {
			return;
		}
		List<SubComponentSpend> subs = metrics.subComponents();
		if (subs.size() < 2) {
			return;
		}
		long total = subs.stream().mapToLong(SubComponentSpend::spendCents).sum();
		if (total <= 0) {
			return;
		}
		SubComponentSpend top = subs.stream()
				.max(Comparator.comparingLong(SubComponentSpend::spendCents))
				.orElseThrow();
		double share = (double) top.spendCents() / total;
		double cost = top.results() > 0 ? (double) top.spendCents() / top.results() : Double.POSITIVE_INFINITY;
		if (share >= limits.eaterSpendShare() && cost > limits.eaterCostRatio() * target) {
			state.eaterActions.add(new AdAction.PauseSubComponent(state.unit.unitId(), top.subComponentId()));
			state.reason = state.reason + "; budget eater " + top.subComponentId() + " paused";
		}
	}

	private boolean shouldPause(AdServingUnit unit,
								MetricsWindow yesterday,
								long target,
								HealthScoreSettings health,
								RebalanceSettings limits) {
		long results = unit.objective().results(yesterday.conversions(), health.qualityMinResults());
		if (yesterday.spendCents() > 0 && results == 0) {
			return true;
		}
		if (target <= 0) {
			return false;
		}
		double cost = HealthScoreEngine.effectiveCost(yesterday, unit.objective(), health);
		return cost / target > limits.pauseCostRatio();
	}

	static double veryGoodStep(int score, RebalanceSettings limits) {
		double step;
		if (score >= 50) {
			step = 0.30;
		} else if (score >= 35) {
			step = 0.20;
		} else {
			step = 0.10;
		}
		return Math.min(step, limits.maxStepUp());
	}

	static double slightlyBadCut(int score, HealthScoreSettings health, RebalanceSettings limits) {
		double span = health.neutralThreshold() - health.slightlyBadThreshold();
		double severity = span <= 0 ? 1.0 : (health.neutralThreshold() - score) / span;
		severity = Math.max(0.0, Math.min(1.0, severity));
		return Math.min(0.20 + 0.30 * severity, limits.maxStepDown());
	}

	static long targetCost(AdServingUnit unit, Direction direction) {
		if (unit.targetCostCents() != null && unit.targetCostCents() > 0) {
			return unit.targetCostCents();
		}
		return direction == null ? 0 : direction.targetCostCents();
	}

	private static Direction resolveDirection(List<AdServingUnit> units,
											  String campaignId,
											  Map<String, Direction> byId,
											  Map<String, Direction> byCampaign) {
		for (AdServingUnit unit : units) {
			if (unit.directionId() != null && byId.containsKey(unit.directionId())) {
				return byId.get(unit.directionId());
			}
		}
		return byCampaign.get(campaignId);
	}

	private static String bestSource(List<UnitState> states) {
		return states.stream()
				.filter(state -> !state.paused && state.delivering && state.assessment != null)
				.max(Comparator.comparingInt((UnitState state) -> state.assessment.level().strength())
						.thenComparingInt(state -> state.assessment.health().score()))
				.or(() -> states.stream().findFirst())
				.map(state -> state.unit.unitId())
				.orElse(null);
	}

	private static long activeTotal(List<UnitState> states) {
		return states.stream().filter(state -> !state.paused).mapToLong(state -> state.proposed).sum();
	}

	private static long createdTotal(List<NewUnit> created) {
		return created.stream().mapToLong(NewUnit::budgetCents).sum();
	}

	private static long floor(double value) {
		return (long) Math.floor(value + EPSILON);
	}

	private static long ceil(double value) {
		return (long) Math.ceil(value - EPSILON);
	}

	private static final class UnitState {
		private final AdServingUnit unit;
		private final UnifiedAssessment assessment;
		private final long current;
		private final List<AdAction> eaterActions = new ArrayList<>();
		private long proposed;
		private long freed;
		private boolean paused;
		private boolean delivering;
		private boolean routeToWaterfall;
		private DecisionKind kind = DecisionKind.HOLD;
		private String reason = "";

		private UnitState(AdServingUnit unit, UnifiedAssessment assessment) {
			this.unit = unit;
			this.assessment = assessment;
			this.current = unit.dailyBudgetCents();
			this.proposed = unit.dailyBudgetCents();
		}

		private void hold(String why) {
			kind = DecisionKind.HOLD;
			reason = why;
		}

		/**
		 * A unit already outside [min, max] is brought back to the nearest bound, whatever its decision was.
		 */
		private void keepWithinBounds(RebalanceSettings limits) {
			if (paused) {
				return;
			}
			long bounded = Math.max(limits.minBudgetCents(), Math.min(limits.maxBudgetCents(), proposed));
			if (bounded == proposed) {
				return;
			}
			proposed = bounded;
			if (bounded < current) {
				freed = current - bounded;
				kind = DecisionKind.DECREASE;
			} else {
				freed = 0;
				kind = DecisionKind.INCREASE;
			}
			reason = reason + ", clamped to budget bounds";
		}

		private void pause(String why) {
			paused = true;
			proposed = 0;
			freed = current;
			kind = DecisionKind.PAUSE;
			reason = why;
		}

		private void adjusted(DecisionKind adjustment, String why) {
			if (kind == DecisionKind.HOLD && proposed != current) {
				kind = adjustment;
			}
			reason = reason.isBlank() ? why : reason + "; " + why;
		}

		private UnitDecision toDecision() {
			return new UnitDecision(
					unit.unitId(),
					unit.campaignId(),
					assessment == null ? null : assessment.level(),
					assessment == null ? 0 : assessment.health().score(),
					current,
					paused ? 0 : proposed,
					kind,
					reason
			);
		}
	}

	private record NewUnit(AdAction action, long budgetCents) {
	}

	/**
	 * Creative reanimation for one direction. Tiers are tried in order and the first one with material wins.
	 */
	private static final class Reanimation {
		private final Direction direction;
		private final RebalanceSettings limits;
		private final List<CreativeAsset> unused = new ArrayList<>();
		private final List<CreativeAsset> ready = new ArrayList<>();
		private boolean lookalikeUsed;
		private int createdCount;

		private Reanimation(Direction direction, List<CreativeAsset> assets, RebalanceSettings limits) {
			this.direction = direction;
			this.limits = limits;
			double maxReadyCost = direction.targetCostCents() > 0
					? direction.targetCostCents() * limits.readyAssetMaxCostRatio()
					: Double.POSITIVE_INFINITY;
			for (CreativeAsset asset : assets) {
				if (asset == null || asset.assetId() == null || !direction.directionId().equals(asset.directionId())) {
					continue;
				}
				if (asset.state() == AssetState.UNUSED) {
					unused.add(asset);
				} else if (asset.state() == AssetState.READY
						&& asset.historicalCostCents() != null
						&& asset.historicalCostCents() <= maxReadyCost) {
					ready.add(asset);
				}
			}
			ready.sort(Comparator.comparingDouble(CreativeAsset::historicalCostCents));
		}

		private List<NewUnit> allocate(long amount, String sourceUnitId, boolean allowRoundUp) {
			int slots = limits.maxNewUnitsPerDirection() - createdCount;
			if (amount <= 0 || slots <= 0) {
				return List.of();
			}
			long budget = amount;
			if (budget < limits.newUnitMinCents()) {
				if (!allowRoundUp) {
					return List.of();
				}
				budget = limits.newUnitMinCents();
			}
			if (!unused.isEmpty()) {
				return fromUnusedAssets(budget, slots);
			}
			if (!ready.isEmpty()) {
				return fromReadyAssets(budget);
			}
			String audience = direction.lookalikeAudienceId();
			if (!lookalikeUsed && audience != null && !audience.isBlank() && sourceUnitId != null) {
				lookalikeUsed = true;
				createdCount++;
				long size = limits.newUnitMinCents();
				return List.of(new NewUnit(
						new AdAction.DuplicateWithAudience(sourceUnitId, audience, size, "LAL"),
						size));
			}
			return List.of();
		}

		private List<NewUnit> fromUnusedAssets(long budget, int slots) {
			int count = (int) Math.ceil(budget / (double) limits.newUnitMaxCents());
			count = Math.max(1, Math.min(count, Math.min(slots, unused.size())));
			while (count > 1 && budget / count < limits.newUnitMinCents()) {
				count--;
			}
			long perUnit = Math.min(limits.newUnitMaxCents(), budget / count);
			int take = Math.min(unused.size(), count * limits.maxAssetsPerNewUnit());
			List<List<String>> assetGroups = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				assetGroups.add(new ArrayList<>());
			}
			for (int i = 0; i < take; i++) {
				assetGroups.get(i % count).add(unused.get(i).assetId());
			}
			unused.subList(0, take).clear();
			List<NewUnit> units = new ArrayList<>();
			for (List<String> group : assetGroups) {
				createdCount++;
				units.add(new NewUnit(
						new AdAction.CreateUnitWithAssets(direction.directionId(), group, perUnit, unitName(), true),
						perUnit));
			}
			return units;
		}

		private List<NewUnit> fromReadyAssets(long budget) {
			int take = Math.min(ready.size(), limits.maxAssetsPerNewUnit());
			List<String> assetIds = new ArrayList<>();
			for (int i = 0; i < take; i++) {
				assetIds.add(ready.get(i).assetId());
			}
			ready.subList(0, take).clear();
			createdCount++;
			long size = Math.min(limits.newUnitMaxCents(), budget);
			return List.of(new NewUnit(
					new AdAction.CreateUnitWithAssets(direction.directionId(), assetIds, size, unitName(), true),
					size));
		}

		private String unitName() {
			String base = direction.name() == null || direction.name().isBlank() ? direction.directionId() : direction.name();
			return base + " reanimation " + createdCount;
		}
	}

	public record RebalanceInput(
			List<AdServingUnit> units,
			List<Direction> directions,
			Map<String, UnifiedAssessment> assessments,
			Map<String, UnitMetrics> metrics,
			List<CreativeAsset> assets,
			boolean reportOnly
	) {
		public RebalanceInput {
			units = units == null ? List.of() : units;
			directions = directions == null ? List.of() : directions;
			assessments = assessments == null ? Map.of() : assessments;
			metrics = metrics == null ? Map.of() : metrics;
			assets = assets == null ? List.of() : assets;
		}
	}

	public record RebalancePlan(
			List<AdAction> actions,
			List<UnitDecision> decisions,
			List<DirectionBudget> directions,
			List<String> notes
	) {
	}
}
