package my.spendpilot.app.service;

import my.spendpilot.app.action.ActionOrdering;
import my.spendpilot.app.action.ActionValidationException;
import my.spendpilot.app.action.ActionValidator;
import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.llm.NoopReasoningClient;
import my.spendpilot.app.llm.ReasoningClient;
import my.spendpilot.app.llm.ReasoningOutputException;
import my.spendpilot.app.llm.ReasoningPlan;
import my.spendpilot.app.llm.ReasoningPlanParser;
import my.spendpilot.app.llm.ReasoningReply;
import my.spendpilot.app.llm.ReasoningRequestException;
import my.spendpilot.app.model.AdServingUnit;
import my.spendpilot.app.model.Direction;
import my.spendpilot.app.model.RebalanceSettings;
import my.spendpilot.app.model.TenantSnapshot;
import my.spendpilot.app.model.UnifiedAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the plan that gets dispatched. The deterministic plan is always validated first; when a reasoning
 * provider is configured its plan replaces the deterministic one, unless it fails in any way, in which case the
 * deterministic plan capped at the action limit is used instead.
 */
@Service
public class ReasoningOverrideService {
	private static final Logger logger = LoggerFactory.getLogger(ReasoningOverrideService.class);

	private final ReasoningClient reasoningClient;
	private final ReasoningPlanParser planParser;
	private final ActionValidator actionValidator;
	private final ObjectMapper objectMapper;

	public ReasoningOverrideService(ReasoningClient reasoningClient,
									ReasoningPlanParser planParser,
									ActionValidator actionValidator,
									ObjectMapper objectMapper) {
		this.reasoningClient = reasoningClient;
		this.planParser = planParser;
		this.actionValidator = actionValidator;
		this.objectMapper = objectMapper;
	}

	public boolean isEnabled() {
		return !(reasoningClient instanceof NoopReasoningClient);
	}

	public PlanChoice choose(TenantSnapshot snapshot,
							 Map<String, UnifiedAssessment> assessments,
							 BudgetRebalancer.RebalancePlan deterministicPlan,
							 RebalanceSettings limits) {
		List<AdAction> deterministic;
		String deterministicProblem = null;
		try {
			deterministic = actionValidator.normalize(deterministicPlan.actions(), limits);
		} catch (ActionValidationException ex) {
			deterministicProblem = "Deterministic plan rejected by validator: " + ex.getMessage();
			logger.warn("{} (tenant={})", deterministicProblem, snapshot.tenantId());
			deterministic = salvage(deterministicPlan.actions(), limits);
		}
		List<AdAction> capped = cap(deterministic, limits.maxActions());
		if (!isEnabled()) {
			if (deterministicProblem != null || capped.size() < deterministic.size()) {
				return new PlanChoice(PlanSource.DETERMINISTIC_FALLBACK, capped, null,
						deterministicProblem == null ? "Plan capped at " + limits.maxActions() + " actions" : deterministicProblem);
			}
			return new PlanChoice(PlanSource.DETERMINISTIC, capped, null, null);
		}

		try {
			String input = objectMapper.writeValueAsString(reasoningInput(snapshot, assessments, deterministicPlan, capped));
			ReasoningReply reply = reasoningClient.proposePlan(input);
			ReasoningPlan plan = planParser.parse(reply.output());
			List<AdAction> actions = actionValidator.validateEnvelopes(plan.actions(), limits);
			actions = ActionOrdering.withStatusReads(actions, campaignByUnit(snapshot), campaignByDirection(snapshot));
			if (actions.size() > limits.maxActions()) {
				throw new ReasoningOutputException("Plan has " + actions.size() + " actions, limit is " + limits.maxActions());
			}
			logger.info("Reasoning plan accepted for tenant {} (model={}, actions={})",
					snapshot.tenantId(), reply.model(), actions.size());
			return new PlanChoice(PlanSource.REASONING, actions, plan.note(), null);
		} catch (ReasoningRequestException ex) {
			logger.warn("Reasoning service unavailable for tenant {} (status={}, retryable={}): {}",
					snapshot.tenantId(), ex.getStatusCode(), ex.isRetryable(), ex.getMessage());
			return new PlanChoice(PlanSource.DETERMINISTIC_FALLBACK, capped, null, "Reasoning unavailable: " + ex.getMessage());
		} catch (ReasoningOutputException | ActionValidationException | JacksonException ex) {
			logger.warn("Reasoning plan rejected for tenant {}: {}", snapshot.tenantId(), ex.getMessage());
			return new PlanChoice(PlanSource.DETERMINISTIC_FALLBACK, capped, null, "Reasoning plan rejected: " + ex.getMessage());
		}
	}

	private List<AdAction> salvage(List<AdAction> actions, RebalanceSettings limits) {
		List<AdAction> valid = new ArrayList<>();
		for (AdAction action : actions) {
			try {
				valid.addAll(actionValidator.normalize(List.of(action), limits));
			} catch (ActionValidationException ex) {
				logger.debug("Dropping invalid {} from fallback plan: {}", ex.getActionType(), ex.getMessage());
			}
		}
		return valid;
	}

	static List<AdAction> cap(List<AdAction> actions, int maxActions) {
		if (actions.size() <= maxActions) {
			return actions;
		}
		return List.copyOf(actions.subList(0, Math.max(0, maxActions)));
	}

	private Map<String, Object> reasoningInput(TenantSnapshot snapshot,
											   Map<String, UnifiedAssessment> assessments,
											   BudgetRebalancer.RebalancePlan plan,
											   List<AdAction> deterministic) {
		Map<String, Object> input = new LinkedHashMap<>();
		input.put("tenantId", snapshot.tenantId());
		input.put("units", snapshot.units());
		input.put("directions", snapshot.directions());
		input.put("assets", snapshot.assets());
		input.put("assessments", assessments.values());
		input.put("decisions", plan.decisions());
		input.put("directionBudgets", plan.directions());
		input.put("deterministicPlan", deterministic.stream().map(AdAction::toEnvelope).toList());
		return input;
	}

	private Map<String, String> campaignByUnit(TenantSnapshot snapshot) {
		Map<String, String> byUnit = new HashMap<>();
		for (AdServingUnit unit : snapshot.units()) {
			if (unit.unitId() != null && unit.campaignId() != null) {
				byUnit.put(unit.unitId(), unit.campaignId());
			}
		}
		return byUnit;
	}

	private Map<String, String> campaignByDirection(TenantSnapshot snapshot) {
		Map<String, String> byDirection = new HashMap<>();
		for (Direction direction : snapshot.directions()) {
			if (direction.directionId() != null && direction.campaignId() != null) {
				byDirection.put(direction.directionId(), direction.campaignId());
			}
		}
		return byDirection;
	}

	public record PlanChoice(PlanSource source, List<AdAction> actions, String note, String fallbackReason) {
	}
}
