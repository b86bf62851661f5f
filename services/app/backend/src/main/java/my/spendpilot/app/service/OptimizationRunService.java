package my.spendpilot.app.service;

import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.client.CollaboratorException;
import my.spendpilot.app.client.MetricsAggregatorClient;
import my.spendpilot.app.client.RiskSignalClient;
import my.spendpilot.app.dispatch.ActionDispatcher;
import my.spendpilot.app.dispatch.DispatchResult;
import my.spendpilot.app.domain.ExecutionRecord;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PendingProposal;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.domain.RunTrigger;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.model.EngineSettings;
import my.spendpilot.app.model.RiskSignal;
import my.spendpilot.app.model.TenantSnapshot;
import my.spendpilot.app.model.UnifiedAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One tenant's optimization run: snapshot, assessment, rebalancing, plan choice, validation and dispatch.
 * Every run leaves exactly one finalized audit record; failures never escape to the caller.
 */
@Service
public class OptimizationRunService {
	private static final Logger logger = LoggerFactory.getLogger(OptimizationRunService.class);

	private final TenantService tenantService;
	private final MetricsAggregatorClient metricsClient;
	private final RiskSignalClient riskClient;
	private final UnitAssessmentService assessmentService;
	private final BudgetRebalancer rebalancer;
	private final ReasoningOverrideService reasoningOverride;
	private final ActionDispatcher dispatcher;
	private final ExecutionAuditService auditService;
	private final ProposalService proposalService;
	private final MonitoringService monitoringService;
	private final IdempotencyKeys idempotencyKeys;
	private final EngineSettings engineSettings;
	private final Clock clock;

	public OptimizationRunService(TenantService tenantService,
								  MetricsAggregatorClient metricsClient,
								  RiskSignalClient riskClient,
								  UnitAssessmentService assessmentService,
								  BudgetRebalancer rebalancer,
								  ReasoningOverrideService reasoningOverride,
								  ActionDispatcher dispatcher,
								  ExecutionAuditService auditService,
								  ProposalService proposalService,
								  MonitoringService monitoringService,
								  IdempotencyKeys idempotencyKeys,
								  EngineSettings engineSettings,
								  Clock clock) {
		this.tenantService = tenantService;
		this.metricsClient = metricsClient;
		this.riskClient = riskClient;
		this.assessmentService = assessmentService;
		this.rebalancer = rebalancer;
		this.reasoningOverride = reasoningOverride;
		this.dispatcher = dispatcher;
		this.auditService = auditService;
		this.proposalService = proposalService;
		this.monitoringService = monitoringService;
		this.idempotencyKeys = idempotencyKeys;
		this.engineSettings = engineSettings;
		this.clock = clock;
	}

	public RunOutcome runScheduled(Tenant tenant) {
		return execute(tenant, new RunRequest(tenant.getTenantId(), null, true, RunTrigger.SCHEDULED));
	}

	public RunOutcome run(RunRequest request) {
		Tenant tenant = tenantService.get(request.tenantId());
		return execute(tenant, request);
	}

	private RunOutcome execute(Tenant tenant, RunRequest request) {
		if (tenant.getMode() == ScheduleMode.DISABLED || !tenant.isActive()) {
			throw new IllegalStateException("Tenant " + tenant.getTenantId() + " is disabled");
		}
		String key = request.idempotencyKey() == null || request.idempotencyKey().isBlank()
				? idempotencyKeys.next()
				: request.idempotencyKey().trim();
		ExecutionRecord existing = auditService.findByKey(key).orElse(null);
		if (existing != null) {
			logger.info("Run {} already recorded for tenant {} with status {}", key, existing.getTenantId(), existing.getStatus());
			return RunOutcome.of(existing, null, true);
		}

		ExecutionRecord record = auditService.begin(tenant.getTenantId(), key, request.trigger(), tenant.getMode());
		try {
			return runPipeline(tenant, request, record);
		} catch (Exception ex) {
			String reference = monitoringService.reportFailure(tenant.getTenantId(), "run", null, ex,
					Map.of("idempotencyKey", key, "trigger", request.trigger().name()));
			ExecutionRecord failed = completeQuietly(record, ExecutionStatus.FAILED, null, "Error ref " + reference, reference);
			markRunQuietly(tenant, reference);
			return RunOutcome.of(failed, null, false);
		}
	}

	private RunOutcome runPipeline(Tenant tenant, RunRequest request, ExecutionRecord record) {
		String tenantId = tenant.getTenantId();
		TenantSnapshot snapshot = metricsClient.fetchSnapshot(tenantId);
		if (!snapshot.hasSpend()) {
			logger.info("Tenant {} has no spend in any window, nothing to optimize", tenantId);
			record = auditService.recordPlan(record, PlanSource.DETERMINISTIC, Map.of("note", "no spend"), List.of());
			record = auditService.complete(record, ExecutionStatus.NO_SPEND, null, null, null);
			markRun(tenant);
			return RunOutcome.of(record, null, false);
		}

		List<RiskSignal> signals = fetchSignals(tenantId);
		Map<String, UnifiedAssessment> assessments = assessmentService.assess(snapshot, signals, engineSettings.health());
		boolean reportOnly = tenant.getMode() == ScheduleMode.REPORT_ONLY;
		BudgetRebalancer.RebalancePlan plan = rebalancer.rebalance(
				new BudgetRebalancer.RebalanceInput(
						snapshot.units(),
						snapshot.directions(),
						assessments,
						snapshot.metricsByUnit(),
						snapshot.assets(),
						reportOnly
				),
				engineSettings
		);

		if (reportOnly) {
			record = auditService.recordPlan(record, PlanSource.DETERMINISTIC, planPayload(assessments, plan, null, null), List.of());
			record = auditService.complete(record, ExecutionStatus.REPORT_ONLY, null, null, null);
			markRun(tenant);
			return RunOutcome.of(record, null, false);
		}

		ReasoningOverrideService.PlanChoice choice = reasoningOverride.choose(snapshot, assessments, plan,
				engineSettings.rebalance());
		List<AdAction> actions = choice.actions();
		record = auditService.recordPlan(record, choice.source(),
				planPayload(assessments, plan, choice.note(), choice.fallbackReason()), actions);

		if (!request.dispatch()) {
			record = auditService.complete(record, ExecutionStatus.DRY_RUN, null, null, null);
			return RunOutcome.of(record, null, false);
		}
		if (tenant.getMode() == ScheduleMode.SEMI_AUTO) {
			PendingProposal proposal = proposalService.create(record, actions);
			record = auditService.complete(record, ExecutionStatus.PENDING_APPROVAL, null, null, null);
			markRun(tenant);
			return RunOutcome.of(record, proposal.getId(), false);
		}

		DispatchResult result = dispatcher.dispatch(record.getIdempotencyKey(), tenantId, snapshot.adAccountId() == null
				? tenant.getAdAccountId()
				: snapshot.adAccountId(), actions);
		if (result.isSuccess() || actions.isEmpty()) {
			record = auditService.complete(record, ExecutionStatus.COMPLETED, result, null, null);
		} else {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("idempotencyKey", record.getIdempotencyKey());
			context.put("attempts", result.attempts());
			context.put("statusCode", result.statusCode());
			context.put("retryable", result.retryable());
			String reference = monitoringService.reportFailure(tenantId, "dispatch", result.error(), null, context);
			record = auditService.complete(record, ExecutionStatus.FAILED, result, "Dispatch failed", reference);
		}
		markRun(tenant);
		return RunOutcome.of(record, null, false);
	}

	private List<RiskSignal> fetchSignals(String tenantId) {
		try {
			return riskClient.fetchSignals(tenantId);
		} catch (CollaboratorException ex) {
			logger.warn("Risk signals unavailable for tenant {} (status={}): {}",
					tenantId, ex.getStatusCode(), ex.getMessage());
			return List.of();
		}
	}

	private Map<String, Object> planPayload(Map<String, UnifiedAssessment> assessments,
											BudgetRebalancer.RebalancePlan plan,
											String reasoningNote,
											String fallbackReason) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("assessments", assessments.values());
		payload.put("decisions", plan.decisions());
		payload.put("directions", plan.directions());
		payload.put("notes", plan.notes());
		if (reasoningNote != null) {
			payload.put("reasoningNote", reasoningNote);
		}
		if (fallbackReason != null) {
			payload.put("fallbackReason", fallbackReason);
		}
		return payload;
	}

	private void markRun(Tenant tenant) {
		tenantService.markRun(tenant.getTenantId(), LocalDateTime.now(clock));
	}

	/**
	 * A failed run still counts as this hour's run, so another instance does not retry it before tomorrow's tick.
	 */
	private void markRunQuietly(Tenant tenant, String reference) {
		try {
			markRun(tenant);
		} catch (RuntimeException ex) {
			logger.error("Failed to record run time for tenant {} (ref={}): {}", tenant.getTenantId(), reference, ex.getMessage());
		}
	}

	private ExecutionRecord completeQuietly(ExecutionRecord record,
											ExecutionStatus status,
											DispatchResult result,
											String error,
											String reference) {
		try {
			return auditService.complete(record, status, result, error, reference);
		} catch (RuntimeException ex) {
			logger.error("Failed to finalize execution {} (ref={}): {}", record.getIdempotencyKey(), reference, ex.getMessage());
			return record;
		}
	}

	public record RunRequest(String tenantId, String idempotencyKey, boolean dispatch, RunTrigger trigger) {
		public RunRequest {
			trigger = trigger == null ? RunTrigger.MANUAL : trigger;
		}
	}

	public record RunOutcome(
			Long executionId,
			String tenantId,
			String idempotencyKey,
			ExecutionStatus status,
			PlanSource planSource,
			int actionsCount,
			Long proposalId,
			String error,
			boolean replayed
	) {
		static RunOutcome of(ExecutionRecord record, Long proposalId, boolean replayed) {
			return new RunOutcome(
					record.getId(),
					record.getTenantId(),
					record.getIdempotencyKey(),
					record.getStatus(),
					record.getPlanSource(),
					record.getActionsCount() == null ? 0 : record.getActionsCount(),
					proposalId,
					record.getError(),
					replayed
			);
		}

		public boolean isFailure() {
			return status == ExecutionStatus.FAILED;
		}
	}
}
