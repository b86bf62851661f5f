package my.spendpilot.app.service;

import my.spendpilot.app.action.ActionEnvelope;
import my.spendpilot.app.action.ActionType;
import my.spendpilot.app.action.ActionValidator;
import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.config.AppProperties;
import my.spendpilot.app.dispatch.ActionDispatcher;
import my.spendpilot.app.dispatch.DispatchResult;
import my.spendpilot.app.domain.ExecutionRecord;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PendingProposal;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.domain.ProposalStatus;
import my.spendpilot.app.domain.RunTrigger;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.model.EngineSettings;
import my.spendpilot.app.repository.PendingProposalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semi-auto plans waiting for an operator. Approval dispatches the stored batch (or a subset of it) under
 * the key {@code <run key>-approved}.
 */
@Service
public class ProposalService {
	private static final Logger logger = LoggerFactory.getLogger(ProposalService.class);
	private static final Duration DEFAULT_TTL = Duration.ofHours(24);

	private final PendingProposalRepository repository;
	private final ActionValidator actionValidator;
	private final ActionDispatcher dispatcher;
	private final ExecutionAuditService auditService;
	private final TenantService tenantService;
	private final MonitoringService monitoringService;
	private final EngineSettings engineSettings;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final Duration ttl;

	public ProposalService(PendingProposalRepository repository,
						   ActionValidator actionValidator,
						   ActionDispatcher dispatcher,
						   ExecutionAuditService auditService,
						   TenantService tenantService,
						   MonitoringService monitoringService,
						   EngineSettings engineSettings,
						   ObjectMapper objectMapper,
						   Clock clock,
						   AppProperties properties) {
		this.repository = repository;
		this.actionValidator = actionValidator;
		this.dispatcher = dispatcher;
		this.auditService = auditService;
		this.tenantService = tenantService;
		this.monitoringService = monitoringService;
		this.engineSettings = engineSettings;
		this.objectMapper = objectMapper;
		this.clock = clock;
		Integer ttlHours = properties.proposals() == null ? null : properties.proposals().ttlHours();
		this.ttl = ttlHours == null || ttlHours <= 0 ? DEFAULT_TTL : Duration.ofHours(ttlHours);
	}

	public PendingProposal create(ExecutionRecord execution, List<AdAction> actions) {
		LocalDateTime now = LocalDateTime.now(clock);
		PendingProposal proposal = new PendingProposal();
		proposal.setTenantId(execution.getTenantId());
		proposal.setExecutionId(execution.getId());
		proposal.setIdempotencyKey(execution.getIdempotencyKey());
		proposal.setActionsJson(writeActions(actions));
		proposal.setActionsCount(actions.size());
		proposal.setStatus(ProposalStatus.PENDING);
		proposal.setCreatedAt(now);
		proposal.setExpiresAt(now.plus(ttl));
		return repository.save(proposal);
	}

	public List<PendingProposal> listPending(String tenantId) {
		String normalized = tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
		return repository.search(normalized, ProposalStatus.PENDING);
	}

	public PendingProposal get(Long id) {
		return repository.findById(id)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Proposal not found"));
	}

	public List<ActionEnvelope> actionsOf(PendingProposal proposal) {
		try {
			return objectMapper.readValue(proposal.getActionsJson(), new TypeReference<List<ActionEnvelope>>() {});
		} catch (JacksonException ex) {
			throw new IllegalStateException("Stored proposal " + proposal.getId() + " is unreadable", ex);
		}
	}

	/**
	 * Approves all actions, or only those at {@code actionIndexes}. Status reads are always kept so that
	 * every mutating action stays behind its campaign's status read.
	 */
	public ProposalApproval approve(Long id, List<Integer> actionIndexes, String decidedBy) {
		PendingProposal proposal = requirePending(id);
		LocalDateTime now = LocalDateTime.now(clock);
		if (!proposal.getExpiresAt().isAfter(now)) {
			proposal.setStatus(ProposalStatus.EXPIRED);
			proposal.setDecidedAt(now);
			repository.save(proposal);
			throw new IllegalStateException("Proposal " + id + " has expired");
		}
		List<ActionEnvelope> selected = select(actionsOf(proposal), actionIndexes);
		List<AdAction> actions = actionValidator.validateEnvelopes(selected, engineSettings.rebalance());
		Tenant tenant = tenantService.get(proposal.getTenantId());

		String key = IdempotencyKeys.approvalKey(proposal.getIdempotencyKey());
		ExecutionRecord execution = auditService.begin(tenant.getTenantId(), key, RunTrigger.APPROVAL, ScheduleMode.SEMI_AUTO);
		proposal.setStatus(ProposalStatus.APPROVED);
		proposal.setDecidedAt(now);
		proposal.setDecidedBy(decidedBy);
		proposal.setApprovedExecutionId(execution.getId());
		repository.save(proposal);

		execution = auditService.recordPlan(execution, PlanSource.DETERMINISTIC,
				Map.of("proposalId", proposal.getId(), "approvedBy", decidedBy == null ? "unknown" : decidedBy),
				actions);
		DispatchResult result;
		try {
			result = dispatcher.dispatch(key, tenant.getTenantId(), tenant.getAdAccountId(), actions);
		} catch (RuntimeException ex) {
			String reference = monitoringService.reportFailure(tenant.getTenantId(), "approval-dispatch", null, ex,
					Map.of("proposalId", proposal.getId(), "idempotencyKey", key));
			execution = auditService.complete(execution, ExecutionStatus.FAILED, null, "Error ref " + reference, reference);
			return new ProposalApproval(proposal, execution);
		}
		if (result.isSuccess() || actions.isEmpty()) {
			execution = auditService.complete(execution, ExecutionStatus.COMPLETED, result, null, null);
		} else {
			String reference = monitoringService.reportFailure(tenant.getTenantId(), "approval-dispatch", result.error(), null,
					Map.of("proposalId", proposal.getId(), "idempotencyKey", key, "attempts", result.attempts()));
			execution = auditService.complete(execution, ExecutionStatus.FAILED, result, "Dispatch failed", reference);
		}
		logger.info("Proposal {} approved by {} ({} actions, status={})",
				proposal.getId(), decidedBy, actions.size(), execution.getStatus());
		return new ProposalApproval(proposal, execution);
	}

	public PendingProposal reject(Long id, String decidedBy) {
		PendingProposal proposal = requirePending(id);
		proposal.setStatus(ProposalStatus.REJECTED);
		proposal.setDecidedAt(LocalDateTime.now(clock));
		proposal.setDecidedBy(decidedBy);
		return repository.save(proposal);
	}

	public int expireDue() {
		int expired = repository.expirePending(LocalDateTime.now(clock));
		if (expired > 0) {
			logger.info("Expired {} pending proposal(s)", expired);
		}
		return expired;
	}

	private PendingProposal requirePending(Long id) {
		PendingProposal proposal = get(id);
		if (proposal.getStatus() != ProposalStatus.PENDING) {
			throw new IllegalStateException("Proposal " + id + " is " + proposal.getStatus());
		}
		return proposal;
	}

	private List<ActionEnvelope> select(List<ActionEnvelope> all, List<Integer> actionIndexes) {
		if (actionIndexes == null || actionIndexes.isEmpty()) {
			return all;
		}
		Set<Integer> wanted = new LinkedHashSet<>();
		for (Integer index : actionIndexes) {
			if (index == null || index < 0 || index >= all.size()) {
				throw new IllegalArgumentException("Action index out of range: " + index);
			}
			wanted.add(index);
		}
		List<ActionEnvelope> selected = new ArrayList<>();
		for (int i = 0; i < all.size(); i++) {
			ActionEnvelope envelope = all.get(i);
			boolean statusRead = ActionType.STATUS_READ.wireName().equals(envelope.type());
			if (statusRead || wanted.contains(i)) {
				selected.add(envelope);
			}
		}
		return selected;
	}

	private String writeActions(List<AdAction> actions) {
		try {
			return objectMapper.writeValueAsString(actions.stream().map(AdAction::toEnvelope).toList());
		} catch (JacksonException ex) {
			throw new IllegalStateException("Failed to serialize proposal actions", ex);
		}
	}

	public record ProposalApproval(PendingProposal proposal, ExecutionRecord execution) {
	}
}
