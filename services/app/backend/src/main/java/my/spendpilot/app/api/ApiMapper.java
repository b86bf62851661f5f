package my.spendpilot.app.api;

import my.spendpilot.app.domain.BatchRun;
import my.spendpilot.app.domain.ExecutionRecord;
import my.spendpilot.app.domain.PendingProposal;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.dto.BatchRunDto;
import my.spendpilot.app.dto.ExecutionDetailDto;
import my.spendpilot.app.dto.ExecutionDto;
import my.spendpilot.app.dto.ProposalDto;
import my.spendpilot.app.dto.TenantDto;
import my.spendpilot.app.service.ProposalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

@Component
public class ApiMapper {
	private static final Logger logger = LoggerFactory.getLogger(ApiMapper.class);

	private final ObjectMapper objectMapper;
	private final ProposalService proposalService;

	public ApiMapper(ObjectMapper objectMapper, ProposalService proposalService) {
		this.objectMapper = objectMapper;
		this.proposalService = proposalService;
	}

	public TenantDto toDto(Tenant tenant) {
		return new TenantDto(
				tenant.getTenantId(),
				tenant.getName(),
				tenant.getAdAccountId(),
				tenant.getMode(),
				tenant.getScheduleHour(),
				tenant.getTimezone(),
				tenant.isActive(),
				tenant.getLastRunAt()
		);
	}

	public ExecutionDto toDto(ExecutionRecord record) {
		if (record == null) {
			return null;
		}
		return new ExecutionDto(
				record.getId(),
				record.getTenantId(),
				record.getIdempotencyKey(),
				record.getTrigger(),
				record.getMode(),
				record.getPlanSource(),
				record.getStatus(),
				record.getActionsCount(),
				record.getDispatchAttempts(),
				record.getError(),
				record.getErrorReference(),
				record.getStartedAt(),
				record.getFinishedAt(),
				record.getDurationMs()
		);
	}

	public ExecutionDetailDto toDetailDto(ExecutionRecord record) {
		return new ExecutionDetailDto(
				toDto(record),
				readTree(record.getPlanJson()),
				readTree(record.getActionsJson()),
				readTree(record.getDispatchResultJson())
		);
	}

	public ProposalDto toDto(PendingProposal proposal) {
		return new ProposalDto(
				proposal.getId(),
				proposal.getTenantId(),
				proposal.getExecutionId(),
				proposal.getIdempotencyKey(),
				proposal.getStatus(),
				proposalService.actionsOf(proposal),
				proposal.getCreatedAt(),
				proposal.getExpiresAt(),
				proposal.getDecidedAt(),
				proposal.getDecidedBy(),
				proposal.getApprovedExecutionId()
		);
	}

	public BatchRunDto toDto(BatchRun run) {
		return new BatchRunDto(
				run.getId(),
				run.getInstanceId(),
				run.getTickHourUtc(),
				run.getStatus(),
				run.getTenantsSelected(),
				run.getTenantsSucceeded(),
				run.getTenantsFailed(),
				run.getStartedAt(),
				run.getFinishedAt(),
				run.getDurationMs()
		);
	}

	private JsonNode readTree(String json) {
		if (json == null || json.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readTree(json);
		} catch (JacksonException ex) {
			logger.warn("Stored JSON payload is unreadable: {}", ex.getMessage());
			return null;
		}
	}
}
