package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.spendpilot.app.dto.ProposalApprovalRequestDto;
import my.spendpilot.app.dto.ProposalApprovalResponseDto;
import my.spendpilot.app.dto.ProposalDto;
import my.spendpilot.app.service.ProposalService;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/proposals")
@Tag(name = "proposals")
public class ProposalController {
	private final ProposalService proposalService;
	private final ApiMapper mapper;

	public ProposalController(ProposalService proposalService, ApiMapper mapper) {
		this.proposalService = proposalService;
		this.mapper = mapper;
	}

	@GetMapping
	@Operation(summary = "Semi-auto plans waiting for approval")
	public List<ProposalDto> listPending(@RequestParam(name = "tenantId", required = false) String tenantId) {
		return proposalService.listPending(tenantId).stream().map(mapper::toDto).toList();
	}

	@GetMapping("/{id}")
	public ProposalDto get(@PathVariable("id") Long id) {
		return mapper.toDto(proposalService.get(id));
	}

	@PostMapping("/{id}/approve")
	@Operation(summary = "Approve all or some actions and dispatch them")
	public ProposalApprovalResponseDto approve(@PathVariable("id") Long id,
											   @RequestBody(required = false) ProposalApprovalRequestDto request,
											   Authentication authentication) {
		ProposalService.ProposalApproval approval = proposalService.approve(
				id,
				request == null ? null : request.actionIndexes(),
				authentication == null ? null : authentication.getName()
		);
		return new ProposalApprovalResponseDto(mapper.toDto(approval.proposal()), mapper.toDto(approval.execution()));
	}

	@PostMapping("/{id}/reject")
	public ProposalDto reject(@PathVariable("id") Long id, Authentication authentication) {
		return mapper.toDto(proposalService.reject(id, authentication == null ? null : authentication.getName()));
	}
}
