package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.spendpilot.app.dto.ExecutionDetailDto;
import my.spendpilot.app.dto.ExecutionDto;
import my.spendpilot.app.service.ExecutionAuditService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
@Tag(name = "executions")
public class ExecutionController {
	private final ExecutionAuditService auditService;
	private final ApiMapper mapper;

	public ExecutionController(ExecutionAuditService auditService, ApiMapper mapper) {
		this.auditService = auditService;
		this.mapper = mapper;
	}

	@GetMapping
	@Operation(summary = "Latest 50 executions, newest first")
	public List<ExecutionDto> list(@RequestParam(name = "tenantId", required = false) String tenantId) {
		return auditService.list(tenantId).stream().map(mapper::toDto).toList();
	}

	@GetMapping("/{id}")
	public ExecutionDetailDto get(@PathVariable("id") Long id) {
		return mapper.toDetailDto(auditService.get(id));
	}
}
