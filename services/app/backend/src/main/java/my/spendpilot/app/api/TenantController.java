package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.spendpilot.app.dto.ScheduleUpdateRequestDto;
import my.spendpilot.app.dto.TenantDto;
import my.spendpilot.app.dto.TenantRequestDto;
import my.spendpilot.app.service.TenantService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tenants")
@Tag(name = "tenants")
public class TenantController {
	private final TenantService tenantService;
	private final ApiMapper mapper;

	public TenantController(TenantService tenantService, ApiMapper mapper) {
		this.tenantService = tenantService;
		this.mapper = mapper;
	}

	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Register a tenant with its schedule")
	public TenantDto create(@Valid @RequestBody TenantRequestDto request) {
		return mapper.toDto(tenantService.register(
				request.tenantId(),
				request.name(),
				request.adAccountId(),
				request.mode(),
				request.scheduleHour(),
				request.timezone()
		));
	}

	@GetMapping
	public List<TenantDto> list() {
		return tenantService.list().stream().map(mapper::toDto).toList();
	}

	@GetMapping("/{tenantId}")
	public TenantDto get(@PathVariable("tenantId") String tenantId) {
		return mapper.toDto(tenantService.get(tenantId));
	}

	@PutMapping("/{tenantId}/schedule")
	@Operation(summary = "Change mode, local schedule hour or timezone")
	public TenantDto updateSchedule(@PathVariable("tenantId") String tenantId,
									@Valid @RequestBody ScheduleUpdateRequestDto request) {
		return mapper.toDto(tenantService.updateSchedule(tenantId, request.mode(), request.scheduleHour(),
				request.timezone()));
	}
}
