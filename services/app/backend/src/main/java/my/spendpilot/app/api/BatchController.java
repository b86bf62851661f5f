package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.spendpilot.app.dto.BatchRunDto;
import my.spendpilot.app.service.BatchRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/batch")
@Tag(name = "batch")
public class BatchController {
	private final BatchRunService batchRunService;
	private final ApiMapper mapper;

	public BatchController(BatchRunService batchRunService, ApiMapper mapper) {
		this.batchRunService = batchRunService;
		this.mapper = mapper;
	}

	@GetMapping("/runs")
	@Operation(summary = "Latest scheduler ticks")
	public List<BatchRunDto> runs() {
		return batchRunService.recentRuns().stream().map(mapper::toDto).toList();
	}

	@PostMapping("/tick")
	@Operation(summary = "Run a scheduler tick now")
	public BatchRunDto tick() {
		return mapper.toDto(batchRunService.runTick());
	}
}
