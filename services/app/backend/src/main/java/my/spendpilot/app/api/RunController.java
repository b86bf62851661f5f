package my.spendpilot.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.spendpilot.app.dto.RunJobResponseDto;
import my.spendpilot.app.dto.RunRequestDto;
import my.spendpilot.app.service.OptimizationJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/runs")
@Tag(name = "runs")
public class RunController {
	private final OptimizationJobService jobService;

	public RunController(OptimizationJobService jobService) {
		this.jobService = jobService;
	}

	@PostMapping
	@ResponseStatus(HttpStatus.ACCEPTED)
	@Operation(summary = "Start an optimization run for one tenant")
	public RunJobResponseDto start(@Valid @RequestBody RunRequestDto request) {
		return jobService.start(request);
	}

	@GetMapping("/{jobId}")
	@Operation(summary = "Poll a run started over the API")
	public RunJobResponseDto get(@PathVariable("jobId") String jobId) {
		return jobService.get(jobId);
	}
}
