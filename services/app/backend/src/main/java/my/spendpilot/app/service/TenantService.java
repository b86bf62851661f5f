package my.spendpilot.app.service;

import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.repository.TenantRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

@Service
public class TenantService {
	private final TenantRepository repository;
	private final Clock clock;

	public TenantService(TenantRepository repository, Clock clock) {
		this.repository = repository;
		this.clock = clock;
	}

	@Transactional
	public Tenant register(String tenantId, String name, String adAccountId, ScheduleMode mode, Integer scheduleHour,
						   String timezone) {
		String id = requireText(tenantId, "tenantId");
		if (repository.existsById(id)) {
			throw new IllegalStateException("Tenant " + id + " already exists");
		}
		LocalDateTime now = LocalDateTime.now(clock);
		Tenant tenant = new Tenant();
		tenant.setTenantId(id);
		tenant.setName(name == null || name.isBlank() ? id : name.trim());
		tenant.setAdAccountId(adAccountId == null || adAccountId.isBlank() ? null : adAccountId.trim());
		tenant.setMode(mode == null ? ScheduleMode.REPORT_ONLY : mode);
		tenant.setScheduleHour(requireHour(scheduleHour == null ? 8 : scheduleHour));
		tenant.setTimezone(requireZone(timezone == null || timezone.isBlank() ? "UTC" : timezone));
		tenant.setActive(true);
		tenant.setCreatedAt(now);
		tenant.setUpdatedAt(now);
		return repository.save(tenant);
	}

	public List<Tenant> list() {
		return repository.findAllByOrderByTenantIdAsc();
	}

	public Tenant get(String tenantId) {
		if (tenantId == null || tenantId.isBlank()) {
			throw new IllegalArgumentException("tenantId is required");
		}
		return repository.findById(tenantId.trim())
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tenant not found"));
	}

	@Transactional
	public Tenant updateSchedule(String tenantId, ScheduleMode mode, Integer scheduleHour, String timezone) {
		Tenant tenant = get(tenantId);
		if (mode != null) {
			tenant.setMode(mode);
		}
		if (scheduleHour != null) {
			tenant.setScheduleHour(requireHour(scheduleHour));
		}
		if (timezone != null) {
			tenant.setTimezone(requireZone(timezone));
		}
		tenant.setUpdatedAt(LocalDateTime.now(clock));
		return repository.save(tenant);
	}

	@Transactional
	public void markRun(String tenantId, LocalDateTime runAt) {
		repository.findById(tenantId).ifPresent(tenant -> {
			tenant.setLastRunAt(runAt);
			tenant.setUpdatedAt(LocalDateTime.now(clock));
			repository.save(tenant);
		});
	}

	private int requireHour(int hour) {
		if (hour < 0 || hour > 23) {
			throw new IllegalArgumentException("scheduleHour must be between 0 and 23");
		}
		return hour;
	}

	private String requireZone(String timezone) {
		String trimmed = timezone.trim();
		try {
			return ZoneId.of(trimmed).getId();
		} catch (DateTimeException ex) {
			throw new IllegalArgumentException("Unknown timezone: " + trimmed);
		}
	}

	private String requireText(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(field + " is required");
		}
		return value.trim();
	}
}
