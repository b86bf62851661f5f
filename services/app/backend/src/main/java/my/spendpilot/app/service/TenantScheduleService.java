package my.spendpilot.app.service;

import my.spendpilot.app.config.AppProperties;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which tenants are due on a tick: the tenant's local schedule hour, converted to UTC,
 * must equal the tick's UTC hour, and the tenant must not have run within the dedup window.
 */
@Service
public class TenantScheduleService {
	private static final Logger logger = LoggerFactory.getLogger(TenantScheduleService.class);
	private static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(50);

	private final TenantRepository tenantRepository;
	private final ZoneId fallbackZone;
	private final Duration dedupWindow;

	public TenantScheduleService(TenantRepository tenantRepository, AppProperties properties) {
		this.tenantRepository = tenantRepository;
		AppProperties.Scheduler scheduler = properties.scheduler();
		this.fallbackZone = resolveFallback(scheduler == null ? null : scheduler.defaultTimezone());
		this.dedupWindow = scheduler == null || scheduler.dedupWindowMinutes() == null
				? DEFAULT_DEDUP_WINDOW
				: Duration.ofMinutes(Math.max(0, scheduler.dedupWindowMinutes()));
	}

	public List<Tenant> dueTenants(Instant now) {
		ZonedDateTime nowUtc = now.atZone(ZoneOffset.UTC);
		List<Tenant> due = new ArrayList<>();
		for (Tenant tenant : tenantRepository.findSchedulable(ScheduleMode.DISABLED)) {
			if (!isDueHour(tenant, nowUtc)) {
				continue;
			}
			if (recentlyProcessed(tenant, nowUtc.toLocalDateTime())) {
				logger.debug("Tenant {} already processed at {}, skipping", tenant.getTenantId(), tenant.getLastRunAt());
				continue;
			}
			due.add(tenant);
		}
		return due;
	}

	boolean isDueHour(Tenant tenant, ZonedDateTime nowUtc) {
		if (tenant.getScheduleHour() == null) {
			return false;
		}
		return utcHourFor(tenant.getScheduleHour(), resolveZone(tenant.getTimezone()), nowUtc) == nowUtc.getHour();
	}

	/**
	 * UTC hour at which the local schedule hour falls on the tenant's current local date.
	 */
	static int utcHourFor(int scheduleHour, ZoneId zone, ZonedDateTime nowUtc) {
		ZonedDateTime local = ZonedDateTime.of(
				nowUtc.withZoneSameInstant(zone).toLocalDate(),
				LocalTime.of(scheduleHour, 0),
				zone
		);
		return local.withZoneSameInstant(ZoneOffset.UTC).getHour();
	}

	boolean recentlyProcessed(Tenant tenant, LocalDateTime nowUtc) {
		LocalDateTime lastRun = tenant.getLastRunAt();
		if (lastRun == null || dedupWindow.isZero()) {
			return false;
		}
		return lastRun.isAfter(nowUtc.minus(dedupWindow));
	}

	ZoneId resolveZone(String timezone) {
		if (timezone == null || timezone.isBlank()) {
			return fallbackZone;
		}
		try {
			return ZoneId.of(timezone.trim());
		} catch (DateTimeException ex) {
			logger.warn("Unknown timezone {}, using {}", timezone, fallbackZone);
			return fallbackZone;
		}
	}

	private static ZoneId resolveFallback(String timezone) {
		if (timezone == null || timezone.isBlank()) {
			return ZoneOffset.UTC;
		}
		try {
			return ZoneId.of(timezone.trim());
		} catch (DateTimeException ex) {
			logger.warn("Unknown default timezone {}, using UTC", timezone);
			return ZoneOffset.UTC;
		}
	}
}
