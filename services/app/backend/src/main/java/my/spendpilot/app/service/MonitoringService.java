package my.spendpilot.app.service;

import my.spendpilot.app.domain.MonitoringEvent;
import my.spendpilot.app.repository.MonitoringEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Internal failure channel. Every report gets a short reference that also goes into the audit record.
 */
@Service
public class MonitoringService {
	private static final Logger logger = LoggerFactory.getLogger(MonitoringService.class);
	private static final int MAX_MESSAGE_LENGTH = 4000;

	private final MonitoringEventRepository repository;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public MonitoringService(MonitoringEventRepository repository, ObjectMapper objectMapper, Clock clock) {
		this.repository = repository;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	/**
	 * Records a failure and returns its reference. Never throws.
	 */
	public String reportFailure(String tenantId, String phase, String message, Throwable error, Map<String, ?> context) {
		String reference = newReference();
		String effectiveMessage = message;
		if ((effectiveMessage == null || effectiveMessage.isBlank()) && error != null) {
			effectiveMessage = error.getMessage();
		}
		logger.error("Optimization failure (ref={}, tenant={}, phase={}, context={}): {}",
				reference, tenantId, phase, context, effectiveMessage, error);
		try {
			MonitoringEvent event = new MonitoringEvent();
			event.setReference(reference);
			event.setTenantId(tenantId);
			event.setPhase(phase == null ? "unknown" : phase);
			event.setMessage(truncate(effectiveMessage));
			event.setExceptionClass(error == null ? null : error.getClass().getName());
			event.setContextJson(context == null || context.isEmpty() ? null : objectMapper.writeValueAsString(context));
			event.setCreatedAt(LocalDateTime.now(clock));
			repository.save(event);
		} catch (Exception ex) {
			logger.error("Failed to store monitoring event {}: {}", reference, ex.getMessage());
		}
		return reference;
	}

	static String newReference() {
		return "OPT-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
	}

	private String truncate(String value) {
		if (value == null || value.length() <= MAX_MESSAGE_LENGTH) {
			return value;
		}
		return value.substring(0, MAX_MESSAGE_LENGTH);
	}
}
