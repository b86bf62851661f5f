package my.spendpilot.app.client;

/**
 * Failure talking to the metrics aggregator or the risk analytics service.
 */
public class CollaboratorException extends RuntimeException {
	private final Integer statusCode;

	public CollaboratorException(String message, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
