package my.spendpilot.app.dispatch;

public class DispatchException extends RuntimeException {
	private final Integer statusCode;

	public DispatchException(String message, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
