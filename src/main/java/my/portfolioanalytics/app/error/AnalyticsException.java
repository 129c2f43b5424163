package my.portfolioanalytics.app.error;

public class AnalyticsException extends RuntimeException {
	private final ErrorCode errorCode;

	public AnalyticsException(ErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	public AnalyticsException(ErrorCode errorCode, String message, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public ErrorCode getErrorCode() {
		return errorCode;
	}
}
