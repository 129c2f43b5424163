package my.portfolioanalytics.app.error;

public enum ErrorCode {
	UNDEFINED_RETURN,
	WEIGHTS_DO_NOT_SUM_TO_ONE,
	MISSING_CLASSIFICATION_NAME,
	CLASSIFICATION_OR_MAPPING_COLUMN_COUNT_INVALID,
	TOO_MANY_ROWS_FOR_RENDER,
	INVALID_FREQUENCY_FOR_RISK_STATISTICS,
	INSUFFICIENT_QUANTITY_OF_RETURNS,
	RETURN_SERIES_LENGTH_MISMATCH,
	NAN_IN_RETURN_SERIES,
	ARITHMETIC_IDENTITY_VIOLATION,
	CROSS_INSTANCE_INCONSISTENCY,
	DATA_SOURCE_UNAVAILABLE,
	MALFORMED_DATE_STRING
}
