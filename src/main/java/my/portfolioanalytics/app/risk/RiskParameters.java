package my.portfolioanalytics.app.risk;

/**
 * Annual rates and VaR inputs of a risk statistics run. Rates are de-annualized to the frequency
 * of the returns before use.
 */
public record RiskParameters(
		double annualMinimumAcceptableReturn,
		double annualRiskFreeRate,
		double confidenceLevel,
		double portfolioValue
) {
	public static final double DEFAULT_ANNUAL_MINIMUM_ACCEPTABLE_RETURN = 0.0;
	public static final double DEFAULT_ANNUAL_RISK_FREE_RATE = 0.03;
	public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
	public static final double DEFAULT_PORTFOLIO_VALUE = 100_000.0;

	public RiskParameters {
		if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
			throw new IllegalArgumentException("Confidence level must be between 0 and 1: " + confidenceLevel);
		}
	}

	public static RiskParameters defaults() {
		return new RiskParameters(DEFAULT_ANNUAL_MINIMUM_ACCEPTABLE_RETURN, DEFAULT_ANNUAL_RISK_FREE_RATE,
				DEFAULT_CONFIDENCE_LEVEL, DEFAULT_PORTFOLIO_VALUE);
	}
}
