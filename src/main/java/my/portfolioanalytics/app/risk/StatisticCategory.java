package my.portfolioanalytics.app.risk;

public enum StatisticCategory {
	ABSOLUTE_RISK("Absolute Risk"),
	DOWNSIDE_RISK("Downside Risk"),
	BENCHMARK_RELATIVE_RISK("Benchmark-Relative Risk"),
	RISK_ADJUSTED_PERFORMANCE("Risk-Adjusted Performance"),
	REGRESSION("Regression");

	private final String label;

	StatisticCategory(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
