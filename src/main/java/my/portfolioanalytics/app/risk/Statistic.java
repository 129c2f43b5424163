package my.portfolioanalytics.app.risk;

import static my.portfolioanalytics.app.risk.StatisticCategory.*;

/**
 * Ex-post risk statistics in display order. Statistics that relate the portfolio to its benchmark
 * have no benchmark value.
 */
public enum Statistic {
	RANGE("Range", ABSOLUTE_RISK, false),
	STANDARD_DEVIATION("Standard Deviation", ABSOLUTE_RISK, false),
	STANDARD_DEVIATION_ANNUALIZED("Annualized Standard Deviation", ABSOLUTE_RISK, false),
	DOWNSIDE_PROBABILITY("Downside Probability", DOWNSIDE_RISK, false),
	EXPECTED_DOWNSIDE_VALUE("Expected Downside Value", DOWNSIDE_RISK, false),
	DOWNSIDE_DEVIATION("Downside Deviation", DOWNSIDE_RISK, false),
	DOWNSIDE_DEVIATION_ANNUALIZED("Annualized Downside Deviation", DOWNSIDE_RISK, false),
	VALUE_AT_RISK("Value At Risk (VAR)", DOWNSIDE_RISK, false),
	CORRELATION("Correlation", BENCHMARK_RELATIVE_RISK, true),
	R_SQUARED("R-Squared", BENCHMARK_RELATIVE_RISK, true),
	TRACKING_ERROR("Tracking Error", BENCHMARK_RELATIVE_RISK, true),
	TRACKING_ERROR_ANNUALIZED("Annualized Tracking Error", BENCHMARK_RELATIVE_RISK, true),
	SHARPE_RATIO("Sharpe Ratio", RISK_ADJUSTED_PERFORMANCE, false),
	SHARPE_RATIO_ANNUALIZED("Annualized Sharpe Ratio", RISK_ADJUSTED_PERFORMANCE, false),
	SORTINO_RATIO("Sortino Ratio", RISK_ADJUSTED_PERFORMANCE, false),
	SORTINO_RATIO_ANNUALIZED("Annualized Sortino Ratio", RISK_ADJUSTED_PERFORMANCE, false),
	INFORMATION_RATIO("Information Ratio", RISK_ADJUSTED_PERFORMANCE, true),
	M_SQUARED("M-Squared", RISK_ADJUSTED_PERFORMANCE, true),
	TREYNOR_RATIO("Treynor Ratio", RISK_ADJUSTED_PERFORMANCE, true),
	BETA("Beta", REGRESSION, true),
	ALPHA("Alpha", REGRESSION, true),
	ALPHA_ANNUALIZED("Annualized Alpha", REGRESSION, true),
	JENSENS_ALPHA("Jensens Alpha", REGRESSION, true),
	JENSENS_ALPHA_ANNUALIZED("Annualized Jensens Alpha", REGRESSION, true);

	private final String label;
	private final StatisticCategory category;
	private final boolean portfolioOnly;

	Statistic(String label, StatisticCategory category, boolean portfolioOnly) {
		this.label = label;
		this.category = category;
		this.portfolioOnly = portfolioOnly;
	}

	public String label() {
		return label;
	}

	public StatisticCategory category() {
		return category;
	}

	public boolean isPortfolioOnly() {
		return portfolioOnly;
	}

	public boolean isAnnualized() {
		return name().endsWith("_ANNUALIZED");
	}
}
