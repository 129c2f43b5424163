package my.portfolioanalytics.app.domain;

import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;

public enum Frequency {
	AS_OFTEN_AS_POSSIBLE("Periodic", 0),
	MONTHLY("Monthly", 12),
	QUARTERLY("Quarterly", 4),
	YEARLY("Yearly", 1);

	private final String label;
	private final int periodsPerYear;

	Frequency(String label, int periodsPerYear) {
		this.label = label;
		this.periodsPerYear = periodsPerYear;
	}

	public String label() {
		return label;
	}

	public boolean hasPeriodsPerYear() {
		return periodsPerYear > 0;
	}

	public int periodsPerYear() {
		if (!hasPeriodsPerYear()) {
			throw new AnalyticsException(ErrorCode.INVALID_FREQUENCY_FOR_RISK_STATISTICS,
					"Frequency " + this + " has no defined periods per year");
		}
		return periodsPerYear;
	}
}
