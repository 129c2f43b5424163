package my.portfolioanalytics.app.risk;

public record StatisticRow(Statistic statistic, double portfolio, double benchmark) {
	public double difference() {
		return portfolio - benchmark;
	}

	public StatisticCategory category() {
		return statistic.category();
	}
}
