package my.portfolioanalytics.app.attribution;

/**
 * Contribution and Brinson-Fachler effects of one classification item in one row. Active values
 * and total effects are derived.
 */
public record AssetAttribution(
		double portfolioReturn,
		double portfolioWeight,
		double benchmarkReturn,
		double benchmarkWeight,
		double portfolioContributionSimple,
		double benchmarkContributionSimple,
		double portfolioContributionSmoothed,
		double benchmarkContributionSmoothed,
		double allocationEffectSimple,
		double selectionEffectSimple,
		double allocationEffectSmoothed,
		double selectionEffectSmoothed
) implements ColumnValues {
	public double totalEffectSimple() {
		return allocationEffectSimple + selectionEffectSimple;
	}

	public double totalEffectSmoothed() {
		return allocationEffectSmoothed + selectionEffectSmoothed;
	}

	@Override
	public double value(Column column) {
		return switch (column) {
			case PORTFOLIO_WEIGHT -> portfolioWeight;
			case BENCHMARK_WEIGHT -> benchmarkWeight;
			case ACTIVE_WEIGHT -> portfolioWeight - benchmarkWeight;
			case PORTFOLIO_RETURN -> portfolioReturn;
			case BENCHMARK_RETURN -> benchmarkReturn;
			case ACTIVE_RETURN -> portfolioReturn - benchmarkReturn;
			case PORTFOLIO_CONTRIBUTION_SIMPLE -> portfolioContributionSimple;
			case BENCHMARK_CONTRIBUTION_SIMPLE -> benchmarkContributionSimple;
			case ACTIVE_CONTRIBUTION_SIMPLE -> portfolioContributionSimple - benchmarkContributionSimple;
			case ALLOCATION_EFFECT_SIMPLE -> allocationEffectSimple;
			case SELECTION_EFFECT_SIMPLE -> selectionEffectSimple;
			case TOTAL_EFFECT_SIMPLE -> totalEffectSimple();
			case PORTFOLIO_CONTRIBUTION_SMOOTHED -> portfolioContributionSmoothed;
			case BENCHMARK_CONTRIBUTION_SMOOTHED -> benchmarkContributionSmoothed;
			case ACTIVE_CONTRIBUTION_SMOOTHED -> portfolioContributionSmoothed - benchmarkContributionSmoothed;
			case ALLOCATION_EFFECT_SMOOTHED -> allocationEffectSmoothed;
			case SELECTION_EFFECT_SMOOTHED -> selectionEffectSmoothed;
			case TOTAL_EFFECT_SMOOTHED -> totalEffectSmoothed();
			default -> throw new IllegalArgumentException("Column " + column + " is not held per classification item");
		};
	}
}
