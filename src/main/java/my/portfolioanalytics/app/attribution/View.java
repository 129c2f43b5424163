package my.portfolioanalytics.app.attribution;

import java.util.List;

import static my.portfolioanalytics.app.attribution.Column.*;

public enum View {
	CUMULATIVE_ATTRIBUTION("Cumulative Attribution", false, true, List.of(
			BEGINNING_DATE, ENDING_DATE,
			PORTFOLIO_RETURN, BENCHMARK_RETURN, ACTIVE_RETURN,
			CUMULATIVE_PORTFOLIO_RETURN, CUMULATIVE_BENCHMARK_RETURN, CUMULATIVE_ACTIVE_RETURN,
			PORTFOLIO_CONTRIBUTION_SMOOTHED, BENCHMARK_CONTRIBUTION_SMOOTHED, ACTIVE_CONTRIBUTION_SMOOTHED,
			CUMULATIVE_PORTFOLIO_CONTRIBUTION, CUMULATIVE_BENCHMARK_CONTRIBUTION, CUMULATIVE_ACTIVE_CONTRIBUTION,
			ALLOCATION_EFFECT_SMOOTHED, SELECTION_EFFECT_SMOOTHED, TOTAL_EFFECT_SMOOTHED,
			CUMULATIVE_ALLOCATION_EFFECT, CUMULATIVE_SELECTION_EFFECT, CUMULATIVE_TOTAL_EFFECT)),
	OVERALL_ATTRIBUTION("Overall Attribution", true, true, List.of(
			CLASSIFICATION_IDENTIFIER, CLASSIFICATION_NAME,
			PORTFOLIO_WEIGHT, PORTFOLIO_RETURN, PORTFOLIO_CONTRIBUTION_SMOOTHED,
			BENCHMARK_WEIGHT, BENCHMARK_RETURN, BENCHMARK_CONTRIBUTION_SMOOTHED,
			ACTIVE_WEIGHT, ACTIVE_RETURN, ACTIVE_CONTRIBUTION_SMOOTHED,
			ALLOCATION_EFFECT_SMOOTHED, SELECTION_EFFECT_SMOOTHED, TOTAL_EFFECT_SMOOTHED)),
	SUBPERIOD_ATTRIBUTION("Sub-Period Attribution", true, false, List.of(
			BEGINNING_DATE, ENDING_DATE,
			CLASSIFICATION_IDENTIFIER, CLASSIFICATION_NAME,
			PORTFOLIO_WEIGHT, PORTFOLIO_RETURN, PORTFOLIO_CONTRIBUTION_SIMPLE,
			BENCHMARK_WEIGHT, BENCHMARK_RETURN, BENCHMARK_CONTRIBUTION_SIMPLE,
			ACTIVE_WEIGHT, ACTIVE_RETURN, ACTIVE_CONTRIBUTION_SIMPLE,
			ALLOCATION_EFFECT_SIMPLE, SELECTION_EFFECT_SIMPLE, TOTAL_EFFECT_SIMPLE)),
	SUBPERIOD_SUMMARY("Sub-Period Summary", false, false, List.of(
			BEGINNING_DATE, ENDING_DATE,
			PORTFOLIO_RETURN, BENCHMARK_RETURN, ACTIVE_RETURN,
			PORTFOLIO_CONTRIBUTION_SIMPLE, BENCHMARK_CONTRIBUTION_SIMPLE, ACTIVE_CONTRIBUTION_SIMPLE,
			ALLOCATION_EFFECT_SIMPLE, SELECTION_EFFECT_SIMPLE, TOTAL_EFFECT_SIMPLE));

	private final String title;
	private final boolean classified;
	private final boolean totalRow;
	private final List<Column> columns;

	View(String title, boolean classified, boolean totalRow, List<Column> columns) {
		this.title = title;
		this.classified = classified;
		this.totalRow = totalRow;
		this.columns = columns;
	}

	public String title() {
		return title;
	}

	/**
	 * Whether the view has one row per classification item rather than one per subperiod.
	 */
	public boolean isClassified() {
		return classified;
	}

	public boolean hasTotalRow() {
		return totalRow;
	}

	public List<Column> columns() {
		return columns;
	}

	public boolean contains(Column column) {
		return columns.contains(column);
	}
}
