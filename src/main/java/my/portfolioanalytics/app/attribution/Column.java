package my.portfolioanalytics.app.attribution;

import java.util.EnumSet;
import java.util.Set;

public enum Column {
	BEGINNING_DATE(Kind.DATE, "Beginning Date"),
	ENDING_DATE(Kind.DATE, "Ending Date"),
	CLASSIFICATION_IDENTIFIER(Kind.CLASSIFICATION, "Identifier"),
	CLASSIFICATION_NAME(Kind.CLASSIFICATION, "Name"),

	PORTFOLIO_WEIGHT(Kind.WEIGHT, "Portfolio Weight"),
	BENCHMARK_WEIGHT(Kind.WEIGHT, "Benchmark Weight"),
	ACTIVE_WEIGHT(Kind.WEIGHT, "Active Weight"),

	PORTFOLIO_RETURN(Kind.RETURN, "Portfolio Return"),
	BENCHMARK_RETURN(Kind.RETURN, "Benchmark Return"),
	ACTIVE_RETURN(Kind.RETURN, "Active Return"),

	PORTFOLIO_CONTRIBUTION_SIMPLE(Kind.SIMPLE, "Portfolio Contribution"),
	BENCHMARK_CONTRIBUTION_SIMPLE(Kind.SIMPLE, "Benchmark Contribution"),
	ACTIVE_CONTRIBUTION_SIMPLE(Kind.SIMPLE, "Active Contribution"),
	ALLOCATION_EFFECT_SIMPLE(Kind.SIMPLE, "Allocation Effect"),
	SELECTION_EFFECT_SIMPLE(Kind.SIMPLE, "Selection Effect"),
	TOTAL_EFFECT_SIMPLE(Kind.SIMPLE, "Total Effect"),

	PORTFOLIO_CONTRIBUTION_SMOOTHED(Kind.SMOOTHED, "Portfolio Contribution"),
	BENCHMARK_CONTRIBUTION_SMOOTHED(Kind.SMOOTHED, "Benchmark Contribution"),
	ACTIVE_CONTRIBUTION_SMOOTHED(Kind.SMOOTHED, "Active Contribution"),
	ALLOCATION_EFFECT_SMOOTHED(Kind.SMOOTHED, "Allocation Effect"),
	SELECTION_EFFECT_SMOOTHED(Kind.SMOOTHED, "Selection Effect"),
	TOTAL_EFFECT_SMOOTHED(Kind.SMOOTHED, "Total Effect"),

	CUMULATIVE_PORTFOLIO_RETURN(Kind.CUMULATIVE, "Cumulative Portfolio Return"),
	CUMULATIVE_BENCHMARK_RETURN(Kind.CUMULATIVE, "Cumulative Benchmark Return"),
	CUMULATIVE_ACTIVE_RETURN(Kind.CUMULATIVE, "Cumulative Active Return"),
	CUMULATIVE_PORTFOLIO_CONTRIBUTION(Kind.CUMULATIVE, "Cumulative Portfolio Contribution"),
	CUMULATIVE_BENCHMARK_CONTRIBUTION(Kind.CUMULATIVE, "Cumulative Benchmark Contribution"),
	CUMULATIVE_ACTIVE_CONTRIBUTION(Kind.CUMULATIVE, "Cumulative Active Contribution"),
	CUMULATIVE_ALLOCATION_EFFECT(Kind.CUMULATIVE, "Cumulative Allocation Effect"),
	CUMULATIVE_SELECTION_EFFECT(Kind.CUMULATIVE, "Cumulative Selection Effect"),
	CUMULATIVE_TOTAL_EFFECT(Kind.CUMULATIVE, "Cumulative Total Effect");

	public enum Kind {
		DATE,
		CLASSIFICATION,
		WEIGHT,
		RETURN,
		SIMPLE,
		SMOOTHED,
		CUMULATIVE
	}

	/** Columns carried by a portfolio-level attribution row. */
	static final Set<Column> PORTFOLIO_LEVEL = EnumSet.noneOf(Column.class);

	static {
		for (Column column : values()) {
			if (column.kind == Kind.RETURN || column.kind == Kind.SIMPLE
					|| column.kind == Kind.SMOOTHED || column.kind == Kind.CUMULATIVE) {
				PORTFOLIO_LEVEL.add(column);
			}
		}
	}

	private final Kind kind;
	private final String label;

	Column(Kind kind, String label) {
		this.kind = kind;
		this.label = label;
	}

	public Kind kind() {
		return kind;
	}

	public String label() {
		return label;
	}

	public boolean isNumeric() {
		return kind != Kind.DATE && kind != Kind.CLASSIFICATION;
	}
}
