package my.portfolioanalytics.app.attribution;

import my.portfolioanalytics.app.domain.Performance;
import my.portfolioanalytics.app.domain.Subperiod;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.util.Tolerance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static my.portfolioanalytics.app.attribution.Column.*;

/**
 * Arithmetic identities every attribution must satisfy. A violation means the inputs or the
 * engine are wrong; it is reported as an {@link AnalyticsException} and never recovered.
 */
public final class AttributionAuditor {
	private static final Logger logger = LoggerFactory.getLogger(AttributionAuditor.class);

	private static final int IDENTITY_DECIMALS = 7;
	private static final int CONTRIBUTION_DECIMALS = 11;
	private static final int TOTAL_RETURN_DECIMALS = 11;

	private static final List<Column[]> SIMPLE_PAIRS = List.of(
			new Column[]{PORTFOLIO_RETURN, PORTFOLIO_CONTRIBUTION_SIMPLE},
			new Column[]{BENCHMARK_RETURN, BENCHMARK_CONTRIBUTION_SIMPLE},
			new Column[]{ACTIVE_RETURN, ACTIVE_CONTRIBUTION_SIMPLE},
			new Column[]{ACTIVE_RETURN, TOTAL_EFFECT_SIMPLE}
	);

	private static final List<Column[]> OVERALL_PAIRS = List.of(
			new Column[]{PORTFOLIO_RETURN, PORTFOLIO_CONTRIBUTION_SMOOTHED},
			new Column[]{BENCHMARK_RETURN, BENCHMARK_CONTRIBUTION_SMOOTHED},
			new Column[]{ACTIVE_RETURN, ACTIVE_CONTRIBUTION_SMOOTHED},
			new Column[]{PORTFOLIO_RETURN, CUMULATIVE_PORTFOLIO_RETURN},
			new Column[]{BENCHMARK_RETURN, CUMULATIVE_BENCHMARK_RETURN},
			new Column[]{ACTIVE_RETURN, CUMULATIVE_ACTIVE_RETURN},
			new Column[]{PORTFOLIO_RETURN, CUMULATIVE_PORTFOLIO_CONTRIBUTION},
			new Column[]{BENCHMARK_RETURN, CUMULATIVE_BENCHMARK_CONTRIBUTION},
			new Column[]{ACTIVE_RETURN, CUMULATIVE_ACTIVE_CONTRIBUTION},
			new Column[]{ALLOCATION_EFFECT_SMOOTHED, CUMULATIVE_ALLOCATION_EFFECT},
			new Column[]{SELECTION_EFFECT_SMOOTHED, CUMULATIVE_SELECTION_EFFECT},
			new Column[]{TOTAL_EFFECT_SMOOTHED, CUMULATIVE_TOTAL_EFFECT},
			new Column[]{ACTIVE_RETURN, TOTAL_EFFECT_SMOOTHED},
			new Column[]{ACTIVE_RETURN, CUMULATIVE_TOTAL_EFFECT}
	);

	private AttributionAuditor() {
	}

	public static void audit(Attribution attribution) {
		auditPerformances(attribution.portfolio(), attribution.benchmark());
		auditColumns(attribution.subperiods(), attribution.overall(), Column.PORTFOLIO_LEVEL, true,
				"attribution of " + attribution.portfolio().name());
		logger.debug("Audited attribution of {}", attribution.portfolio().name());
	}

	public static void auditView(Attribution attribution, View view) {
		ViewTable table = attribution.view(view);
		auditContributions(table, attribution.portfolio(),
				PORTFOLIO_WEIGHT, PORTFOLIO_RETURN, PORTFOLIO_CONTRIBUTION_SIMPLE);
		auditContributions(table, attribution.benchmark(),
				BENCHMARK_WEIGHT, BENCHMARK_RETURN, BENCHMARK_CONTRIBUTION_SIMPLE);
		// Item-level subperiod rows interact with one another, so their simple pairs do not tie.
		boolean simplePairs = view != View.SUBPERIOD_ATTRIBUTION;
		auditColumns(table.bodyRows(), table.totalRow().orElse(null), Set.copyOf(view.columns()), simplePairs,
				"view " + view.title());
	}

	public static void auditAttributions(List<Attribution> attributions) {
		Attribution base = null;
		for (Attribution attribution : attributions) {
			audit(attribution);
			if (base == null) {
				base = attribution;
				continue;
			}
			requireEquivalent(base.portfolio(), attribution.portfolio());
			requireEquivalent(base.benchmark(), attribution.benchmark());
		}
	}

	private static void auditPerformances(Performance portfolio, Performance benchmark) {
		List<Subperiod> portfolioSubperiods = portfolio.subperiods();
		List<Subperiod> benchmarkSubperiods = benchmark.subperiods();
		if (!portfolioSubperiods.get(0).beginningDate().equals(benchmarkSubperiods.get(0).beginningDate())
				|| !portfolioSubperiods.get(portfolioSubperiods.size() - 1).endingDate()
				.equals(benchmarkSubperiods.get(benchmarkSubperiods.size() - 1).endingDate())) {
			throw violation(ErrorCode.ARITHMETIC_IDENTITY_VIOLATION,
					"Date ranges of " + portfolio.name() + " and " + benchmark.name() + " differ");
		}
	}

	private static void auditContributions(ViewTable table, Performance performance,
										   Column weight, Column assetReturn, Column contribution) {
		if (performance.subperiodsConsolidated()) {
			return;
		}
		if (!table.view().contains(weight) || !table.view().contains(assetReturn)
				|| !table.view().contains(contribution)) {
			return;
		}
		for (ViewRow row : table.rows()) {
			double expected = row.value(weight) * row.value(assetReturn);
			if (!Tolerance.equalToDecimals(expected, row.value(contribution), CONTRIBUTION_DECIMALS)) {
				throw violation(ErrorCode.ARITHMETIC_IDENTITY_VIOLATION, String.format(
						"weight * return != contribution for %s on %s: %s <> %s",
						row.identifier(), row.beginningDate(), expected, row.value(contribution)));
			}
		}
	}

	private static void auditColumns(List<? extends ColumnValues> body,
									 ColumnValues overall,
									 Set<Column> present,
									 boolean simplePairs,
									 String subject) {
		if (simplePairs) {
			for (Column[] pair : SIMPLE_PAIRS) {
				if (!present.contains(pair[0]) || !present.contains(pair[1])) {
					continue;
				}
				for (ColumnValues row : body) {
					requirePair(row, pair, subject);
				}
			}
		}
		if (overall == null) {
			return;
		}
		for (Column[] pair : OVERALL_PAIRS) {
			if (present.contains(pair[0]) && present.contains(pair[1])) {
				requirePair(overall, pair, subject + " (overall)");
			}
		}
		for (Column column : present) {
			if (column.kind() != Column.Kind.SMOOTHED) {
				continue;
			}
			double sum = 0.0;
			for (ColumnValues row : body) {
				sum += row.value(column);
			}
			if (!Tolerance.areNear(sum, overall.value(column), Tolerance.MEDIUM)) {
				throw violation(ErrorCode.ARITHMETIC_IDENTITY_VIOLATION,
						subject + ": " + column + " does not foot when summed (" + sum + " <> "
								+ overall.value(column) + ")");
			}
		}
	}

	private static void requirePair(ColumnValues row, Column[] pair, String subject) {
		double first = row.value(pair[0]);
		double second = row.value(pair[1]);
		if (!Tolerance.equalToDecimals(first, second, IDENTITY_DECIMALS)) {
			throw violation(ErrorCode.ARITHMETIC_IDENTITY_VIOLATION,
					subject + ": " + pair[0] + " <> " + pair[1] + " (" + first + " <> " + second + ")");
		}
	}

	private static void requireEquivalent(Performance base, Performance other) {
		List<Subperiod> baseSubperiods = base.subperiods();
		List<Subperiod> otherSubperiods = other.subperiods();
		double[] baseReturns = base.totalReturns();
		double[] otherReturns = other.totalReturns();
		if (baseSubperiods.size() != otherSubperiods.size()) {
			throw violation(ErrorCode.CROSS_INSTANCE_INCONSISTENCY,
					base.name() + " and " + other.name() + " have different subperiod counts");
		}
		for (int t = 0; t < baseSubperiods.size(); t++) {
			Subperiod expected = baseSubperiods.get(t);
			Subperiod actual = otherSubperiods.get(t);
			if (!expected.equals(actual) || expected.quantityOfDays() != actual.quantityOfDays()) {
				throw violation(ErrorCode.CROSS_INSTANCE_INCONSISTENCY,
						"Subperiod " + t + " differs: " + expected + " <> " + actual);
			}
			if (!Tolerance.equalToDecimals(baseReturns[t], otherReturns[t], TOTAL_RETURN_DECIMALS)) {
				throw violation(ErrorCode.CROSS_INSTANCE_INCONSISTENCY,
						"Total return of " + other.name() + " differs in " + actual + ": "
								+ baseReturns[t] + " <> " + otherReturns[t]);
			}
		}
	}

	private static AnalyticsException violation(ErrorCode code, String message) {
		logger.error("Audit failed: {}", message);
		return new AnalyticsException(code, message);
	}
}
