package my.portfolioanalytics.app.risk;

import my.portfolioanalytics.app.domain.Frequency;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.support.PerformanceFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RiskStatisticsTest {
	private static final double[] PORTFOLIO = {
			0.021, -0.013, 0.034, 0.008, -0.027, 0.015, 0.042, -0.005, 0.011, 0.019, -0.031, 0.026
	};
	private static final double[] BENCHMARK = {
			0.018, -0.010, 0.029, 0.011, -0.022, 0.012, 0.035, -0.002, 0.009, 0.016, -0.025, 0.020
	};

	private final RiskStatistics statistics = new RiskStatistics(PORTFOLIO, BENCHMARK, Frequency.MONTHLY);

	@Test
	void statisticsAreListedInDisplayOrderWithCategories() {
		List<StatisticRow> rows = statistics.rows();

		assertThat(rows).hasSize(24);
		assertThat(rows.get(0).statistic()).isEqualTo(Statistic.RANGE);
		assertThat(rows.get(23).statistic()).isEqualTo(Statistic.JENSENS_ALPHA_ANNUALIZED);
		Map<StatisticCategory, Long> counts = rows.stream()
				.collect(Collectors.groupingBy(StatisticRow::category, Collectors.counting()));
		assertThat(counts).containsEntry(StatisticCategory.ABSOLUTE_RISK, 3L)
				.containsEntry(StatisticCategory.DOWNSIDE_RISK, 5L)
				.containsEntry(StatisticCategory.BENCHMARK_RELATIVE_RISK, 4L)
				.containsEntry(StatisticCategory.RISK_ADJUSTED_PERFORMANCE, 7L)
				.containsEntry(StatisticCategory.REGRESSION, 5L);
	}

	@Test
	void valueAtRiskFollowsConfidenceLevel() {
		RiskStatistics strict = new RiskStatistics(PORTFOLIO, BENCHMARK, Frequency.MONTHLY,
				new RiskParameters(0.0, 0.03, 0.99, 100_000.0));
		double mean = Arrays.stream(PORTFOLIO).average().orElseThrow();
		double stddev = strict.portfolio(Statistic.STANDARD_DEVIATION);

		assertThat(strict.portfolio(Statistic.VALUE_AT_RISK))
				.isCloseTo(100_000.0 * (mean + 2.3263478740408408 * stddev), within(1e-3));
		assertThat(strict.portfolio(Statistic.VALUE_AT_RISK))
				.isGreaterThan(statistics.portfolio(Statistic.VALUE_AT_RISK));
	}

	@Test
	void absoluteAndDownsideRisk() {
		assertThat(statistics.portfolio(Statistic.RANGE)).isCloseTo(0.073, within(1e-12));
		assertThat(statistics.benchmark(Statistic.RANGE)).isCloseTo(0.06, within(1e-12));
		assertThat(statistics.portfolio(Statistic.STANDARD_DEVIATION)).isCloseTo(0.022095751225568738, within(1e-12));
		assertThat(statistics.benchmark(Statistic.STANDARD_DEVIATION)).isCloseTo(0.018062199632258403, within(1e-12));
		assertThat(statistics.portfolio(Statistic.STANDARD_DEVIATION_ANNUALIZED))
				.isCloseTo(0.07654192750817468, within(1e-12));
		assertThat(statistics.portfolio(Statistic.DOWNSIDE_PROBABILITY)).isCloseTo(1.0 / 3.0, within(1e-12));
		assertThat(statistics.portfolio(Statistic.EXPECTED_DOWNSIDE_VALUE))
				.isCloseTo(-0.006333333333333333, within(1e-12));
		assertThat(statistics.benchmark(Statistic.EXPECTED_DOWNSIDE_VALUE))
				.isCloseTo(-0.004916666666666667, within(1e-12));
		assertThat(statistics.portfolio(Statistic.DOWNSIDE_DEVIATION)).isCloseTo(0.012529964086141668, within(1e-12));
		assertThat(statistics.benchmark(Statistic.DOWNSIDE_DEVIATION_ANNUALIZED))
				.isCloseTo(0.034828149534536, within(1e-12));
		assertThat(statistics.portfolio(Statistic.VALUE_AT_RISK)).isCloseTo(4467.760987692749, within(1e-3));
		assertThat(statistics.benchmark(Statistic.VALUE_AT_RISK)).isCloseTo(3729.30079091751, within(1e-3));
	}

	@Test
	void riskAdjustedPerformance() {
		assertThat(statistics.frequencyRiskFreeRate()).isCloseTo(0.0024662697723036864, within(1e-15));
		assertThat(statistics.portfolio(Statistic.SHARPE_RATIO)).isCloseTo(0.2655290377382782, within(1e-10));
		assertThat(statistics.benchmark(Statistic.SHARPE_RATIO)).isCloseTo(0.28330234773237506, within(1e-10));
		assertThat(statistics.portfolio(Statistic.SHARPE_RATIO_ANNUALIZED)).isCloseTo(0.9198195684951432, within(1e-10));
		assertThat(statistics.portfolio(Statistic.SORTINO_RATIO)).isCloseTo(0.5594025614167794, within(1e-10));
		assertThat(statistics.benchmark(Statistic.SORTINO_RATIO_ANNUALIZED)).isCloseTo(1.9149290982226845, within(1e-10));
		assertThat(statistics.portfolio(Statistic.INFORMATION_RATIO)).isCloseTo(0.174273358834763, within(1e-10));
		assertThat(statistics.portfolio(Statistic.M_SQUARED)).isCloseTo(0.007262308260093942, within(1e-12));
		assertThat(statistics.portfolio(Statistic.TREYNOR_RATIO)).isCloseTo(0.00440880355472437, within(1e-12));
	}

	@Test
	void benchmarkRelativeAndRegression() {
		assertThat(statistics.portfolio(Statistic.CORRELATION)).isCloseTo(0.997179520302439, within(1e-12));
		assertThat(statistics.portfolio(Statistic.R_SQUARED)).isCloseTo(0.9943669957106023, within(1e-12));
		assertThat(statistics.portfolio(Statistic.TRACKING_ERROR)).isCloseTo(0.004303583777891785, within(1e-12));
		assertThat(statistics.portfolio(Statistic.TRACKING_ERROR_ANNUALIZED))
				.isCloseTo(0.014908051515875573, within(1e-12));
		assertThat(statistics.portfolio(Statistic.BETA)).isCloseTo(1.3307609396074453, within(1e-10));
		assertThat(statistics.portfolio(Statistic.ALPHA)).isCloseTo(-0.0017582704586897955, within(1e-12));
		assertThat(statistics.portfolio(Statistic.ALPHA_ANNUALIZED)).isCloseTo(-0.0060908275357963206, within(1e-12));
		assertThat(statistics.portfolio(Statistic.JENSENS_ALPHA)).isCloseTo(-0.000942524751477187, within(1e-12));
		assertThat(statistics.portfolio(Statistic.JENSENS_ALPHA_ANNUALIZED))
				.isCloseTo(-0.0032650015138994343, within(1e-12));
	}

	@Test
	void portfolioOnlyStatisticsHaveNoBenchmarkValue() {
		for (Statistic statistic : Statistic.values()) {
			StatisticRow row = statistics.row(statistic);
			if (statistic.isPortfolioOnly()) {
				assertThat(row.benchmark()).as(statistic.name()).isNaN();
				assertThat(row.difference()).as(statistic.name()).isNaN();
			} else {
				assertThat(row.difference()).as(statistic.name())
						.isCloseTo(row.portfolio() - row.benchmark(), within(1e-15));
			}
		}
	}

	@Test
	void annualizedStatisticsAreNaNForLessThanAYear() {
		RiskStatistics quarterly = new RiskStatistics(new double[]{0.02, -0.01, 0.03},
				new double[]{0.015, -0.005, 0.02}, Frequency.QUARTERLY);

		assertThat(quarterly.annualizationCoefficient()).isNaN();
		for (Statistic statistic : Statistic.values()) {
			if (statistic.isAnnualized()) {
				assertThat(quarterly.portfolio(statistic)).as(statistic.name()).isNaN();
				assertThat(quarterly.benchmark(statistic)).as(statistic.name()).isNaN();
			}
		}
		assertThat(quarterly.portfolio(Statistic.STANDARD_DEVIATION)).isFinite();
	}

	@Test
	void ratiosWithZeroDenominatorAreInfinite() {
		double[] portfolio = {0.5, 0.25, 0.75};
		double[] benchmark = {0.25, 0.0, 0.5};

		RiskStatistics constantActive = new RiskStatistics(portfolio, benchmark, Frequency.YEARLY);

		assertThat(constantActive.portfolio(Statistic.TRACKING_ERROR)).isZero();
		assertThat(constantActive.portfolio(Statistic.INFORMATION_RATIO)).isEqualTo(Double.POSITIVE_INFINITY);
		assertThat(constantActive.portfolio(Statistic.SORTINO_RATIO)).isEqualTo(Double.POSITIVE_INFINITY);
	}

	@Test
	void performancesContributeNamesDatesAndTotalReturns() {
		RiskStatistics fromPerformances = new RiskStatistics(PerformanceFixtures.portfolio(),
				PerformanceFixtures.benchmark(), Frequency.MONTHLY, RiskParameters.defaults());

		assertThat(fromPerformances.portfolioName()).isEqualTo("Growth Fund");
		assertThat(fromPerformances.beginningDate()).isEqualTo(PerformanceFixtures.DATES[0]);
		assertThat(fromPerformances.endingDate()).isEqualTo(PerformanceFixtures.DATES[5]);
		assertThat(fromPerformances.quantityOfReturns()).isEqualTo(5);
		assertThat(fromPerformances.portfolio(Statistic.STANDARD_DEVIATION_ANNUALIZED)).isNaN();
	}

	@Test
	void preconditionsRaiseDistinctErrors() {
		assertThatThrownBy(() -> new RiskStatistics(PORTFOLIO, BENCHMARK, Frequency.AS_OFTEN_AS_POSSIBLE))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_FREQUENCY_FOR_RISK_STATISTICS);
		assertThatThrownBy(() -> new RiskStatistics(PORTFOLIO, Arrays.copyOf(BENCHMARK, 11), Frequency.MONTHLY))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.RETURN_SERIES_LENGTH_MISMATCH);
		assertThatThrownBy(() -> new RiskStatistics(new double[]{0.01}, new double[]{0.02}, Frequency.MONTHLY))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_QUANTITY_OF_RETURNS);
		assertThatThrownBy(() -> new RiskStatistics(new double[]{0.01, Double.NaN}, new double[]{0.02, 0.01},
				Frequency.MONTHLY))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.NAN_IN_RETURN_SERIES);
	}

	@Test
	void frequencyIsCheckedBeforeLengths() {
		assertThatThrownBy(() -> new RiskStatistics(new double[]{0.01}, new double[]{0.02, 0.03},
				Frequency.AS_OFTEN_AS_POSSIBLE))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_FREQUENCY_FOR_RISK_STATISTICS);
	}

	@Test
	void deannualizeIsGeometric() {
		assertThat(RiskStatistics.deannualize(0.03, 12)).isCloseTo(0.0024662697723036864, within(1e-15));
		assertThat(RiskStatistics.deannualize(0.0, 4)).isZero();
		assertThatThrownBy(() -> new RiskParameters(0.0, 0.03, 1.0, 1.0))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
