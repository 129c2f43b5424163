package my.portfolioanalytics.app.risk;

import my.portfolioanalytics.app.domain.Frequency;
import my.portfolioanalytics.app.domain.Performance;
import my.portfolioanalytics.app.domain.Subperiod;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ex-post risk statistics of a portfolio return series against its benchmark.
 * <p>
 * Standard deviations are population ones. Annualized statistics scale by the square root of the
 * periods per year and are {@code NaN} for series shorter than a year. The minimum acceptable
 * return and the risk-free rate are de-annualized geometrically to the frequency of the returns.
 */
public class RiskStatistics {
	private static final Logger logger = LoggerFactory.getLogger(RiskStatistics.class);

	public static final int MINIMUM_QUANTITY_OF_RETURNS = 2;

	private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

	private final String portfolioName;
	private final String benchmarkName;
	private final LocalDate beginningDate;
	private final LocalDate endingDate;
	private final Frequency frequency;
	private final RiskParameters parameters;
	private final int quantityOfReturns;
	private final double annualizationCoefficient;
	private final double frequencyMinimumAcceptableReturn;
	private final double frequencyRiskFreeRate;
	private final Map<Statistic, StatisticRow> rows;

	public RiskStatistics(double[] portfolioReturns, double[] benchmarkReturns, Frequency frequency) {
		this(portfolioReturns, benchmarkReturns, frequency, RiskParameters.defaults());
	}

	public RiskStatistics(double[] portfolioReturns, double[] benchmarkReturns, Frequency frequency,
						  RiskParameters parameters) {
		this("Portfolio", "Benchmark", null, null, portfolioReturns, benchmarkReturns, frequency, parameters);
	}

	public RiskStatistics(Performance portfolio, Performance benchmark, Frequency frequency, RiskParameters parameters) {
		this(portfolio.name(), benchmark.name(), firstBeginning(portfolio), lastEnding(portfolio),
				portfolio.totalReturns(), benchmark.totalReturns(), frequency, parameters);
	}

	private RiskStatistics(String portfolioName,
						   String benchmarkName,
						   LocalDate beginningDate,
						   LocalDate endingDate,
						   double[] portfolioReturns,
						   double[] benchmarkReturns,
						   Frequency frequency,
						   RiskParameters parameters) {
		if (frequency == null || !frequency.hasPeriodsPerYear()) {
			throw new AnalyticsException(ErrorCode.INVALID_FREQUENCY_FOR_RISK_STATISTICS,
					"Risk statistics need a periodic frequency but got " + frequency);
		}
		if (portfolioReturns.length != benchmarkReturns.length) {
			throw new AnalyticsException(ErrorCode.RETURN_SERIES_LENGTH_MISMATCH,
					"Portfolio and benchmark return counts differ: "
							+ portfolioReturns.length + " <> " + benchmarkReturns.length);
		}
		if (portfolioReturns.length < MINIMUM_QUANTITY_OF_RETURNS) {
			throw new AnalyticsException(ErrorCode.INSUFFICIENT_QUANTITY_OF_RETURNS,
					"At least " + MINIMUM_QUANTITY_OF_RETURNS + " returns are needed but got " + portfolioReturns.length);
		}
		if (containsNaN(portfolioReturns) || containsNaN(benchmarkReturns)) {
			throw new AnalyticsException(ErrorCode.NAN_IN_RETURN_SERIES, "Return series contain NaN");
		}
		this.portfolioName = portfolioName;
		this.benchmarkName = benchmarkName;
		this.beginningDate = beginningDate;
		this.endingDate = endingDate;
		this.frequency = frequency;
		this.parameters = parameters == null ? RiskParameters.defaults() : parameters;
		this.quantityOfReturns = portfolioReturns.length;

		int periodsPerYear = frequency.periodsPerYear();
		this.annualizationCoefficient = quantityOfReturns < periodsPerYear ? Double.NaN : Math.sqrt(periodsPerYear);
		this.frequencyMinimumAcceptableReturn = deannualize(this.parameters.annualMinimumAcceptableReturn(), periodsPerYear);
		this.frequencyRiskFreeRate = deannualize(this.parameters.annualRiskFreeRate(), periodsPerYear);

		Map<Statistic, Double> portfolio = calculate(portfolioReturns.clone(), benchmarkReturns.clone(), true);
		Map<Statistic, Double> benchmark = calculate(benchmarkReturns.clone(), portfolioReturns.clone(), false);
		Map<Statistic, StatisticRow> calculated = new EnumMap<>(Statistic.class);
		for (Statistic statistic : Statistic.values()) {
			calculated.put(statistic, new StatisticRow(statistic, portfolio.get(statistic), benchmark.get(statistic)));
		}
		this.rows = Collections.unmodifiableMap(calculated);
		logger.debug("Calculated {} risk statistics over {} {} returns", rows.size(), quantityOfReturns, frequency.label());
	}

	/**
	 * {@code (1 + annualReturn)^(1 / periodsPerYear) - 1}.
	 */
	public static double deannualize(double annualReturn, int periodsPerYear) {
		return Math.pow(1.0 + annualReturn, 1.0 / periodsPerYear) - 1.0;
	}

	public List<StatisticRow> rows() {
		return new ArrayList<>(rows.values());
	}

	public StatisticRow row(Statistic statistic) {
		return rows.get(statistic);
	}

	public double portfolio(Statistic statistic) {
		return rows.get(statistic).portfolio();
	}

	public double benchmark(Statistic statistic) {
		return rows.get(statistic).benchmark();
	}

	public double difference(Statistic statistic) {
		return rows.get(statistic).difference();
	}

	public String portfolioName() {
		return portfolioName;
	}

	public String benchmarkName() {
		return benchmarkName;
	}

	public LocalDate beginningDate() {
		return beginningDate;
	}

	public LocalDate endingDate() {
		return endingDate;
	}

	public Frequency frequency() {
		return frequency;
	}

	public RiskParameters parameters() {
		return parameters;
	}

	public int quantityOfReturns() {
		return quantityOfReturns;
	}

	public double annualizationCoefficient() {
		return annualizationCoefficient;
	}

	public double frequencyMinimumAcceptableReturn() {
		return frequencyMinimumAcceptableReturn;
	}

	public double frequencyRiskFreeRate() {
		return frequencyRiskFreeRate;
	}

	private Map<Statistic, Double> calculate(double[] returns, double[] other, boolean isPortfolio) {
		StandardDeviation populationStd = new StandardDeviation(false);
		double n = returns.length;
		double mean = StatUtils.mean(returns);
		double stddev = populationStd.evaluate(returns);

		double downsideSquares = 0.0;
		int belowMar = 0;
		double belowMarSum = 0.0;
		for (double value : returns) {
			double shortfall = value - frequencyMinimumAcceptableReturn;
			if (shortfall < 0.0) {
				downsideSquares += shortfall * shortfall;
				belowMar++;
				belowMarSum += shortfall;
			}
		}
		double downsideDeviation = Math.sqrt(downsideSquares / n);

		double[] excess = new double[returns.length];
		List<Double> negativeExcess = new ArrayList<>();
		for (int i = 0; i < returns.length; i++) {
			excess[i] = returns[i] - frequencyRiskFreeRate;
			if (excess[i] < 0.0) {
				negativeExcess.add(excess[i]);
			}
		}
		double excessMean = StatUtils.mean(excess);
		double sharpe = excessMean / populationStd.evaluate(excess);
		double downsideExcessStd = negativeExcess.isEmpty() ? 0.0
				: populationStd.evaluate(negativeExcess.stream().mapToDouble(Double::doubleValue).toArray());
		double sortino = downsideExcessStd == 0.0 ? Double.POSITIVE_INFINITY : excessMean / downsideExcessStd;

		Map<Statistic, Double> values = new EnumMap<>(Statistic.class);
		values.put(Statistic.RANGE, StatUtils.max(returns) - StatUtils.min(returns));
		values.put(Statistic.STANDARD_DEVIATION, stddev);
		values.put(Statistic.STANDARD_DEVIATION_ANNUALIZED, annualizationCoefficient * stddev);
		values.put(Statistic.DOWNSIDE_PROBABILITY, belowMar / n);
		values.put(Statistic.EXPECTED_DOWNSIDE_VALUE, belowMarSum / n);
		values.put(Statistic.DOWNSIDE_DEVIATION, downsideDeviation);
		values.put(Statistic.DOWNSIDE_DEVIATION_ANNUALIZED, annualizationCoefficient * downsideDeviation);
		values.put(Statistic.VALUE_AT_RISK, parametricValueAtRisk(mean, stddev));
		values.put(Statistic.SHARPE_RATIO, sharpe);
		values.put(Statistic.SHARPE_RATIO_ANNUALIZED, annualizationCoefficient * sharpe);
		values.put(Statistic.SORTINO_RATIO, sortino);
		values.put(Statistic.SORTINO_RATIO_ANNUALIZED, annualizationCoefficient * sortino);

		if (!isPortfolio) {
			for (Statistic statistic : Statistic.values()) {
				if (statistic.isPortfolioOnly()) {
					values.put(statistic, Double.NaN);
				}
			}
			return values;
		}

		double[] benchmark = other;
		double benchmarkMean = StatUtils.mean(benchmark);
		double[] active = new double[returns.length];
		for (int i = 0; i < returns.length; i++) {
			active[i] = returns[i] - benchmark[i];
		}
		double trackingError = populationStd.evaluate(active);
		// Sample covariance over population variance.
		double beta = new Covariance().covariance(returns, benchmark, true) / new Variance(false).evaluate(benchmark);
		double alpha = mean - beta * benchmarkMean;
		double correlation = new PearsonsCorrelation().correlation(returns, benchmark);
		double jensensAlpha = excessMean - beta * (benchmarkMean - frequencyRiskFreeRate);

		values.put(Statistic.CORRELATION, correlation);
		values.put(Statistic.R_SQUARED, correlation * correlation);
		values.put(Statistic.TRACKING_ERROR, trackingError);
		values.put(Statistic.TRACKING_ERROR_ANNUALIZED, annualizationCoefficient * trackingError);
		values.put(Statistic.INFORMATION_RATIO,
				trackingError == 0.0 ? Double.POSITIVE_INFINITY : StatUtils.mean(active) / trackingError);
		values.put(Statistic.M_SQUARED, sharpe * populationStd.evaluate(benchmark) + frequencyRiskFreeRate);
		values.put(Statistic.TREYNOR_RATIO, excessMean / beta);
		values.put(Statistic.BETA, beta);
		values.put(Statistic.ALPHA, alpha);
		values.put(Statistic.ALPHA_ANNUALIZED, annualizationCoefficient * alpha);
		values.put(Statistic.JENSENS_ALPHA, jensensAlpha);
		values.put(Statistic.JENSENS_ALPHA_ANNUALIZED, annualizationCoefficient * jensensAlpha);
		return values;
	}

	private double parametricValueAtRisk(double mean, double stddev) {
		double zScore = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - parameters.confidenceLevel());
		return Math.abs(parameters.portfolioValue() * (mean - zScore * stddev));
	}

	private static boolean containsNaN(double[] values) {
		for (double value : values) {
			if (Double.isNaN(value)) {
				return true;
			}
		}
		return false;
	}

	private static LocalDate firstBeginning(Performance performance) {
		List<Subperiod> subperiods = performance.subperiods();
		return subperiods.isEmpty() ? null : subperiods.get(0).beginningDate();
	}

	private static LocalDate lastEnding(Performance performance) {
		List<Subperiod> subperiods = performance.subperiods();
		return subperiods.isEmpty() ? null : subperiods.get(subperiods.size() - 1).endingDate();
	}
}
