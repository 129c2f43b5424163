package my.portfolioanalytics.app.attribution;

import my.portfolioanalytics.app.classification.Classification;
import my.portfolioanalytics.app.domain.AssetMetrics;
import my.portfolioanalytics.app.domain.Frequency;
import my.portfolioanalytics.app.domain.Performance;
import my.portfolioanalytics.app.domain.Subperiod;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.util.LinkingMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static my.portfolioanalytics.app.attribution.Column.*;

/**
 * Multi-period Brinson-Fachler attribution of a portfolio against its benchmark.
 * <p>
 * Simple (single-subperiod) effects are
 * <pre>
 * allocation = (rc_b - R_b) * (w_p - w_b)
 * selection  = w_p * (rc_p - rc_b)
 * </pre>
 * and are linked across subperiods with Carino coefficients, so that the smoothed total effects
 * add up to the compounded active return. Contributions are smoothed with each side's own
 * linking coefficients instead.
 */
public class Attribution {
	private static final Logger logger = LoggerFactory.getLogger(Attribution.class);

	public static final int DEFAULT_MAX_RENDER_ROWS = 500;

	private final Performance portfolio;
	private final Performance benchmark;
	private final Classification classification;
	private final Frequency frequency;
	private final AssetUniverse universe;
	private final double[] linkingCoefficients;
	private final List<AttributionRow> rows;
	private final AttributionRow overall;
	private final Map<View, ViewTable> views = new ConcurrentHashMap<>();

	public Attribution(Performance portfolio, Performance benchmark, Classification classification, Frequency frequency) {
		this.universe = AssetUniverse.equalize(portfolio, benchmark);
		requireMatchingSubperiods(portfolio, benchmark);
		this.portfolio = portfolio;
		this.benchmark = benchmark;
		this.classification = classification == null ? Classification.empty() : classification;
		this.frequency = frequency == null ? Frequency.AS_OFTEN_AS_POSSIBLE : frequency;
		this.linkingCoefficients = attributionLinkingCoefficients(portfolio.totalReturns(), benchmark.totalReturns(),
				portfolio.overallReturn(), benchmark.overallReturn());
		this.rows = List.copyOf(calculateSubperiods());
		this.overall = calculateOverall();
		logger.info("Built attribution of {} against {}: {} subperiods, {} classification items.",
				portfolio.name(), benchmark.name(), rows.size(), universe.identifiers().size());
	}

	/**
	 * {@code carino(p_t, b_t) / carino(P, B)} for every subperiod.
	 */
	public static double[] attributionLinkingCoefficients(double[] portfolioReturns,
														  double[] benchmarkReturns,
														  double portfolioOverallReturn,
														  double benchmarkOverallReturn) {
		if (portfolioReturns.length != benchmarkReturns.length) {
			throw new IllegalArgumentException("Series lengths differ: "
					+ portfolioReturns.length + " <> " + benchmarkReturns.length);
		}
		double overallCoefficient = LinkingMath.carinoLinkingCoefficient(portfolioOverallReturn, benchmarkOverallReturn);
		double[] coefficients = new double[portfolioReturns.length];
		for (int t = 0; t < coefficients.length; t++) {
			coefficients[t] = LinkingMath.carinoLinkingCoefficient(portfolioReturns[t], benchmarkReturns[t])
					/ overallCoefficient;
		}
		return coefficients;
	}

	public Performance portfolio() {
		return portfolio;
	}

	public Performance benchmark() {
		return benchmark;
	}

	public Classification classification() {
		return classification;
	}

	public Frequency frequency() {
		return frequency;
	}

	public List<String> identifiers() {
		return universe.identifiers();
	}

	public double[] linkingCoefficients() {
		return linkingCoefficients.clone();
	}

	public List<AttributionRow> subperiods() {
		return rows;
	}

	public AttributionRow overall() {
		return overall;
	}

	public ViewTable view(View view) {
		ViewTable cached = views.get(view);
		if (cached != null) {
			return cached;
		}
		logger.debug("Materializing view {} of {}", view, portfolio.name());
		ViewTable table = ViewMaterializer.materialize(this, view);
		ViewTable existing = views.putIfAbsent(view, table);
		return existing == null ? table : existing;
	}

	public ViewTable renderable(View view) {
		return renderable(view, DEFAULT_MAX_RENDER_ROWS);
	}

	/**
	 * Returns the view for per-row expensive processing, provided it has fewer than
	 * {@code maxRows} rows.
	 */
	public ViewTable renderable(View view, int maxRows) {
		ViewTable table = view(view);
		if (table.size() >= maxRows) {
			throw new AnalyticsException(ErrorCode.TOO_MANY_ROWS_FOR_RENDER,
					"View " + view.title() + " has " + table.size() + " rows; the limit is " + (maxRows - 1));
		}
		return table;
	}

	private List<AttributionRow> calculateSubperiods() {
		double[] portfolioReturns = portfolio.totalReturns();
		double[] benchmarkReturns = benchmark.totalReturns();
		double[] portfolioCoefficients = portfolio.linkingCoefficients();
		double[] benchmarkCoefficients = benchmark.linkingCoefficients();

		List<AttributionRow> calculated = new ArrayList<>();
		double cumulativePortfolioGrowth = 1.0;
		double cumulativeBenchmarkGrowth = 1.0;
		Map<Column, Double> running = new EnumMap<>(Column.class);
		for (int t = 0; t < portfolioReturns.length; t++) {
			double portfolioReturn = portfolioReturns[t];
			double benchmarkReturn = benchmarkReturns[t];

			Map<String, AssetAttribution> assets = new TreeMap<>();
			for (String identifier : universe.identifiers()) {
				AssetMetrics held = universe.portfolioMetrics(t, identifier);
				AssetMetrics index = universe.benchmarkMetrics(t, identifier);
				double portfolioConsolidated = universe.portfolioConsolidatedReturn(t, identifier);
				double benchmarkConsolidated = universe.benchmarkConsolidatedReturn(t, identifier);
				double allocation = (benchmarkConsolidated - benchmarkReturn) * (held.weight() - index.weight());
				double selection = held.weight() * (portfolioConsolidated - benchmarkConsolidated);
				assets.put(identifier, new AssetAttribution(
						held.assetReturn(),
						held.weight(),
						index.assetReturn(),
						index.weight(),
						held.contribution(),
						index.contribution(),
						held.contribution() * portfolioCoefficients[t],
						index.contribution() * benchmarkCoefficients[t],
						allocation,
						selection,
						allocation * linkingCoefficients[t],
						selection * linkingCoefficients[t]));
			}

			Map<Column, Double> values = new EnumMap<>(Column.class);
			values.put(PORTFOLIO_RETURN, portfolioReturn);
			values.put(BENCHMARK_RETURN, benchmarkReturn);
			values.put(ACTIVE_RETURN, portfolioReturn - benchmarkReturn);
			for (Column column : List.of(PORTFOLIO_CONTRIBUTION_SIMPLE, BENCHMARK_CONTRIBUTION_SIMPLE,
					ALLOCATION_EFFECT_SIMPLE, SELECTION_EFFECT_SIMPLE,
					PORTFOLIO_CONTRIBUTION_SMOOTHED, BENCHMARK_CONTRIBUTION_SMOOTHED,
					ALLOCATION_EFFECT_SMOOTHED, SELECTION_EFFECT_SMOOTHED)) {
				double sum = 0.0;
				for (AssetAttribution asset : assets.values()) {
					sum += asset.value(column);
				}
				values.put(column, sum);
			}
			values.put(ACTIVE_CONTRIBUTION_SIMPLE,
					values.get(PORTFOLIO_CONTRIBUTION_SIMPLE) - values.get(BENCHMARK_CONTRIBUTION_SIMPLE));
			values.put(ACTIVE_CONTRIBUTION_SMOOTHED,
					values.get(PORTFOLIO_CONTRIBUTION_SMOOTHED) - values.get(BENCHMARK_CONTRIBUTION_SMOOTHED));
			values.put(TOTAL_EFFECT_SIMPLE, values.get(ALLOCATION_EFFECT_SIMPLE) + values.get(SELECTION_EFFECT_SIMPLE));
			values.put(TOTAL_EFFECT_SMOOTHED,
					values.get(ALLOCATION_EFFECT_SMOOTHED) + values.get(SELECTION_EFFECT_SMOOTHED));

			cumulativePortfolioGrowth *= 1.0 + portfolioReturn;
			cumulativeBenchmarkGrowth *= 1.0 + benchmarkReturn;
			values.put(CUMULATIVE_PORTFOLIO_RETURN, cumulativePortfolioGrowth - 1.0);
			values.put(CUMULATIVE_BENCHMARK_RETURN, cumulativeBenchmarkGrowth - 1.0);
			values.put(CUMULATIVE_ACTIVE_RETURN, cumulativePortfolioGrowth - cumulativeBenchmarkGrowth);
			accumulate(running, values, PORTFOLIO_CONTRIBUTION_SMOOTHED, CUMULATIVE_PORTFOLIO_CONTRIBUTION);
			accumulate(running, values, BENCHMARK_CONTRIBUTION_SMOOTHED, CUMULATIVE_BENCHMARK_CONTRIBUTION);
			accumulate(running, values, ACTIVE_CONTRIBUTION_SMOOTHED, CUMULATIVE_ACTIVE_CONTRIBUTION);
			accumulate(running, values, ALLOCATION_EFFECT_SMOOTHED, CUMULATIVE_ALLOCATION_EFFECT);
			accumulate(running, values, SELECTION_EFFECT_SMOOTHED, CUMULATIVE_SELECTION_EFFECT);
			accumulate(running, values, TOTAL_EFFECT_SMOOTHED, CUMULATIVE_TOTAL_EFFECT);

			calculated.add(new AttributionRow(portfolio.subperiods().get(t), values, assets));
		}
		return calculated;
	}

	private AttributionRow calculateOverall() {
		AttributionRow first = rows.get(0);
		AttributionRow last = rows.get(rows.size() - 1);

		Map<Column, Double> values = new EnumMap<>(Column.class);
		for (Column column : Column.PORTFOLIO_LEVEL) {
			switch (column.kind()) {
				case SIMPLE -> values.put(column, Double.NaN);
				case CUMULATIVE -> values.put(column, last.value(column));
				default -> {
					double sum = 0.0;
					for (AttributionRow row : rows) {
						sum += row.value(column);
					}
					values.put(column, sum);
				}
			}
		}
		double portfolioOverall = portfolio.overallReturn();
		double benchmarkOverall = benchmark.overallReturn();
		values.put(PORTFOLIO_RETURN, portfolioOverall);
		values.put(BENCHMARK_RETURN, benchmarkOverall);
		values.put(ACTIVE_RETURN, portfolioOverall - benchmarkOverall);

		Map<String, AssetAttribution> assets = new TreeMap<>();
		for (String identifier : universe.identifiers()) {
			AssetMetrics held = universe.portfolioOverallMetrics(identifier);
			AssetMetrics index = universe.benchmarkOverallMetrics(identifier);
			double allocation = 0.0;
			double selection = 0.0;
			for (AttributionRow row : rows) {
				AssetAttribution asset = row.asset(identifier);
				allocation += asset.allocationEffectSmoothed();
				selection += asset.selectionEffectSmoothed();
			}
			assets.put(identifier, new AssetAttribution(
					held.assetReturn(),
					held.weight(),
					index.assetReturn(),
					index.weight(),
					Double.NaN,
					Double.NaN,
					held.contribution(),
					index.contribution(),
					Double.NaN,
					Double.NaN,
					allocation,
					selection));
		}
		Subperiod whole = new Subperiod(first.subperiod().beginningDate(), last.subperiod().endingDate());
		return new AttributionRow(whole, values, assets);
	}

	private static void accumulate(Map<Column, Double> running, Map<Column, Double> values, Column source, Column target) {
		double sum = running.getOrDefault(target, 0.0) + values.get(source);
		running.put(target, sum);
		values.put(target, sum);
	}

	private static void requireMatchingSubperiods(Performance portfolio, Performance benchmark) {
		List<Subperiod> portfolioSubperiods = portfolio.subperiods();
		List<Subperiod> benchmarkSubperiods = benchmark.subperiods();
		if (portfolioSubperiods.isEmpty()) {
			throw new IllegalArgumentException("Performance " + portfolio.name() + " has no subperiods");
		}
		if (!portfolioSubperiods.equals(benchmarkSubperiods)) {
			throw new IllegalArgumentException("Subperiods of " + portfolio.name() + " and "
					+ benchmark.name() + " do not match");
		}
	}
}
