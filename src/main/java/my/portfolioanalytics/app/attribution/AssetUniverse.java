package my.portfolioanalytics.app.attribution;

import my.portfolioanalytics.app.domain.AssetMetrics;
import my.portfolioanalytics.app.domain.Performance;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The sorted union of the portfolio and benchmark identifiers. An identifier held on only one side
 * reads as zero weight, return and contribution on the other.
 */
public final class AssetUniverse {
	private final Performance portfolio;
	private final Performance benchmark;
	private final Set<String> portfolioIdentifiers;
	private final Set<String> benchmarkIdentifiers;
	private final List<String> identifiers;

	private AssetUniverse(Performance portfolio, Performance benchmark) {
		this.portfolio = portfolio;
		this.benchmark = benchmark;
		this.portfolioIdentifiers = Set.copyOf(portfolio.identifiers());
		this.benchmarkIdentifiers = Set.copyOf(benchmark.identifiers());
		TreeSet<String> union = new TreeSet<>(portfolioIdentifiers);
		union.addAll(benchmarkIdentifiers);
		this.identifiers = List.copyOf(union);
	}

	public static AssetUniverse equalize(Performance portfolio, Performance benchmark) {
		if (portfolio == null || benchmark == null) {
			throw new IllegalArgumentException("Portfolio and benchmark are required");
		}
		return new AssetUniverse(portfolio, benchmark);
	}

	public List<String> identifiers() {
		return identifiers;
	}

	public AssetMetrics portfolioMetrics(int subperiod, String identifier) {
		return portfolioIdentifiers.contains(identifier) ? portfolio.metrics(subperiod, identifier) : AssetMetrics.ZERO;
	}

	public AssetMetrics benchmarkMetrics(int subperiod, String identifier) {
		return benchmarkIdentifiers.contains(identifier) ? benchmark.metrics(subperiod, identifier) : AssetMetrics.ZERO;
	}

	public double portfolioConsolidatedReturn(int subperiod, String identifier) {
		return portfolioIdentifiers.contains(identifier) ? portfolio.consolidatedReturn(subperiod, identifier) : 0.0;
	}

	public double benchmarkConsolidatedReturn(int subperiod, String identifier) {
		return benchmarkIdentifiers.contains(identifier) ? benchmark.consolidatedReturn(subperiod, identifier) : 0.0;
	}

	public AssetMetrics portfolioOverallMetrics(String identifier) {
		return portfolioIdentifiers.contains(identifier) ? portfolio.overallMetrics(identifier) : AssetMetrics.ZERO;
	}

	public AssetMetrics benchmarkOverallMetrics(String identifier) {
		return benchmarkIdentifiers.contains(identifier) ? benchmark.overallMetrics(identifier) : AssetMetrics.ZERO;
	}
}
