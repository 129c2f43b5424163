package my.portfolioanalytics.app.domain;

import my.portfolioanalytics.app.classification.Mapping;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.util.LinkingMath;
import my.portfolioanalytics.app.util.Tolerance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

public final class PerformanceSeries implements Performance {
	private final String name;
	private final String classificationName;
	private final Map<String, String> classificationItems;
	private final List<Subperiod> subperiods;
	private final List<Map<String, AssetMetrics>> holdings;
	private final List<Map<String, Double>> consolidatedReturns;
	private final boolean consolidated;
	private final List<String> identifiers;
	private final double[] totalReturns;
	private final double overallReturn;
	private final double[] linkingCoefficients;

	public PerformanceSeries(String name,
							 String classificationName,
							 Map<String, String> classificationItems,
							 List<Entry> entries) {
		this(name, classificationName, classificationItems, entries, false);
	}

	public PerformanceSeries(String name,
							 String classificationName,
							 Map<String, String> classificationItems,
							 List<Entry> entries,
							 boolean consolidated) {
		if (entries == null || entries.isEmpty()) {
			throw new IllegalArgumentException("Performance " + name + " has no subperiods");
		}
		this.name = name == null ? "" : name;
		this.classificationName = classificationName == null ? "" : classificationName;
		this.classificationItems = lowerCaseKeys(classificationItems);
		this.consolidated = consolidated;

		List<Subperiod> periods = new ArrayList<>();
		List<Map<String, AssetMetrics>> held = new ArrayList<>();
		List<Map<String, Double>> rebased = new ArrayList<>();
		TreeSet<String> allIdentifiers = new TreeSet<>();
		double[] totals = new double[entries.size()];
		for (int t = 0; t < entries.size(); t++) {
			Entry entry = Objects.requireNonNull(entries.get(t), "entry");
			if (t > 0 && !entry.subperiod().beginningDate().equals(periods.get(t - 1).endingDate())) {
				throw new IllegalArgumentException("Discontinuous subperiods in " + this.name + ": "
						+ periods.get(t - 1).endingDate() + " -> " + entry.subperiod().beginningDate());
			}
			Map<String, AssetMetrics> metrics = lowerCaseKeys(entry.holdings());
			double weightSum = 0.0;
			double total = 0.0;
			for (AssetMetrics value : metrics.values()) {
				weightSum += value.weight();
				total += value.contribution();
			}
			if (!Tolerance.areNear(weightSum, 1.0, Tolerance.LOW)) {
				throw new AnalyticsException(ErrorCode.WEIGHTS_DO_NOT_SUM_TO_ONE,
						String.format(Locale.ROOT, "Weights of %s sum to %.10f for %s", this.name, weightSum,
								entry.subperiod()));
			}
			periods.add(entry.subperiod());
			held.add(Collections.unmodifiableMap(metrics));
			rebased.add(Collections.unmodifiableMap(lowerCaseKeys(entry.consolidatedReturns())));
			allIdentifiers.addAll(metrics.keySet());
			totals[t] = total;
		}
		this.subperiods = List.copyOf(periods);
		this.holdings = List.copyOf(held);
		this.consolidatedReturns = List.copyOf(rebased);
		this.identifiers = List.copyOf(allIdentifiers);
		this.totalReturns = totals;
		this.overallReturn = compound(totals);
		this.linkingCoefficients = LinkingMath.logLinkingCoefficients(overallReturn, totals);
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public List<Subperiod> subperiods() {
		return subperiods;
	}

	@Override
	public double[] totalReturns() {
		return totalReturns.clone();
	}

	@Override
	public List<String> identifiers() {
		return identifiers;
	}

	@Override
	public AssetMetrics metrics(int subperiod, String identifier) {
		return holdings.get(subperiod).getOrDefault(identifier, AssetMetrics.ZERO);
	}

	@Override
	public double consolidatedReturn(int subperiod, String identifier) {
		Double rebased = consolidatedReturns.get(subperiod).get(identifier);
		if (rebased != null) {
			return rebased;
		}
		return metrics(subperiod, identifier).assetReturn();
	}

	@Override
	public double[] linkingCoefficients() {
		return linkingCoefficients.clone();
	}

	@Override
	public double overallReturn() {
		return overallReturn;
	}

	@Override
	public AssetMetrics overallMetrics(String identifier) {
		double growth = 1.0;
		double weightSum = 0.0;
		double contribution = 0.0;
		for (int t = 0; t < subperiods.size(); t++) {
			AssetMetrics metrics = metrics(t, identifier);
			growth *= 1.0 + metrics.assetReturn();
			weightSum += metrics.weight();
			contribution += metrics.contribution() * linkingCoefficients[t];
		}
		return new AssetMetrics(growth - 1.0, weightSum / subperiods.size(), contribution);
	}

	@Override
	public boolean subperiodsConsolidated() {
		return consolidated;
	}

	@Override
	public String classificationName() {
		return classificationName;
	}

	@Override
	public Map<String, String> classificationItems() {
		return classificationItems;
	}

	/**
	 * Relabels every asset through {@code mapping}, aggregating weights and contributions of the
	 * assets that land on the same target identifier.
	 */
	public PerformanceSeries mapTo(Mapping mapping, String targetClassificationName) {
		Objects.requireNonNull(mapping, "mapping");
		List<Entry> mapped = new ArrayList<>();
		for (int t = 0; t < subperiods.size(); t++) {
			Map<String, double[]> groups = new TreeMap<>();
			for (Map.Entry<String, AssetMetrics> holding : holdings.get(t).entrySet()) {
				String target = mapping.map(holding.getKey());
				double[] group = groups.computeIfAbsent(target, key -> new double[3]);
				AssetMetrics metrics = holding.getValue();
				group[0] += metrics.weight();
				group[1] += metrics.contribution();
				group[2] += metrics.weight() * consolidatedReturn(t, holding.getKey());
			}
			Map<String, AssetMetrics> aggregated = new TreeMap<>();
			Map<String, Double> rebased = new TreeMap<>();
			for (Map.Entry<String, double[]> group : groups.entrySet()) {
				double weight = group.getValue()[0];
				double contribution = group.getValue()[1];
				double assetReturn = weight == 0.0 ? 0.0 : contribution / weight;
				aggregated.put(group.getKey(), new AssetMetrics(assetReturn, weight, contribution));
				if (!consolidatedReturns.get(t).isEmpty()) {
					rebased.put(group.getKey(), weight == 0.0 ? 0.0 : group.getValue()[2] / weight);
				}
			}
			mapped.add(new Entry(subperiods.get(t), aggregated, rebased));
		}
		return new PerformanceSeries(name, targetClassificationName, Map.of(), mapped, consolidated);
	}

	private static double compound(double[] returns) {
		double growth = 1.0;
		for (double value : returns) {
			growth *= 1.0 + value;
		}
		return growth - 1.0;
	}

	private static <V> Map<String, V> lowerCaseKeys(Map<String, V> source) {
		Map<String, V> normalized = new TreeMap<>();
		if (source == null) {
			return normalized;
		}
		for (Map.Entry<String, V> entry : source.entrySet()) {
			if (entry.getKey() == null) {
				continue;
			}
			String key = entry.getKey().trim().toLowerCase(Locale.ROOT);
			if (normalized.put(key, entry.getValue()) != null) {
				throw new IllegalArgumentException("Duplicate identifier after case normalization: " + key);
			}
		}
		return normalized;
	}

	public record Entry(Subperiod subperiod,
						Map<String, AssetMetrics> holdings,
						Map<String, Double> consolidatedReturns) {
		public Entry {
			Objects.requireNonNull(subperiod, "subperiod");
			holdings = holdings == null ? Map.of() : holdings;
			consolidatedReturns = consolidatedReturns == null ? Map.of() : consolidatedReturns;
		}

		public static Entry of(Subperiod subperiod, Map<String, AssetMetrics> holdings) {
			return new Entry(subperiod, holdings, Map.of());
		}
	}
}
