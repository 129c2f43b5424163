package my.portfolioanalytics.app.classification;

import my.portfolioanalytics.app.importer.TwoColumnSourceReader;
import my.portfolioanalytics.app.util.CsvParsing;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Relabels asset identifiers into the identifiers of another classification. Only the identifiers
 * the mapping was built for are retained; an identifier missing from the source maps to itself.
 */
public final class Mapping {
	private final Map<String, String> targets;

	public Mapping(Map<String, String> source, Collection<String> identifiersToMap) {
		Map<String, String> normalized = new TreeMap<>();
		if (source != null) {
			source.forEach((identifier, target) -> {
				if (identifier != null && target != null && !target.isBlank()) {
					normalized.put(CsvParsing.normalizeKey(identifier), CsvParsing.normalizeKey(target));
				}
			});
		}
		Map<String, String> retained = new TreeMap<>();
		if (identifiersToMap != null) {
			for (String identifier : identifiersToMap) {
				String key = CsvParsing.normalizeKey(identifier);
				retained.put(key, normalized.getOrDefault(key, key));
			}
		}
		this.targets = Collections.unmodifiableMap(retained);
	}

	public static Mapping fromCsv(Path path, Collection<String> identifiersToMap) {
		return new Mapping(TwoColumnSourceReader.read(path), identifiersToMap);
	}

	public static Mapping fromTable(List<List<String>> rows, Collection<String> identifiersToMap) {
		return new Mapping(TwoColumnSourceReader.fromTable(rows), identifiersToMap);
	}

	public String map(String identifier) {
		String key = CsvParsing.normalizeKey(identifier);
		return targets.getOrDefault(key, key);
	}

	public Map<String, String> targets() {
		return targets;
	}
}
