package my.portfolioanalytics.app.classification;

import my.portfolioanalytics.app.importer.TwoColumnSourceReader;
import my.portfolioanalytics.app.util.CsvParsing;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Display names of the items of one classification (e.g. sector names keyed by sector code).
 */
public final class Classification {
	private static final Classification EMPTY = new Classification("", Map.of());

	private final String name;
	private final Map<String, String> items;

	public Classification(String name, Map<String, String> items) {
		this.name = name == null ? "" : name;
		Map<String, String> normalized = new TreeMap<>();
		if (items != null) {
			items.forEach((identifier, displayName) -> {
				if (identifier != null) {
					normalized.put(CsvParsing.normalizeKey(identifier), displayName);
				}
			});
		}
		this.items = Collections.unmodifiableMap(normalized);
	}

	public static Classification empty() {
		return EMPTY;
	}

	public static Classification fromCsv(String name, Path path) {
		return new Classification(name, TwoColumnSourceReader.read(path));
	}

	public static Classification fromTable(String name, List<List<String>> rows) {
		return new Classification(name, TwoColumnSourceReader.fromTable(rows));
	}

	public String name() {
		return name;
	}

	public Map<String, String> items() {
		return items;
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

	/**
	 * @return the display name of {@code identifier}, or {@code null} when it is not classified
	 */
	public String displayName(String identifier) {
		return items.get(CsvParsing.normalizeKey(identifier));
	}
}
