package my.portfolioanalytics.app.importer;

import my.portfolioanalytics.app.domain.AssetMetrics;
import my.portfolioanalytics.app.domain.PerformanceSeries;
import my.portfolioanalytics.app.domain.Subperiod;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a long-format performance file, one line per subperiod and asset:
 * <pre>
 * beginning_date,ending_date,identifier,return,weight[,consolidated_return]
 * </pre>
 */
public class PerformanceCsvReader {
	private static final Logger logger = LoggerFactory.getLogger(PerformanceCsvReader.class);

	static final String BEGINNING_DATE = "beginning_date";
	static final String ENDING_DATE = "ending_date";
	static final String IDENTIFIER = "identifier";
	static final String RETURN = "return";
	static final String WEIGHT = "weight";
	static final String CONSOLIDATED_RETURN = "consolidated_return";

	public PerformanceSeries read(Path path, String name, String classificationName, Map<String, String> classificationItems) {
		String content = CsvParsing.readUtf8(path);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(content))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();

		Map<LocalDate, Subperiod> subperiods = new TreeMap<>();
		Map<LocalDate, Map<String, AssetMetrics>> holdings = new TreeMap<>();
		Map<LocalDate, Map<String, Double>> rebased = new TreeMap<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			Map<String, String> columns = normalizedHeader(parser.getHeaderNames());
			for (String required : List.of(BEGINNING_DATE, ENDING_DATE, IDENTIFIER, RETURN, WEIGHT)) {
				if (!columns.containsKey(required)) {
					throw new IllegalArgumentException("Missing column " + required + " in " + path);
				}
			}
			boolean hasConsolidated = columns.containsKey(CONSOLIDATED_RETURN);
			for (CSVRecord record : parser) {
				Subperiod subperiod = new Subperiod(
						parseDate(record.get(columns.get(BEGINNING_DATE))),
						parseDate(record.get(columns.get(ENDING_DATE))));
				String identifier = CsvParsing.normalizeKey(record.get(columns.get(IDENTIFIER)));
				if (identifier.isEmpty()) {
					logger.warn("Skipping line {} without identifier in {}", record.getRecordNumber(), path);
					continue;
				}
				double assetReturn = parseNumber(record.get(columns.get(RETURN)), record);
				double weight = parseNumber(record.get(columns.get(WEIGHT)), record);
				Subperiod known = subperiods.putIfAbsent(subperiod.beginningDate(), subperiod);
				if (known != null && !known.equals(subperiod)) {
					throw new IllegalArgumentException("Conflicting ending dates for subperiod beginning "
							+ subperiod.beginningDate() + " in " + path);
				}
				Map<String, AssetMetrics> period = holdings.computeIfAbsent(subperiod.beginningDate(), key -> new TreeMap<>());
				if (period.put(identifier, AssetMetrics.of(assetReturn, weight)) != null) {
					throw new IllegalArgumentException("Duplicate identifier " + identifier + " for " + subperiod);
				}
				if (hasConsolidated) {
					String value = record.get(columns.get(CONSOLIDATED_RETURN));
					if (value != null && !value.isBlank()) {
						rebased.computeIfAbsent(subperiod.beginningDate(), key -> new TreeMap<>())
								.put(identifier, parseNumber(value, record));
					}
				}
			}
			List<PerformanceSeries.Entry> entries = new ArrayList<>();
			for (Map.Entry<LocalDate, Subperiod> period : subperiods.entrySet()) {
				entries.add(new PerformanceSeries.Entry(period.getValue(), holdings.get(period.getKey()),
						rebased.getOrDefault(period.getKey(), Map.of())));
			}
			logger.debug("Read {} subperiods of {} from {}", entries.size(), name, path);
			return new PerformanceSeries(name, classificationName, classificationItems, entries, hasConsolidated);
		} catch (IOException exc) {
			throw new AnalyticsException(ErrorCode.DATA_SOURCE_UNAVAILABLE,
					"Failed to parse " + path + ": " + exc.getMessage(), exc);
		}
	}

	public PerformanceSeries read(Path path, String name) {
		return read(path, name, "", Map.of());
	}

	static LocalDate parseDate(String value) {
		try {
			return LocalDate.parse(value == null ? "" : value.trim());
		} catch (DateTimeParseException exc) {
			throw new AnalyticsException(ErrorCode.MALFORMED_DATE_STRING,
					"Expected a yyyy-MM-dd date but found '" + value + "'", exc);
		}
	}

	private static double parseNumber(String value, CSVRecord record) {
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("Invalid number '" + value + "' on line "
					+ record.getRecordNumber(), exc);
		}
	}

	private static Map<String, String> normalizedHeader(List<String> headerNames) {
		Map<String, String> columns = new TreeMap<>();
		for (String header : headerNames) {
			columns.put(CsvParsing.normalizeKey(CsvParsing.stripBom(header)), header);
		}
		return columns;
	}
}
