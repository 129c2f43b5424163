package my.portfolioanalytics.app.importer;

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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the key/value pairs of a classification or mapping source. The first column is the
 * asset identifier, the second its value; further columns are ignored.
 */
public final class TwoColumnSourceReader {
	private static final Logger logger = LoggerFactory.getLogger(TwoColumnSourceReader.class);

	private TwoColumnSourceReader() {
	}

	public static Map<String, String> read(Path path) {
		String content = CsvParsing.readUtf8(path);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(content))
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();
		List<List<String>> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			for (CSVRecord record : parser) {
				rows.add(record.toList());
			}
		} catch (IOException exc) {
			throw new AnalyticsException(ErrorCode.DATA_SOURCE_UNAVAILABLE,
					"Failed to parse " + path + ": " + exc.getMessage(), exc);
		}
		return fromTable(rows);
	}

	public static Map<String, String> fromTable(List<List<String>> rows) {
		Map<String, String> pairs = new LinkedHashMap<>();
		if (rows == null || rows.isEmpty()) {
			return pairs;
		}
		int width = 0;
		for (List<String> row : rows) {
			width = Math.max(width, row == null ? 0 : row.size());
		}
		if (width < 2) {
			throw new AnalyticsException(ErrorCode.CLASSIFICATION_OR_MAPPING_COLUMN_COUNT_INVALID,
					"Expected at least 2 columns but found " + width);
		}
		int line = 0;
		for (List<String> row : rows) {
			line++;
			if (row == null || row.size() < 2) {
				logger.warn("Skipping row {} with fewer than 2 fields: {}", line, row);
				continue;
			}
			String key = row.get(0) == null ? "" : row.get(0).trim();
			if (key.isEmpty()) {
				logger.warn("Skipping row {} without identifier", line);
				continue;
			}
			pairs.put(key, row.get(1) == null ? "" : row.get(1).trim());
		}
		return pairs;
	}
}
