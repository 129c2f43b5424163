package my.portfolioanalytics.app.util;

import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String readUtf8(Path path) {
		if (path == null || !Files.isRegularFile(path)) {
			throw new AnalyticsException(ErrorCode.DATA_SOURCE_UNAVAILABLE, "File does not exist: " + path);
		}
		try {
			return stripBom(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
		} catch (IOException exc) {
			throw new AnalyticsException(ErrorCode.DATA_SOURCE_UNAVAILABLE,
					"Failed to read " + path + ": " + exc.getMessage(), exc);
		}
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		int lineEnd = sample.indexOf('\n');
		String firstLine = lineEnd < 0 ? sample : sample.substring(0, lineEnd);
		if (firstLine.indexOf(';') >= 0) {
			return ';';
		}
		return ',';
	}

	public static String normalizeKey(String value) {
		return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
	}
}
