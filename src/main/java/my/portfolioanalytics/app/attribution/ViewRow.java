package my.portfolioanalytics.app.attribution;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One row of a materialized view. Identifiers are upper-case; a total row carries the label
 * {@value #TOTAL_LABEL} in its ending date (portfolio-level views) or name (classified views).
 */
public record ViewRow(
		LocalDate beginningDate,
		LocalDate endingDate,
		String identifier,
		String name,
		Map<Column, Double> values,
		boolean total
) implements ColumnValues {
	public static final String TOTAL_LABEL = "Total";

	public ViewRow {
		values = Collections.unmodifiableMap(new EnumMap<>(values));
	}

	@Override
	public double value(Column column) {
		Double value = values.get(column);
		if (value == null) {
			throw new IllegalArgumentException("Column " + column + " is not numeric in this row");
		}
		return value;
	}

	public String text(Column column) {
		return switch (column) {
			case BEGINNING_DATE -> beginningDate == null ? null : beginningDate.toString();
			case ENDING_DATE -> total && endingDate == null ? TOTAL_LABEL
					: endingDate == null ? null : endingDate.toString();
			case CLASSIFICATION_IDENTIFIER -> identifier;
			case CLASSIFICATION_NAME -> name;
			default -> String.valueOf(value(column));
		};
	}
}
