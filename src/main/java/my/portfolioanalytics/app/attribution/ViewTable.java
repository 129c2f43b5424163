package my.portfolioanalytics.app.attribution;

import java.util.List;
import java.util.Optional;

public record ViewTable(View view, List<ViewRow> rows) {
	public ViewTable {
		rows = List.copyOf(rows);
	}

	public List<Column> columns() {
		return view.columns();
	}

	public int size() {
		return rows.size();
	}

	public List<ViewRow> bodyRows() {
		if (totalRow().isPresent()) {
			return rows.subList(0, rows.size() - 1);
		}
		return rows;
	}

	public Optional<ViewRow> totalRow() {
		if (rows.isEmpty() || !rows.get(rows.size() - 1).total()) {
			return Optional.empty();
		}
		return Optional.of(rows.get(rows.size() - 1));
	}

	/**
	 * The values of a numeric column over every row, the total row included.
	 */
	public double[] column(Column column) {
		if (!view.contains(column) || !column.isNumeric()) {
			throw new IllegalArgumentException("View " + view + " has no numeric column " + column);
		}
		double[] values = new double[rows.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = rows.get(i).value(column);
		}
		return values;
	}
}
