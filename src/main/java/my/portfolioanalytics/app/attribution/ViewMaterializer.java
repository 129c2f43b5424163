package my.portfolioanalytics.app.attribution;

import my.portfolioanalytics.app.classification.Classification;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class ViewMaterializer {
	private ViewMaterializer() {
	}

	static ViewTable materialize(Attribution attribution, View view) {
		List<ViewRow> rows = switch (view) {
			case SUBPERIOD_ATTRIBUTION -> classifiedRows(attribution, attribution.subperiods(), view);
			case OVERALL_ATTRIBUTION -> classifiedRows(attribution, List.of(attribution.overall()), view);
			case CUMULATIVE_ATTRIBUTION, SUBPERIOD_SUMMARY -> portfolioLevelRows(attribution.subperiods(), view);
		};
		if (view.hasTotalRow()) {
			rows.add(totalRow(attribution, rows, view));
		}
		return new ViewTable(view, rows);
	}

	// Subperiod rows come in date order and identifiers in sorted order.
	private static List<ViewRow> classifiedRows(Attribution attribution, List<AttributionRow> source, View view) {
		Classification classification = attribution.classification();
		List<ViewRow> rows = new ArrayList<>();
		for (AttributionRow row : source) {
			for (Map.Entry<String, AssetAttribution> asset : row.assets().entrySet()) {
				Map<Column, Double> values = new EnumMap<>(Column.class);
				for (Column column : view.columns()) {
					if (column.isNumeric()) {
						values.put(column, asset.getValue().value(column));
					}
				}
				rows.add(new ViewRow(
						row.subperiod().beginningDate(),
						row.subperiod().endingDate(),
						asset.getKey().toUpperCase(Locale.ROOT),
						classification.displayName(asset.getKey()),
						values,
						false));
			}
		}
		return rows;
	}

	private static List<ViewRow> portfolioLevelRows(List<AttributionRow> source, View view) {
		List<ViewRow> rows = new ArrayList<>();
		for (AttributionRow row : source) {
			Map<Column, Double> values = new EnumMap<>(Column.class);
			for (Column column : view.columns()) {
				if (column.isNumeric()) {
					values.put(column, row.value(column));
				}
			}
			rows.add(new ViewRow(row.subperiod().beginningDate(), row.subperiod().endingDate(), null, null,
					values, false));
		}
		return rows;
	}

	private static ViewRow totalRow(Attribution attribution, List<ViewRow> body, View view) {
		Map<Column, Double> values = new EnumMap<>(Column.class);
		for (Column column : view.columns()) {
			if (!column.isNumeric()) {
				continue;
			}
			if (column.kind() == Column.Kind.CUMULATIVE) {
				values.put(column, body.isEmpty() ? Double.NaN : body.get(body.size() - 1).value(column));
				continue;
			}
			double sum = 0.0;
			for (ViewRow row : body) {
				sum += row.value(column);
			}
			values.put(column, sum);
		}
		if (view.contains(Column.ACTIVE_RETURN)) {
			double portfolioReturn = attribution.portfolio().overallReturn();
			double benchmarkReturn = attribution.benchmark().overallReturn();
			values.put(Column.PORTFOLIO_RETURN, portfolioReturn);
			values.put(Column.BENCHMARK_RETURN, benchmarkReturn);
			values.put(Column.ACTIVE_RETURN, portfolioReturn - benchmarkReturn);
		}
		if (view.isClassified()) {
			return new ViewRow(null, null, null, ViewRow.TOTAL_LABEL, values, true);
		}
		return new ViewRow(null, null, null, null, values, true);
	}
}
