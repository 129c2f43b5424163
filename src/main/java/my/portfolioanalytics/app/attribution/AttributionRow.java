package my.portfolioanalytics.app.attribution;

import my.portfolioanalytics.app.domain.Subperiod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio-level values and per-item attributions of one subperiod, or of the overall period.
 */
public final class AttributionRow implements ColumnValues {
	private final Subperiod subperiod;
	private final Map<Column, Double> values;
	private final Map<String, AssetAttribution> assets;

	AttributionRow(Subperiod subperiod, Map<Column, Double> values, Map<String, AssetAttribution> assets) {
		this.subperiod = subperiod;
		this.values = Collections.unmodifiableMap(new EnumMap<>(values));
		this.assets = Collections.unmodifiableMap(new TreeMap<>(assets));
	}

	public Subperiod subperiod() {
		return subperiod;
	}

	@Override
	public double value(Column column) {
		Double value = values.get(column);
		if (value == null) {
			throw new IllegalArgumentException("Column " + column + " is not held at portfolio level");
		}
		return value;
	}

	public Map<Column, Double> values() {
		return values;
	}

	public Map<String, AssetAttribution> assets() {
		return assets;
	}

	public AssetAttribution asset(String identifier) {
		return assets.get(identifier);
	}
}
