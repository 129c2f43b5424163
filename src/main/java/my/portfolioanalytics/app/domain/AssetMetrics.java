package my.portfolioanalytics.app.domain;

public record AssetMetrics(double assetReturn, double weight, double contribution) {
	public static final AssetMetrics ZERO = new AssetMetrics(0.0, 0.0, 0.0);

	public static AssetMetrics of(double assetReturn, double weight) {
		return new AssetMetrics(assetReturn, weight, weight * assetReturn);
	}
}
