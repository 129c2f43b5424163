package my.portfolioanalytics.app.util;

public enum Tolerance {
	LOW(0.00000005),
	MEDIUM(0.0000000005),
	HIGH(0.0000000000005);

	private final double value;

	Tolerance(double value) {
		this.value = value;
	}

	public double value() {
		return value;
	}

	public static boolean areNear(double first, double second, Tolerance tolerance) {
		return Math.abs(first - second) < tolerance.value;
	}

	public static boolean areNear(double first, double second) {
		return areNear(first, second, HIGH);
	}

	public static boolean nearZero(double value, Tolerance tolerance) {
		return areNear(value, 0.0, tolerance);
	}

	public static boolean nearZero(double value) {
		return nearZero(value, HIGH);
	}

	/**
	 * Compares two values as if both had been rounded to {@code decimals} places, without the
	 * boundary flip of actual rounding.
	 */
	public static boolean equalToDecimals(double first, double second, int decimals) {
		if (Double.isNaN(first) || Double.isNaN(second)) {
			return Double.isNaN(first) && Double.isNaN(second);
		}
		return Math.abs(first - second) < 0.5 * Math.pow(10, -decimals);
	}
}
