package my.portfolioanalytics.app.util;

import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;

import java.util.Locale;

/**
 * Logarithmic smoothing and Carino linking coefficients used to chain arithmetic subperiod
 * contributions and attribution effects into geometrically compounded multi-period results.
 */
public final class LinkingMath {
	private static final double UNDEFINED_RETURN = -1.0;

	private LinkingMath() {
	}

	/**
	 * {@code ln(1 + r) / r}, or {@code 1.0} for a zero return.
	 */
	public static double logSmoothingCoefficient(double value) {
		requireDefined(value, "return");
		if (value == 0.0) {
			return 1.0;
		}
		return Math.log1p(value) / value;
	}

	public static double[] logSmoothingCoefficients(double[] returns) {
		double[] coefficients = new double[returns.length];
		for (int i = 0; i < returns.length; i++) {
			coefficients[i] = logSmoothingCoefficient(returns[i]);
		}
		return coefficients;
	}

	/**
	 * Coefficients that link each subperiod to the overall period: for a series compounding to
	 * {@code overallReturn}, the coefficient-weighted sum of the subperiod returns equals it.
	 */
	public static double[] logLinkingCoefficients(double overallReturn, double[] returns) {
		double denominator = logSmoothingCoefficient(overallReturn);
		double[] coefficients = logSmoothingCoefficients(returns);
		for (int i = 0; i < coefficients.length; i++) {
			coefficients[i] = coefficients[i] / denominator;
		}
		return coefficients;
	}

	public static double[] logLinkingCoefficientSeries(double[] overallReturns, double[] returns) {
		if (overallReturns.length != returns.length) {
			throw new IllegalArgumentException("Series lengths differ: "
					+ overallReturns.length + " <> " + returns.length);
		}
		double[] numerators = logSmoothingCoefficients(returns);
		double[] denominators = logSmoothingCoefficients(overallReturns);
		double[] coefficients = new double[returns.length];
		for (int i = 0; i < returns.length; i++) {
			coefficients[i] = numerators[i] / denominators[i];
		}
		return coefficients;
	}

	public static double carinoLinkingCoefficient(double portfolioReturn, double benchmarkReturn) {
		requireDefined(portfolioReturn, "portfolio return");
		requireDefined(benchmarkReturn, "benchmark return");
		double difference = portfolioReturn - benchmarkReturn;
		// The log-ratio formula degenerates when the two returns are (almost) identical.
		if (Tolerance.nearZero(difference)) {
			return 1.0 / (1.0 + portfolioReturn);
		}
		return (Math.log1p(portfolioReturn) - Math.log1p(benchmarkReturn)) / difference;
	}

	private static void requireDefined(double value, String label) {
		if (!(value > UNDEFINED_RETURN)) {
			throw new AnalyticsException(ErrorCode.UNDEFINED_RETURN,
					String.format(Locale.ROOT, "The %s of %.6f is undefined for logarithmic linking", label, value));
		}
	}
}
