package my.portfolioanalytics.app.util;

import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinkingMathTest {
	@Test
	void smoothingCoefficientIsOneForZeroReturn() {
		assertThat(LinkingMath.logSmoothingCoefficient(0.0)).isEqualTo(1.0);
		assertThat(LinkingMath.logSmoothingCoefficient(0.1)).isCloseTo(0.9531017980432486, within(1e-15));
	}

	@Test
	void smoothingCoefficientRejectsTotalLoss() {
		assertThatThrownBy(() -> LinkingMath.logSmoothingCoefficient(-1.0))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNDEFINED_RETURN);
	}

	@Test
	void linkingCoefficientsReconcileSubperiodsToOverallReturn() {
		double[] returns = {0.02, -0.01, 0.035, 0.0};
		double growth = 1.0;
		for (double value : returns) {
			growth *= 1.0 + value;
		}
		double overall = growth - 1.0;

		double[] coefficients = LinkingMath.logLinkingCoefficients(overall, returns);

		double linked = 0.0;
		for (int i = 0; i < returns.length; i++) {
			linked += returns[i] * coefficients[i];
		}
		assertThat(linked).isCloseTo(overall, within(1e-15));
	}

	@Test
	void linkingCoefficientsWithZeroOverallUseUnitDenominator() {
		double[] coefficients = LinkingMath.logLinkingCoefficients(0.0, new double[]{0.0, 0.1});

		assertThat(coefficients[0]).isEqualTo(1.0);
		assertThat(coefficients[1]).isCloseTo(0.9531017980432486, within(1e-15));
	}

	@Test
	void linkingCoefficientsRejectUndefinedOverallReturn() {
		assertThatThrownBy(() -> LinkingMath.logLinkingCoefficients(-1.5, new double[]{0.01}))
				.isInstanceOf(AnalyticsException.class)
				.hasMessageContaining("undefined");
	}

	@Test
	void linkingCoefficientSeriesDividesElementwise() {
		double[] coefficients = LinkingMath.logLinkingCoefficientSeries(new double[]{0.1, 0.0}, new double[]{0.0, 0.1});

		assertThat(coefficients[0]).isCloseTo(1.0 / 0.9531017980432486, within(1e-14));
		assertThat(coefficients[1]).isCloseTo(0.9531017980432486, within(1e-15));
		assertThatThrownBy(() -> LinkingMath.logLinkingCoefficientSeries(new double[]{0.1}, new double[]{0.1, 0.2}))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void carinoCoefficientMatchesLogRatio() {
		assertThat(LinkingMath.carinoLinkingCoefficient(0.05, 0.03)).isCloseTo(0.9615680963943801, within(1e-15));
		assertThat(LinkingMath.carinoLinkingCoefficient(0.04, 0.04)).isCloseTo(1.0 / 1.04, within(1e-15));
	}

	@Test
	void carinoCoefficientIsContinuousAcrossNearEqualBranch() {
		double portfolio = 0.04;
		double atBranch = LinkingMath.carinoLinkingCoefficient(portfolio, portfolio);
		double justOutside = LinkingMath.carinoLinkingCoefficient(portfolio, portfolio - 1e-6);
		double justInside = LinkingMath.carinoLinkingCoefficient(portfolio, portfolio - 1e-14);

		assertThat(atBranch).isPositive().isFinite();
		assertThat(justOutside).isCloseTo(atBranch, within(1e-6));
		assertThat(justInside).isEqualTo(atBranch);
	}

	@Test
	void carinoCoefficientIsPositiveAndFiniteOverWideRange() {
		double[] returns = {-0.9, -0.5, -0.1, 0.0, 0.1, 0.5, 2.0};
		for (double portfolio : returns) {
			for (double benchmark : returns) {
				assertThat(LinkingMath.carinoLinkingCoefficient(portfolio, benchmark)).isPositive().isFinite();
			}
		}
	}

	@Test
	void carinoCoefficientRejectsUndefinedReturns() {
		assertThatThrownBy(() -> LinkingMath.carinoLinkingCoefficient(-1.0, 0.03))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNDEFINED_RETURN);
		assertThatThrownBy(() -> LinkingMath.carinoLinkingCoefficient(0.05, -1.0))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNDEFINED_RETURN);
	}
}
