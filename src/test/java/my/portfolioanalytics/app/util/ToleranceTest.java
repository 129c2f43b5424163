package my.portfolioanalytics.app.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToleranceTest {
	@Test
	void areNearUsesStrictBound() {
		assertThat(Tolerance.areNear(1.0, 1.0 + 4e-13)).isTrue();
		assertThat(Tolerance.areNear(1.0, 1.0 + 1e-12)).isFalse();
		assertThat(Tolerance.areNear(1.0, 1.0 + 4e-8, Tolerance.LOW)).isTrue();
		assertThat(Tolerance.areNear(1.0, 1.0 + 1e-9, Tolerance.MEDIUM)).isFalse();
	}

	@Test
	void nearZeroDefaultsToHighTolerance() {
		assertThat(Tolerance.nearZero(1e-13)).isTrue();
		assertThat(Tolerance.nearZero(-1e-12)).isFalse();
		assertThat(Tolerance.nearZero(1e-10, Tolerance.MEDIUM)).isTrue();
	}

	@Test
	void equalToDecimalsTreatsNaNAsEqualOnlyToNaN() {
		assertThat(Tolerance.equalToDecimals(Double.NaN, Double.NaN, 7)).isTrue();
		assertThat(Tolerance.equalToDecimals(Double.NaN, 0.0, 7)).isFalse();
		assertThat(Tolerance.equalToDecimals(0.12345671, 0.12345674, 7)).isTrue();
		assertThat(Tolerance.equalToDecimals(0.1234567, 0.1234569, 7)).isFalse();
	}
}
