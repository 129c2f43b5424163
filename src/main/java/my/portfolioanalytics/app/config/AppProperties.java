package my.portfolioanalytics.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import my.portfolioanalytics.app.risk.RiskParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Risk risk,
		@Valid @NotNull Attribution attribution
) {
	public record Risk(
			double annualMinimumAcceptableReturn,
			double annualRiskFreeRate,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) double confidenceLevel,
			@Positive double portfolioValue
	) {
		public RiskParameters toParameters() {
			return new RiskParameters(annualMinimumAcceptableReturn, annualRiskFreeRate, confidenceLevel, portfolioValue);
		}
	}

	public record Attribution(
			@Min(1) int maxRenderRows,
			boolean auditOnBuild
	) {
	}
}
