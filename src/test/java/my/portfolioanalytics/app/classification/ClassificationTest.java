package my.portfolioanalytics.app.classification;

import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationTest {
	@Test
	void identifiersAreCaseInsensitive() {
		Classification sectors = new Classification("Sector", Map.of("TECH", "Technology", " Fin ", "Financials"));

		assertThat(sectors.items()).containsOnlyKeys("tech", "fin");
		assertThat(sectors.displayName("Tech")).isEqualTo("Technology");
		assertThat(sectors.displayName("fin")).isEqualTo("Financials");
		assertThat(sectors.displayName("energy")).isNull();
	}

	@Test
	void fromTableKeepsTheFirstTwoColumns() {
		Classification regions = Classification.fromTable("Region", List.of(
				List.of("US", "United States", "Americas"),
				List.of("DE", "Germany")));

		assertThat(regions.name()).isEqualTo("Region");
		assertThat(regions.items()).containsExactly(
				Map.entry("de", "Germany"),
				Map.entry("us", "United States"));
	}

	@Test
	void singleColumnTableIsRejected() {
		assertThatThrownBy(() -> Classification.fromTable("Region", List.of(List.of("US"))))
				.isInstanceOf(AnalyticsException.class)
				.hasFieldOrPropertyWithValue("errorCode", ErrorCode.CLASSIFICATION_OR_MAPPING_COLUMN_COUNT_INVALID);
	}

	@Test
	void emptyClassificationHasNoNameOrItems() {
		assertThat(Classification.empty().name()).isEmpty();
		assertThat(Classification.empty().isEmpty()).isTrue();
		assertThat(new Classification(null, null).isEmpty()).isTrue();
	}
}
