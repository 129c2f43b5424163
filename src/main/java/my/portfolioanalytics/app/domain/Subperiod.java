package my.portfolioanalytics.app.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public record Subperiod(LocalDate beginningDate, LocalDate endingDate) {
	public Subperiod {
		Objects.requireNonNull(beginningDate, "beginningDate");
		Objects.requireNonNull(endingDate, "endingDate");
		if (!beginningDate.isBefore(endingDate)) {
			throw new IllegalArgumentException("Beginning date " + beginningDate
					+ " must be before ending date " + endingDate);
		}
	}

	public long quantityOfDays() {
		return ChronoUnit.DAYS.between(beginningDate, endingDate);
	}
}
