package my.portfolioanalytics.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PortfolioAnalyticsApplication {
	public static void main(String[] args) {
		SpringApplication.run(PortfolioAnalyticsApplication.class, args);
	}
}
