package my.portfolioanalytics.app.service;

import my.portfolioanalytics.app.attribution.Attribution;
import my.portfolioanalytics.app.attribution.AttributionAuditor;
import my.portfolioanalytics.app.attribution.View;
import my.portfolioanalytics.app.attribution.ViewTable;
import my.portfolioanalytics.app.classification.Classification;
import my.portfolioanalytics.app.classification.Mapping;
import my.portfolioanalytics.app.config.AppProperties;
import my.portfolioanalytics.app.domain.Frequency;
import my.portfolioanalytics.app.domain.Performance;
import my.portfolioanalytics.app.domain.PerformanceSeries;
import my.portfolioanalytics.app.error.AnalyticsException;
import my.portfolioanalytics.app.error.ErrorCode;
import my.portfolioanalytics.app.risk.RiskStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AnalyticsService {
	private static final Logger logger = LoggerFactory.getLogger(AnalyticsService.class);

	private final AppProperties properties;

	public AnalyticsService(AppProperties properties) {
		this.properties = properties;
	}

	public Attribution attribution(Performance portfolio,
								   Performance benchmark,
								   Frequency frequency,
								   String classificationName,
								   Classification classification) {
		Classification resolved = resolveClassification(portfolio, benchmark, classificationName, classification);
		Attribution attribution = new Attribution(portfolio, benchmark, resolved, frequency);
		if (properties.attribution().auditOnBuild()) {
			AttributionAuditor.audit(attribution);
		}
		return attribution;
	}

	/**
	 * Relabels both sides into the classification's items before attributing. A {@code null}
	 * mapping leaves that side unchanged.
	 */
	public Attribution attribution(PerformanceSeries portfolio,
								   PerformanceSeries benchmark,
								   Frequency frequency,
								   Classification classification,
								   Mapping portfolioMapping,
								   Mapping benchmarkMapping) {
		if (classification == null || classification.name().isBlank()) {
			throw new AnalyticsException(ErrorCode.MISSING_CLASSIFICATION_NAME,
					"Mapping performances requires a named classification");
		}
		PerformanceSeries mappedPortfolio = portfolioMapping == null
				? portfolio : portfolio.mapTo(portfolioMapping, classification.name());
		PerformanceSeries mappedBenchmark = benchmarkMapping == null
				? benchmark : benchmark.mapTo(benchmarkMapping, classification.name());
		logger.debug("Mapped {} and {} onto classification {}", portfolio.name(), benchmark.name(),
				classification.name());
		return attribution(mappedPortfolio, mappedBenchmark, frequency, classification.name(), classification);
	}

	public ViewTable renderable(Attribution attribution, View view) {
		return attribution.renderable(view, properties.attribution().maxRenderRows());
	}

	public void auditAttributions(List<Attribution> attributions) {
		AttributionAuditor.auditAttributions(attributions);
		logger.info("Audited {} attributions.", attributions.size());
	}

	public RiskStatistics riskStatistics(Performance portfolio, Performance benchmark, Frequency frequency) {
		return new RiskStatistics(portfolio, benchmark, frequency, properties.risk().toParameters());
	}

	public RiskStatistics riskStatistics(double[] portfolioReturns, double[] benchmarkReturns, Frequency frequency) {
		return new RiskStatistics(portfolioReturns, benchmarkReturns, frequency, properties.risk().toParameters());
	}

	static Classification resolveClassification(Performance portfolio,
												Performance benchmark,
												String classificationName,
												Classification classification) {
		String name = classificationName == null ? "" : classificationName.trim();
		if (classification != null) {
			if (name.isEmpty()) {
				name = classification.name().trim();
			}
			if (name.isEmpty()) {
				throw new AnalyticsException(ErrorCode.MISSING_CLASSIFICATION_NAME,
						"A classification was supplied without a name");
			}
			return new Classification(name, classification.items());
		}
		if (!name.isEmpty()) {
			return new Classification(name, portfolio.classificationItems());
		}
		if (!portfolio.classificationName().equals(benchmark.classificationName())) {
			throw new AnalyticsException(ErrorCode.MISSING_CLASSIFICATION_NAME,
					"Portfolio classification '" + portfolio.classificationName()
							+ "' differs from benchmark classification '" + benchmark.classificationName()
							+ "' and no classification name was given");
		}
		return new Classification(portfolio.classificationName(), portfolio.classificationItems());
	}
}
