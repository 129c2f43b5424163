package my.portfolioanalytics.app.domain;

import java.util.List;
import java.util.Map;

/**
 * Consolidated return and weight history of one portfolio or benchmark, as handed to the
 * attribution and risk engines. Identifiers are lower-case; metrics of an identifier that is not
 * held in a subperiod read as {@link AssetMetrics#ZERO}.
 */
public interface Performance {
	String name();

	List<Subperiod> subperiods();

	double[] totalReturns();

	List<String> identifiers();

	AssetMetrics metrics(int subperiod, String identifier);

	/**
	 * The asset's return re-based to be comparable with the subperiod's total return.
	 */
	double consolidatedReturn(int subperiod, String identifier);

	/**
	 * Own-return-based linking coefficients, one per subperiod.
	 */
	double[] linkingCoefficients();

	double overallReturn();

	AssetMetrics overallMetrics(String identifier);

	boolean subperiodsConsolidated();

	String classificationName();

	Map<String, String> classificationItems();

	default int size() {
		return subperiods().size();
	}
}
