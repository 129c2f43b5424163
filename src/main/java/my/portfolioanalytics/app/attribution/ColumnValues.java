package my.portfolioanalytics.app.attribution;

interface ColumnValues {
	double value(Column column);
}
