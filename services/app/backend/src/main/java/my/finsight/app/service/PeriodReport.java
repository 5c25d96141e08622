package my.finsight.app.service;

import my.finsight.app.view.RatioRow;
import my.finsight.app.view.ViewRow;

import java.util.List;

public record PeriodReport(
		ReportingPeriod period,
		List<ViewRow> primaryStatement,
		List<ViewRow> secondaryStatement,
		List<MeasureValue> measures,
		List<RatioRow> ratios
) {
}
