package my.finsight.app.service;

import my.finsight.app.accounts.AccountFilter;
import my.finsight.app.accounts.AccountFilterResult;
import my.finsight.app.accounts.ChartOfAccounts;
import my.finsight.app.accounts.RejectedEntry;
import my.finsight.app.config.AppProperties;
import my.finsight.app.engine.AggregatedStatement;
import my.finsight.app.engine.AggregationEngine;
import my.finsight.app.engine.CanonicalMeasureExtractor;
import my.finsight.app.engine.LedgerEntry;
import my.finsight.app.engine.MeasureMeta;
import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.ratios.DerivedMeasureEvaluator;
import my.finsight.app.ratios.RatioEvaluator;
import my.finsight.app.ratios.RatioResult;
import my.finsight.app.view.StatementView;
import my.finsight.app.view.ViewProjector;
import my.finsight.app.view.ViewRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ReportingService {
	private static final Logger logger = LoggerFactory.getLogger(ReportingService.class);
	private static final String PERIOD_DAYS = "period_days";

	private final ReportingStandard standard;
	private final AppProperties properties;
	private final AccountFilter accountFilter;
	private final AggregationEngine aggregationEngine;
	private final CanonicalMeasureExtractor measureExtractor;
	private final DerivedMeasureEvaluator derivedMeasureEvaluator;
	private final RatioEvaluator ratioEvaluator;
	private final ViewProjector viewProjector;

	public ReportingService(ReportingStandard standard, AppProperties properties) {
		this.standard = standard;
		this.properties = properties;
		this.accountFilter = new AccountFilter();
		this.aggregationEngine = new AggregationEngine();
		this.measureExtractor = new CanonicalMeasureExtractor();
		this.derivedMeasureEvaluator = new DerivedMeasureEvaluator();
		this.ratioEvaluator = new RatioEvaluator();
		this.viewProjector = new ViewProjector();
	}

	public ReportResult compute(List<LedgerEntry> entries, List<ReportingPeriod> periods) {
		return compute(entries, periods, null, StatementView.DETAILED);
	}

	/**
	 * Runs the full pipeline once per period: statements, canonical and derived measures, then
	 * ratios for {@code ratiosLevel} (the configured level when null). Unknown account codes are
	 * dropped up front when a chart of accounts is configured and reported back.
	 */
	public ReportResult compute(List<LedgerEntry> entries, List<ReportingPeriod> periods, String ratiosLevel,
								StatementView view) {
		if (periods == null || periods.isEmpty()) {
			throw new IllegalArgumentException("At least one reporting period is required");
		}
		String level = ratiosLevel == null || ratiosLevel.isBlank() ? properties.ratios().level() : ratiosLevel.trim();
		StatementView statementView = view == null ? StatementView.DETAILED : view;

		List<LedgerEntry> known = entries == null ? List.of() : entries;
		List<RejectedEntry> rejected = List.of();
		if (standard.getChartOfAccounts().isPresent()) {
			AccountFilterResult filtered = accountFilter.filterUnknownAccounts(known,
					standard.getChartOfAccounts().get().codes());
			for (RejectedEntry reject : filtered.rejected()) {
				logger.warn(reject.reason());
			}
			known = filtered.kept();
			rejected = filtered.rejected();
		}

		List<PeriodReport> reports = new ArrayList<>();
		for (ReportingPeriod period : periods) {
			reports.add(computePeriod(known, period, level, statementView));
		}
		logger.debug("Computed {} period(s) for standard {} at ratio level {}", reports.size(), standard.getName(), level);
		return new ReportResult(standard.getName(), level, reports, rejected);
	}

	private PeriodReport computePeriod(List<LedgerEntry> entries, ReportingPeriod period, String level,
									   StatementView view) {
		List<LedgerEntry> periodEntries = new ArrayList<>();
		for (LedgerEntry entry : entries) {
			if (period.contains(entry.date())) {
				periodEntries.add(entry);
			}
		}

		MappingTemplate primaryTemplate = standard.getPrimaryTemplate();
		AggregatedStatement primary = aggregationEngine.aggregate(periodEntries, primaryTemplate);
		Map<String, Double> measures = measureExtractor.extract(primary, primaryTemplate, extraMeasures(period));
		List<ViewRow> primaryRows = render(primary, periodEntries, primaryTemplate, view);

		List<ViewRow> secondaryRows = List.of();
		if (standard.getSecondaryTemplate().isPresent()) {
			MappingTemplate secondaryTemplate = standard.getSecondaryTemplate().get();
			AggregatedStatement secondary = aggregationEngine.aggregate(periodEntries, secondaryTemplate);
			measures = measureExtractor.merge(measures, measureExtractor.extract(secondary, secondaryTemplate));
			secondaryRows = render(secondary, periodEntries, secondaryTemplate, view);
		}

		boolean ratiosEnabled = Boolean.TRUE.equals(properties.ratios().enabled());
		if (ratiosEnabled) {
			if (standard.getStandardRules().isPresent()) {
				measures = derivedMeasureEvaluator.compute(measures, standard.getStandardRules().get());
			}
			if (standard.getCustomRules().isPresent()) {
				measures = derivedMeasureEvaluator.compute(measures, standard.getCustomRules().get());
			}
		}

		List<MeasureValue> measureValues = new ArrayList<>();
		for (Map.Entry<String, Double> measure : measures.entrySet()) {
			MeasureMeta meta = standard.metaFor(measure.getKey());
			measureValues.add(new MeasureValue(measure.getKey(), meta.label(), measure.getValue(), meta.unit(),
					meta.notes(), meta.kind()));
		}

		List<RatioResult> ratios = new ArrayList<>();
		if (ratiosEnabled && standard.hasRatioRules()) {
			if (standard.getStandardRules().isPresent()) {
				ratios.addAll(ratioEvaluator.compute(measures, standard.getStandardRules().get(), level));
			}
			if (standard.getCustomRules().isPresent()) {
				ratios.addAll(ratioEvaluator.compute(measures, standard.getCustomRules().get(), level));
			}
		}

		return new PeriodReport(period, primaryRows, secondaryRows, measureValues,
				viewProjector.ratioTable(ratios, properties.ratios().decimals()));
	}

	private List<ViewRow> render(AggregatedStatement statement, List<LedgerEntry> entries, MappingTemplate template,
								 StatementView view) {
		if (view == StatementView.COMPLETE) {
			Map<String, String> names = standard.getChartOfAccounts()
					.map(ChartOfAccounts::namesByCode)
					.orElse(Map.of());
			return viewProjector.buildCompleteView(statement, entries, template, names);
		}
		return viewProjector.project(statement, view);
	}

	// Balance-sheet and HR inputs come from configuration; period_days defaults to the period length.
	private Map<String, Double> extraMeasures(ReportingPeriod period) {
		AppProperties.Inputs inputs = properties.inputs();
		Map<String, Double> extra = new LinkedHashMap<>(inputs.balanceSheet());
		extra.putAll(inputs.hr());
		Integer periodDays = inputs.periodDays();
		extra.put(PERIOD_DAYS, (double) (periodDays == null ? period.lengthInDays() : periodDays));
		return extra;
	}
}
