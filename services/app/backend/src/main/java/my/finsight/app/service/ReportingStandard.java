package my.finsight.app.service;

import my.finsight.app.accounts.ChartOfAccounts;
import my.finsight.app.engine.CanonicalMeasureExtractor;
import my.finsight.app.engine.MeasureMeta;
import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.ratios.DerivedMeasureEvaluator;
import my.finsight.app.ratios.RatioRulesDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one accounting standard brings along: the statement templates, the optional
 * chart of accounts and the standard and custom ratio rules, plus the measure metadata
 * derived from them.
 */
public class ReportingStandard {
	public static final String PRIMARY = "primary";
	public static final String SECONDARY = "secondary";

	private final String name;
	private final MappingTemplate primaryTemplate;
	private final MappingTemplate secondaryTemplate;
	private final ChartOfAccounts chartOfAccounts;
	private final RatioRulesDefinition standardRules;
	private final RatioRulesDefinition customRules;
	private final Map<String, MeasureMeta> canonicalMeta;
	private final Map<String, MeasureMeta> derivedMeta;

	public ReportingStandard(String name,
							 MappingTemplate primaryTemplate,
							 MappingTemplate secondaryTemplate,
							 ChartOfAccounts chartOfAccounts,
							 RatioRulesDefinition standardRules,
							 RatioRulesDefinition customRules) {
		if (primaryTemplate == null) {
			throw new IllegalArgumentException("A primary mapping template is required");
		}
		this.name = name;
		this.primaryTemplate = primaryTemplate;
		this.secondaryTemplate = secondaryTemplate;
		this.chartOfAccounts = chartOfAccounts;
		this.standardRules = standardRules;
		this.customRules = customRules;

		CanonicalMeasureExtractor extractor = new CanonicalMeasureExtractor();
		Map<String, MeasureMeta> canonical = new LinkedHashMap<>(extractor.metadata(primaryTemplate));
		if (secondaryTemplate != null) {
			canonical.putAll(extractor.metadata(secondaryTemplate));
		}
		this.canonicalMeta = Collections.unmodifiableMap(canonical);

		DerivedMeasureEvaluator derived = new DerivedMeasureEvaluator();
		Map<String, MeasureMeta> extra = new LinkedHashMap<>(derived.metadata(standardRules));
		extra.putAll(derived.metadata(customRules));
		this.derivedMeta = Collections.unmodifiableMap(extra);
	}

	public String getName() {
		return name;
	}

	public MappingTemplate getPrimaryTemplate() {
		return primaryTemplate;
	}

	public Optional<MappingTemplate> getSecondaryTemplate() {
		return Optional.ofNullable(secondaryTemplate);
	}

	public Optional<MappingTemplate> template(String statement) {
		if (PRIMARY.equalsIgnoreCase(statement)) {
			return Optional.of(primaryTemplate);
		}
		if (SECONDARY.equalsIgnoreCase(statement)) {
			return getSecondaryTemplate();
		}
		return Optional.empty();
	}

	public Optional<ChartOfAccounts> getChartOfAccounts() {
		return Optional.ofNullable(chartOfAccounts);
	}

	public Optional<RatioRulesDefinition> getStandardRules() {
		return Optional.ofNullable(standardRules);
	}

	public Optional<RatioRulesDefinition> getCustomRules() {
		return Optional.ofNullable(customRules);
	}

	public boolean hasRatioRules() {
		return standardRules != null || customRules != null;
	}

	public MeasureMeta metaFor(String key) {
		MeasureMeta meta = canonicalMeta.get(key);
		if (meta == null) {
			meta = derivedMeta.get(key);
		}
		return meta == null ? MeasureMeta.fallback(key) : meta;
	}

	public Map<String, MeasureMeta> getCanonicalMeta() {
		return canonicalMeta;
	}

	public Map<String, MeasureMeta> getDerivedMeta() {
		return derivedMeta;
	}
}
