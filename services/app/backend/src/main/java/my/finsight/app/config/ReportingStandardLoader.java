package my.finsight.app.config;

import my.finsight.app.accounts.ChartOfAccounts;
import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.MappingTemplateException;
import my.finsight.app.mapping.MappingTemplateParser;
import my.finsight.app.mapping.MappingTemplateValidator;
import my.finsight.app.ratios.RatioRulesDefinition;
import my.finsight.app.ratios.RatioRulesParser;
import my.finsight.app.ratios.RatioRulesValidator;
import my.finsight.app.service.ReportingStandard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class ReportingStandardLoader {
	private static final Logger logger = LoggerFactory.getLogger(ReportingStandardLoader.class);

	private final ResourceLoader resourceLoader;
	private final MappingTemplateParser templateParser = new MappingTemplateParser();
	private final MappingTemplateValidator templateValidator = new MappingTemplateValidator();
	private final RatioRulesParser rulesParser = new RatioRulesParser();
	private final RatioRulesValidator rulesValidator = new RatioRulesValidator();

	public ReportingStandardLoader(ResourceLoader resourceLoader) {
		this.resourceLoader = resourceLoader;
	}

	@Bean
	public ReportingStandard reportingStandard(AppProperties properties) {
		return load(properties.standard());
	}

	public ReportingStandard load(AppProperties.Standard standard) {
		MappingTemplate primary = loadTemplate(standard.primaryMapping());
		MappingTemplate secondary = isSet(standard.secondaryMapping()) ? loadTemplate(standard.secondaryMapping()) : null;
		ChartOfAccounts chart = null;
		if (isSet(standard.chartOfAccounts())) {
			chart = ChartOfAccounts.parse(read(standard.chartOfAccounts()));
			logger.info("Loaded {} accounts from {}", chart.size(), standard.chartOfAccounts());
		}
		RatioRulesDefinition rules = isSet(standard.ratiosRules()) ? loadRules(standard.ratiosRules()) : null;
		RatioRulesDefinition custom = isSet(standard.ratiosCustom()) ? loadRules(standard.ratiosCustom()) : null;

		ReportingStandard loaded = new ReportingStandard(standard.name(), primary, secondary, chart, rules, custom);
		logger.info("Reporting standard {} ready (primary={} rows, secondary={}, canonical measures={}, derived measures={})",
				standard.name(), primary.getRows().size(), secondary == null ? "none" : secondary.getRows().size() + " rows",
				loaded.getCanonicalMeta().size(), loaded.getDerivedMeta().size());
		return loaded;
	}

	private MappingTemplate loadTemplate(String location) {
		MappingTemplate template = templateParser.parse(location, read(location));
		MappingTemplateValidator.ValidationReport report = templateValidator.validate(template);
		for (String warning : report.warnings()) {
			logger.warn("Mapping {}: {}", location, warning);
		}
		if (!report.valid()) {
			throw new MappingTemplateException("Mapping " + location + " is invalid: " + String.join("; ", report.errors()));
		}
		logger.info("Loaded mapping template {} ({} rows)", location, template.getRows().size());
		return template;
	}

	private RatioRulesDefinition loadRules(String location) {
		RatioRulesDefinition definition;
		try {
			definition = rulesParser.parse(new String(read(location), StandardCharsets.UTF_8), location);
		} catch (Exception ex) {
			throw new IllegalArgumentException("Failed to read ratio rules " + location + ": " + ex.getMessage(), ex);
		}
		List<String> errors = rulesValidator.validate(definition);
		for (String error : errors) {
			logger.warn("Ratio rules {}: {}", location, error);
		}
		logger.info("Loaded ratio rules {} ({} measures, {} ratios)", location, definition.measureRules().size(),
				definition.ratioRules().size());
		return definition;
	}

	private byte[] read(String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalArgumentException("Resource not found: " + location);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			return inputStream.readAllBytes();
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read " + location + ": " + ex.getMessage(), ex);
		}
	}

	private boolean isSet(String value) {
		return value != null && !value.isBlank();
	}
}
