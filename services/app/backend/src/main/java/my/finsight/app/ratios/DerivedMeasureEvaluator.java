package my.finsight.app.ratios;

import my.finsight.app.engine.MeasureMeta;
import my.finsight.app.expr.ExpressionException;
import my.finsight.app.expr.ExpressionParser;
import my.finsight.app.expr.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DerivedMeasureEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(DerivedMeasureEvaluator.class);

	public Map<String, Double> compute(Map<String, Double> baseMeasures, RatioRulesDefinition rules) {
		return compute(baseMeasures, rules == null ? List.of() : rules.measureRules());
	}

	/**
	 * Folds the rules top to bottom into a copy of {@code baseMeasures}. A rule may read any
	 * name written before it; a later rule with the same key overwrites. Rules that cannot be
	 * evaluated leave the measures untouched.
	 */
	public Map<String, Double> compute(Map<String, Double> baseMeasures, List<MeasureRule> rules) {
		Map<String, Double> measures = new LinkedHashMap<>(baseMeasures);
		VariableResolver resolver = VariableResolver.strict(measures);
		for (MeasureRule rule : rules) {
			if (rule.formula().isEmpty()) {
				continue;
			}
			try {
				double value = ExpressionParser.parseMeasureFormula(rule.formula()).evaluate(resolver);
				measures.put(rule.key(), value);
			} catch (ExpressionException ex) {
				logger.debug("Skipping derived measure {} ({}): {}", rule.key(), rule.formula(), ex.getMessage());
			}
		}
		return measures;
	}

	public Map<String, MeasureMeta> metadata(RatioRulesDefinition rules) {
		Map<String, MeasureMeta> metadata = new LinkedHashMap<>();
		if (rules == null) {
			return metadata;
		}
		for (MeasureRule rule : rules.measureRules()) {
			metadata.put(rule.key(), new MeasureMeta(rule.key(), rule.label(), rule.unit(), rule.notes(),
					MeasureMeta.KIND_EXTRA));
		}
		return metadata;
	}
}
