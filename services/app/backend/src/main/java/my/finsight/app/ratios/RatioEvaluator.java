package my.finsight.app.ratios;

import my.finsight.app.expr.ExpressionException;
import my.finsight.app.expr.ExpressionParser;
import my.finsight.app.expr.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RatioEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(RatioEvaluator.class);

	public List<RatioResult> compute(Map<String, Double> measures, RatioRulesDefinition rules, String level) {
		return compute(measures, rules == null ? List.of() : rules.ratioRules(), level);
	}

	public List<RatioResult> compute(Map<String, Double> measures, List<RatioRule> rules, String level) {
		Set<String> available = new LinkedHashSet<>();
		for (RatioRule rule : rules) {
			available.add(rule.level());
		}
		List<RatioResult> results = new ArrayList<>();
		for (String included : RatioLevels.levelsToInclude(level, available)) {
			for (RatioRule rule : rules) {
				if (included.equals(rule.level())) {
					results.add(new RatioResult(rule.key(), rule.label(), evaluate(rule, measures), rule.unit(),
							rule.notes(), rule.level()));
				}
			}
		}
		return results;
	}

	private Double evaluate(RatioRule rule, Map<String, Double> measures) {
		String formula = rule.formula();
		if (formula.isEmpty()) {
			return null;
		}
		Double direct = measures.get(formula);
		if (direct != null) {
			return direct;
		}
		try {
			return ExpressionParser.parseMeasureFormula(formula).evaluate(VariableResolver.strict(measures));
		} catch (ExpressionException ex) {
			logger.debug("Ratio {} ({}) has no value: {}", rule.key(), formula, ex.getMessage());
			return null;
		}
	}
}
