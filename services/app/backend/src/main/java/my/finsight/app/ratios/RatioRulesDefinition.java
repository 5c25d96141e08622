package my.finsight.app.ratios;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RatioRulesDefinition {
	private Map<String, MeasureRuleDefinition> measures = new LinkedHashMap<>();
	private Map<String, Map<String, RatioRuleDefinition>> ratios = new LinkedHashMap<>();

	public Map<String, MeasureRuleDefinition> getMeasures() {
		return measures;
	}

	public void setMeasures(Map<String, MeasureRuleDefinition> measures) {
		this.measures = measures;
	}

	public Map<String, Map<String, RatioRuleDefinition>> getRatios() {
		return ratios;
	}

	public void setRatios(Map<String, Map<String, RatioRuleDefinition>> ratios) {
		this.ratios = ratios;
	}

	public List<MeasureRule> measureRules() {
		List<MeasureRule> rules = new ArrayList<>();
		if (measures == null) {
			return rules;
		}
		for (Map.Entry<String, MeasureRuleDefinition> entry : measures.entrySet()) {
			MeasureRuleDefinition definition = entry.getValue();
			if (definition == null) {
				continue;
			}
			rules.add(new MeasureRule(entry.getKey(), definition.getFormula(), definition.getLabel(),
					definition.getUnit(), definition.getNotes()));
		}
		return rules;
	}

	public List<RatioRule> ratioRules() {
		List<RatioRule> rules = new ArrayList<>();
		if (ratios == null) {
			return rules;
		}
		for (Map.Entry<String, Map<String, RatioRuleDefinition>> level : ratios.entrySet()) {
			if (level.getValue() == null) {
				continue;
			}
			for (Map.Entry<String, RatioRuleDefinition> entry : level.getValue().entrySet()) {
				RatioRuleDefinition definition = entry.getValue();
				if (definition == null) {
					continue;
				}
				String formula = definition.getFormula();
				if (formula == null || formula.isBlank()) {
					formula = definition.getMeasure();
				}
				rules.add(new RatioRule(entry.getKey(), level.getKey(), formula, definition.getLabel(),
						definition.getUnit(), definition.getNotes()));
			}
		}
		return rules;
	}
}
