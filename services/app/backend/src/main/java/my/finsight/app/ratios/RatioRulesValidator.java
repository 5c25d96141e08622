package my.finsight.app.ratios;

import my.finsight.app.expr.ExpressionException;
import my.finsight.app.expr.ExpressionParser;

import java.util.ArrayList;
import java.util.List;

public class RatioRulesValidator {
	public List<String> validate(RatioRulesDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Ratio rules are empty");
			return errors;
		}
		for (MeasureRule rule : definition.measureRules()) {
			if (rule.formula().isEmpty()) {
				errors.add("measures." + rule.key() + ".formula is required");
				continue;
			}
			checkSyntax("measures." + rule.key(), rule.formula(), errors);
		}
		for (RatioRule rule : definition.ratioRules()) {
			String path = "ratios." + rule.level() + "." + rule.key();
			if (rule.formula().isEmpty()) {
				errors.add(path + ".formula is required");
				continue;
			}
			checkSyntax(path, rule.formula(), errors);
		}
		return errors;
	}

	private void checkSyntax(String path, String formula, List<String> errors) {
		try {
			ExpressionParser.parseMeasureFormula(formula);
		} catch (ExpressionException ex) {
			errors.add(path + ".formula is invalid: " + ex.getMessage());
		}
	}
}
