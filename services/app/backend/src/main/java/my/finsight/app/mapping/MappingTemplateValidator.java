package my.finsight.app.mapping;

import my.finsight.app.expr.BinaryOperation;
import my.finsight.app.expr.Expression;
import my.finsight.app.expr.NumberLiteral;
import my.finsight.app.expr.SumFunction;
import my.finsight.app.expr.UnaryOperation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class MappingTemplateValidator {
	public ValidationReport validate(MappingTemplate template) {
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		if (template == null) {
			errors.add("Mapping template is empty");
			return new ValidationReport(errors, warnings);
		}
		if (template.getRows().isEmpty()) {
			errors.add("Mapping template has no rows");
		}
		Set<Integer> ids = new HashSet<>();
		Map<String, Integer> measures = new HashMap<>();
		for (RowDefinition row : template.getRows()) {
			if (!ids.add(row.id())) {
				errors.add("row " + row.id() + ": duplicate id");
			}
			if (row.level() < 0) {
				errors.add("row " + row.id() + ": level must not be negative");
			}
			if (row.hasCanonicalMeasure()) {
				Integer previous = measures.putIfAbsent(row.canonicalMeasure(), row.id());
				if (previous != null) {
					errors.add("row " + row.id() + ": canonical measure '" + row.canonicalMeasure()
							+ "' already used by row " + previous);
				}
			}
			if (row.isAggregation()) {
				if (row.includePatterns().isEmpty()) {
					warnings.add("row " + row.id() + ": no accounts_to_include, row stays at zero");
				}
				if (!row.formula().isBlank()) {
					warnings.add("row " + row.id() + ": formula is ignored on acc rows");
				}
			} else if (!row.hasFormulaMarker()) {
				warnings.add("row " + row.id() + ": formula does not start with '=', row evaluates to zero");
			}
		}
		for (RowDefinition row : template.getRows()) {
			if (!row.isFormula() || !row.hasFormulaMarker()) {
				continue;
			}
			Expression expression;
			try {
				expression = template.parseFormula(row);
			} catch (FormulaException ex) {
				errors.add("row " + row.id() + ": " + ex.getMessage());
				continue;
			}
			for (String variable : expression.variables()) {
				if (!ids.contains(parseId(variable))) {
					warnings.add("row " + row.id() + ": references unknown row " + variable + ", read as zero");
				}
			}
			if (hasConstant(expression)) {
				warnings.add("row " + row.id() + ": decimal numbers in " + row.formula()
						+ " are constants, only whole numbers address rows");
			}
		}
		for (MappingTemplate.ForwardReference reference : template.forwardReferences()) {
			warnings.add("row " + reference.rowId() + ": references formula row " + reference.referencedRowId()
					+ " declared later, its value is read before it is computed");
		}
		return new ValidationReport(errors, warnings);
	}

	private boolean hasConstant(Expression expression) {
		if (expression instanceof NumberLiteral) {
			return true;
		}
		if (expression instanceof UnaryOperation unary) {
			return hasConstant(unary.operand());
		}
		if (expression instanceof BinaryOperation binary) {
			return hasConstant(binary.left()) || hasConstant(binary.right());
		}
		if (expression instanceof SumFunction sum) {
			return sum.arguments().stream().anyMatch(this::hasConstant);
		}
		return false;
	}

	private Integer parseId(String variable) {
		try {
			return Integer.valueOf(variable);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public record ValidationReport(List<String> errors, List<String> warnings) {
		public ValidationReport {
			errors = List.copyOf(errors);
			warnings = List.copyOf(warnings);
		}

		public boolean valid() {
			return errors.isEmpty();
		}
	}
}
