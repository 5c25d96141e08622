package my.finsight.app.mapping;

import my.finsight.app.expr.Expression;
import my.finsight.app.expr.ExpressionException;
import my.finsight.app.expr.ExpressionParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class MappingTemplate {
	private final String name;
	private final List<RowDefinition> rows;
	private final Map<Integer, RowDefinition> rowsById;
	private final Map<RowDefinition, Expression> parsedFormulas = new ConcurrentHashMap<>();

	public MappingTemplate(String name, List<RowDefinition> rows) {
		this.name = name == null ? "" : name;
		this.rows = List.copyOf(rows);
		Map<Integer, RowDefinition> byId = new HashMap<>();
		for (RowDefinition row : this.rows) {
			byId.put(row.id(), row);
		}
		this.rowsById = Collections.unmodifiableMap(byId);
	}

	public MappingTemplate(List<RowDefinition> rows) {
		this("", rows);
	}

	public String getName() {
		return name;
	}

	public List<RowDefinition> getRows() {
		return rows;
	}

	public Optional<RowDefinition> findRow(int id) {
		return Optional.ofNullable(rowsById.get(id));
	}

	public RowDefinition getRow(int id) {
		RowDefinition row = rowsById.get(id);
		if (row == null) {
			throw new MappingTemplateException("Unknown row id " + id + " in template " + name);
		}
		return row;
	}

	public List<Integer> rowsForCode(String code) {
		List<Integer> ids = new ArrayList<>();
		for (RowDefinition row : rows) {
			if (row.claims(code)) {
				ids.add(row.id());
			}
		}
		return ids;
	}

	public double evaluateFormula(int id, Map<Integer, Double> knownValues) {
		RowDefinition row = getRow(id);
		if (!row.hasFormulaMarker()) {
			return 0.0d;
		}
		Expression expression = parseFormula(row);
		try {
			return expression.evaluate(name -> resolveRow(name, knownValues));
		} catch (ExpressionException ex) {
			throw new FormulaException(row.id(), row.formula(), ex.getMessage(), ex);
		}
	}

	public Expression parseFormula(RowDefinition row) {
		return parsedFormulas.computeIfAbsent(row, key -> {
			String body = row.formula().strip().substring(RowDefinition.FORMULA_MARKER.length());
			try {
				return ExpressionParser.parseRowFormula(body);
			} catch (ExpressionException ex) {
				throw new FormulaException(row.id(), row.formula(), ex.getMessage(), ex);
			}
		});
	}

	/**
	 * Canonical measure name to row, in declaration order. Fails on duplicate row ids or
	 * duplicate measure tags.
	 */
	public Map<String, RowDefinition> canonicalMeasureRows() {
		Set<Integer> seenIds = new HashSet<>();
		Map<String, RowDefinition> byMeasure = new LinkedHashMap<>();
		for (RowDefinition row : rows) {
			if (!seenIds.add(row.id())) {
				throw new MappingTemplateException("Duplicate row id " + row.id() + " in template " + name);
			}
			if (!row.hasCanonicalMeasure()) {
				continue;
			}
			RowDefinition previous = byMeasure.putIfAbsent(row.canonicalMeasure(), row);
			if (previous != null) {
				throw new MappingTemplateException("Duplicate canonical measure '" + row.canonicalMeasure()
						+ "' on rows " + previous.id() + " and " + row.id() + " in template " + name);
			}
		}
		return byMeasure;
	}

	/**
	 * Formula rows reading a formula row declared after them. Evaluation keeps declaration
	 * order, so such references see the value before that row is computed.
	 */
	public List<ForwardReference> forwardReferences() {
		Map<Integer, Integer> formulaPositions = new HashMap<>();
		for (int i = 0; i < rows.size(); i++) {
			if (rows.get(i).isFormula()) {
				formulaPositions.put(rows.get(i).id(), i);
			}
		}
		List<ForwardReference> references = new ArrayList<>();
		for (int i = 0; i < rows.size(); i++) {
			RowDefinition row = rows.get(i);
			if (!row.isFormula() || !row.hasFormulaMarker()) {
				continue;
			}
			Expression expression;
			try {
				expression = parseFormula(row);
			} catch (FormulaException ex) {
				continue;
			}
			for (String variable : expression.variables()) {
				Integer referencedId = toRowId(variable);
				Integer position = referencedId == null ? null : formulaPositions.get(referencedId);
				if (position != null && position > i) {
					references.add(new ForwardReference(row.id(), referencedId));
				}
			}
		}
		return references;
	}

	private static double resolveRow(String variable, Map<Integer, Double> knownValues) {
		Integer id = toRowId(variable);
		if (id == null) {
			return 0.0d;
		}
		Double value = knownValues.get(id);
		return value == null ? 0.0d : value;
	}

	private static Integer toRowId(String variable) {
		try {
			return Integer.valueOf(variable);
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	public record ForwardReference(int rowId, int referencedRowId) {
	}
}
