package my.finsight.app.mapping;

import java.util.List;

public record RowDefinition(
		int displayOrder,
		int id,
		String name,
		RowKind kind,
		int level,
		List<String> includePatterns,
		List<String> excludePatterns,
		String formula,
		String canonicalMeasure,
		String notes
) {
	public static final String FORMULA_MARKER = "=";

	public RowDefinition {
		name = name == null ? "" : name;
		includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
		excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
		formula = formula == null ? "" : formula;
		canonicalMeasure = canonicalMeasure == null || canonicalMeasure.isBlank() ? null : canonicalMeasure.trim();
		notes = notes == null ? "" : notes;
	}

	public static RowDefinition aggregation(int displayOrder, int id, String name, int level,
											List<String> includePatterns, List<String> excludePatterns) {
		return new RowDefinition(displayOrder, id, name, RowKind.AGGREGATION, level, includePatterns, excludePatterns,
				"", null, "");
	}

	public static RowDefinition formula(int displayOrder, int id, String name, int level, String formula) {
		return new RowDefinition(displayOrder, id, name, RowKind.FORMULA, level, List.of(), List.of(), formula, null, "");
	}

	public RowDefinition withCanonicalMeasure(String measure) {
		return new RowDefinition(displayOrder, id, name, kind, level, includePatterns, excludePatterns, formula, measure,
				notes);
	}

	public boolean isAggregation() {
		return kind == RowKind.AGGREGATION;
	}

	public boolean isFormula() {
		return kind == RowKind.FORMULA;
	}

	public boolean hasFormulaMarker() {
		return formula.strip().startsWith(FORMULA_MARKER);
	}

	public boolean hasCanonicalMeasure() {
		return canonicalMeasure != null;
	}

	public boolean claims(String code) {
		return isAggregation()
				&& PatternMatcher.matches(code, includePatterns)
				&& !PatternMatcher.matches(code, excludePatterns);
	}
}
