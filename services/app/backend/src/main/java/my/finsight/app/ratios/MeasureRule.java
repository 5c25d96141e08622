package my.finsight.app.ratios;

public record MeasureRule(String key, String formula, String label, String unit, String notes) {
	public MeasureRule {
		formula = formula == null ? "" : formula.trim();
		label = label == null || label.isBlank() ? key : label;
		unit = unit == null || unit.isBlank() ? "amount" : unit;
		notes = notes == null ? "" : notes;
	}

	public MeasureRule(String key, String formula) {
		this(key, formula, null, null, null);
	}
}
