package my.finsight.app.ratios;

/**
 * One ratio definition. {@code formula} is either an expression over measures or the
 * name of a single measure.
 */
public record RatioRule(String key, String level, String formula, String label, String unit, String notes) {
	public RatioRule {
		formula = formula == null ? "" : formula.trim();
		label = label == null || label.isBlank() ? key : label;
		unit = unit == null || unit.isBlank() ? "amount" : unit;
		notes = notes == null ? "" : notes;
	}

	public RatioRule(String key, String level, String formula) {
		this(key, level, formula, null, null, null);
	}
}
