package my.finsight.app.ratios;

public record RatioResult(String key, String label, Double value, String unit, String notes, String level) {
	public boolean hasValue() {
		return value != null;
	}
}
