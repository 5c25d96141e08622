package my.finsight.app.engine;

public record MeasureMeta(String key, String label, String unit, String notes, String kind) {
	public static final String KIND_CANONICAL = "canonical";
	public static final String KIND_EXTRA = "extra";
	public static final String UNIT_AMOUNT = "amount";
	public static final String UNIT_DAYS = "days";

	public static MeasureMeta fallback(String key) {
		String unit = "period_days".equals(key) ? UNIT_DAYS : UNIT_AMOUNT;
		return new MeasureMeta(key, key, unit, "", KIND_EXTRA);
	}
}
