package my.finsight.app.service;

public record MeasureValue(String key, String label, double value, String unit, String notes, String kind) {
}
