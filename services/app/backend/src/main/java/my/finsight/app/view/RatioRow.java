package my.finsight.app.view;

public record RatioRow(String key, String label, Double value, String unit, String level, String notes) {
}
