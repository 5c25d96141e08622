package my.finsight.app.service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record ReportingPeriod(String label, LocalDate start, LocalDate end) {
	public ReportingPeriod {
		if (start == null || end == null) {
			throw new IllegalArgumentException("Period start and end are required");
		}
		if (end.isBefore(start)) {
			throw new IllegalArgumentException("Period end date cannot be before start date: " + start + " > " + end);
		}
		if (label == null || label.isBlank()) {
			label = start + " - " + end;
		}
	}

	public boolean contains(LocalDate date) {
		return date != null && !date.isBefore(start) && !date.isAfter(end);
	}

	public int lengthInDays() {
		return (int) ChronoUnit.DAYS.between(start, end) + 1;
	}
}
