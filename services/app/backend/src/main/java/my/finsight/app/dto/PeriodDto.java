package my.finsight.app.dto;

import jakarta.validation.constraints.NotNull;
import my.finsight.app.service.ReportingPeriod;

import java.time.LocalDate;

public record PeriodDto(String label, @NotNull LocalDate start, @NotNull LocalDate end) {
	public ReportingPeriod toPeriod() {
		return new ReportingPeriod(label, start, end);
	}
}
