package my.finsight.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import my.finsight.app.engine.LedgerEntry;

import java.time.LocalDate;

public record LedgerEntryDto(@NotNull LocalDate date, @NotBlank String code, @NotNull Double amount,
							 String description) {
	public LedgerEntry toEntry() {
		return new LedgerEntry(date, code, amount, description);
	}
}
