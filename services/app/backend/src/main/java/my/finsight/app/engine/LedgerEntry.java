package my.finsight.app.engine;

import java.time.LocalDate;

public record LedgerEntry(LocalDate date, String code, double amount, String description) {
	public LedgerEntry {
		code = code == null ? "" : code.trim();
		description = description == null ? "" : description;
	}

	public LedgerEntry(LocalDate date, String code, double amount) {
		this(date, code, amount, "");
	}
}
