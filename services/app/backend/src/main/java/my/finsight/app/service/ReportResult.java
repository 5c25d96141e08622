package my.finsight.app.service;

import my.finsight.app.accounts.RejectedEntry;

import java.util.List;

public record ReportResult(String standard, String ratiosLevel, List<PeriodReport> periods,
						   List<RejectedEntry> rejectedEntries) {
}
