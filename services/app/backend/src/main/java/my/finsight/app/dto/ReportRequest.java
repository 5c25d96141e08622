package my.finsight.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ReportRequest(@NotNull List<@Valid LedgerEntryDto> entries,
							@NotEmpty List<@Valid PeriodDto> periods,
							String ratiosLevel,
							String view) {
}
