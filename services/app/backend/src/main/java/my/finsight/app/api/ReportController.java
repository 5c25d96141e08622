package my.finsight.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.finsight.app.dto.LedgerEntryDto;
import my.finsight.app.dto.PeriodDto;
import my.finsight.app.dto.ReportRequest;
import my.finsight.app.engine.LedgerEntry;
import my.finsight.app.importer.LedgerEntryCsvParser;
import my.finsight.app.service.ReportResult;
import my.finsight.app.service.ReportingPeriod;
import my.finsight.app.service.ReportingService;
import my.finsight.app.view.StatementView;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@Tag(name = "Reports")
public class ReportController {
	private final ReportingService reportingService;
	private final LedgerEntryCsvParser csvParser = new LedgerEntryCsvParser();

	public ReportController(ReportingService reportingService) {
		this.reportingService = reportingService;
	}

	@PostMapping
	@Operation(summary = "Compute statements, measures and ratios for ledger entries")
	public ReportResult compute(@Valid @RequestBody ReportRequest request) {
		List<LedgerEntry> entries = request.entries().stream().map(LedgerEntryDto::toEntry).toList();
		List<ReportingPeriod> periods = request.periods().stream().map(PeriodDto::toPeriod).toList();
		return reportingService.compute(entries, periods, request.ratiosLevel(), StatementView.fromName(request.view()));
	}

	@PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Compute a report for one period from a ledger CSV upload")
	public ReportResult importAndCompute(@RequestParam("file") MultipartFile file,
										 @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
										 @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
										 @RequestParam(value = "label", required = false) String label,
										 @RequestParam(value = "ratiosLevel", required = false) String ratiosLevel,
										 @RequestParam(value = "view", required = false) String view) {
		if (file == null || file.isEmpty()) {
			throw new IllegalArgumentException("Ledger CSV upload is empty");
		}
		List<LedgerEntry> entries;
		try {
			entries = csvParser.parse(file.getBytes());
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read upload: " + ex.getMessage(), ex);
		}
		return reportingService.compute(entries, List.of(new ReportingPeriod(label, start, end)), ratiosLevel,
				StatementView.fromName(view));
	}
}
