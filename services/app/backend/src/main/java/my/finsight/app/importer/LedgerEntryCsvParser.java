package my.finsight.app.importer;

import my.finsight.app.engine.LedgerEntry;
import my.finsight.app.util.CsvParsing;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads ledger entries from CSV, either with separate debit and credit columns
 * (amount = credit - debit) or with a pre-signed amount column.
 */
public class LedgerEntryCsvParser {
	static final String DATE = "date";
	static final String CODE = "code";
	static final String DEBIT = "debit";
	static final String CREDIT = "credit";
	static final String AMOUNT = "amount";
	static final List<String> DESCRIPTION_COLUMNS = List.of("description", "label");

	public List<LedgerEntry> parse(byte[] payload) {
		return parse(CsvParsing.decodeUtf8(payload));
	}

	public List<LedgerEntry> parse(String content) {
		String csv = CsvParsing.stripBom(content == null ? "" : content);
		List<LedgerEntry> entries = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(csv), CsvParsing.headerFormat(csv))) {
			Map<String, String> headers = new HashMap<>();
			for (String header : parser.getHeaderNames()) {
				headers.putIfAbsent(CsvParsing.normalizeHeader(header), header);
			}
			Layout layout = detectLayout(headers);
			String descriptionColumn = null;
			for (String candidate : DESCRIPTION_COLUMNS) {
				if (headers.containsKey(candidate)) {
					descriptionColumn = headers.get(candidate);
					break;
				}
			}
			for (CSVRecord record : parser) {
				long line = record.getRecordNumber() + 1;
				LocalDate date = parseDate(record.get(headers.get(DATE)), line);
				String code = record.get(headers.get(CODE));
				double amount;
				if (layout == Layout.DEBIT_CREDIT) {
					amount = parseAmount(record.get(headers.get(CREDIT)), CREDIT, line)
							- parseAmount(record.get(headers.get(DEBIT)), DEBIT, line);
				} else {
					String raw = record.get(headers.get(AMOUNT));
					if (raw == null || raw.isBlank()) {
						throw new IllegalArgumentException("Missing value in 'amount' column at line " + line);
					}
					amount = parseAmount(raw, AMOUNT, line);
				}
				String description = descriptionColumn == null ? "" : record.get(descriptionColumn);
				entries.add(new LedgerEntry(date, code, amount, description));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read ledger CSV: " + exc.getMessage(), exc);
		}
		return entries;
	}

	private Layout detectLayout(Map<String, String> headers) {
		boolean base = headers.containsKey(DATE) && headers.containsKey(CODE);
		if (base && headers.containsKey(DEBIT) && headers.containsKey(CREDIT)) {
			return Layout.DEBIT_CREDIT;
		}
		if (base && headers.containsKey(AMOUNT)) {
			return Layout.SIGNED_AMOUNT;
		}
		throw new IllegalArgumentException("Unsupported ledger CSV columns " + headers.keySet()
				+ ". Expected date, code, debit, credit[, description] or date, code, amount[, description]");
	}

	private LocalDate parseDate(String raw, long line) {
		try {
			return LocalDate.parse(raw.trim());
		} catch (DateTimeParseException exc) {
			throw new IllegalArgumentException("Invalid value in 'date' column at line " + line + ": " + raw, exc);
		}
	}

	private double parseAmount(String raw, String column, long line) {
		String value = raw == null ? "" : raw.trim().replace(" ", "");
		if (value.isEmpty()) {
			return 0.0d;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("Invalid numeric value in '" + column + "' column at line " + line
					+ ": " + raw, exc);
		}
	}

	private enum Layout {
		DEBIT_CREDIT,
		SIGNED_AMOUNT
	}
}
