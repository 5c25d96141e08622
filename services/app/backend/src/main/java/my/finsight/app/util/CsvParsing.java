package my.finsight.app.util;

import org.apache.commons.csv.CSVFormat;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		boolean hasComma = sample.indexOf(',') >= 0;
		boolean hasSemicolon = sample.indexOf(';') >= 0;
		if (hasSemicolon && !hasComma) {
			return ';';
		}
		return ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	public static String firstLine(String content) {
		if (content == null) {
			return "";
		}
		int end = content.indexOf('\n');
		String line = end < 0 ? content : content.substring(0, end);
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	// Pattern and SUM argument lists use ';', so only the header decides the delimiter.
	public static CSVFormat headerFormat(String content) {
		return CSVFormat.DEFAULT.builder()
				.setDelimiter(sniffDelimiter(firstLine(content)))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.get();
	}

	public static String normalizeHeader(String header) {
		return header == null ? "" : stripBom(header).trim().toLowerCase(Locale.ROOT);
	}
}
