package my.finsight.app.mapping;

import my.finsight.app.util.CsvParsing;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class MappingTemplateParser {
	public static final String COL_DISPLAY_ORDER = "display_order";
	public static final String COL_ID = "id";
	public static final String COL_NAME = "name";
	public static final String COL_TYPE = "type";
	public static final String COL_LEVEL = "level";
	public static final String COL_INCLUDE = "accounts_to_include";
	public static final String COL_EXCLUDE = "accounts_to_exclude";
	public static final String COL_FORMULA = "formula";
	public static final String COL_CANONICAL_MEASURE = "canonical_measure";
	public static final String COL_NOTES = "notes";

	private static final List<String> REQUIRED = List.of(COL_DISPLAY_ORDER, COL_ID, COL_NAME, COL_TYPE, COL_LEVEL);

	public MappingTemplate parse(String name, byte[] payload) {
		return parse(name, CsvParsing.decodeUtf8(payload));
	}

	public MappingTemplate parse(String name, String content) {
		String text = CsvParsing.stripBom(content == null ? "" : content);
		List<RowDefinition> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(text), CsvParsing.headerFormat(text))) {
			Map<String, String> columns = columnIndex(parser.getHeaderNames());
			for (String required : REQUIRED) {
				if (!columns.containsKey(required)) {
					throw new MappingTemplateException("Mapping " + name + " is missing column '" + required + "'");
				}
			}
			for (CSVRecord record : parser) {
				rows.add(toRow(name, record, columns));
			}
		} catch (IOException exc) {
			throw new MappingTemplateException("Failed to read mapping " + name + ": " + exc.getMessage(), exc);
		}
		return new MappingTemplate(name, rows);
	}

	private RowDefinition toRow(String name, CSVRecord record, Map<String, String> columns) {
		long line = record.getRecordNumber() + 1;
		return new RowDefinition(
				parseInt(name, line, COL_DISPLAY_ORDER, value(record, columns, COL_DISPLAY_ORDER)),
				parseInt(name, line, COL_ID, value(record, columns, COL_ID)),
				value(record, columns, COL_NAME),
				kind(name, line, value(record, columns, COL_TYPE)),
				parseInt(name, line, COL_LEVEL, value(record, columns, COL_LEVEL)),
				PatternMatcher.splitPatterns(value(record, columns, COL_INCLUDE)),
				PatternMatcher.splitPatterns(value(record, columns, COL_EXCLUDE)),
				value(record, columns, COL_FORMULA),
				value(record, columns, COL_CANONICAL_MEASURE),
				value(record, columns, COL_NOTES)
		);
	}

	private RowKind kind(String name, long line, String raw) {
		try {
			return RowKind.fromCode(raw);
		} catch (MappingTemplateException ex) {
			throw new MappingTemplateException("Mapping " + name + " line " + line + ": " + ex.getMessage(), ex);
		}
	}

	private int parseInt(String name, long line, String column, String raw) {
		String value = raw == null ? "" : raw.trim();
		// Spreadsheet exports write integers as 10.0
		if (value.endsWith(".0")) {
			value = value.substring(0, value.length() - 2);
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException ex) {
			throw new MappingTemplateException("Mapping " + name + " line " + line + ": column '" + column
					+ "' is not an integer: '" + raw + "'", ex);
		}
	}

	private String value(CSVRecord record, Map<String, String> columns, String column) {
		String header = columns.get(column);
		if (header == null || !record.isSet(header)) {
			return "";
		}
		String value = record.get(header);
		return value == null ? "" : value.trim();
	}

	private Map<String, String> columnIndex(List<String> headers) {
		Map<String, String> index = new HashMap<>();
		for (String header : headers) {
			index.putIfAbsent(CsvParsing.normalizeHeader(header), header);
		}
		return index;
	}
}
