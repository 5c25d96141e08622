package my.finsight.app.accounts;

import my.finsight.app.util.CsvParsing;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User-maintained list of account codes and their labels.
 */
public class ChartOfAccounts {
	static final List<String> CODE_COLUMNS = List.of("account_number", "account", "code");
	static final List<String> NAME_COLUMNS = List.of("name", "label", "description");

	private final Map<String, String> namesByCode;

	public ChartOfAccounts(Map<String, String> namesByCode) {
		this.namesByCode = Collections.unmodifiableMap(new LinkedHashMap<>(namesByCode));
	}

	public static ChartOfAccounts parse(byte[] payload) {
		return parse(CsvParsing.decodeUtf8(payload));
	}

	public static ChartOfAccounts parse(String content) {
		String csv = CsvParsing.stripBom(content == null ? "" : content);
		Map<String, String> names = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(csv), CsvParsing.headerFormat(csv))) {
			Map<String, String> headers = new LinkedHashMap<>();
			for (String header : parser.getHeaderNames()) {
				headers.putIfAbsent(CsvParsing.normalizeHeader(header), header);
			}
			String codeColumn = pickColumn(headers, CODE_COLUMNS, "account code");
			String nameColumn = pickColumn(headers, NAME_COLUMNS, "account name/label");
			for (CSVRecord record : parser) {
				String code = record.get(codeColumn).trim();
				if (code.isEmpty()) {
					continue;
				}
				names.put(code, record.get(nameColumn).trim());
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read chart of accounts: " + exc.getMessage(), exc);
		}
		return new ChartOfAccounts(names);
	}

	private static String pickColumn(Map<String, String> headers, List<String> candidates, String what) {
		for (String candidate : candidates) {
			String header = headers.get(candidate);
			if (header != null) {
				return header;
			}
		}
		throw new IllegalArgumentException("Could not find an " + what + " column in chart of accounts. Expected one of: "
				+ String.join(", ", candidates));
	}

	public Set<String> codes() {
		return namesByCode.keySet();
	}

	public Map<String, String> namesByCode() {
		return namesByCode;
	}

	public String nameOf(String code) {
		return namesByCode.getOrDefault(code, "");
	}

	public int size() {
		return namesByCode.size();
	}
}
