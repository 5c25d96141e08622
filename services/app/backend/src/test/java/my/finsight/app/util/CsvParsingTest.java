package my.finsight.app.util;

import org.apache.commons.csv.CSVFormat;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		String value = "\uFEFFa,b,c";
		assertThat(CsvParsing.stripBom(value)).isEqualTo("a,b,c");
	}

	@Test
	void stripBomHandlesNullAndEmpty() {
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterPicksSemicolonOnlyWithoutComma() {
		assertThat(CsvParsing.sniffDelimiter("a;b;c")).isEqualTo(';');
		assertThat(CsvParsing.sniffDelimiter("id,accounts_to_include\n1,70*;71*")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("abc")).isEqualTo(',');
	}

	@Test
	void sniffDelimiterHandlesNullOrEmpty() {
		assertThat(CsvParsing.sniffDelimiter(null)).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("")).isEqualTo(',');
	}

	@Test
	void headerFormatLooksAtFirstLineOnly() {
		CSVFormat format = CsvParsing.headerFormat("a;b\r\n1,5;2\n");

		assertThat(format.getDelimiterString()).isEqualTo(";");
		assertThat(CsvParsing.firstLine("a;b\r\n1,5;2\n")).isEqualTo("a;b");
		assertThat(CsvParsing.firstLine(null)).isEmpty();
	}

	@Test
	void decodeUtf8RemovesBom() {
		byte[] payload = "\uFEFFa,b".getBytes(StandardCharsets.UTF_8);
		assertThat(CsvParsing.decodeUtf8(payload)).isEqualTo("a,b");
	}

	@Test
	void normalizeHeaderLowercasesAndTrims() {
		assertThat(CsvParsing.normalizeHeader("\uFEFF Account_Number ")).isEqualTo("account_number");
		assertThat(CsvParsing.normalizeHeader(null)).isEmpty();
	}
}
