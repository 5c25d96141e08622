package my.finsight.app.importer;

import my.finsight.app.engine.LedgerEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerEntryCsvParserTest {
	private final LedgerEntryCsvParser parser = new LedgerEntryCsvParser();

	@Test
	void debitCreditLayoutComputesSignedAmount() {
		String csv = "date,code,debit,credit,description\n"
				+ "2024-01-15,75402,0,844.65,Subsidy\n"
				+ "2024-01-16,606300,120.50,,Supplies\n";

		List<LedgerEntry> entries = parser.parse(csv.getBytes(StandardCharsets.UTF_8));

		assertThat(entries).hasSize(2);
		assertThat(entries.get(0).date()).isEqualTo(LocalDate.of(2024, 1, 15));
		assertThat(entries.get(0).code()).isEqualTo("75402");
		assertThat(entries.get(0).amount()).isEqualTo(844.65);
		assertThat(entries.get(0).description()).isEqualTo("Subsidy");
		assertThat(entries.get(1).amount()).isEqualTo(-120.50);
	}

	@Test
	void signedAmountLayoutWithSemicolonsAndLabelColumn() {
		String csv = "\uFEFFDate;Code;Amount;Label\n2024-02-01;707000;1000;Invoice 12\n2024-02-03; 62201 ;-300.5;\n";

		List<LedgerEntry> entries = parser.parse(csv);

		assertThat(entries).extracting(LedgerEntry::code).containsExactly("707000", "62201");
		assertThat(entries).extracting(LedgerEntry::amount).containsExactly(1000.0, -300.5);
		assertThat(entries.get(0).description()).isEqualTo("Invoice 12");
	}

	@Test
	void descriptionIsOptional() {
		List<LedgerEntry> entries = parser.parse("date,code,amount\n2024-03-01,70,5\n");

		assertThat(entries).singleElement().satisfies(e -> assertThat(e.description()).isEmpty());
	}

	@Test
	void rejectsUnsupportedColumns() {
		assertThatThrownBy(() -> parser.parse("date,account,value\n2024-01-01,70,1\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unsupported ledger CSV columns");
	}

	@Test
	void rejectsInvalidValues() {
		assertThatThrownBy(() -> parser.parse("date,code,amount\n01/02/2024,70,1\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'date'");
		assertThatThrownBy(() -> parser.parse("date,code,amount\n2024-01-02,70,abc\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'amount'");
		assertThatThrownBy(() -> parser.parse("date,code,amount\n2024-01-02,70,\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Missing value");
		assertThatThrownBy(() -> parser.parse("date,code,debit,credit\n2024-01-02,60,1.2.3,0\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'debit'");
	}
}
