package my.finsight.app.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MappingTemplateValidatorTest {
	private final MappingTemplateValidator validator = new MappingTemplateValidator();

	@Test
	void acceptsWellFormedTemplate() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of()),
				RowDefinition.aggregation(20, 2, "Costs", 2, List.of("60*"), List.of()),
				RowDefinition.formula(30, 3, "Margin", 1, "=1+2")
		));

		MappingTemplateValidator.ValidationReport report = validator.validate(template);

		assertThat(report.valid()).isTrue();
		assertThat(report.errors()).isEmpty();
		assertThat(report.warnings()).isEmpty();
	}

	@Test
	void rejectsNullOrEmptyTemplate() {
		assertThat(validator.validate(null).valid()).isFalse();
		assertThat(validator.validate(new MappingTemplate(List.of())).valid()).isFalse();
	}

	@Test
	void reportsDuplicateIdsMeasuresAndNegativeLevels() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "A", 2, List.of("70*"), List.of()).withCanonicalMeasure("revenue"),
				RowDefinition.aggregation(20, 1, "B", -1, List.of("71*"), List.of()).withCanonicalMeasure("revenue")
		));

		MappingTemplateValidator.ValidationReport report = validator.validate(template);

		assertThat(report.valid()).isFalse();
		assertThat(report.errors()).anyMatch(e -> e.contains("duplicate id"));
		assertThat(report.errors()).anyMatch(e -> e.contains("level"));
		assertThat(report.errors()).anyMatch(e -> e.contains("canonical measure 'revenue'"));
	}

	@Test
	void reportsUnparsableFormula() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.formula(10, 1, "Bad", 1, "=1 + abs(2)")
		));

		MappingTemplateValidator.ValidationReport report = validator.validate(template);

		assertThat(report.valid()).isFalse();
		assertThat(report.errors()).singleElement().asString().contains("row 1");
	}

	@Test
	void warnsAboutSuspiciousButLegalRows() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Empty", 2, List.of(), List.of()),
				RowDefinition.formula(20, 2, "No marker", 1, "1+1"),
				RowDefinition.formula(30, 3, "Unknown ref", 1, "=1+42"),
				RowDefinition.formula(40, 4, "Forward", 1, "=5"),
				RowDefinition.formula(50, 5, "Later", 1, "=1")
		));

		MappingTemplateValidator.ValidationReport report = validator.validate(template);

		assertThat(report.valid()).isTrue();
		assertThat(report.warnings())
				.anyMatch(w -> w.startsWith("row 1:") && w.contains("accounts_to_include"))
				.anyMatch(w -> w.startsWith("row 2:") && w.contains("'='"))
				.anyMatch(w -> w.startsWith("row 3:") && w.contains("unknown row 42"))
				.anyMatch(w -> w.startsWith("row 4:") && w.contains("declared later"));
	}

	@Test
	void warnsWhenRowFormulaUsesDecimalConstants() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of()),
				RowDefinition.formula(20, 2, "Half", 1, "=1*0.5"),
				RowDefinition.formula(30, 3, "Whole", 1, "=SUM(1;2)")
		));

		MappingTemplateValidator.ValidationReport report = validator.validate(template);

		assertThat(report.valid()).isTrue();
		assertThat(report.warnings())
				.anyMatch(w -> w.startsWith("row 2:") && w.contains("constants"))
				.noneMatch(w -> w.startsWith("row 3:"));
	}
}
