package my.finsight.app.mapping;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingTemplateTest {
	@Test
	void sumFormulaAddsReferencedRows() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "A", 2, List.of("1*"), List.of()),
				RowDefinition.aggregation(20, 2, "B", 2, List.of("2*"), List.of()),
				RowDefinition.aggregation(30, 3, "C", 2, List.of("3*"), List.of()),
				RowDefinition.formula(40, 4, "Total", 1, "=SUM(1;2;3)")
		));

		double total = template.evaluateFormula(4, Map.of(1, 10.0, 2, 20.0, 3, 30.0));

		assertThat(total).isEqualTo(60.0);
	}

	@Test
	void arithmeticFormulaOverRows() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.formula(10, 4, "Net", 1, "=1+2-3")
		));

		assertThat(template.evaluateFormula(4, Map.of(1, 10.0, 2, 20.0, 3, 30.0))).isEqualTo(0.0);
	}

	@Test
	void missingReferencesReadAsZero() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.formula(10, 5, "Partial", 1, "=1+99")
		));

		assertThat(template.evaluateFormula(5, Map.of(1, 42.0))).isEqualTo(42.0);
	}

	@Test
	void formulaWithoutMarkerEvaluatesToZero() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.formula(10, 1, "Plain", 1, "1+2")
		));

		assertThat(template.evaluateFormula(1, Map.of(1, 5.0, 2, 7.0))).isEqualTo(0.0);
	}

	@Test
	void unsafeFormulaIsRejected() {
		MappingTemplate template = new MappingTemplate("income", List.of(
				RowDefinition.formula(10, 7, "Evil", 1, "=__import__('os').system('x')")
		));
		Map<Integer, Double> values = new HashMap<>();

		assertThatThrownBy(() -> template.evaluateFormula(7, values))
				.isInstanceOf(FormulaException.class)
				.isInstanceOf(MappingTemplateException.class)
				.hasMessageContaining("row 7");
	}

	@Test
	void divisionByZeroInRowFormulaFails() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.formula(10, 3, "Ratio", 1, "=1/2")
		));

		assertThatThrownBy(() -> template.evaluateFormula(3, Map.of(1, 5.0, 2, 0.0)))
				.isInstanceOf(FormulaException.class);
	}

	@Test
	void excludeTakesPrecedenceOverInclude() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Sales", 3, List.of("70*"), List.of("709*")),
				RowDefinition.aggregation(20, 2, "Rebates", 3, List.of("709*"), List.of())
		));

		assertThat(template.rowsForCode("707")).containsExactly(1);
		assertThat(template.rowsForCode("7091")).containsExactly(2);
		assertThat(template.rowsForCode("601")).isEmpty();
	}

	@Test
	void codeMayFeedSeveralRows() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Detail", 3, List.of("707"), List.of()),
				RowDefinition.aggregation(20, 2, "Total", 2, List.of("70*"), List.of()),
				RowDefinition.formula(30, 3, "Ignored", 1, "=1")
		));

		assertThat(template.rowsForCode("707")).containsExactly(1, 2);
	}

	@Test
	void getRowFailsOnUnknownId() {
		MappingTemplate template = new MappingTemplate("income", List.of());

		assertThatThrownBy(() -> template.getRow(12))
				.isInstanceOf(MappingTemplateException.class)
				.hasMessageContaining("12");
		assertThat(template.findRow(12)).isEmpty();
	}

	@Test
	void canonicalMeasureRowsKeepDeclarationOrder() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of()).withCanonicalMeasure("revenue"),
				RowDefinition.aggregation(20, 2, "Other", 2, List.of("71*"), List.of()),
				RowDefinition.formula(30, 3, "Net", 1, "=1+2").withCanonicalMeasure("net_income")
		));

		assertThat(template.canonicalMeasureRows()).containsOnlyKeys("revenue", "net_income");
		assertThat(template.canonicalMeasureRows().keySet()).containsExactly("revenue", "net_income");
		assertThat(template.canonicalMeasureRows().get("net_income").id()).isEqualTo(3);
	}

	@Test
	void canonicalMeasureRowsRejectDuplicates() {
		MappingTemplate duplicateMeasure = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "A", 2, List.of("70*"), List.of()).withCanonicalMeasure("revenue"),
				RowDefinition.aggregation(20, 2, "B", 2, List.of("71*"), List.of()).withCanonicalMeasure("revenue")
		));
		MappingTemplate duplicateId = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "A", 2, List.of("70*"), List.of()),
				RowDefinition.aggregation(20, 1, "B", 2, List.of("71*"), List.of())
		));

		assertThatThrownBy(duplicateMeasure::canonicalMeasureRows)
				.isInstanceOf(MappingTemplateException.class)
				.hasMessageContaining("revenue");
		assertThatThrownBy(duplicateId::canonicalMeasureRows)
				.isInstanceOf(MappingTemplateException.class)
				.hasMessageContaining("Duplicate row id 1");
	}

	@Test
	void forwardReferencesListFormulaRowsDeclaredLater() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "A", 2, List.of("70*"), List.of()),
				RowDefinition.formula(20, 2, "Early", 1, "=1+3"),
				RowDefinition.formula(30, 3, "Late", 1, "=1*2")
		));

		assertThat(template.forwardReferences())
				.containsExactly(new MappingTemplate.ForwardReference(2, 3));
	}

	@Test
	void sumIgnoresEmptyArguments() {
		MappingTemplate template = new MappingTemplate(List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of()),
				RowDefinition.aggregation(20, 2, "Costs", 2, List.of("60*"), List.of()),
				RowDefinition.formula(30, 3, "Trailing", 1, "=SUM(1;2;)"),
				RowDefinition.formula(40, 4, "Leading", 1, "=SUM(;1)")
		));
		Map<Integer, Double> values = Map.of(1, 10.0, 2, 20.0);

		assertThat(template.evaluateFormula(3, values)).isEqualTo(30.0);
		assertThat(template.evaluateFormula(4, values)).isEqualTo(10.0);
	}
}
