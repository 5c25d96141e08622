package my.finsight.app.ratios;

import my.finsight.app.engine.MeasureMeta;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DerivedMeasureEvaluatorTest {
	private final DerivedMeasureEvaluator evaluator = new DerivedMeasureEvaluator();

	@Test
	void laterRuleSeesEarlierResult() {
		List<MeasureRule> rules = List.of(
				new MeasureRule("gross_margin", "revenue + cost_of_goods_sold"),
				new MeasureRule("gross_margin_pct", "gross_margin / revenue * 100")
		);

		Map<String, Double> measures = evaluator.compute(Map.of("revenue", 1000.0, "cost_of_goods_sold", -400.0), rules);

		assertThat(measures).containsEntry("gross_margin", 600.0).containsEntry("gross_margin_pct", 60.0);
	}

	@Test
	void ruleReadingAMeasureDefinedLaterIsSkipped() {
		List<MeasureRule> rules = List.of(
				new MeasureRule("b", "a * 2"),
				new MeasureRule("a", "base + 1")
		);

		Map<String, Double> measures = evaluator.compute(Map.of("base", 1.0), rules);

		assertThat(measures).containsEntry("a", 2.0).doesNotContainKey("b");
	}

	@Test
	void failingRulesLeaveMeasuresUntouched() {
		List<MeasureRule> rules = List.of(
				new MeasureRule("margin_pct", "net_income / revenue * 100"),
				new MeasureRule("broken", "revenue +"),
				new MeasureRule("blank", "  "),
				new MeasureRule("per_employee", "revenue / average_fte")
		);

		Map<String, Double> measures = evaluator.compute(Map.of("revenue", 0.0, "net_income", 5.0), rules);

		assertThat(measures).containsOnlyKeys("revenue", "net_income");
	}

	@Test
	void laterDefinitionOverwritesAndBaseIsNotMutated() {
		Map<String, Double> base = Map.of("revenue", 100.0);
		List<MeasureRule> rules = List.of(
				new MeasureRule("revenue", "revenue * 2"),
				new MeasureRule("revenue", "revenue + 1")
		);

		Map<String, Double> measures = evaluator.compute(base, rules);

		assertThat(measures).containsEntry("revenue", 201.0);
		assertThat(base).containsEntry("revenue", 100.0);
	}

	@Test
	void metadataCarriesLabelsAndDefaults() {
		RatioRulesDefinition definition = new RatioRulesDefinition();
		MeasureRuleDefinition labelled = new MeasureRuleDefinition();
		labelled.setFormula("a + b");
		labelled.setLabel("A plus B");
		labelled.setUnit("percent");
		MeasureRuleDefinition bare = new MeasureRuleDefinition();
		bare.setFormula("a");
		definition.getMeasures().put("sum_ab", labelled);
		definition.getMeasures().put("copy_a", bare);

		Map<String, MeasureMeta> metadata = evaluator.metadata(definition);

		assertThat(metadata.get("sum_ab").label()).isEqualTo("A plus B");
		assertThat(metadata.get("sum_ab").unit()).isEqualTo("percent");
		assertThat(metadata.get("copy_a").label()).isEqualTo("copy_a");
		assertThat(metadata.get("copy_a").unit()).isEqualTo("amount");
		assertThat(metadata.values()).allMatch(meta -> MeasureMeta.KIND_EXTRA.equals(meta.kind()));
		assertThat(evaluator.metadata(null)).isEmpty();
	}

	@Test
	void overlyNestedFormulaIsSkipped() {
		List<MeasureRule> rules = List.of(
				new MeasureRule("deep", "(".repeat(20_000) + "revenue" + ")".repeat(20_000)),
				new MeasureRule("doubled", "revenue * 2"));

		Map<String, Double> measures = evaluator.compute(Map.of("revenue", 1000.0), rules);

		assertThat(measures).doesNotContainKey("deep").containsEntry("doubled", 2000.0);
	}
}
