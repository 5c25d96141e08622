package my.finsight.app.config;

import my.finsight.app.mapping.MappingTemplateException;
import my.finsight.app.service.ReportingStandard;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportingStandardLoaderTest {
	private final ReportingStandardLoader loader = new ReportingStandardLoader(new DefaultResourceLoader());

	@Test
	void loadsBundledStandard() {
		ReportingStandard standard = loader.load(new AppProperties.Standard("FR_PCG",
				"classpath:standards/fr_pcg/income_statement.csv",
				"classpath:standards/fr_pcg/sig.csv",
				"classpath:standards/fr_pcg/chart_of_accounts.csv",
				"classpath:standards/fr_pcg/ratios.toml",
				null));

		assertThat(standard.getName()).isEqualTo("FR_PCG");
		assertThat(standard.getSecondaryTemplate()).isPresent();
		assertThat(standard.getChartOfAccounts()).hasValueSatisfying(chart -> assertThat(chart.codes()).contains("70"));
		assertThat(standard.getCanonicalMeta()).containsKeys("revenue", "net_income", "ebitda");
		assertThat(standard.getDerivedMeta()).containsKeys("gross_margin", "caf");
		assertThat(standard.getCustomRules()).isEmpty();
	}

	@Test
	void optionalPartsMayBeLeftOut() {
		ReportingStandard standard = loader.load(new AppProperties.Standard("MIN",
				"classpath:fixtures/minimal_mapping.csv", " ", null, null, null));

		assertThat(standard.getSecondaryTemplate()).isEmpty();
		assertThat(standard.getChartOfAccounts()).isEmpty();
		assertThat(standard.hasRatioRules()).isFalse();
	}

	@Test
	void invalidMappingFailsLoading() {
		assertThatThrownBy(() -> loader.load(new AppProperties.Standard("BAD",
				"classpath:fixtures/duplicate_measure_mapping.csv", null, null, null, null)))
				.isInstanceOf(MappingTemplateException.class)
				.hasMessageContaining("revenue");
	}

	@Test
	void missingResourceFailsLoading() {
		assertThatThrownBy(() -> loader.load(new AppProperties.Standard("GONE",
				"classpath:fixtures/does_not_exist.csv", null, null, null, null)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("not found");
	}
}
