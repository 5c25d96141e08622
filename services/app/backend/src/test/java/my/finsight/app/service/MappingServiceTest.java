package my.finsight.app.service;

import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.MappingTemplateValidator;
import my.finsight.app.mapping.RowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MappingServiceTest {
	@Mock
	private ReportingStandard standard;

	@InjectMocks
	private MappingService mappingService;

	@Test
	void returnsRowsOfRequestedStatement() {
		MappingTemplate template = new MappingTemplate("primary", List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of())));
		when(standard.template("primary")).thenReturn(Optional.of(template));

		assertThat(mappingService.getRows("primary")).extracting(RowDefinition::id).containsExactly(1);
		verify(standard).template("primary");
	}

	@Test
	void lintReportsForwardReferences() {
		MappingTemplate template = new MappingTemplate("primary", List.of(
				RowDefinition.aggregation(10, 1, "Revenue", 2, List.of("70*"), List.of()),
				RowDefinition.formula(20, 2, "Early", 1, "=3"),
				RowDefinition.formula(30, 3, "Late", 1, "=1")));
		when(standard.template("primary")).thenReturn(Optional.of(template));

		MappingTemplateValidator.ValidationReport report = mappingService.lint("primary");

		assertThat(report.valid()).isTrue();
		assertThat(report.warnings()).anyMatch(w -> w.contains("declared later"));
	}

	@Test
	void unknownStatementIsBadInput() {
		when(standard.template("balance")).thenReturn(Optional.empty());

		assertThatThrownBy(() -> mappingService.lint("balance"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("balance");
	}

	@Test
	void validateTurnsParseFailuresIntoErrors() {
		MappingTemplateValidator.ValidationReport broken = mappingService.validate("upload", "id,name\n1,x\n");
		MappingTemplateValidator.ValidationReport fine = mappingService.validate("upload",
				"display_order,id,name,type,level,accounts_to_include\n10,1,Revenue,acc,1,70*\n");

		assertThat(broken.valid()).isFalse();
		assertThat(broken.errors()).hasSize(1).allMatch(error -> error.contains("missing column"));
		assertThat(fine.valid()).isTrue();
	}
}
