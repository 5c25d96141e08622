package my.finsight.app.dto;

import my.finsight.app.mapping.MappingTemplateValidator;

import java.util.List;

public record MappingValidationDto(boolean valid, List<String> errors, List<String> warnings) {
	public static MappingValidationDto from(MappingTemplateValidator.ValidationReport report) {
		return new MappingValidationDto(report.valid(), report.errors(), report.warnings());
	}
}
