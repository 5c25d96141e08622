package my.finsight.app.service;

import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.MappingTemplateException;
import my.finsight.app.mapping.MappingTemplateParser;
import my.finsight.app.mapping.MappingTemplateValidator;
import my.finsight.app.mapping.RowDefinition;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class MappingService {
	private final ReportingStandard standard;
	private final MappingTemplateParser parser;
	private final MappingTemplateValidator validator;

	public MappingService(ReportingStandard standard) {
		this.standard = standard;
		this.parser = new MappingTemplateParser();
		this.validator = new MappingTemplateValidator();
	}

	public List<RowDefinition> getRows(String statement) {
		return template(statement).getRows();
	}

	public MappingTemplateValidator.ValidationReport lint(String statement) {
		return validator.validate(template(statement));
	}

	public MappingTemplateValidator.ValidationReport validate(String name, String content) {
		try {
			return validator.validate(parser.parse(name, content));
		} catch (MappingTemplateException ex) {
			return new MappingTemplateValidator.ValidationReport(List.of(ex.getMessage()), List.of());
		}
	}

	private MappingTemplate template(String statement) {
		return standard.template(statement)
				.orElseThrow(() -> new IllegalArgumentException("Unknown statement: " + statement));
	}
}
