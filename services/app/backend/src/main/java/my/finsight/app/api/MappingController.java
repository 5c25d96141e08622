package my.finsight.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.finsight.app.dto.MappingRowDto;
import my.finsight.app.dto.MappingValidateRequest;
import my.finsight.app.dto.MappingValidationDto;
import my.finsight.app.service.MappingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/mapping")
@Tag(name = "Mapping")
public class MappingController {
	private final MappingService mappingService;

	public MappingController(MappingService mappingService) {
		this.mappingService = mappingService;
	}

	@GetMapping("/{statement}")
	@Operation(summary = "List the rows of the primary or secondary mapping")
	public List<MappingRowDto> rows(@PathVariable String statement) {
		return mappingService.getRows(statement).stream().map(MappingRowDto::from).toList();
	}

	@GetMapping("/{statement}/lint")
	@Operation(summary = "Validate a loaded mapping and list forward references")
	public MappingValidationDto lint(@PathVariable String statement) {
		return MappingValidationDto.from(mappingService.lint(statement));
	}

	@PostMapping("/validate")
	@Operation(summary = "Validate a mapping CSV without loading it")
	public MappingValidationDto validate(@Valid @RequestBody MappingValidateRequest request) {
		String name = request.name() == null || request.name().isBlank() ? "upload" : request.name();
		return MappingValidationDto.from(mappingService.validate(name, request.content()));
	}
}
