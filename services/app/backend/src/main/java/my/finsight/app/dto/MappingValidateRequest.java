package my.finsight.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record MappingValidateRequest(String name, @NotBlank @JsonAlias("csv") String content) {
}
