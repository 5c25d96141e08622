package my.finsight.app.ratios;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.Locale;

public class RatioRulesParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper tomlMapper;
	private final ObjectMapper yamlMapper;

	public RatioRulesParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.tomlMapper = TomlMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public RatioRulesDefinition parse(String content, String filename) throws Exception {
		String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
		if (name.endsWith(".toml")) {
			return tomlMapper.readValue(content, RatioRulesDefinition.class);
		}
		if (name.endsWith(".json")) {
			return jsonMapper.readValue(content, RatioRulesDefinition.class);
		}
		if (name.endsWith(".yml") || name.endsWith(".yaml")) {
			return yamlMapper.readValue(content, RatioRulesDefinition.class);
		}
		return parse(content);
	}

	public RatioRulesDefinition parse(String content) throws Exception {
		try {
			return jsonMapper.readValue(content, RatioRulesDefinition.class);
		} catch (Exception jsonEx) {
			try {
				return tomlMapper.readValue(content, RatioRulesDefinition.class);
			} catch (Exception tomlEx) {
				return yamlMapper.readValue(content, RatioRulesDefinition.class);
			}
		}
	}
}
