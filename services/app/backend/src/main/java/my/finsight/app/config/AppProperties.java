package my.finsight.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Standard standard,
		@Valid Inputs inputs,
		@Valid Ratios ratios
) {
	public AppProperties {
		inputs = inputs == null ? new Inputs(null, null, null) : inputs;
		ratios = ratios == null ? new Ratios(null, null, null) : ratios;
	}

	public record Standard(
			@NotBlank String name,
			@NotBlank String primaryMapping,
			String secondaryMapping,
			String chartOfAccounts,
			String ratiosRules,
			String ratiosCustom
	) {
	}

	public record Inputs(
			Map<String, Double> balanceSheet,
			Map<String, Double> hr,
			@Positive Integer periodDays
	) {
		public Inputs {
			balanceSheet = balanceSheet == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(balanceSheet));
			hr = hr == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hr));
		}
	}

	public record Ratios(
			Boolean enabled,
			String level,
			@Min(0) Integer decimals
	) {
		public static final String DEFAULT_LEVEL = "basic";
		public static final int DEFAULT_DECIMALS = 1;

		public Ratios {
			enabled = enabled == null ? Boolean.TRUE : enabled;
			level = level == null || level.isBlank() ? DEFAULT_LEVEL : level.trim();
			decimals = decimals == null ? DEFAULT_DECIMALS : decimals;
		}
	}
}
