package my.finsight.app.engine;

import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.RowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class CanonicalMeasureExtractor {
	private static final Logger logger = LoggerFactory.getLogger(CanonicalMeasureExtractor.class);

	public Map<String, Double> extract(AggregatedStatement statement, MappingTemplate template) {
		return extract(statement, template, Map.of());
	}

	public Map<String, Double> extract(AggregatedStatement statement, MappingTemplate template,
										 Map<String, ?> extraMeasures) {
		Map<Integer, Double> amounts = statement.amountsById();
		Map<String, Double> measures = new LinkedHashMap<>();
		for (RowDefinition row : template.getRows()) {
			if (!row.hasCanonicalMeasure()) {
				continue;
			}
			Double amount = amounts.get(row.id());
			measures.put(row.canonicalMeasure(), amount == null || amount.isNaN() ? 0.0d : amount);
		}
		if (extraMeasures != null) {
			for (Map.Entry<String, ?> extra : extraMeasures.entrySet()) {
				Double value = coerce(extra.getValue());
				if (value == null) {
					logger.debug("Dropping extra measure {}: '{}' is not numeric", extra.getKey(), extra.getValue());
					continue;
				}
				measures.put(extra.getKey(), value);
			}
		}
		return measures;
	}

	/**
	 * Secondary statement measures are more specific and win on key collisions.
	 */
	public Map<String, Double> merge(Map<String, Double> primary, Map<String, Double> secondary) {
		Map<String, Double> merged = new LinkedHashMap<>(primary);
		if (secondary != null) {
			merged.putAll(secondary);
		}
		return merged;
	}

	public Map<String, MeasureMeta> metadata(MappingTemplate template) {
		Map<String, MeasureMeta> metadata = new LinkedHashMap<>();
		for (Map.Entry<String, RowDefinition> entry : template.canonicalMeasureRows().entrySet()) {
			RowDefinition row = entry.getValue();
			String label = row.name().isBlank() ? entry.getKey() : row.name();
			metadata.put(entry.getKey(), new MeasureMeta(entry.getKey(), label, MeasureMeta.UNIT_AMOUNT, row.notes(),
					MeasureMeta.KIND_CANONICAL));
		}
		return metadata;
	}

	static Double coerce(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (value instanceof Boolean flag) {
			return flag ? 1.0d : 0.0d;
		}
		try {
			return Double.valueOf(value.toString().trim());
		} catch (NumberFormatException ex) {
			return null;
		}
	}
}
