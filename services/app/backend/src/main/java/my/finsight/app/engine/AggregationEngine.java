package my.finsight.app.engine;

import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.RowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class AggregationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

	private static final Comparator<RowDefinition> PRESENTATION_ORDER = Comparator
			.comparingInt(RowDefinition::level)
			.thenComparingInt(RowDefinition::displayOrder);

	public AggregatedStatement aggregate(List<LedgerEntry> entries, MappingTemplate template) {
		Map<Integer, Double> amounts = new HashMap<>();
		for (RowDefinition row : template.getRows()) {
			amounts.put(row.id(), 0.0d);
		}

		int unmatched = 0;
		for (LedgerEntry entry : entries) {
			List<Integer> rowIds = template.rowsForCode(entry.code());
			if (rowIds.isEmpty()) {
				unmatched++;
			}
			for (Integer rowId : rowIds) {
				amounts.merge(rowId, entry.amount(), Double::sum);
			}
		}

		// Declaration order: a formula only sees formula rows declared before it.
		for (RowDefinition row : template.getRows()) {
			if (row.isFormula()) {
				amounts.put(row.id(), template.evaluateFormula(row.id(), amounts));
			}
		}

		List<RowDefinition> ordered = new ArrayList<>(template.getRows());
		ordered.sort(PRESENTATION_ORDER);
		List<StatementRow> out = new ArrayList<>(ordered.size());
		for (RowDefinition row : ordered) {
			out.add(new StatementRow(
					row.level(),
					row.displayOrder(),
					row.id(),
					row.name(),
					row.kind(),
					Amounts.roundCurrency(amounts.getOrDefault(row.id(), 0.0d))
			));
		}
		logger.debug("Aggregated {} entries into {} rows of template {} ({} entries matched no row)",
				entries.size(), out.size(), template.getName(), unmatched);
		return new AggregatedStatement(out);
	}
}
