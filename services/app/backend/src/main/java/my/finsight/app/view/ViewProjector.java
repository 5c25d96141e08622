package my.finsight.app.view;

import my.finsight.app.engine.AggregatedStatement;
import my.finsight.app.engine.Amounts;
import my.finsight.app.engine.LedgerEntry;
import my.finsight.app.engine.StatementRow;
import my.finsight.app.mapping.MappingTemplate;
import my.finsight.app.mapping.RowDefinition;
import my.finsight.app.mapping.RowKind;
import my.finsight.app.ratios.RatioLevels;
import my.finsight.app.ratios.RatioResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ViewProjector {
	public static final int DISPLAY_ORDER_STEP = 10;
	public static final int LEAF_LEVEL = 3;
	private static final int CHILD_ID_FACTOR = 1000;

	public List<ViewRow> project(AggregatedStatement statement, StatementView view) {
		List<ViewRow> rows = new ArrayList<>();
		for (StatementRow row : statement.getRows()) {
			if (row.level() <= view.getMaxLevel()) {
				rows.add(new ViewRow(row.displayOrder(), row.id(), row.level(), row.name(), row.kind(), row.amount()));
			}
		}
		rows.sort(Comparator.comparingInt(ViewRow::displayOrder));
		return renumber(rows);
	}

	/**
	 * Every template row in display order, with the accounts feeding each leaf aggregation
	 * row listed right below it one level deeper.
	 */
	public List<ViewRow> buildCompleteView(AggregatedStatement statement, List<LedgerEntry> entries,
											 MappingTemplate template, Map<String, String> accountNames) {
		Map<String, Double> totalsByCode = new TreeMap<>();
		for (LedgerEntry entry : entries) {
			totalsByCode.merge(entry.code(), entry.amount(), Double::sum);
		}

		Map<Integer, List<Map.Entry<String, Double>>> childrenByRowId = new HashMap<>();
		for (Map.Entry<String, Double> total : totalsByCode.entrySet()) {
			if (total.getValue() == 0.0d) {
				continue;
			}
			for (Integer rowId : template.rowsForCode(total.getKey())) {
				RowDefinition row = template.getRow(rowId);
				if (row.isAggregation() && row.level() == LEAF_LEVEL) {
					childrenByRowId.computeIfAbsent(rowId, key -> new ArrayList<>()).add(total);
				}
			}
		}

		List<RowDefinition> ordered = new ArrayList<>(template.getRows());
		ordered.sort(Comparator.comparingInt(RowDefinition::displayOrder));
		List<ViewRow> rows = new ArrayList<>();
		for (RowDefinition row : ordered) {
			rows.add(new ViewRow(row.displayOrder(), row.id(), row.level(), row.name(), row.kind(),
					Amounts.roundCurrency(statement.amountOf(row.id()))));
			if (!row.isAggregation() || row.level() != LEAF_LEVEL) {
				continue;
			}
			int index = 0;
			for (Map.Entry<String, Double> child : childrenByRowId.getOrDefault(row.id(), List.of())) {
				index++;
				String label = accountNames == null ? "" : accountNames.getOrDefault(child.getKey(), "");
				rows.add(new ViewRow(row.displayOrder(), row.id() * CHILD_ID_FACTOR + index, row.level() + 1,
						(child.getKey() + " " + label).strip(), RowKind.AGGREGATION,
						Amounts.roundCurrency(child.getValue())));
			}
		}
		return renumber(rows);
	}

	public List<RatioRow> ratioTable(List<RatioResult> results, int decimals) {
		List<RatioRow> rows = new ArrayList<>();
		for (RatioResult result : results) {
			Double value = result.value() == null ? null : Amounts.round(result.value(), decimals);
			rows.add(new RatioRow(result.key(), result.label(), value, result.unit(), result.level(), result.notes()));
		}
		rows.sort(Comparator.comparingInt((RatioRow r) -> RatioLevels.rank(r.level())).thenComparing(RatioRow::key));
		return rows;
	}

	private List<ViewRow> renumber(List<ViewRow> rows) {
		List<ViewRow> renumbered = new ArrayList<>(rows.size());
		int order = DISPLAY_ORDER_STEP;
		for (ViewRow row : rows) {
			renumbered.add(row.withDisplayOrder(order));
			order += DISPLAY_ORDER_STEP;
		}
		return renumbered;
	}
}
