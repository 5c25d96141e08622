package my.finsight.app.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class AggregatedStatement {
	private final List<StatementRow> rows;
	private final Map<Integer, StatementRow> rowsById;

	public AggregatedStatement(List<StatementRow> rows) {
		this.rows = List.copyOf(rows);
		Map<Integer, StatementRow> byId = new LinkedHashMap<>();
		for (StatementRow row : this.rows) {
			byId.put(row.id(), row);
		}
		this.rowsById = Collections.unmodifiableMap(byId);
	}

	public List<StatementRow> getRows() {
		return rows;
	}

	public Optional<StatementRow> findRow(int id) {
		return Optional.ofNullable(rowsById.get(id));
	}

	public double amountOf(int id) {
		StatementRow row = rowsById.get(id);
		return row == null ? 0.0d : row.amount();
	}

	public Map<Integer, Double> amountsById() {
		Map<Integer, Double> amounts = new LinkedHashMap<>();
		for (StatementRow row : rows) {
			amounts.put(row.id(), row.amount());
		}
		return amounts;
	}

	public int size() {
		return rows.size();
	}
}
