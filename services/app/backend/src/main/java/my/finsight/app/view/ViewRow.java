package my.finsight.app.view;

import my.finsight.app.mapping.RowKind;

public record ViewRow(int displayOrder, int id, int level, String name, RowKind kind, double amount) {
	ViewRow withDisplayOrder(int order) {
		return new ViewRow(order, id, level, name, kind, amount);
	}
}
