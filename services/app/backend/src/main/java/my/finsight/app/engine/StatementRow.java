package my.finsight.app.engine;

import my.finsight.app.mapping.RowKind;

public record StatementRow(int level, int displayOrder, int id, String name, RowKind kind, double amount) {
}
