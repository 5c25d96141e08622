package my.finsight.app.accounts;

import my.finsight.app.engine.LedgerEntry;

public record RejectedEntry(LedgerEntry entry, String reason) {
}
