package my.finsight.app.accounts;

import my.finsight.app.engine.LedgerEntry;

import java.util.List;

public record AccountFilterResult(List<LedgerEntry> kept, List<RejectedEntry> rejected) {
	public AccountFilterResult {
		kept = List.copyOf(kept);
		rejected = List.copyOf(rejected);
	}

	public boolean hasRejections() {
		return !rejected.isEmpty();
	}
}
