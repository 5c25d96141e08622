package my.finsight.app.accounts;

import my.finsight.app.engine.LedgerEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class AccountFilter {
	public static final String UNKNOWN_ACCOUNT = "Unknown account code %s, ignored";

	/**
	 * Keeps entries whose code, or one of its prefixes, is a known account. Nothing is
	 * printed; rejects are handed back to the caller.
	 */
	public AccountFilterResult filterUnknownAccounts(Collection<LedgerEntry> entries, Set<String> knownCodes) {
		List<LedgerEntry> kept = new ArrayList<>();
		List<RejectedEntry> rejected = new ArrayList<>();
		for (LedgerEntry entry : entries) {
			if (resolveToKnownAccount(entry.code(), knownCodes).isPresent()) {
				kept.add(entry);
			} else {
				rejected.add(new RejectedEntry(entry, String.format(UNKNOWN_ACCOUNT, entry.code())));
			}
		}
		return new AccountFilterResult(kept, rejected);
	}

	// Longest known prefix: 606300 resolves to 6063 before 606 or 60.
	public Optional<String> resolveToKnownAccount(String code, Set<String> knownCodes) {
		String trimmed = code == null ? "" : code.trim();
		for (int length = trimmed.length(); length > 0; length--) {
			String prefix = trimmed.substring(0, length);
			if (knownCodes.contains(prefix)) {
				return Optional.of(prefix);
			}
		}
		return Optional.empty();
	}
}
