package my.finsight.app.view;

import java.util.Locale;

public enum StatementView {
	SIMPLIFIED(1),
	REGULAR(2),
	DETAILED(Integer.MAX_VALUE),
	COMPLETE(Integer.MAX_VALUE);

	private final int maxLevel;

	StatementView(int maxLevel) {
		this.maxLevel = maxLevel;
	}

	public int getMaxLevel() {
		return maxLevel;
	}

	public static StatementView fromName(String raw) {
		if (raw == null || raw.isBlank()) {
			return DETAILED;
		}
		try {
			return valueOf(raw.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unsupported view: " + raw, ex);
		}
	}
}
