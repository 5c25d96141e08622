package my.finsight.app.mapping;

import java.util.Locale;

public enum RowKind {
	AGGREGATION("acc"),
	FORMULA("calc");

	private final String code;

	RowKind(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static RowKind fromCode(String raw) {
		String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
		for (RowKind kind : values()) {
			if (kind.code.equals(value)) {
				return kind;
			}
		}
		throw new MappingTemplateException("Unknown row type '" + raw + "', expected 'acc' or 'calc'");
	}
}
