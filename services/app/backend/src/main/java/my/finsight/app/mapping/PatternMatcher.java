package my.finsight.app.mapping;

import java.util.ArrayList;
import java.util.List;

public final class PatternMatcher {
	public static final String WILDCARD = "*";
	public static final String SEPARATOR = ";";

	private PatternMatcher() {
	}

	public static boolean matches(String code, List<String> patterns) {
		if (code == null || patterns == null) {
			return false;
		}
		for (String pattern : patterns) {
			if (pattern == null) {
				continue;
			}
			if (pattern.endsWith(WILDCARD)) {
				if (code.startsWith(pattern.substring(0, pattern.length() - WILDCARD.length()))) {
					return true;
				}
			} else if (code.equals(pattern)) {
				return true;
			}
		}
		return false;
	}

	public static List<String> splitPatterns(String raw) {
		List<String> patterns = new ArrayList<>();
		if (raw == null || raw.isBlank()) {
			return patterns;
		}
		for (String part : raw.split(SEPARATOR)) {
			String trimmed = part.trim();
			if (!trimmed.isEmpty()) {
				patterns.add(trimmed);
			}
		}
		return patterns;
	}
}
