package my.finsight.app.ratios;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class RatioLevels {
	public static final String BASIC = "basic";
	public static final String ADVANCED = "advanced";
	public static final String FULL = "full";

	public static final List<String> ORDER = List.of(BASIC, ADVANCED, FULL);

	private RatioLevels() {
	}

	public static boolean isKnown(String level) {
		return ORDER.contains(level);
	}

	/**
	 * Known tiers are cumulative (advanced brings basic along); any other name selects only
	 * the section with exactly that name.
	 */
	public static List<String> levelsToInclude(String requested, Collection<String> available) {
		List<String> levels = new ArrayList<>();
		if (requested == null) {
			return levels;
		}
		int max = ORDER.indexOf(requested);
		if (max < 0) {
			if (available.contains(requested)) {
				levels.add(requested);
			}
			return levels;
		}
		for (String level : ORDER.subList(0, max + 1)) {
			if (available.contains(level)) {
				levels.add(level);
			}
		}
		return levels;
	}

	public static int rank(String level) {
		int index = ORDER.indexOf(level);
		return index < 0 ? 99 : index;
	}
}
