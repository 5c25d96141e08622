package my.finsight.app.dto;

import my.finsight.app.mapping.RowDefinition;

import java.util.List;

public record MappingRowDto(int displayOrder, int id, String name, String type, int level,
							List<String> accountsToInclude, List<String> accountsToExclude, String formula,
							String canonicalMeasure, String notes) {
	public static MappingRowDto from(RowDefinition row) {
		return new MappingRowDto(row.displayOrder(), row.id(), row.name(), row.kind().getCode(), row.level(),
				row.includePatterns(), row.excludePatterns(), row.formula(), row.canonicalMeasure(), row.notes());
	}
}
