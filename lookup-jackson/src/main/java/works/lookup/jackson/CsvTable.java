package works.lookup.jackson;

import java.util.List;

/**
 * Parsed CSV text. Empty cells are empty strings, never null.
 */
public record CsvTable(List<String> header, List<List<String>> rows) {
	public CsvTable {
		header = List.copyOf(header);
		rows = rows.stream().map(List::copyOf).toList();
	}
}
