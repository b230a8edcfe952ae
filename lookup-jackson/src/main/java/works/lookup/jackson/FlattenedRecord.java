package works.lookup.jackson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;

/**
 * A document reduced to one level: each key is a dot-joined path
 * (like {@code configuration.delay}) and each value is a scalar, an array,
 * or a whole nested structure kept as one cell.
 * <p>
 * Iteration follows insertion order, which is the column order of the row.
 */
public record FlattenedRecord(Map<String, JsonNode> values) {
	public FlattenedRecord {
		values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public @Nullable JsonNode get(String key) {
		return values.get(key);
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	public Set<String> keys() {
		return values.keySet();
	}

	public int size() {
		return values.size();
	}
}
