package works.lookup.jackson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import works.lookup.exceptions.InvalidInputException;

/**
 * The ordered fields of a document collection, and the declared type of any of them.
 * Fields with no declared type are {@link FieldType#STRING}.
 */
public record FieldSchema(List<String> fields, Map<String, FieldType> types) {
	public FieldSchema {
		LinkedHashSet<String> seen = new LinkedHashSet<>();
		for (String field : fields) {
			validateName(field);
			if (!seen.add(field)) {
				throw new InvalidInputException("Duplicate field \"" + field + "\"");
			}
		}
		for (String typed : types.keySet()) {
			validateName(typed);
		}
		fields = List.copyOf(fields);
		types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
	}

	public static FieldSchema of(String... fields) {
		return new FieldSchema(List.of(fields), Map.of());
	}

	/**
	 * Parses a transform's comma-separated field list, such as {@code "_key, name, configuration, _user"}.
	 */
	public static FieldSchema fromFieldsList(String fieldsList) {
		List<String> fields = new ArrayList<>();
		for (String field : fieldsList.split(",", -1)) {
			fields.add(field.strip());
		}
		return new FieldSchema(fields, Map.of());
	}

	/**
	 * @param typeNames field name to type name, as stored in a collection definition
	 */
	public FieldSchema withTypeNames(Map<String, String> typeNames) {
		Map<String, FieldType> newTypes = new LinkedHashMap<>(types);
		typeNames.forEach((field, typeName) -> newTypes.put(field, FieldType.parse(typeName)));
		return new FieldSchema(fields, newTypes);
	}

	public FieldType typeOf(String field) {
		return types.getOrDefault(field, FieldType.STRING);
	}

	private static void validateName(String field) {
		if (field.isEmpty()) {
			throw new InvalidInputException("Field names must not be empty");
		}
		if (field.indexOf('.') >= 0) {
			throw new InvalidInputException("Field name \"" + field + "\" must not contain '.'");
		}
	}
}
