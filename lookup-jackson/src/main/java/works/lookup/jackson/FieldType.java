package works.lookup.jackson;

import java.util.Locale;
import works.lookup.exceptions.InvalidInputException;

/**
 * Column types a collection definition can declare.
 */
public enum FieldType {
	STRING,
	NUMBER,
	BOOL,
	TIME,
	ARRAY,
	;

	/**
	 * @param name a collection's type name, like {@code number} or {@code cidr}
	 * @throws InvalidInputException if the name isn't a known type
	 */
	public static FieldType parse(String name) {
		return switch (name.strip().toLowerCase(Locale.ROOT)) {
			case "string", "cidr" -> STRING;
			case "number" -> NUMBER;
			case "bool", "boolean" -> BOOL;
			case "time" -> TIME;
			case "array" -> ARRAY;
			default -> throw new InvalidInputException("Unknown field type \"" + name + "\"");
		};
	}
}
