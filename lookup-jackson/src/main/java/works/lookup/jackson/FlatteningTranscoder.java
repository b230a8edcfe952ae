package works.lookup.jackson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.exceptions.InvalidInputException;

/**
 * Converts nested JSON documents to {@link FlattenedRecord}s and back.
 * <p>
 * Nested objects are flattened into dot-joined keys, so
 * <pre>{"configuration": {"delay": 300}}</pre>
 * becomes a record with key {@code configuration.delay}.
 * Arrays are never exploded; they stay whole under their own key.
 * An empty object has no leaves, so it stays whole too.
 * <p>
 * Because {@code .} is the path separator, a document key that contains one
 * can't be flattened unambiguously and is rejected with {@link InvalidInputException}.
 * <p>
 * Records hold copies of the document's values, so changing one leaves the other alone.
 */
public class FlatteningTranscoder {
	private static final String SEPARATOR = ".";

	final ObjectMapper mapper;

	public FlatteningTranscoder(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public static FlatteningTranscoder create() {
		return new FlatteningTranscoder(JsonMapper.builder().build());
	}

	/**
	 * Flattens every nested object of {@code document} into dot-joined keys.
	 */
	public FlattenedRecord flatten(ObjectNode document) {
		Map<String, JsonNode> result = new LinkedHashMap<>();
		flatten(null, document, path -> true, result);
		return new FlattenedRecord(result);
	}

	/**
	 * Emits only the given top-level {@code fields}, in the given order.
	 * A field whose value is an object is emitted as that object's JSON text,
	 * so each field stays a single cell. Fields missing from the document are skipped.
	 */
	public FlattenedRecord flatten(ObjectNode document, List<String> fields) {
		ObjectNode selected = mapper.createObjectNode();
		for (String field : fields) {
			JsonNode value = document.get(field);
			if (value != null) {
				selected.set(field, value);
			}
		}
		Map<String, JsonNode> result = new LinkedHashMap<>();
		flatten(null, selected, path -> false, result);
		return new FlattenedRecord(result);
	}

	/**
	 * Rebuilds the nested document by splitting each key on {@code .}.
	 *
	 * @throws InvalidInputException if two keys disagree about whether
	 * a path is an object or a value, like {@code a} and {@code a.b}
	 */
	public ObjectNode unflatten(FlattenedRecord record) {
		ObjectNode root = mapper.createObjectNode();
		record.values().forEach((key, value) -> {
			String[] segments = key.split("\\.", -1);
			ObjectNode parent = root;
			for (int i = 0; i < segments.length - 1; i++) {
				JsonNode child = parent.get(segments[i]);
				if (child == null) {
					parent = parent.putObject(segments[i]);
				} else if (child.isObject()) {
					parent = (ObjectNode) child;
				} else {
					throw new InvalidInputException("Key \"" + key + "\" conflicts with the value at \"" + segments[i] + "\"");
				}
			}
			String last = segments[segments.length - 1];
			if (parent.has(last)) {
				throw new InvalidInputException("Key \"" + key + "\" conflicts with another key");
			}
			parent.set(last, value.deepCopy());
		});
		return root;
	}

	/**
	 * @param descend whether to flatten the object at a given path into its own keys;
	 *                an object that isn't descended into is emitted as JSON text
	 */
	private void flatten(@Nullable String prefix, ObjectNode node, Predicate<String> descend, Map<String, JsonNode> result) {
		for (Map.Entry<String, JsonNode> property : node.properties()) {
			String key = property.getKey();
			if (key.contains(SEPARATOR)) {
				throw new InvalidInputException("Document key \"" + key + "\" contains '" + SEPARATOR + "'");
			}
			String path = (prefix == null) ? key : prefix + SEPARATOR + key;
			JsonNode value = property.getValue();
			if (!value.isObject()) {
				result.put(path, value.deepCopy());
			} else if (!descend.test(path)) {
				result.put(path, mapper.valueToTree(mapper.writeValueAsString(value)));
			} else if (value.isEmpty()) {
				result.put(path, value.deepCopy());
			} else {
				flatten(path, (ObjectNode) value, descend, result);
			}
		}
	}
}
