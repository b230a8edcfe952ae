package works.lookup.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.Session;
import works.lookup.jackson.DocumentStoreService;
import works.lookup.jackson.FieldSchema;

import static works.lookup.jackson.TabularDocumentBridge.KEY_FIELD;

/**
 * A {@link DocumentStoreService} that holds its collections in memory.
 * Documents are copied on the way in and on the way out.
 */
public class InMemoryDocumentStore implements DocumentStoreService {
	private final Map<String, List<ObjectNode>> collections = new ConcurrentHashMap<>();
	private final Map<String, FieldSchema> schemas = new ConcurrentHashMap<>();
	private final AtomicLong nextKey = new AtomicLong(1);

	/**
	 * Adds a document, assigning a {@code _key} if it has none.
	 */
	public void insert(String collection, ObjectNode document) {
		ObjectNode copy = document.deepCopy();
		JsonNode key = copy.get(KEY_FIELD);
		if (key == null || key.isNull()) {
			copy.put(KEY_FIELD, Long.toString(nextKey.getAndIncrement()));
		}
		collections.computeIfAbsent(collection, c -> new CopyOnWriteArrayList<>()).add(copy);
	}

	public void defineSchema(String collection, FieldSchema schema) {
		schemas.put(collection, schema);
	}

	@Override
	public Iterable<ObjectNode> list(String collection, Session session) {
		return () -> {
			List<ObjectNode> snapshot = new ArrayList<>();
			for (ObjectNode document : collections.getOrDefault(collection, List.of())) {
				snapshot.add(document.deepCopy());
			}
			return snapshot.iterator();
		};
	}

	@Override
	public Optional<FieldSchema> getSchema(String collection) {
		return Optional.ofNullable(schemas.get(collection));
	}
}
