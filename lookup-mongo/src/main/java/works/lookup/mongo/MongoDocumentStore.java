package works.lookup.mongo;

import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.Session;
import works.lookup.exceptions.AuthFailureException;
import works.lookup.exceptions.ConnectionFailureException;
import works.lookup.exceptions.InvalidInputException;
import works.lookup.jackson.DocumentStoreService;
import works.lookup.jackson.FieldSchema;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.lookup.jackson.TabularDocumentBridge.KEY_FIELD;

/**
 * A {@link DocumentStoreService} over the collections of one {@link MongoDatabase}.
 * <p>
 * A document's {@code _id} is presented as its {@code _key}: an {@link ObjectId} as its hex string,
 * anything else as its string form. The rest of the document is converted through
 * relaxed Extended JSON, so numbers stay numbers, while types JSON lacks,
 * like dates, come through as their Extended JSON objects.
 * <p>
 * Each pass over {@link #list} opens a cursor that's closed once it's exhausted or fails.
 * The iterator is also {@link AutoCloseable}, so a consumer that stops partway can release it;
 * otherwise an abandoned cursor is left to the server's idle timeout.
 * A {@link Session#timeout()} becomes the query's {@code maxTimeMS}.
 */
public class MongoDocumentStore implements DocumentStoreService {
	static final String ID_FIELD = "_id";
	static final String FIELDS_LIST = "fields_list";
	static final String FIELD_TYPES = "field_types";

	private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
		.outputMode(JsonMode.RELAXED)
		.build();

	private final MongoDatabase database;
	private final MongoDocumentStoreSettings settings;
	private final ObjectMapper mapper;

	public MongoDocumentStore(MongoDatabase database, MongoDocumentStoreSettings settings, ObjectMapper mapper) {
		settings.validate();
		this.database = database;
		this.settings = settings;
		this.mapper = mapper;
	}

	public MongoDocumentStore(MongoDatabase database, MongoDocumentStoreSettings settings) {
		this(database, settings, JsonMapper.builder().build());
	}

	@Override
	public Iterable<ObjectNode> list(String collection, Session session) {
		return list(collection, new Document(), session);
	}

	Iterable<ObjectNode> list(String collection, Bson filter, Session session) {
		return () -> {
			FindIterable<Document> find = database.getCollection(collection)
				.find(filter)
				.batchSize(settings.batchSize());
			if (session.timeout() != null) {
				find = find.maxTime(session.timeout().toMillis(), MILLISECONDS);
			}
			MongoCursor<Document> cursor = translatingFailures(find::iterator);
			LOGGER.debug("Opened cursor on \"{}\"", collection);
			return new DocumentIterator(cursor);
		};
	}

	@Override
	public Optional<FieldSchema> getSchema(String collection) {
		Document definition = translatingFailures(() -> database.getCollection(settings.schemaCollection())
			.find(new Document(ID_FIELD, collection))
			.first());
		if (definition == null) {
			return Optional.empty();
		}
		String fieldsList = definition.getString(FIELDS_LIST);
		if (fieldsList == null) {
			LOGGER.warn("Definition of \"{}\" has no {}; treating it as having no schema", collection, FIELDS_LIST);
			return Optional.empty();
		}
		FieldSchema schema = FieldSchema.fromFieldsList(fieldsList);
		Document types = definition.get(FIELD_TYPES, Document.class);
		if (types != null) {
			Map<String, String> typeNames = new LinkedHashMap<>();
			types.forEach((field, type) -> typeNames.put(field, String.valueOf(type)));
			schema = schema.withTypeNames(typeNames);
		}
		return Optional.of(schema);
	}

	/**
	 * Stores documents as produced by a tabular import.
	 * A document's {@code _key}, if it has one, becomes its {@code _id};
	 * otherwise the server assigns one.
	 */
	public void insert(String collection, List<ObjectNode> documents) {
		if (documents.isEmpty()) {
			return;
		}
		List<Document> bson = new ArrayList<>(documents.size());
		for (ObjectNode document : documents) {
			bson.add(toBson(document));
		}
		translatingFailures(() -> database.getCollection(collection).insertMany(bson));
		LOGGER.debug("Inserted {} documents into \"{}\"", bson.size(), collection);
	}

	ObjectNode toJson(Document document) {
		ObjectNode result = mapper.createObjectNode();
		Document rest = new Document(document);
		Object id = rest.remove(ID_FIELD);
		if (id instanceof ObjectId) {
			result.put(KEY_FIELD, ((ObjectId) id).toHexString());
		} else if (id != null) {
			result.put(KEY_FIELD, id.toString());
		}
		rest.remove(KEY_FIELD);
		JsonNode fields = mapper.readTree(rest.toJson(JSON_SETTINGS));
		for (Map.Entry<String, JsonNode> field : fields.properties()) {
			result.set(field.getKey(), field.getValue());
		}
		return result;
	}

	Document toBson(ObjectNode document) {
		ObjectNode copy = document.deepCopy();
		JsonNode key = copy.remove(KEY_FIELD);
		Document result = new Document();
		if (key != null && !key.isNull()) {
			if (key.isObject() || key.isArray()) {
				throw new InvalidInputException("_key must be a scalar");
			}
			result.put(ID_FIELD, mapper.convertValue(key, String.class));
		}
		result.putAll(Document.parse(mapper.writeValueAsString(copy)));
		return result;
	}

	static <T> T translatingFailures(Supplier<T> action) {
		try {
			return action.get();
		} catch (MongoSecurityException e) {
			throw new AuthFailureException("Not authorized to access the document store: " + e.getMessage(), e);
		} catch (MongoTimeoutException | MongoSocketException e) {
			throw new ConnectionFailureException("Unable to reach the document store: " + e.getMessage(), e);
		} catch (MongoExecutionTimeoutException e) {
			throw new ConnectionFailureException("Document store query exceeded the session timeout: " + e.getMessage(), e);
		}
	}

	private final class DocumentIterator implements Iterator<ObjectNode>, AutoCloseable {
		private final MongoCursor<Document> cursor;
		private boolean closed = false;

		DocumentIterator(MongoCursor<Document> cursor) {
			this.cursor = cursor;
		}

		@Override
		public boolean hasNext() {
			if (closed) {
				return false;
			}
			boolean result = closingOnFailure(() -> translatingFailures(cursor::hasNext));
			if (!result) {
				close();
			}
			return result;
		}

		@Override
		public ObjectNode next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return closingOnFailure(() -> toJson(translatingFailures(cursor::next)));
		}

		@Override
		public void close() {
			if (!closed) {
				closed = true;
				cursor.close();
			}
		}

		private <T> T closingOnFailure(Supplier<T> action) {
			try {
				return action.get();
			} catch (RuntimeException e) {
				LOGGER.debug("Closing cursor after failure", e);
				try {
					close();
				} catch (RuntimeException closeFailure) {
					e.addSuppressed(closeFailure);
				}
				throw e;
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoDocumentStore.class);
}
