package works.lookup.testing;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.Session;
import works.lookup.jackson.DocumentStoreService;
import works.lookup.jackson.FieldSchema;
import works.lookup.jackson.FieldType;
import works.lookup.jackson.FlattenedRecord;
import works.lookup.jackson.FlatteningTranscoder;
import works.lookup.jackson.TabularDocumentBridge;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.lookup.jackson.TabularDocumentBridge.KEY_FIELD;

/**
 * Checks the contract of {@link DocumentStoreService} against any implementation.
 * <p>
 * Use this by extending it and implementing {@link #documentStore},
 * {@link #insert} and {@link #defineSchema}. Each test works in a collection
 * of its own, named by {@link #collection}, so implementations backed by
 * a shared server needn't clean up between tests.
 */
public abstract class DocumentStoreConformanceTest {
	protected static final Session SESSION = Session.of("conformance-session");
	private static final AtomicInteger COLLECTION_COUNTER = new AtomicInteger();

	protected final ObjectMapper mapper = JsonMapper.builder().build();
	protected String collection;

	protected abstract DocumentStoreService documentStore();

	/**
	 * Stores {@code document} as-is if it has a {@code _key}, or with a fresh key otherwise.
	 */
	protected abstract void insert(String collection, ObjectNode document);

	protected abstract void defineSchema(String collection, FieldSchema schema);

	@BeforeEach
	void chooseCollection(TestInfo testInfo) {
		collection = "conformance_" + COLLECTION_COUNTER.incrementAndGet() + "_"
			+ testInfo.getTestMethod().map(m -> m.getName()).orElse("test");
	}

	@Test
	void missingCollection_isEmpty() {
		assertFalse(documentStore().list(collection, SESSION).iterator().hasNext());
	}

	@Test
	void missingSchema_isEmpty() {
		assertEquals(Optional.empty(), documentStore().getSchema(collection));
	}

	@Test
	void documents_keepTheirContent() {
		ObjectNode original = document("""
			{ "_key": "abc", "name": "Test", "configuration": { "views": [ { "name": "some_view", "app": "some_app" } ],
			  "delay": 300, "hide_chrome": true }, "_user": "nobody" }
			""");
		insert(collection, original);

		List<ObjectNode> listed = list();
		assertEquals(1, listed.size());
		ObjectNode document = listed.get(0);
		assertEquals("abc", text(document.get(KEY_FIELD)));
		assertEquals("Test", text(document.get("name")));
		assertEquals(300, document.get("configuration").get("delay").asInt());
		assertTrue(document.get("configuration").get("hide_chrome").asBoolean());
		assertEquals("some_app", text(document.get("configuration").get("views").get(0).get("app")));
		assertEquals("nobody", text(document.get("_user")));
	}

	@Test
	void documentsWithoutKey_areGivenDistinctKeys() {
		insert(collection, document("{\"name\": \"a\"}"));
		insert(collection, document("{\"name\": \"b\"}"));

		Set<String> keys = new HashSet<>();
		for (ObjectNode document : list()) {
			JsonNode key = document.get(KEY_FIELD);
			assertTrue(key != null && !text(key).isEmpty(), "Every document has a key");
			keys.add(text(key));
		}
		assertEquals(2, keys.size());
	}

	@Test
	void list_isRestartable() {
		int n = 25;
		for (int i = 0; i < n; i++) {
			insert(collection, document("{\"_key\": \"k" + i + "\", \"n\": " + i + "}"));
		}

		Iterable<ObjectNode> documents = documentStore().list(collection, SESSION);
		assertEquals(n, count(documents));
		assertEquals(n, count(documents));
	}

	@Test
	void list_seesLaterInserts() {
		Iterable<ObjectNode> documents = documentStore().list(collection, SESSION);
		insert(collection, document("{\"_key\": \"late\"}"));
		assertEquals(1, count(documents));
	}

	@Test
	void listedDocuments_areIndependentCopies() {
		insert(collection, document("{\"_key\": \"k\", \"name\": \"before\"}"));
		list().get(0).put("name", "after");
		assertEquals("before", text(list().get(0).get("name")));
	}

	@Test
	void schema_keepsFieldOrderAndTypes() {
		FieldSchema schema = FieldSchema.fromFieldsList("_key, name, count, configuration, _user")
			.withTypeNames(Map.of("count", "number"));
		defineSchema(collection, schema);

		FieldSchema found = documentStore().getSchema(collection).orElseThrow();
		assertThat(found.fields(), contains("_key", "name", "count", "configuration", "_user"));
		assertEquals(FieldType.NUMBER, found.typeOf("count"));
		assertEquals(FieldType.STRING, found.typeOf("name"));
	}

	@Test
	void bridge_exportsWithMetadataColumns() throws IOException {
		insert(collection, document("{\"_key\": \"1\", \"name\": \"Ann\", \"address\": {\"city\": \"Oslo\"}}"));
		TabularDocumentBridge bridge = new TabularDocumentBridge(documentStore(), new FlatteningTranscoder(mapper));

		List<FlattenedRecord> rows = new ArrayList<>();
		bridge.rows(collection, SESSION).forEach(rows::add);
		assertEquals(1, rows.size());
		assertEquals("Oslo", text(rows.get(0).get("address.city")));

		StringWriter out = new StringWriter();
		assertEquals(1, bridge.writeCsv(collection, SESSION, out));
		assertThat(out.toString(), startsWith("_key,name,address.city,_user\r\n1,Ann,Oslo,\r\n"));
	}

	protected ObjectNode document(String json) {
		return (ObjectNode) mapper.readTree(json);
	}

	protected String text(JsonNode node) {
		return mapper.convertValue(node, String.class);
	}

	private List<ObjectNode> list() {
		List<ObjectNode> result = new ArrayList<>();
		documentStore().list(collection, SESSION).forEach(result::add);
		return result;
	}

	private static int count(Iterable<?> iterable) {
		int result = 0;
		for (Object ignored : iterable) {
			++result;
		}
		return result;
	}
}
