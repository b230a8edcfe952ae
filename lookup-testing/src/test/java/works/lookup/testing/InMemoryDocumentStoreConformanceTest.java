package works.lookup.testing;

import org.junit.jupiter.api.BeforeEach;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.jackson.DocumentStoreService;
import works.lookup.jackson.FieldSchema;

class InMemoryDocumentStoreConformanceTest extends DocumentStoreConformanceTest {
	InMemoryDocumentStore store;

	@BeforeEach
	void setupStore() {
		store = new InMemoryDocumentStore();
	}

	@Override
	protected DocumentStoreService documentStore() {
		return store;
	}

	@Override
	protected void insert(String collection, ObjectNode document) {
		store.insert(collection, document);
	}

	@Override
	protected void defineSchema(String collection, FieldSchema schema) {
		store.defineSchema(collection, schema);
	}
}
