package works.lookup.mongo;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MongoDocumentStoreSettings {
	/**
	 * How many documents each round trip fetches while a collection is being listed.
	 */
	@Default int batchSize = 500;

	/**
	 * The collection holding one definition document per lookup collection,
	 * with the lookup collection's name as its {@code _id}.
	 */
	@Default String schemaCollection = "lookup_transforms";

	public void validate() {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
		}
		if (schemaCollection == null || schemaCollection.isBlank()) {
			throw new IllegalArgumentException("schemaCollection must not be blank");
		}
	}
}
