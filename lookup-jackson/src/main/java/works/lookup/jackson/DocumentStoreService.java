package works.lookup.jackson;

import java.util.Optional;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.Session;
import works.lookup.exceptions.AuthFailureException;
import works.lookup.exceptions.ConnectionFailureException;

/**
 * Read access to document collections.
 * <p>
 * Implementations translate their transport failures into
 * {@link AuthFailureException} and {@link ConnectionFailureException}.
 */
public interface DocumentStoreService {
	/**
	 * @return the documents of {@code collection}; each call to {@link Iterable#iterator()}
	 * starts a fresh pass, fetching lazily where the store pages its results.
	 * A collection that doesn't exist is empty.
	 */
	Iterable<ObjectNode> list(String collection, Session session);

	/**
	 * @return the field order declared for {@code collection}, if it has one
	 */
	Optional<FieldSchema> getSchema(String collection);
}
