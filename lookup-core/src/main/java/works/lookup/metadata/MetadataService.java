package works.lookup.metadata;

import java.util.List;
import works.lookup.Session;
import works.lookup.exceptions.AuthFailureException;
import works.lookup.exceptions.ConnectionFailureException;

/**
 * The platform service that knows which application and user own each knowledge object.
 * <p>
 * Implementations report rejected credentials with {@link AuthFailureException}
 * and unreachable services or exceeded {@link Session#timeout() timeouts}
 * with {@link ConnectionFailureException}. No retries are expected at this level.
 */
public interface MetadataService {
	String LOOKUP_TABLE_FILES = "lookup-table-files";

	/**
	 * Looks up a knowledge object as it is visible from the given context.
	 *
	 * @param kind the object type, such as {@link #LOOKUP_TABLE_FILES}
	 * @return the actual owner, or {@link ObjectMetadata#missing()} if nothing by that name is visible
	 */
	ObjectMetadata resolveObject(String kind, String name, String namespace, String owner, Session session);

	/**
	 * @return the applications whose shared objects are visible from {@code namespace},
	 * in the order they should be searched. Needn't include {@code namespace} itself.
	 */
	List<String> listAppsVisibleFrom(String namespace);
}
