package works.lookup.metadata;

import works.lookup.Session;
import works.lookup.exceptions.NotFoundException;

/**
 * Determines who really owns a lookup that was requested from a given context.
 * <p>
 * An object stored in one application can be visible from another,
 * so the answer can name an application and user other than the ones asked about.
 */
public interface OwnerResolver {
	/**
	 * @param contextApp the sanitized, defaulted namespace of the request
	 * @param contextUser the normalized owner of the request
	 * @throws NotFoundException if no visible object has that name
	 */
	ObjectOwner resolveOwner(String name, String contextApp, String contextUser, Session session);
}
