package works.lookup.metadata;

import works.lookup.OwnerScope;

/**
 * The application and user that actually own a knowledge object.
 *
 * @param owner a user name, or {@value OwnerScope#NOBODY} for the global scope
 */
public record ObjectOwner(String namespace, String owner) {
	public ObjectOwner {
		owner = OwnerScope.normalize(owner);
	}
}
