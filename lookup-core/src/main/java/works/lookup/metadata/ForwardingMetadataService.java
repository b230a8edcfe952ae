package works.lookup.metadata;

import java.util.List;
import works.lookup.Session;

/**
 * Implements all {@link MetadataService} methods by simply calling the corresponding
 * methods on another service. Useful for overriding one or two methods while leaving
 * the rest unchanged.
 */
public class ForwardingMetadataService implements MetadataService {
	protected final MetadataService downstream;

	public ForwardingMetadataService(MetadataService downstream) {
		this.downstream = downstream;
	}

	@Override
	public ObjectMetadata resolveObject(String kind, String name, String namespace, String owner, Session session) {
		return downstream.resolveObject(kind, name, namespace, owner, session);
	}

	@Override
	public List<String> listAppsVisibleFrom(String namespace) {
		return downstream.listAppsVisibleFrom(namespace);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" +
			"downstream=" + downstream +
			'}';
	}
}
