package works.lookup.metadata;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lookup.PathSanitizer;
import works.lookup.Session;
import works.lookup.exceptions.NotFoundException;

import static works.lookup.metadata.MetadataService.LOOKUP_TABLE_FILES;

/**
 * Resolves ownership by walking the visibility graph the {@link MetadataService} exposes.
 * <p>
 * The requesting application is asked first. If the object isn't visible there,
 * the applications visible from it are asked breadth-first, in the order the service
 * lists them, each at most once. The first application that reports the object wins.
 */
public class MetadataOwnerResolver implements OwnerResolver {
	private final MetadataService metadataService;
	private final String kind;

	public MetadataOwnerResolver(MetadataService metadataService) {
		this(metadataService, LOOKUP_TABLE_FILES);
	}

	public MetadataOwnerResolver(MetadataService metadataService, String kind) {
		this.metadataService = metadataService;
		this.kind = kind;
	}

	@Override
	public ObjectOwner resolveOwner(String name, String contextApp, String contextUser, Session session) {
		Set<String> visited = new LinkedHashSet<>();
		Deque<String> pending = new ArrayDeque<>();
		pending.add(contextApp);
		while (!pending.isEmpty()) {
			String app = pending.removeFirst();
			if (!visited.add(app)) {
				continue;
			}
			ObjectMetadata metadata = metadataService.resolveObject(kind, name, app, contextUser, session);
			if (metadata.exists()) {
				ObjectOwner result = new ObjectOwner(PathSanitizer.sanitize(metadata.owningNamespace()), metadata.owningOwner());
				LOGGER.debug("Lookup \"{}\" requested from {} is owned by {}", name, contextApp, result);
				return result;
			}
			for (String visible : metadataService.listAppsVisibleFrom(app)) {
				if (!visited.contains(visible)) {
					pending.addLast(visible);
				}
			}
		}
		LOGGER.debug("Lookup \"{}\" not visible from {} after searching {}", name, contextApp, visited);
		throw new NotFoundException("No " + kind + " named \"" + name + "\" is visible from " + contextApp);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MetadataOwnerResolver.class);
}
