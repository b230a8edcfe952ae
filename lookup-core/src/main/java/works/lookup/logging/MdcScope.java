package works.lookup.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

import static works.lookup.logging.MdcKeys.LOOKUP_NAME;
import static works.lookup.logging.MdcKeys.NAMESPACE;
import static works.lookup.logging.MdcKeys.OWNER;

/**
 * Puts the requested lookup coordinates into the {@link MDC} and
 * restores whatever was there before when closed, so scopes can nest.
 */
public final class MdcScope implements AutoCloseable {
	private final Map<String, String> oldValues = new LinkedHashMap<>();

	private MdcScope(Map<String, String> newValues) {
		newValues.forEach((key, value) -> {
			oldValues.put(key, MDC.get(key));
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		});
	}

	public static MdcScope forLookup(String name, String namespace, String owner) {
		Map<String, String> values = new LinkedHashMap<>();
		values.put(LOOKUP_NAME, name);
		values.put(NAMESPACE, namespace);
		values.put(OWNER, owner);
		return new MdcScope(values);
	}

	@Override
	public void close() {
		oldValues.forEach((key, value) -> {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		});
	}
}
