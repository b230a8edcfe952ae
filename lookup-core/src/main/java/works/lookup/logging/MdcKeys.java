package works.lookup.logging;

/**
 * Keys for the SLF4J {@link org.slf4j.MDC} entries set while a lookup operation is in progress.
 */
public final class MdcKeys {
	public static final String LOOKUP_NAME = "lookup.name";
	public static final String NAMESPACE = "lookup.namespace";
	public static final String OWNER = "lookup.owner";

	private MdcKeys() { }
}
