package works.lookup.metadata;

/**
 * What the {@link MetadataService} knows about a knowledge object's ownership.
 */
public record ObjectMetadata(
	String owningNamespace,
	String owningOwner,
	boolean exists
) {
	private static final ObjectMetadata MISSING = new ObjectMetadata("", "", false);

	public static ObjectMetadata missing() {
		return MISSING;
	}

	public static ObjectMetadata ownedBy(String owningNamespace, String owningOwner) {
		return new ObjectMetadata(owningNamespace, owningOwner, true);
	}
}
