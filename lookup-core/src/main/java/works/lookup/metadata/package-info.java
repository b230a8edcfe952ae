/**
 * Access to the platform's knowledge-object metadata, and the ownership
 * resolution that is built on it.
 * <p>
 * {@link works.lookup.metadata.MetadataService} is implemented outside this library
 * by whatever talks to the platform. {@link works.lookup.metadata.OwnerResolver} is the
 * seam the rest of the library uses; {@link works.lookup.metadata.MetadataOwnerResolver}
 * is its standard implementation.
 */
package works.lookup.metadata;
