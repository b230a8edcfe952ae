/**
 * Resolution of lookup references to physical files, and editing of those files.
 * <p>
 * The main entry points are {@link works.lookup.LookupResolver} and
 * {@link works.lookup.LookupFileEditor}; backups live in {@link works.lookup.backup}.
 * Every externally supplied path component passes through
 * {@link works.lookup.PathSanitizer} and every owner through {@link works.lookup.OwnerScope}.
 */
package works.lookup;
