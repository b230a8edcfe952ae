/**
 * Point-in-time backups of lookup files.
 * <p>
 * Start with {@link works.lookup.backup.BackupStore}. Version identifiers are opaque
 * strings ordered by {@link works.lookup.backup.VersionOrder} and minted by a
 * {@link works.lookup.backup.VersionGenerator}.
 */
package works.lookup.backup;
