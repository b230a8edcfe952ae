/**
 * Exceptions that can reach the user of the lookup APIs.
 * <p>
 * Failures from the Metadata Service and the document store propagate unchanged;
 * the only local recovery is the defaulting done by
 * {@link works.lookup.PathSanitizer} and {@link works.lookup.OwnerScope},
 * and the retry-on-collision inside {@link works.lookup.backup.BackupStore#createBackup}.
 */
package works.lookup.exceptions;
