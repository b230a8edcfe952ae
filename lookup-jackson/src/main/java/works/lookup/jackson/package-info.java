/**
 * Conversion between nested JSON documents and flat tabular rows.
 * <p>
 * {@link works.lookup.jackson.FlatteningTranscoder} does the per-document work;
 * {@link works.lookup.jackson.TabularDocumentBridge} applies it to whole collections
 * read through a {@link works.lookup.jackson.DocumentStoreService}, and to CSV text.
 */
package works.lookup.jackson;
