package works.lookup.jackson;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.CsvListWriter;
import org.supercsv.prefs.CsvPreference;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.JsonNodeType;
import tools.jackson.databind.node.ObjectNode;
import works.lookup.Session;
import works.lookup.exceptions.InvalidInputException;

/**
 * Moves data between document collections and flat rows.
 * <p>
 * Exported columns are the collection's {@link FieldSchema} if it has one,
 * and otherwise every key seen across the flattened documents, in first-seen order.
 * Either way, {@value #KEY_FIELD} comes first and {@value #USER_FIELD} last.
 * <p>
 * Rows are produced lazily from {@link DocumentStoreService#list},
 * so each pass over {@link #rows} reads the collection again.
 * Where the store's iterator is {@link AutoCloseable}, so is the row iterator,
 * and it's closed when producing a row fails.
 */
public class TabularDocumentBridge {
	public static final String KEY_FIELD = "_key";
	public static final String USER_FIELD = "_user";
	public static final String TIME_FIELD = "_time";

	private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");
	private static final Pattern JSON_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final DocumentStoreService documentStore;
	private final FlatteningTranscoder transcoder;
	private final ObjectMapper mapper;

	public TabularDocumentBridge(DocumentStoreService documentStore, FlatteningTranscoder transcoder) {
		this.documentStore = documentStore;
		this.transcoder = transcoder;
		this.mapper = transcoder.mapper;
	}

	/**
	 * Without a schema, this reads the whole collection once.
	 */
	public List<String> columns(String collection, Session session) {
		Optional<FieldSchema> schema = documentStore.getSchema(collection);
		if (schema.isPresent()) {
			return withMetadataFields(schema.get().fields());
		}
		LinkedHashSet<String> seen = new LinkedHashSet<>();
		Iterator<ObjectNode> documents = documentStore.list(collection, session).iterator();
		try {
			while (documents.hasNext()) {
				seen.addAll(transcoder.flatten(documents.next()).keys());
			}
		} finally {
			release(documents);
		}
		List<String> result = withMetadataFields(seen);
		LOGGER.debug("Collection \"{}\" has no schema; derived {} columns", collection, result.size());
		return result;
	}

	/**
	 * With a schema, each row holds only the schema's fields, and nested values
	 * are JSON text. Without one, each row is the fully flattened document.
	 */
	public Iterable<FlattenedRecord> rows(String collection, Session session) {
		Optional<FieldSchema> schema = documentStore.getSchema(collection);
		Function<ObjectNode, FlattenedRecord> toRow;
		if (schema.isPresent()) {
			List<String> columns = withMetadataFields(schema.get().fields());
			toRow = document -> transcoder.flatten(document, columns);
		} else {
			toRow = transcoder::flatten;
		}
		return () -> new RowIterator(documentStore.list(collection, session).iterator(), toRow);
	}

	/**
	 * Writes a header line and then one line per document.
	 * Without a schema, the collection is read twice: once for the columns, then for the rows.
	 * <p>
	 * {@code writer} is flushed but not closed.
	 *
	 * @return the number of rows written
	 */
	public int writeCsv(String collection, Session session, Writer writer) throws IOException {
		List<String> columns = columns(collection, session);
		CsvListWriter csv = new CsvListWriter(writer, CsvPreference.STANDARD_PREFERENCE);
		csv.writeHeader(columns.toArray(new String[0]));
		int count = 0;
		Iterator<FlattenedRecord> rows = rows(collection, session).iterator();
		try {
			while (rows.hasNext()) {
				FlattenedRecord row = rows.next();
				List<String> cells = new ArrayList<>(columns.size());
				for (String column : columns) {
					cells.add(cellText(row.get(column)));
				}
				csv.write(cells);
				++count;
			}
		} finally {
			release(rows);
		}
		csv.flush();
		LOGGER.debug("Exported {} rows of \"{}\"", count, collection);
		return count;
	}

	/**
	 * Parses CSV text whose first line is the header.
	 * A leading byte order mark is ignored.
	 */
	public CsvTable readCsv(Reader reader) throws IOException {
		PushbackReader input = new PushbackReader(reader);
		int first = input.read();
		if (first != -1 && first != BYTE_ORDER_MARK) {
			input.unread(first);
		}
		CsvListReader csv = new CsvListReader(input, CsvPreference.STANDARD_PREFERENCE);
		try {
			String[] header = csv.getHeader(true);
			if (header == null) {
				return new CsvTable(List.of(), List.of());
			}
			List<List<String>> rows = new ArrayList<>();
			List<String> line;
			while ((line = csv.read()) != null) {
				List<String> row = new ArrayList<>(line.size());
				for (String cell : line) {
					row.add(cell == null ? "" : cell);
				}
				rows.add(row);
			}
			List<String> columns = new ArrayList<>(header.length);
			for (String column : header) {
				columns.add(column == null ? "" : column);
			}
			return new CsvTable(columns, rows);
		} catch (SuperCsvException e) {
			throw new InvalidInputException("Malformed CSV: " + e.getMessage(), e);
		}
	}

	/**
	 * Converts tabular rows to documents, applying each column's type from {@code schema}.
	 * A column named {@value #TIME_FIELD} is always a time.
	 * Dotted column names become nested objects.
	 * A blank {@value #KEY_FIELD} is left out so the store can assign one.
	 *
	 * @throws InvalidInputException if a cell doesn't parse as its column's type
	 */
	public List<ObjectNode> toDocuments(List<String> header, Iterable<List<String>> rows, @Nullable FieldSchema schema) {
		List<ObjectNode> result = new ArrayList<>();
		int rowNumber = 0;
		for (List<String> row : rows) {
			++rowNumber;
			Map<String, JsonNode> cells = new LinkedHashMap<>();
			for (int i = 0; i < header.size(); i++) {
				String column = header.get(i);
				String text = (i < row.size() && row.get(i) != null) ? row.get(i) : "";
				if (KEY_FIELD.equals(column) && text.isBlank()) {
					continue;
				}
				try {
					cells.put(column, cellValue(text, typeOf(column, schema)));
				} catch (InvalidInputException e) {
					throw new InvalidInputException("Row " + rowNumber + ", column \"" + column + "\": " + e.getMessage(), e);
				}
			}
			result.add(transcoder.unflatten(new FlattenedRecord(cells)));
		}
		return result;
	}

	public List<ObjectNode> toDocuments(CsvTable table, @Nullable FieldSchema schema) {
		return toDocuments(table.header(), table.rows(), schema);
	}

	static List<String> withMetadataFields(Collection<String> fields) {
		List<String> result = new ArrayList<>(fields.size() + 2);
		result.add(KEY_FIELD);
		for (String field : fields) {
			if (!KEY_FIELD.equals(field) && !USER_FIELD.equals(field)) {
				result.add(field);
			}
		}
		result.add(USER_FIELD);
		return result;
	}

	private static FieldType typeOf(String column, @Nullable FieldSchema schema) {
		if (TIME_FIELD.equals(column)) {
			return FieldType.TIME;
		} else if (schema == null) {
			return FieldType.STRING;
		} else {
			return schema.typeOf(column);
		}
	}

	private String cellText(@Nullable JsonNode value) {
		if (value == null || value.isNull() || value.isMissingNode()) {
			return "";
		} else if (value.getNodeType() == JsonNodeType.STRING) {
			return mapper.convertValue(value, String.class);
		} else {
			return mapper.writeValueAsString(value);
		}
	}

	private JsonNode cellValue(String text, FieldType type) {
		return switch (type) {
			case STRING -> node(text);
			case NUMBER -> text.isBlank() ? node("") : parseNumber(text.strip());
			case BOOL -> text.isBlank() ? node("") : parseBoolean(text.strip());
			case TIME -> timeValue(text.strip());
			case ARRAY -> text.isBlank() ? node("") : parseArray(text);
		};
	}

	private JsonNode parseNumber(String text) {
		if (!JSON_NUMBER.matcher(text).matches()) {
			throw new InvalidInputException("\"" + text + "\" is not a number");
		}
		return readNumber(text);
	}

	private JsonNode readNumber(String text) {
		try {
			return mapper.readTree(text);
		} catch (JacksonException e) {
			// Leading zeros are valid here but not in JSON
			return node(new BigDecimal(text));
		}
	}

	private JsonNode node(Object value) {
		return mapper.valueToTree(value);
	}

	private JsonNode parseBoolean(String text) {
		return switch (text.toLowerCase(Locale.ROOT)) {
			case "true" -> node(Boolean.TRUE);
			case "false" -> node(Boolean.FALSE);
			default -> throw new InvalidInputException("\"" + text + "\" is not a boolean");
		};
	}

	/**
	 * Numbers pass through, ISO-8601 date-times become epoch seconds,
	 * and anything else is kept as text.
	 */
	private JsonNode timeValue(String text) {
		if (NUMERIC.matcher(text).matches()) {
			return readNumber(text);
		}
		Instant instant;
		try {
			instant = OffsetDateTime.parse(text).toInstant();
		} catch (DateTimeParseException e) {
			LOGGER.trace("Time value \"{}\" isn't an ISO-8601 date-time; keeping it as text", text);
			return node(text);
		}
		long millis = instant.toEpochMilli();
		if (millis % 1000 == 0) {
			return node(millis / 1000);
		} else {
			return node(millis / 1000.0);
		}
	}

	private JsonNode parseArray(String text) {
		JsonNode parsed;
		try {
			parsed = mapper.readTree(text);
		} catch (JacksonException e) {
			throw new InvalidInputException("The value for the array is not valid JSON", e);
		}
		if (!parsed.isArray()) {
			throw new InvalidInputException("The value for the array is not an array");
		}
		return parsed;
	}

	/**
	 * Closes {@code iterator} if the document store handed out something closeable.
	 */
	static void release(Iterator<?> iterator) {
		if (iterator instanceof AutoCloseable) {
			try {
				((AutoCloseable) iterator).close();
			} catch (RuntimeException e) {
				throw e;
			} catch (Exception e) {
				throw new IllegalStateException("Unable to close document iterator", e);
			}
		}
	}

	private static final class RowIterator implements Iterator<FlattenedRecord>, AutoCloseable {
		private final Iterator<ObjectNode> documents;
		private final Function<ObjectNode, FlattenedRecord> toRow;

		RowIterator(Iterator<ObjectNode> documents, Function<ObjectNode, FlattenedRecord> toRow) {
			this.documents = documents;
			this.toRow = toRow;
		}

		@Override
		public boolean hasNext() {
			return documents.hasNext();
		}

		@Override
		public FlattenedRecord next() {
			ObjectNode document = documents.next();
			try {
				return toRow.apply(document);
			} catch (RuntimeException e) {
				try {
					close();
				} catch (RuntimeException closeFailure) {
					e.addSuppressed(closeFailure);
				}
				throw e;
			}
		}

		@Override
		public void close() {
			release(documents);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TabularDocumentBridge.class);
}
