package works.lookup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.lookup.backup.BackupStore;
import works.lookup.exceptions.InvalidInputException;
import works.lookup.exceptions.NotFoundException;
import works.lookup.storage.FileSystemStorage;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.lookup.FakeMetadataService.Sharing.APP;
import static works.lookup.FakeMetadataService.Sharing.PRIVATE;

class LookupFileEditorTest {
	static final Session SESSION = Session.of("test-session");

	@TempDir Path etc;
	FakeMetadataService metadata;
	BackupStore backupStore;
	LookupFileEditor editor;

	@BeforeEach
	void setupEditor() {
		metadata = new FakeMetadataService()
			.withObject("users.csv", "search", "nobody", APP)
			.withObject("mine.csv", "search", "alice", PRIVATE);
		LookupEditorConfig config = LookupEditorConfig.builder()
			.etcDirectory(etc)
			.build();
		LookupResolver resolver = LookupResolver.of(config, metadata);
		FileSystemStorage storage = new FileSystemStorage();
		backupStore = BackupStore.of(resolver, storage, config);
		editor = new LookupFileEditor(resolver, backupStore, storage);
	}

	@Test
	void newLookup_isCreatedWithoutBackup() throws IOException {
		LookupReference reference = LookupReference.of("fresh.csv", "search", "nobody");

		assertEquals(Optional.empty(), editor.save(reference, "a,b\n1,2\n".getBytes(UTF_8), SESSION));

		Path expected = etc.resolve("apps/search/lookups/fresh.csv");
		assertEquals("a,b\n1,2\n", Files.readString(expected));
	}

	@Test
	void newPrivateLookup_goesUnderUser() throws IOException {
		editor.save(LookupReference.of("fresh.csv", "search", "bob"), "x".getBytes(UTF_8), SESSION);
		assertTrue(Files.exists(etc.resolve("users/bob/search/lookups/fresh.csv")));
	}

	@Test
	void knownLookupWithoutFile_isWrittenWithoutBackup() throws IOException {
		LookupReference reference = LookupReference.of("users.csv", "search", "nobody");
		assertEquals(Optional.empty(), editor.save(reference, "v1".getBytes(UTF_8), SESSION));
		assertThat(backupStore.listVersions("users.csv", "search", "nobody", SESSION), empty());
	}

	@Test
	void overwrite_backsUpPreviousContent() throws IOException {
		LookupReference reference = LookupReference.of("users.csv", "search", "nobody");
		editor.save(reference, "v1".getBytes(UTF_8), SESSION);
		String firstBackup = editor.save(reference, "v2".getBytes(UTF_8), SESSION).orElseThrow();
		String secondBackup = editor.save(reference, "v3".getBytes(UTF_8), SESSION).orElseThrow();

		assertArrayEquals("v3".getBytes(UTF_8), editor.read(reference, SESSION));
		assertArrayEquals("v1".getBytes(UTF_8), editor.read(reference.withVersion(firstBackup), SESSION));
		assertArrayEquals("v2".getBytes(UTF_8), editor.read(reference.withVersion(secondBackup), SESSION));
		assertThat(backupStore.listVersions("users.csv", "search", "nobody", SESSION), contains(firstBackup, secondBackup));
	}

	@Test
	void privateCopy_isBackedUpUnderItsOwner() throws IOException {
		LookupReference reference = LookupReference.of("mine.csv", "search", "alice");
		editor.save(reference, "v1".getBytes(UTF_8), SESSION);
		String backup = editor.save(reference, "v2".getBytes(UTF_8), SESSION).orElseThrow();

		Path backupFile = etc.resolve("users/alice/search/lookups/lookup_file_backups/search/alice/mine.csv").resolve(backup);
		assertEquals("v1", Files.readString(backupFile));
	}

	@Test
	void savingVersion_isRejected() {
		LookupReference reference = LookupReference.of("users.csv", "search", "nobody").withVersion("1700000000.000000");
		assertThrows(InvalidInputException.class, () -> editor.save(reference, new byte[0], SESSION));
	}

	@Test
	void readMissingContent_throwsNotFound() {
		assertThrows(NotFoundException.class, () -> editor.read(LookupReference.of("users.csv", "search", "nobody"), SESSION));
		assertThrows(NotFoundException.class, () -> editor.read(LookupReference.of("absent.csv", "search", "nobody"), SESSION));
	}

	@ParameterizedTest
	@ValueSource(strings = {"..", "/", "./.", "../.."})
	void nameWithNothingLeft_isNotFound(String name) throws IOException {
		assertThrows(NotFoundException.class, () -> editor.save(LookupReference.of(name, "search", "nobody"), "x".getBytes(UTF_8), SESSION));
		assertThrows(NotFoundException.class, () -> editor.read(LookupReference.of(name, "search", "nobody"), SESSION));
		assertFalse(Files.isRegularFile(etc.resolve("apps/search/lookups")));

		editor.save(LookupReference.of("fresh.csv", "search", "nobody"), "x".getBytes(UTF_8), SESSION);
		assertEquals("x", Files.readString(etc.resolve("apps/search/lookups/fresh.csv")));
	}

	@Test
	void versionWithNothingLeft_addressesLiveLookup() throws IOException {
		LookupReference reference = LookupReference.of("users.csv", "search", "nobody");
		editor.save(reference, "v1".getBytes(UTF_8), SESSION);
		editor.save(reference.withVersion(".."), "v2".getBytes(UTF_8), SESSION);

		assertArrayEquals("v2".getBytes(UTF_8), editor.read(reference.withVersion(".."), SESSION));
		assertThat(backupStore.listVersions("users.csv", "search", "nobody", SESSION).size(), is(1));
	}
}
