package io.evitadb.docast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Traverser should visit matching files in a stable order")
public class TraverserTest {

	private static final Pattern MARKDOWN = Pattern.compile("(?i).*\\.md");

	private static Path write(Path file, String content) throws IOException {
		Files.createDirectories(file.getParent());
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static void deleteRecursively(Path root) throws IOException {
		if (root == null || !Files.exists(root)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(root)) {
			walk.sorted(Comparator.reverseOrder()).forEach(p -> {
				try {
					Files.deleteIfExists(p);
				} catch (IOException ignored) {
				}
			});
		}
	}

	@Test
	@DisplayName("visits matching files in lexicographical order with UTF-8 content")
	public void shouldVisitMatchingFilesInOrder() throws Exception {
		final Path root = Files.createTempDirectory("traverser-order-");
		try {
			final Path b = write(root.resolve("b.md"), "B");
			final Path a = write(root.resolve("a/nested.MD"), "čeština");
			write(root.resolve("c.txt"), "ignored");

			final List<Path> visited = new ArrayList<>();
			final List<String> contents = new ArrayList<>();
			final int count = new Traverser(root, MARKDOWN, null, (file, content) -> {
				visited.add(file);
				contents.add(content);
			}).traverse();

			assertEquals(2, count);
			assertEquals(List.of(a, b), visited);
			assertEquals(List.of("čeština", "B"), contents);
		} finally {
			deleteRecursively(root);
		}
	}

	@Test
	@DisplayName("skips excluded directories and files")
	public void shouldSkipExcludedDirectoriesAndFiles() throws Exception {
		final Path root = Files.createTempDirectory("traverser-exclude-");
		try {
			final Path readme = write(root.resolve("docs/readme.md"), "README");
			write(root.resolve("assets/asset.md"), "ASSET");
			write(root.resolve("docs/draft.md"), "DRAFT");

			final List<Path> visited = new ArrayList<>();
			new Traverser(
				root,
				MARKDOWN,
				List.of(Pattern.compile(".*/assets/"), Pattern.compile(".*draft\\.md")),
				(file, content) -> visited.add(file)
			).traverse();

			assertEquals(List.of(readme), visited);
		} finally {
			deleteRecursively(root);
		}
	}

	@Test
	@DisplayName("fails when the source directory is missing or is a file")
	public void shouldFailForMissingOrNonDirectorySource() throws Exception {
		final Path root = Files.createTempDirectory("traverser-missing-");
		try {
			final Path missing = root.resolve("missing");
			final IOException notFound = assertThrows(
				IOException.class,
				() -> new Traverser(missing, MARKDOWN, null, (file, content) -> { }).traverse()
			);
			assertTrue(notFound.getMessage().startsWith("Source directory does not exist"));

			final Path file = write(root.resolve("file.md"), "x");
			final IOException notDirectory = assertThrows(
				IOException.class,
				() -> new Traverser(file, MARKDOWN, null, (f, content) -> { }).traverse()
			);
			assertTrue(notDirectory.getMessage().startsWith("Source path is not a directory"));
		} finally {
			deleteRecursively(root);
		}
	}

	@Test
	@DisplayName("returns zero for an empty directory")
	public void shouldReturnZeroForEmptyDirectory() throws Exception {
		final Path root = Files.createTempDirectory("traverser-empty-");
		try {
			assertEquals(0, new Traverser(root, MARKDOWN, List.of(), (file, content) -> { }).traverse());
		} finally {
			deleteRecursively(root);
		}
	}
}
