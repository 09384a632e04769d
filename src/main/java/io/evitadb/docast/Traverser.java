package io.evitadb.docast;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Traverses a source directory recursively, finds files matching a regex pattern and invokes a
 * visitor with the full file contents.
 *
 * - Traversal order is deterministic: files are visited in lexicographical order of their paths.
 * - Entire file contents are read using UTF-8.
 * - Directories matching an exclusion pattern are not entered at all, files matching one are
 *   skipped.
 */
public final class Traverser {

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final Pattern filePattern;
	@Nonnull
	private final List<Pattern> exclusionPatterns;
	@Nonnull
	private final Visitor visitor;

	/**
	 * Create a traverser.
	 *
	 * @param sourceDir         root directory to traverse
	 * @param filePattern       regex pattern for matching file paths (Path.toString())
	 * @param exclusionPatterns regex patterns for excluding directories and files
	 * @param visitor           callback to process file contents
	 */
	public Traverser(
		@Nonnull final Path sourceDir,
		@Nonnull final Pattern filePattern,
		@Nullable final List<Pattern> exclusionPatterns,
		@Nonnull final Visitor visitor
	) {
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null");
		this.filePattern = Objects.requireNonNull(filePattern, "filePattern must not be null");
		this.exclusionPatterns = exclusionPatterns != null ? List.copyOf(exclusionPatterns) : List.of();
		this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
	}

	/**
	 * Perform recursive traversal and notify visitor for each matched file.
	 *
	 * @return number of visited files
	 * @throws IOException when the source directory is missing or cannot be read
	 */
	public int traverse() throws IOException {
		if (!Files.exists(this.sourceDir)) {
			throw new IOException("Source directory does not exist: " + this.sourceDir);
		}
		if (!Files.isDirectory(this.sourceDir)) {
			throw new IOException("Source path is not a directory: " + this.sourceDir);
		}

		final List<Path> files = new ArrayList<>();
		collectFiles(this.sourceDir, files);
		files.sort(Comparator.comparing(Path::toString));

		int visited = 0;
		for (final Path file : files) {
			final String p = file.toString();
			if (!this.filePattern.matcher(p).matches() || isExcluded(p)) {
				continue;
			}
			final String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
			this.visitor.visit(file, content);
			visited++;
		}
		return visited;
	}

	private void collectFiles(@Nonnull final Path dir, @Nonnull final List<Path> out) throws IOException {
		final List<Path> children = new ArrayList<>();
		try (var stream = Files.list(dir)) {
			stream.forEach(children::add);
		}
		children.sort(Comparator.comparing(Path::toString));
		for (final Path child : children) {
			final BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
			if (attrs.isDirectory()) {
				final String dirPath = child.toString();
				if (!isExcluded(dirPath) && !isExcluded(dirPath + "/")) {
					collectFiles(child, out);
				}
			} else if (attrs.isRegularFile()) {
				out.add(child);
			}
			// symlinks and other types are ignored
		}
	}

	private boolean isExcluded(@Nonnull final String path) {
		for (final Pattern pattern : this.exclusionPatterns) {
			if (pattern.matcher(path).matches()) {
				return true;
			}
		}
		return false;
	}
}
