package io.evitadb.docast;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.section.DocumentSections;
import io.evitadb.docast.section.DocumentSplitter;
import io.evitadb.docast.section.Section;
import io.evitadb.docast.section.Slugifier;
import io.evitadb.docast.section.SplitResult;
import io.evitadb.docast.section.SplitSpec;
import io.evitadb.docast.section.SplitStrategy;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Writes the parts of a split document into files of their own.
 *
 * Files are named {@code <base>-<NN>-<slug>.md} where {@code NN} is the 1-based part number and
 * the slug is derived from the heading text or part title. With the default section strategy the
 * content before the first heading goes to {@code <base>-00-preamble.md}. Every file carries the
 * metadata of the source document.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class SectionFileSplitter {

	static final String PREAMBLE_NAME = "preamble";
	static final String PART_NAME = "part";

	@Nonnull
	private final Log log;
	@Nonnull
	private final Writer writer;

	public SectionFileSplitter(@Nonnull Log log, @Nonnull Writer writer) {
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
	}

	/**
	 * Splits the document into one file per section in the target directory.
	 *
	 * @param document  source document
	 * @param targetDir directory receiving the files
	 * @param baseName  file name prefix, usually the source file name without extension
	 * @param dryRun    when true, files are only reported, not written
	 * @return paths of the written (or, in dry run, planned) files in section order
	 * @throws ConversionException when a section cannot be rendered
	 * @throws IOException         when a file cannot be written
	 */
	@Nonnull
	public List<Path> split(
		@Nonnull Document document,
		@Nonnull Path targetDir,
		@Nonnull String baseName,
		boolean dryRun
	) throws ConversionException, IOException {
		return split(document, targetDir, baseName, dryRun, SplitSpec.SECTIONS);
	}

	/**
	 * Splits the document into files in the target directory using the given strategy. The
	 * section strategy keeps the {@code 00} preamble numbering, other strategies number the
	 * files by part and fall back to {@value #PART_NAME} for parts without a title.
	 *
	 * @param document  source document
	 * @param targetDir directory receiving the files
	 * @param baseName  file name prefix, usually the source file name without extension
	 * @param dryRun    when true, files are only reported, not written
	 * @param spec      split strategy
	 * @return paths of the written (or, in dry run, planned) files in part order
	 * @throws ConversionException when a part cannot be rendered
	 * @throws IOException         when a file cannot be written
	 */
	@Nonnull
	public List<Path> split(
		@Nonnull Document document,
		@Nonnull Path targetDir,
		@Nonnull String baseName,
		boolean dryRun,
		@Nonnull SplitSpec spec
	) throws ConversionException, IOException {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(targetDir, "targetDir must not be null");
		Objects.requireNonNull(baseName, "baseName must not be null");
		Objects.requireNonNull(spec, "spec must not be null");

		if (spec.strategy() == SplitStrategy.SECTIONS) {
			return splitBySections(document, targetDir, baseName, dryRun);
		}

		final List<Path> files = new ArrayList<>();
		final Set<String> seenSlugs = new HashSet<>();
		final List<SplitResult> parts = spec.apply(document);
		for (final SplitResult part : parts) {
			final String slug = part.filenameSlug();
			final Path file = targetDir.resolve(
				fileName(baseName, part.index(), Slugifier.slugify(slug.isEmpty() ? PART_NAME : slug, seenSlugs))
			);
			store(part.document(), file, dryRun);
			files.add(file);
		}
		if (parts.size() == 1) {
			warnIfUnsplit(parts.get(0).metadata().getString(DocumentSplitter.REASON).orElse(null), baseName, spec);
		}
		return files;
	}

	@Nonnull
	private List<Path> splitBySections(
		@Nonnull Document document,
		@Nonnull Path targetDir,
		@Nonnull String baseName,
		boolean dryRun
	) throws ConversionException, IOException {
		final List<Path> files = new ArrayList<>();
		final List<Block> preamble = DocumentSections.getPreamble(document);
		if (!preamble.isEmpty()) {
			final Path file = targetDir.resolve(fileName(baseName, 0, PREAMBLE_NAME));
			store(new Document(preamble, document.metadata()), file, dryRun);
			files.add(file);
		}

		final Set<String> seenSlugs = new HashSet<>();
		final List<Section> sections = DocumentSections.getAllSections(document);
		for (int i = 0; i < sections.size(); i++) {
			final Section section = sections.get(i);
			final String slug = Slugifier.slugify(section.headingText(), seenSlugs);
			final Path file = targetDir.resolve(fileName(baseName, i + 1, slug));
			store(section.toDocument().withMetadata(document.metadata()), file, dryRun);
			files.add(file);
		}

		if (sections.isEmpty()) {
			this.log.warn("Document " + baseName + " contains no sections (headings)");
		}
		return files;
	}

	private void warnIfUnsplit(@Nullable String reason, @Nonnull String baseName, @Nonnull SplitSpec spec) {
		if (reason != null) {
			this.log.warn("Document " + baseName + " was not split by " + spec.strategy().name().toLowerCase(Locale.ROOT) + ": " + reason);
		}
	}

	private void store(@Nonnull Document document, @Nonnull Path file, boolean dryRun) throws ConversionException, IOException {
		if (dryRun) {
			this.log.info("Would write " + file + " (" + document.children().size() + " top-level node(s))");
		} else {
			this.writer.write(document, file);
			if (this.log.isDebugEnabled()) {
				this.log.debug("Written " + file);
			}
		}
	}

	@Nonnull
	static String fileName(@Nonnull String baseName, int number, @Nonnull String slug) {
		return String.format("%s-%02d-%s.md", baseName, number, slug);
	}
}
