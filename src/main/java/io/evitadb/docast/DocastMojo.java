package io.evitadb.docast;

import io.evitadb.docast.markdown.CommonMarkParser;
import io.evitadb.docast.markdown.MarkdownRenderer;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.DocumentParser;
import io.evitadb.docast.section.SplitSpec;
import io.evitadb.docast.section.TableOfContents;
import io.evitadb.docast.section.TocPosition;
import io.evitadb.docast.section.TocStyle;
import io.evitadb.docast.security.RegexSafety;
import io.evitadb.docast.security.UnsafePatternException;
import io.evitadb.docast.transform.HeadingLevelTransformer;
import io.evitadb.docast.transform.TransformPipeline;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Main Mojo for the docast plugin providing actions:
 * - show-config: prints current configuration
 * - toc: inserts a table of contents into every matched markdown file
 * - split: writes the parts of every matched file (sections by default) into files of their own
 * - shift-headings: shifts heading levels of every matched file by a fixed offset
 *
 * Rewritten files go to the target directory under their path relative to the source directory.
 * When no target directory is configured, toc and shift-headings rewrite the sources in place.
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class DocastMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "toc", "split" or "shift-headings". */
	@Parameter(property = "docast.action", defaultValue = "show-config")
	private String action;

	/** Source directory path - relative to the project root (no default). */
	@Parameter(property = "docast.sourceDir")
	private String sourceDir;

	/** Target directory path; required by split, optional otherwise. */
	@Parameter(property = "docast.targetDir")
	private String targetDir;

	/** Regex to match all files to process - default (?i).*\.md (ignore case). */
	@Parameter(property = "docast.fileRegex", defaultValue = "(?i).*\\.md")
	private String fileRegex = "(?i).*\\.md";

	/** Regex patterns of paths (directories or files) to skip. */
	@Parameter(property = "docast.exclusions")
	private List<String> exclusions;

	/** Least significant heading level listed in a table of contents. */
	@Parameter(property = "docast.tocMaxLevel", defaultValue = "3")
	private int tocMaxLevel = 3;

	/** Table of contents style: "markdown", "list" or "nested". */
	@Parameter(property = "docast.tocStyle", defaultValue = "markdown")
	private String tocStyle = "markdown";

	/** Table of contents position: "start" or "after_first_heading". */
	@Parameter(property = "docast.tocPosition", defaultValue = "start")
	private String tocPosition = "start";

	/** Offset added to heading levels by shift-headings. */
	@Parameter(property = "docast.headingOffset", defaultValue = "1")
	private int headingOffset = 1;

	/** Split strategy: "sections", "h1"-"h6", "length=N", "parts=N", "delimiter=TEXT", "break" or "auto". */
	@Parameter(property = "docast.splitBy", defaultValue = "sections")
	private String splitBy = "sections";

	/** When true, do not write any changes, only simulate. */
	@Parameter(property = "docast.dryRun", defaultValue = "true")
	private boolean dryRun = true;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "toc":
				toc(getLog());
				break;
			case "split":
				split(getLog());
				break;
			case "shift-headings":
				shiftHeadings(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, toc, split, shift-headings");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Docast Plugin Configuration:");
		log.info(" - sourceDir: " + (isBlank(this.sourceDir) ? "<not set>" : this.sourceDir));
		if (isBlank(this.sourceDir)) {
			log.warn("Source directory is not set");
		}
		log.info(" - targetDir: " + (isBlank(this.targetDir) ? "<not set>" : this.targetDir));
		log.info(" - fileRegex: " + this.fileRegex);
		if (this.exclusions == null || this.exclusions.isEmpty()) {
			log.info(" - exclusions: <none>");
		} else {
			log.info(" - exclusions:");
			for (final String exclusion : this.exclusions) {
				log.info("   - " + exclusion);
			}
		}
		log.info(" - tocMaxLevel: " + this.tocMaxLevel);
		log.info(" - tocStyle: " + this.tocStyle);
		log.info(" - tocPosition: " + this.tocPosition);
		log.info(" - headingOffset: " + this.headingOffset);
		log.info(" - splitBy: " + this.splitBy);
		log.info(" - dryRun: " + this.dryRun);
	}

	private void toc(@Nonnull final Log log) throws MojoExecutionException {
		final TocStyle style;
		final TocPosition position;
		try {
			style = TocStyle.fromName(this.tocStyle);
			position = TocPosition.fromName(this.tocPosition);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage(), e);
		}
		if (this.tocMaxLevel < 1 || this.tocMaxLevel > 6) {
			throw new MojoExecutionException("tocMaxLevel must be between 1 and 6, got " + this.tocMaxLevel);
		}
		rewrite(log, "toc", document -> TableOfContents.insert(document, position, this.tocMaxLevel, style));
	}

	private void shiftHeadings(@Nonnull final Log log) throws MojoExecutionException {
		final TransformPipeline pipeline = new TransformPipeline(log, List.of(new HeadingLevelTransformer(this.headingOffset)));
		rewrite(log, "shift-headings", pipeline::apply);
	}

	private void split(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.targetDir)) {
			log.error("Target directory must be specified for split action");
			throw new MojoExecutionException("Target directory not specified");
		}
		final SplitSpec spec;
		try {
			spec = SplitSpec.parse(this.splitBy);
		} catch (IllegalArgumentException e) {
			log.error("Invalid split strategy: " + e.getMessage());
			throw new MojoExecutionException("Invalid split strategy: " + this.splitBy, e);
		}
		final Path root = sourceRoot(log, "split");
		final Path target = Path.of(this.targetDir).toAbsolutePath().normalize();
		final DocumentParser parser = new CommonMarkParser();
		final SectionFileSplitter splitter = new SectionFileSplitter(log, createWriter());
		final AtomicInteger fileCount = new AtomicInteger(0);
		final AtomicInteger sectionFileCount = new AtomicInteger(0);
		final List<String> failures = new ArrayList<>();

		final Visitor splittingVisitor = (file, content) -> {
			final Path relativePath = root.relativize(file.toAbsolutePath().normalize());
			try {
				final Document document = parser.parse(content);
				final Path relativeParent = relativePath.getParent();
				final Path outputDir = relativeParent == null ? target : target.resolve(relativeParent);
				final List<Path> written = splitter.split(document, outputDir, baseName(file), this.dryRun, spec);
				sectionFileCount.addAndGet(written.size());
				fileCount.incrementAndGet();
				log.info("Split " + relativePath + " into " + written.size() + " file(s)");
			} catch (ConversionException | IOException | RuntimeException e) {
				failures.add(relativePath.toString());
				log.error("Error processing file " + relativePath + ": " + e.getMessage());
			}
		};

		traverse(root, splittingVisitor, "split");
		log.info("--- Split Summary ---");
		log.info("Processed files: " + fileCount.get());
		log.info((this.dryRun ? "Planned" : "Written") + " section files: " + sectionFileCount.get());
		failIfNeeded(failures, "split");
	}

	private void rewrite(
		@Nonnull final Log log,
		@Nonnull final String actionName,
		@Nonnull final DocumentOperation operation
	) throws MojoExecutionException {
		final Path root = sourceRoot(log, actionName);
		final Path target = isBlank(this.targetDir) ? root : Path.of(this.targetDir).toAbsolutePath().normalize();
		final DocumentParser parser = new CommonMarkParser();
		final Writer writer = createWriter();
		final AtomicInteger fileCount = new AtomicInteger(0);
		final List<String> failures = new ArrayList<>();

		final Visitor rewritingVisitor = (file, content) -> {
			final Path relativePath = root.relativize(file.toAbsolutePath().normalize());
			try {
				final Document result = operation.apply(parser.parse(content));
				final Path targetFile = target.resolve(relativePath);
				if (this.dryRun) {
					log.info("Would write " + targetFile);
				} else {
					writer.write(result, targetFile);
					log.info("Written " + targetFile);
				}
				fileCount.incrementAndGet();
			} catch (ConversionException | IOException | RuntimeException e) {
				failures.add(relativePath.toString());
				log.error("Error processing file " + relativePath + ": " + e.getMessage());
			}
		};

		traverse(root, rewritingVisitor, actionName);
		log.info("--- " + actionName + " Summary ---");
		log.info((this.dryRun ? "Files to write: " : "Written files: ") + fileCount.get());
		failIfNeeded(failures, actionName);
	}

	@Nonnull
	private Path sourceRoot(@Nonnull final Log log, @Nonnull final String actionName) throws MojoExecutionException {
		if (isBlank(this.sourceDir)) {
			log.error("Source directory must be specified for " + actionName + " action");
			throw new MojoExecutionException("Source directory not specified");
		}
		final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
		if (!Files.isDirectory(root)) {
			log.error("Source directory does not exist or is not a directory: " + root);
			throw new MojoExecutionException("Invalid source directory: " + root);
		}
		log.info("=== Running " + actionName + " in: " + root + (this.dryRun ? " (dry run)" : "") + " ===");
		return root;
	}

	private void traverse(
		@Nonnull final Path root,
		@Nonnull final Visitor visitor,
		@Nonnull final String actionName
	) throws MojoExecutionException {
		final Pattern pattern;
		final List<Pattern> exclusionPatterns = new ArrayList<>();
		try {
			pattern = RegexSafety.compile(this.fileRegex);
			if (this.exclusions != null) {
				for (final String exclusion : this.exclusions) {
					exclusionPatterns.add(RegexSafety.compile(exclusion));
				}
			}
		} catch (IllegalArgumentException | UnsafePatternException e) {
			throw new MojoExecutionException("Invalid file pattern: " + e.getMessage(), e);
		}
		try {
			new Traverser(root, pattern, exclusionPatterns, visitor).traverse();
		} catch (IOException e) {
			throw new MojoExecutionException(actionName + " action failed: " + e.getMessage(), e);
		}
	}

	private static void failIfNeeded(@Nonnull final List<String> failures, @Nonnull final String actionName) throws MojoExecutionException {
		if (!failures.isEmpty()) {
			throw new MojoExecutionException(
				actionName + " failed for " + failures.size() + " file(s): " + String.join(", ", failures)
			);
		}
	}

	/**
	 * Creates the writer storing rewritten and split documents as markdown.
	 */
	@Nonnull
	Writer createWriter() {
		return new Writer(new MarkdownRenderer());
	}

	@Nonnull
	private static String baseName(@Nonnull final Path file) {
		final String name = String.valueOf(file.getFileName());
		final int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setTargetDir(@Nullable final String targetDir) { this.targetDir = targetDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setExclusions(@Nullable final List<String> exclusions) { this.exclusions = exclusions; }
	void setTocMaxLevel(final int tocMaxLevel) { this.tocMaxLevel = tocMaxLevel; }
	void setTocStyle(@Nonnull final String tocStyle) { this.tocStyle = tocStyle; }
	void setTocPosition(@Nonnull final String tocPosition) { this.tocPosition = tocPosition; }
	void setHeadingOffset(final int headingOffset) { this.headingOffset = headingOffset; }
	void setSplitBy(@Nonnull final String splitBy) { this.splitBy = splitBy; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }

	/**
	 * Document rewrite performed by the toc and shift-headings actions.
	 */
	@FunctionalInterface
	private interface DocumentOperation {
		@Nonnull
		Document apply(@Nonnull Document document) throws ConversionException;
	}
}
