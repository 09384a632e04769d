package io.evitadb.docast;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocastMojoTest {

    private static final String GUIDE = "# Guide\n\nIntro\n\n## Install\n\nSteps\n";

    private Path sourceDir;
    private Path targetDir;
    private StringBuilder out;
    private DocastMojo mojo;

    @BeforeEach
    void setUp() throws IOException {
        this.sourceDir = Files.createTempDirectory("mojo-source-");
        this.targetDir = Files.createTempDirectory("mojo-target-");
        Files.writeString(this.sourceDir.resolve("guide.md"), GUIDE, StandardCharsets.UTF_8);
        Files.writeString(this.sourceDir.resolve("notes.txt"), "not markdown", StandardCharsets.UTF_8);
        this.out = new StringBuilder();
        this.mojo = new DocastMojo();
        this.mojo.setLog(capturingLog(this.out));
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(this.sourceDir);
        deleteRecursively(this.targetDir);
    }

    @Test
    public void testShowConfigDisplaysDefaultsAndWarnsForMissingSource() throws MojoExecutionException {
        mojo.setAction("show-config");
        // leave other properties unset to trigger defaults and warnings

        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains("Docast Plugin Configuration:"), "Should contain header");
        assertTrue(log.contains(" - sourceDir: <not set>"), "Should show missing source dir");
        assertTrue(log.contains(" - fileRegex: (?i).*\\.md"), "Should show default regex");
        assertTrue(log.contains(" - exclusions: <none>"), "Should show no exclusions");
        assertTrue(log.contains(" - tocMaxLevel: 3"), "Should show default toc level");
        assertTrue(log.contains(" - tocStyle: markdown"), "Should show default toc style");
        assertTrue(log.contains(" - headingOffset: 1"), "Should show default heading offset");
        assertTrue(log.contains(" - splitBy: sections"), "Should show default split strategy");
        assertTrue(log.contains(" - dryRun: true"), "Should show dryRun default true");
        assertTrue(log.contains("Source directory is not set"), "Should warn about missing source dir");
    }

    @Test
    public void shouldDefaultToShowConfigWhenActionIsBlank() throws MojoExecutionException {
        mojo.setAction(" ");
        mojo.setExclusions(List.of(".*/drafts/.*"));

        mojo.execute();

        assertTrue(out.toString().contains("   - .*/drafts/.*"), "Should list exclusions");
    }

    @Test
    public void shouldRejectUnknownAction() {
        mojo.setAction("translate");

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());

        assertEquals("Unknown action: translate. Supported actions: show-config, toc, split, shift-headings", ex.getMessage());
    }

    @Test
    public void shouldOnlyReportTocFilesInDryRun() throws Exception {
        mojo.setAction("toc");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTargetDir(targetDir.toString());

        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains(" (dry run) ==="), "Should announce dry run");
        assertTrue(log.contains("Would write " + targetDir.toAbsolutePath().normalize().resolve("guide.md")));
        assertTrue(log.contains("Files to write: 1"), "Only markdown files should be processed");
        assertFalse(Files.exists(targetDir.resolve("guide.md")), "Dry run must not write");
    }

    @Test
    public void shouldWriteTableOfContentsToTarget() throws Exception {
        mojo.setAction("toc");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTargetDir(targetDir.toString());
        mojo.setDryRun(false);

        mojo.execute();

        String written = Files.readString(targetDir.resolve("guide.md"), StandardCharsets.UTF_8);
        assertTrue(written.startsWith("# Table of Contents\n"), written);
        assertTrue(written.contains("[Guide](#guide)"), written);
        assertTrue(written.contains("[Install](#install)"), written);
        assertTrue(written.endsWith("## Install\n\nSteps\n"), written);
        assertEquals(GUIDE, Files.readString(sourceDir.resolve("guide.md"), StandardCharsets.UTF_8), "Source must stay untouched");
        assertTrue(out.toString().contains("Written files: 1"));
    }

    @Test
    public void shouldRejectInvalidTocSettings() {
        mojo.setAction("toc");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTocStyle("fancy");

        MojoExecutionException style = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertEquals("Invalid style: fancy. Expected one of markdown, list, nested.", style.getMessage());

        mojo.setTocStyle("nested");
        mojo.setTocMaxLevel(7);
        MojoExecutionException level = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertEquals("tocMaxLevel must be between 1 and 6, got 7", level.getMessage());
    }

    @Test
    public void shouldShiftHeadingsInPlace() throws Exception {
        mojo.setAction("shift-headings");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setHeadingOffset(1);
        mojo.setDryRun(false);

        mojo.execute();

        assertEquals(
            "## Guide\n\nIntro\n\n### Install\n\nSteps\n",
            Files.readString(sourceDir.resolve("guide.md"), StandardCharsets.UTF_8)
        );
        assertEquals("not markdown", Files.readString(sourceDir.resolve("notes.txt"), StandardCharsets.UTF_8));
    }

    @Test
    public void shouldRequireTargetDirectoryForSplit() {
        mojo.setAction("split");
        mojo.setSourceDir(sourceDir.toString());

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());

        assertEquals("Target directory not specified", ex.getMessage());
        assertTrue(out.toString().contains("Target directory must be specified for split action"));
    }

    @Test
    public void shouldSplitFilesIntoSections() throws Exception {
        Files.createDirectories(sourceDir.resolve("nested"));
        Files.writeString(sourceDir.resolve("nested/faq.md"), "# Why\n\nBecause\n", StandardCharsets.UTF_8);
        mojo.setAction("split");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTargetDir(targetDir.toString());
        mojo.setDryRun(false);

        mojo.execute();

        assertEquals("# Guide\n\nIntro\n", Files.readString(targetDir.resolve("guide-01-guide.md"), StandardCharsets.UTF_8));
        assertEquals("## Install\n\nSteps\n", Files.readString(targetDir.resolve("guide-02-install.md"), StandardCharsets.UTF_8));
        assertTrue(Files.exists(targetDir.resolve("nested/faq-01-why.md")), "Relative directories should be kept");
        String log = out.toString();
        assertTrue(log.contains("Split guide.md into 2 file(s)"));
        assertTrue(log.contains("Processed files: 2"));
        assertTrue(log.contains("Written section files: 3"));
    }

    @Test
    public void shouldSplitFilesAtThematicBreaks() throws Exception {
        Files.writeString(sourceDir.resolve("story.md"), "Alpha\n\n---\n\nBeta\n", StandardCharsets.UTF_8);
        mojo.setAction("split");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTargetDir(targetDir.toString());
        mojo.setSplitBy("break");
        mojo.setDryRun(false);

        mojo.execute();

        assertEquals("Alpha\n", Files.readString(targetDir.resolve("story-01-part-1.md"), StandardCharsets.UTF_8));
        assertEquals("Beta\n", Files.readString(targetDir.resolve("story-02-part-2.md"), StandardCharsets.UTF_8));
        assertTrue(Files.exists(targetDir.resolve("guide-01-part-1.md")), "Unsplit document should be written whole");
        String log = out.toString();
        assertTrue(log.contains("Split story.md into 2 file(s)"));
        assertTrue(log.contains("Document guide was not split by break: no_breaks_found"));
    }

    @Test
    public void shouldRejectInvalidSplitStrategy() {
        mojo.setAction("split");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setTargetDir(targetDir.toString());
        mojo.setSplitBy("h9");

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());

        assertEquals("Invalid split strategy: h9", ex.getMessage());
        assertTrue(out.toString().contains("Heading level must be between 1 and 6, got 9"));
    }

    @Test
    public void shouldRejectMissingOrInvalidSourceDirectory() {
        mojo.setAction("toc");
        MojoExecutionException missing = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertEquals("Source directory not specified", missing.getMessage());

        mojo.setSourceDir(sourceDir.resolve("guide.md").toString());
        MojoExecutionException invalid = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertTrue(invalid.getMessage().startsWith("Invalid source directory: "));
    }

    @Test
    public void shouldRejectUnsafeFilePattern() {
        mojo.setAction("shift-headings");
        mojo.setSourceDir(sourceDir.toString());
        mojo.setFileRegex("(a+)+");

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());

        assertTrue(ex.getMessage().startsWith("Invalid file pattern: "), ex.getMessage());
    }

    @Test
    public void shouldReportSplitFilesFailingAtRuntime() throws Exception {
        DocastMojo failing = new DocastMojo() {
            @Override
            Writer createWriter() {
                return new Writer(document -> {
                    throw new IllegalStateException("renderer broken");
                });
            }
        };
        failing.setLog(capturingLog(out));
        failing.setAction("split");
        failing.setSourceDir(sourceDir.toString());
        failing.setTargetDir(targetDir.toString());
        failing.setDryRun(false);

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, failing::execute);

        assertEquals("split failed for 1 file(s): guide.md", ex.getMessage());
        assertTrue(out.toString().contains("Error processing file guide.md: renderer broken"));
        assertTrue(out.toString().contains("Processed files: 0"));
    }

    private static Log capturingLog(StringBuilder out) {
        return new Log() {
            @Override public boolean isDebugEnabled() { return true; }
            @Override public void debug(CharSequence content) { out.append(content).append('\n'); }
            @Override public void debug(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void debug(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isInfoEnabled() { return true; }
            @Override public void info(CharSequence content) { out.append(content).append('\n'); }
            @Override public void info(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void info(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isWarnEnabled() { return true; }
            @Override public void warn(CharSequence content) { out.append(content).append('\n'); }
            @Override public void warn(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void warn(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isErrorEnabled() { return true; }
            @Override public void error(CharSequence content) { out.append(content).append('\n'); }
            @Override public void error(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void error(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
        };
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }
}
