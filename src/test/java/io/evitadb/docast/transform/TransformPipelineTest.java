package io.evitadb.docast.transform;

import io.evitadb.docast.markdown.MarkdownRenderer;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.ConversionStage;
import io.evitadb.docast.security.UnsafeUrlException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TransformPipeline should apply transformers in order")
public class TransformPipelineTest {

	private Log log;

	@BeforeEach
	void setUp() {
		this.log = Mockito.mock(Log.class);
	}

	@Test
	@DisplayName("shouldApplyTransformersInOrder")
	public void shouldApplyTransformersInOrder() throws ConversionException {
		final TransformPipeline pipeline = new TransformPipeline(this.log, List.of(new HeadingLevelTransformer(1)))
			.then(new HeadingIdTransformer());

		final Document output = pipeline.apply(Document.of(Heading.of(1, "Intro"), Paragraph.of("text")));

		final Heading heading = (Heading) output.children().get(0);
		assertEquals(2, heading.level());
		assertEquals("intro", heading.metadata().getString(HeadingIdTransformer.ID).orElseThrow());
		assertEquals(2, pipeline.getTransformers().size());
		verify(this.log).info("Applied 2 transformer(s), document has 2 top-level node(s)");
		verify(this.log, never()).debug(anyString());
	}

	@Test
	@DisplayName("shouldLogStepsWhenDebugIsEnabled")
	public void shouldLogStepsWhenDebugIsEnabled() throws ConversionException {
		when(this.log.isDebugEnabled()).thenReturn(true);
		final TransformPipeline pipeline = new TransformPipeline(this.log, List.of(new RemoveImagesTransformer()));

		pipeline.apply(Document.of());

		verify(this.log).debug("Applying transformer 1/1: RemoveImagesTransformer");
	}

	@Test
	@DisplayName("shouldLeaveOriginalPipelineUntouchedByThen")
	public void shouldLeaveOriginalPipelineUntouchedByThen() {
		final TransformPipeline pipeline = new TransformPipeline(this.log, List.of());

		pipeline.then(new RemoveImagesTransformer());

		assertEquals(0, pipeline.getTransformers().size());
	}

	@Test
	@DisplayName("shouldWrapTransformerFailure")
	public void shouldWrapTransformerFailure() {
		final TransformPipeline pipeline = new TransformPipeline(
			this.log, List.of(new LinkRewriter(url -> "javascript:alert(1)"))
		);

		final ConversionException ex = assertThrows(
			ConversionException.class,
			() -> pipeline.apply(Document.of(Paragraph.of(Link.of("a.md", "A"))))
		);

		assertEquals(ConversionStage.TRANSFORMING, ex.getStage());
		assertInstanceOf(UnsafeUrlException.class, ex.getCause());
		assertEquals(
			"[transforming] Transformer LinkRewriter failed: Link URL uses dangerous scheme 'javascript': javascript:alert(1)",
			ex.getMessage()
		);
		verify(this.log).error("Transformer LinkRewriter failed: Link URL uses dangerous scheme 'javascript': javascript:alert(1)");
	}

	@Test
	@DisplayName("shouldRenderTransformedDocument")
	public void shouldRenderTransformedDocument() throws ConversionException {
		final TransformPipeline pipeline = new TransformPipeline(this.log, List.of(new HeadingLevelTransformer(1)));

		final String markdown = pipeline.apply(Document.of(Heading.of(1, "Intro")), new MarkdownRenderer());

		assertEquals("## Intro\n", markdown);
	}
}
