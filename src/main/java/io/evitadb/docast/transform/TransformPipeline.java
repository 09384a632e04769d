package io.evitadb.docast.transform;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.ConversionStage;
import io.evitadb.docast.plugin.DocumentRenderer;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies an ordered list of transformers to a document and optionally renders the result.
 *
 * Each transformer receives the output of the previous one. A failing transformer aborts the
 * pipeline with a {@link ConversionException} in the {@link ConversionStage#TRANSFORMING} stage;
 * the input document is never modified.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class TransformPipeline {

	@Nonnull
	private final Log log;
	@Nonnull
	private final List<NodeTransformer> transformers;

	/**
	 * Creates a new TransformPipeline.
	 *
	 * @param log          logger for progress reporting
	 * @param transformers transformers in the order of application
	 */
	public TransformPipeline(@Nonnull Log log, @Nonnull List<? extends NodeTransformer> transformers) {
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.transformers = List.copyOf(Objects.requireNonNull(transformers, "transformers must not be null"));
	}

	/**
	 * Returns a new pipeline with the transformer appended.
	 *
	 * @param transformer transformer to append
	 * @return new pipeline
	 */
	@Nonnull
	public TransformPipeline then(@Nonnull NodeTransformer transformer) {
		final List<NodeTransformer> extended = new ArrayList<>(this.transformers);
		extended.add(Objects.requireNonNull(transformer, "transformer must not be null"));
		return new TransformPipeline(this.log, extended);
	}

	@Nonnull
	public List<NodeTransformer> getTransformers() {
		return this.transformers;
	}

	/**
	 * Applies all transformers to the document.
	 *
	 * @param document input document
	 * @return transformed document
	 * @throws ConversionException when a transformer fails or removes the document root
	 */
	@Nonnull
	public Document apply(@Nonnull Document document) throws ConversionException {
		Objects.requireNonNull(document, "document must not be null");
		Document current = document;
		for (int i = 0; i < this.transformers.size(); i++) {
			final NodeTransformer transformer = this.transformers.get(i);
			final String name = transformer.getClass().getSimpleName();
			if (this.log.isDebugEnabled()) {
				this.log.debug("Applying transformer " + (i + 1) + "/" + this.transformers.size() + ": " + name);
			}
			final Node result;
			try {
				result = transformer.transform(current);
			} catch (RuntimeException e) {
				this.log.error("Transformer " + name + " failed: " + e.getMessage());
				throw new ConversionException(
					ConversionStage.TRANSFORMING, "Transformer " + name + " failed: " + e.getMessage(), e
				);
			}
			if (!(result instanceof Document transformed)) {
				throw new ConversionException(
					ConversionStage.TRANSFORMING,
					"Transformer " + name + " did not return a Document for the document root"
				);
			}
			current = transformed;
		}
		this.log.info("Applied " + this.transformers.size() + " transformer(s), document has " + current.children().size() + " top-level node(s)");
		return current;
	}

	/**
	 * Applies all transformers and renders the result.
	 *
	 * @param document input document
	 * @param renderer renderer of the target format
	 * @return rendered output
	 * @throws ConversionException when a transformer or the renderer fails
	 */
	@Nonnull
	public String apply(@Nonnull Document document, @Nonnull DocumentRenderer renderer) throws ConversionException {
		Objects.requireNonNull(renderer, "renderer must not be null");
		final Document transformed = apply(document);
		if (this.log.isDebugEnabled()) {
			this.log.debug("Rendering with " + renderer.getClass().getSimpleName());
		}
		return renderer.render(transformed);
	}
}
