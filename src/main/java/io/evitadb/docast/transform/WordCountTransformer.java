package io.evitadb.docast.transform;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stores the number of words and characters of the document text in its metadata.
 */
public class WordCountTransformer extends NodeTransformer {

	public static final String DEFAULT_WORD_FIELD = "word_count";
	public static final String DEFAULT_CHAR_FIELD = "char_count";

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	@Nonnull
	private final String wordField;
	@Nonnull
	private final String charField;

	public WordCountTransformer() {
		this(DEFAULT_WORD_FIELD, DEFAULT_CHAR_FIELD);
	}

	public WordCountTransformer(@Nonnull String wordField, @Nonnull String charField) {
		this.wordField = Objects.requireNonNull(wordField, "wordField must not be null");
		this.charField = Objects.requireNonNull(charField, "charField must not be null");
	}

	@Override
	public Node visit(@Nonnull Document document) {
		final String text = Nodes.extractText(document).trim();
		final int words = text.isEmpty() ? 0 : WHITESPACE.split(text).length;
		final Document transformed = transformDocument(document);
		return transformed.withMetadata(
			transformed.metadata()
				.with(this.wordField, words)
				.with(this.charField, text.length())
		);
	}
}
