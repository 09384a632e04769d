package io.evitadb.docast.visitor;

import io.evitadb.docast.node.Code;
import io.evitadb.docast.node.CodeBlock;
import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.Inline;
import io.evitadb.docast.node.LineBreak;
import io.evitadb.docast.node.MathBlock;
import io.evitadb.docast.node.MathInline;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Text;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Generic structural helpers that work on any node variant without a per-type switch at the call
 * site.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class Nodes {

	private Nodes() {
	}

	/**
	 * Returns the immediate children of the node. Tables return the header row (when present)
	 * before the body rows; definition lists return each term followed by its descriptions.
	 *
	 * @param node any node
	 * @return unmodifiable list of children, empty for leaf nodes
	 */
	@Nonnull
	public static List<Node> children(@Nonnull Node node) {
		Objects.requireNonNull(node, "node must not be null");
		return node.accept(ChildAccessor.INSTANCE);
	}

	/**
	 * Creates a new node of the same variant with the given children and all other attributes
	 * of the original. Leaf nodes accept only an empty list and are copied.
	 *
	 * @param node     template node
	 * @param children replacement children in the layout returned by {@link #children(Node)}
	 * @return new node instance of the same variant as the template
	 * @throws IllegalArgumentException when a child does not fit the slot it would be placed in
	 */
	@Nonnull
	public static Node withChildren(@Nonnull Node node, @Nonnull List<? extends Node> children) {
		Objects.requireNonNull(node, "node must not be null");
		Objects.requireNonNull(children, "children must not be null");
		return node.accept(new ChildReplacer(children));
	}

	/**
	 * Flattens the text of the node and its descendants. Inline content is concatenated as is,
	 * the texts of sibling block nodes are separated by a single space. Images contribute their
	 * alternative text and line breaks a space.
	 *
	 * @param node any node
	 * @return plain text, possibly empty
	 */
	@Nonnull
	public static String extractText(@Nonnull Node node) {
		Objects.requireNonNull(node, "node must not be null");
		final StringBuilder sb = new StringBuilder();
		appendText(node, sb);
		return sb.toString();
	}

	/**
	 * Returns the snake_case type name of the node variant, e.g. {@code code_block} for
	 * {@link CodeBlock} or {@code list} for the list block. The names are used in configuration
	 * that selects node types by name.
	 *
	 * @param type node variant
	 * @return type name
	 */
	@Nonnull
	public static String typeName(@Nonnull Class<? extends Node> type) {
		final String simpleName = type.getSimpleName();
		if ("ListBlock".equals(simpleName)) {
			return "list";
		}
		final StringBuilder sb = new StringBuilder(simpleName.length() + 4);
		for (int i = 0; i < simpleName.length(); i++) {
			final char c = simpleName.charAt(i);
			if (Character.isUpperCase(c) && i > 0) {
				sb.append('_');
			}
			sb.append(Character.toLowerCase(c));
		}
		return sb.toString().toLowerCase(Locale.ROOT);
	}

	/**
	 * Returns the snake_case type name of the node.
	 *
	 * @param node any node
	 * @return type name
	 * @see #typeName(Class)
	 */
	@Nonnull
	public static String typeName(@Nonnull Node node) {
		return typeName(node.getClass());
	}

	private static void appendText(@Nonnull Node node, @Nonnull StringBuilder sb) {
		if (node instanceof Text text) {
			sb.append(text.content());
		} else if (node instanceof Code code) {
			sb.append(code.content());
		} else if (node instanceof MathInline math) {
			sb.append(math.content());
		} else if (node instanceof Image image) {
			sb.append(image.altText());
		} else if (node instanceof LineBreak) {
			sb.append(' ');
		} else if (node instanceof CodeBlock codeBlock) {
			sb.append(codeBlock.content());
		} else if (node instanceof MathBlock math) {
			sb.append(math.content());
		} else {
			for (final Node child : children(node)) {
				if (!(child instanceof Inline) && sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') {
					sb.append(' ');
				}
				appendText(child, sb);
			}
		}
	}
}
