package io.evitadb.docast.transform;

import io.evitadb.docast.node.BlockQuote;
import io.evitadb.docast.node.Code;
import io.evitadb.docast.node.CodeBlock;
import io.evitadb.docast.node.Comment;
import io.evitadb.docast.node.CommentInline;
import io.evitadb.docast.node.DefinitionDescription;
import io.evitadb.docast.node.DefinitionList;
import io.evitadb.docast.node.DefinitionTerm;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Emphasis;
import io.evitadb.docast.node.FootnoteDefinition;
import io.evitadb.docast.node.FootnoteReference;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.HtmlBlock;
import io.evitadb.docast.node.HtmlInline;
import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.LineBreak;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.MathBlock;
import io.evitadb.docast.node.MathInline;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.Strikethrough;
import io.evitadb.docast.node.Strong;
import io.evitadb.docast.node.Subscript;
import io.evitadb.docast.node.Superscript;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.node.Underline;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Removes every node whose type name is listed, together with its subtree. Type names are the
 * snake_case names returned by {@link Nodes#typeName(Class)}, e.g. {@code image},
 * {@code code_block} or {@code html_inline}. The document root is never removed.
 */
public class RemoveNodesTransformer extends NodeTransformer {

	/**
	 * Names of all node variants that may be removed.
	 */
	public static final Set<String> KNOWN_TYPES = List.of(
			Heading.class, Paragraph.class, CodeBlock.class, BlockQuote.class, ListBlock.class, ListItem.class,
			Table.class, TableRow.class, TableCell.class, ThematicBreak.class, HtmlBlock.class, Comment.class,
			MathBlock.class, FootnoteDefinition.class, DefinitionList.class, DefinitionTerm.class,
			DefinitionDescription.class, Text.class, Strong.class, Emphasis.class, Strikethrough.class,
			Underline.class, Superscript.class, Subscript.class, Code.class, Link.class, Image.class,
			LineBreak.class, HtmlInline.class, CommentInline.class, FootnoteReference.class, MathInline.class
		)
		.stream()
		.map(Nodes::typeName)
		.collect(Collectors.toUnmodifiableSet());

	@Nonnull
	private final Set<String> nodeTypes;

	/**
	 * Creates a transformer removing the listed node types.
	 *
	 * @param nodeTypes snake_case type names
	 * @throws IllegalArgumentException when a name does not denote a removable node type
	 */
	public RemoveNodesTransformer(@Nonnull Collection<String> nodeTypes) {
		for (final String nodeType : nodeTypes) {
			if (!KNOWN_TYPES.contains(nodeType)) {
				throw new IllegalArgumentException(
					"Unknown node type '" + nodeType + "', expected one of " + new TreeSet<>(KNOWN_TYPES)
				);
			}
		}
		this.nodeTypes = Set.copyOf(nodeTypes);
	}

	@Nullable
	@Override
	public Node transform(@Nonnull Node node) {
		if (!(node instanceof Document) && this.nodeTypes.contains(Nodes.typeName(node))) {
			return null;
		}
		return super.transform(node);
	}
}
