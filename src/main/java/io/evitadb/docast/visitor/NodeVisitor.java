package io.evitadb.docast.visitor;

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

import javax.annotation.Nonnull;

/**
 * Double-dispatch target of {@link io.evitadb.docast.node.Node#accept(NodeVisitor)}.
 *
 * There is exactly one {@code visit} overload per node variant. A new variant therefore breaks
 * compilation of every implementation until it handles the variant, or until it extends
 * {@link AbstractVisitor} or {@link io.evitadb.docast.transform.NodeTransformer} which provide
 * generic defaults. Exceptions thrown by a visit method propagate unchanged to the caller of
 * {@code accept}.
 *
 * @param <R> result type produced by the visitor
 */
public interface NodeVisitor<R> {

	R visit(@Nonnull Document document);

	R visit(@Nonnull Heading heading);

	R visit(@Nonnull Paragraph paragraph);

	R visit(@Nonnull CodeBlock codeBlock);

	R visit(@Nonnull BlockQuote blockQuote);

	R visit(@Nonnull ListBlock listBlock);

	R visit(@Nonnull ListItem listItem);

	R visit(@Nonnull Table table);

	R visit(@Nonnull TableRow tableRow);

	R visit(@Nonnull TableCell tableCell);

	R visit(@Nonnull ThematicBreak thematicBreak);

	R visit(@Nonnull HtmlBlock htmlBlock);

	R visit(@Nonnull Comment comment);

	R visit(@Nonnull MathBlock mathBlock);

	R visit(@Nonnull FootnoteDefinition footnoteDefinition);

	R visit(@Nonnull DefinitionList definitionList);

	R visit(@Nonnull DefinitionTerm definitionTerm);

	R visit(@Nonnull DefinitionDescription definitionDescription);

	R visit(@Nonnull Text text);

	R visit(@Nonnull Strong strong);

	R visit(@Nonnull Emphasis emphasis);

	R visit(@Nonnull Strikethrough strikethrough);

	R visit(@Nonnull Underline underline);

	R visit(@Nonnull Superscript superscript);

	R visit(@Nonnull Subscript subscript);

	R visit(@Nonnull Code code);

	R visit(@Nonnull Link link);

	R visit(@Nonnull Image image);

	R visit(@Nonnull LineBreak lineBreak);

	R visit(@Nonnull HtmlInline htmlInline);

	R visit(@Nonnull CommentInline commentInline);

	R visit(@Nonnull FootnoteReference footnoteReference);

	R visit(@Nonnull MathInline mathInline);

}
