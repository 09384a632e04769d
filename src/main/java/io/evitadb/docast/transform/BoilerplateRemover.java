package io.evitadb.docast.transform;

import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.security.RegexSafety;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes paragraphs whose text is boilerplate such as page footers or confidentiality notices.
 * A paragraph is removed when one of the patterns matches at the start of its trimmed text;
 * matching ignores case.
 */
public class BoilerplateRemover extends NodeTransformer {

	/**
	 * Patterns used by the no-argument constructor.
	 */
	public static final List<String> DEFAULT_PATTERNS = List.of(
		"^CONFIDENTIAL$",
		"^Page \\d+ of \\d+$",
		"^Internal Use Only$",
		"^\\[DRAFT\\]$",
		"^Copyright \\d{4}",
		"^All rights reserved\\.?$",
		"^Printed on \\d{4}-\\d{2}-\\d{2}$"
	);

	@Nonnull
	private final List<Pattern> patterns;

	public BoilerplateRemover() {
		this(DEFAULT_PATTERNS);
	}

	/**
	 * Creates the remover.
	 *
	 * @param patterns regular expressions identifying boilerplate paragraphs
	 * @throws IllegalArgumentException when a pattern does not compile
	 * @throws io.evitadb.docast.security.UnsafePatternException when a pattern is unsafe
	 */
	public BoilerplateRemover(@Nonnull List<String> patterns) {
		final List<Pattern> compiled = new ArrayList<>(patterns.size());
		for (final String pattern : patterns) {
			compiled.add(RegexSafety.compile(pattern, Pattern.CASE_INSENSITIVE));
		}
		this.patterns = Collections.unmodifiableList(compiled);
	}

	@Override
	public Node visit(@Nonnull Paragraph paragraph) {
		final String text = Nodes.extractText(paragraph).trim();
		for (final Pattern pattern : this.patterns) {
			if (pattern.matcher(text).lookingAt()) {
				return null;
			}
		}
		return super.visit(paragraph);
	}
}
