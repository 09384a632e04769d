package io.evitadb.docast;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Visitor that processes the matched file content.
 */
public interface Visitor {
	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file    path to the file that matched
	 * @param content full textual contents of the file
	 */
	void visit(@Nonnull Path file, @Nonnull String content);
}
