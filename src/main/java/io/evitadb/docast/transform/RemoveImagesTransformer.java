package io.evitadb.docast.transform;

import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.Node;

import javax.annotation.Nonnull;

/**
 * Removes every image from the document.
 */
public class RemoveImagesTransformer extends NodeTransformer {

	@Override
	public Node visit(@Nonnull Image image) {
		return null;
	}
}
