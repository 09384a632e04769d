package io.evitadb.docast.transform;

import io.evitadb.docast.node.Metadata;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the metadata of two documents when they are merged. Documents are folded from left to
 * right, so {@code accumulated} holds the merged metadata of all preceding documents.
 */
@FunctionalInterface
public interface MetadataMerger {

	/**
	 * Values of the later document overwrite values of the earlier ones.
	 */
	MetadataMerger LAST_WRITE_WINS = (accumulated, next) -> accumulated.withAll(next);

	/**
	 * Values already present are kept, the later document only adds new keys.
	 */
	MetadataMerger FIRST_WRITE_WINS = (accumulated, next) -> next.withAll(accumulated);

	/**
	 * List values present on both sides are concatenated, every other key behaves as
	 * {@link #LAST_WRITE_WINS}.
	 */
	MetadataMerger MERGE_LISTS = (accumulated, next) -> {
		final Map<String, Object> result = new LinkedHashMap<>(accumulated.asMap());
		for (final Map.Entry<String, Object> entry : next.asMap().entrySet()) {
			final Object existing = result.get(entry.getKey());
			if (existing instanceof List<?> existingList && entry.getValue() instanceof List<?> nextList) {
				final List<Object> concatenated = new ArrayList<>(existingList);
				concatenated.addAll(nextList);
				result.put(entry.getKey(), concatenated);
			} else {
				result.put(entry.getKey(), entry.getValue());
			}
		}
		return Metadata.of(result);
	};

	/**
	 * Merges two metadata maps.
	 *
	 * @param accumulated metadata merged so far
	 * @param next        metadata of the next document
	 * @return merged metadata
	 */
	@Nonnull
	Metadata merge(@Nonnull Metadata accumulated, @Nonnull Metadata next);
}
