package io.evitadb.docast.node;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable string-keyed attribute map attached to every node and to the document root.
 *
 * Values are restricted to a small closed set so that metadata stays comparable and serializable:
 * {@link String}, {@link Number}, {@link Boolean}, {@link Temporal}, lists of allowed values and
 * nested string-keyed maps of allowed values. Lists and maps are copied into unmodifiable
 * structures on construction, so two nodes never share mutable metadata state.
 *
 * Insertion order of keys is preserved.
 */
public final class Metadata {

	private static final Metadata EMPTY = new Metadata(Collections.emptyMap());

	@Nonnull
	private final Map<String, Object> values;

	private Metadata(@Nonnull Map<String, Object> values) {
		this.values = values;
	}

	/**
	 * Returns the shared empty metadata instance.
	 *
	 * @return empty metadata
	 */
	@Nonnull
	public static Metadata empty() {
		return EMPTY;
	}

	/**
	 * Creates metadata from a single entry.
	 *
	 * @param key   the key
	 * @param value the value, must be of an allowed type
	 * @return new metadata
	 * @throws IllegalArgumentException when the value type is not supported
	 */
	@Nonnull
	public static Metadata of(@Nonnull String key, @Nonnull Object value) {
		return empty().with(key, value);
	}

	/**
	 * Creates metadata from the given map, deep copying lists and nested maps.
	 *
	 * @param values source entries
	 * @return new metadata
	 * @throws IllegalArgumentException when some value type is not supported
	 */
	@Nonnull
	public static Metadata of(@Nonnull Map<String, ?> values) {
		Objects.requireNonNull(values, "values must not be null");
		if (values.isEmpty()) {
			return EMPTY;
		}
		final Map<String, Object> copy = new LinkedHashMap<>(values.size());
		for (final Map.Entry<String, ?> entry : values.entrySet()) {
			final String key = Objects.requireNonNull(entry.getKey(), "metadata key must not be null");
			copy.put(key, copyValue(key, entry.getValue()));
		}
		return new Metadata(Collections.unmodifiableMap(copy));
	}

	/**
	 * Returns the value stored under the key.
	 *
	 * @param key the key
	 * @return value or empty Optional
	 */
	@Nonnull
	public Optional<Object> get(@Nonnull String key) {
		return Optional.ofNullable(this.values.get(key));
	}

	/**
	 * Returns the value stored under the key if it is a string.
	 *
	 * @param key the key
	 * @return string value or empty Optional when missing or of another type
	 */
	@Nonnull
	public Optional<String> getString(@Nonnull String key) {
		final Object value = this.values.get(key);
		return value instanceof String text ? Optional.of(text) : Optional.empty();
	}

	/**
	 * Returns the value stored under the key if it is a list.
	 *
	 * @param key the key
	 * @return unmodifiable list or empty Optional when missing or of another type
	 */
	@Nonnull
	public Optional<List<Object>> getList(@Nonnull String key) {
		final Object value = this.values.get(key);
		return value instanceof List<?> list ? Optional.of(Collections.<Object>unmodifiableList(list)) : Optional.empty();
	}

	/**
	 * Returns the value stored under the key if it is a nested map.
	 *
	 * @param key the key
	 * @return unmodifiable map or empty Optional when missing or of another type
	 */
	@Nonnull
	public Optional<Map<String, Object>> getMap(@Nonnull String key) {
		final Object value = this.values.get(key);
		if (!(value instanceof Map<?, ?> map)) {
			return Optional.empty();
		}
		// nested maps are validated to have string keys on construction
		final Map<String, Object> result = new LinkedHashMap<>(map.size());
		map.forEach((nestedKey, nestedValue) -> result.put((String) nestedKey, nestedValue));
		return Optional.of(Collections.unmodifiableMap(result));
	}

	public boolean containsKey(@Nonnull String key) {
		return this.values.containsKey(key);
	}

	public boolean isEmpty() {
		return this.values.isEmpty();
	}

	public int size() {
		return this.values.size();
	}

	@Nonnull
	public Set<String> keySet() {
		return this.values.keySet();
	}

	/**
	 * Returns a copy of this metadata with the key set to the value. An existing key keeps its
	 * position in the iteration order.
	 *
	 * @param key   the key
	 * @param value the value, must be of an allowed type
	 * @return new metadata
	 */
	@Nonnull
	public Metadata with(@Nonnull String key, @Nonnull Object value) {
		Objects.requireNonNull(key, "key must not be null");
		final Map<String, Object> copy = new LinkedHashMap<>(this.values);
		copy.put(key, copyValue(key, value));
		return new Metadata(Collections.unmodifiableMap(copy));
	}

	/**
	 * Returns a copy of this metadata without the key.
	 *
	 * @param key the key to remove
	 * @return new metadata, or this instance when the key is not present
	 */
	@Nonnull
	public Metadata without(@Nonnull String key) {
		if (!this.values.containsKey(key)) {
			return this;
		}
		final Map<String, Object> copy = new LinkedHashMap<>(this.values);
		copy.remove(key);
		return copy.isEmpty() ? EMPTY : new Metadata(Collections.unmodifiableMap(copy));
	}

	/**
	 * Returns a copy of this metadata overlaid with all entries of the other metadata. Values of
	 * the other metadata win for duplicate keys.
	 *
	 * @param other metadata to overlay
	 * @return new metadata
	 */
	@Nonnull
	public Metadata withAll(@Nonnull Metadata other) {
		Objects.requireNonNull(other, "other must not be null");
		if (other.isEmpty()) {
			return this;
		}
		if (this.isEmpty()) {
			return other;
		}
		final Map<String, Object> copy = new LinkedHashMap<>(this.values);
		copy.putAll(other.values);
		return new Metadata(Collections.unmodifiableMap(copy));
	}

	/**
	 * Returns an unmodifiable view of all entries in insertion order.
	 *
	 * @return map view
	 */
	@Nonnull
	public Map<String, Object> asMap() {
		return this.values;
	}

	@Nonnull
	private static Object copyValue(@Nonnull String key, @Nullable Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Metadata value for key '" + key + "' must not be null");
		}
		if (value instanceof String || value instanceof Number || value instanceof Boolean || value instanceof Temporal) {
			return value;
		}
		if (value instanceof List<?> source) {
			final List<Object> copy = new ArrayList<>(source.size());
			for (final Object item : source) {
				copy.add(copyValue(key, item));
			}
			return Collections.unmodifiableList(copy);
		}
		if (value instanceof Map<?, ?> source) {
			final Map<String, Object> copy = new LinkedHashMap<>(source.size());
			for (final Map.Entry<?, ?> entry : source.entrySet()) {
				if (!(entry.getKey() instanceof String nestedKey)) {
					throw new IllegalArgumentException("Nested metadata map under key '" + key + "' must have string keys");
				}
				copy.put(nestedKey, copyValue(key + "." + nestedKey, entry.getValue()));
			}
			return Collections.unmodifiableMap(copy);
		}
		throw new IllegalArgumentException(
			"Unsupported metadata value type " + value.getClass().getName() + " for key '" + key + "'"
		);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Metadata other)) {
			return false;
		}
		return this.values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return this.values.hashCode();
	}

	@Override
	public String toString() {
		return "Metadata" + this.values;
	}
}
