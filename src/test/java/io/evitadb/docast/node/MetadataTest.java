package io.evitadb.docast.node;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Metadata should behave as an immutable open mapping")
public class MetadataTest {

	@Test
	@DisplayName("shouldReturnNewInstanceWhenValueAdded")
	public void shouldReturnNewInstanceWhenValueAdded() {
		final Metadata original = Metadata.of("title", "Guide");
		final Metadata extended = original.with("author", "Alice");

		assertEquals(1, original.size());
		assertEquals(2, extended.size());
		assertEquals("Alice", extended.getString("author").orElse(null));
		assertFalse(original.containsKey("author"));
	}

	@Test
	@DisplayName("shouldCopyMutableListsOnCreation")
	public void shouldCopyMutableListsOnCreation() {
		final List<Object> tags = new ArrayList<>(List.of("a", "b"));
		final Metadata metadata = Metadata.of("tags", tags);
		tags.add("c");

		assertEquals(List.of("a", "b"), metadata.getList("tags").orElseThrow());
		assertThrows(UnsupportedOperationException.class, () -> metadata.getList("tags").orElseThrow().add("d"));
	}

	@Test
	@DisplayName("shouldAcceptNestedMapsAndTemporalValues")
	public void shouldAcceptNestedMapsAndTemporalValues() {
		final Map<String, Object> nested = new LinkedHashMap<>();
		nested.put("width", 10);
		nested.put("draft", true);
		final Metadata metadata = Metadata.of("layout", nested).with("created", LocalDate.of(2025, 1, 2));

		assertEquals(10, metadata.getMap("layout").orElseThrow().get("width"));
		assertEquals(LocalDate.of(2025, 1, 2), metadata.get("created").orElseThrow());
	}

	@Test
	@DisplayName("shouldRejectUnsupportedValueTypes")
	public void shouldRejectUnsupportedValueTypes() {
		final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Metadata.of("bad", new Object()));
		assertTrue(ex.getMessage().contains("bad"));
	}

	@Test
	@DisplayName("shouldLetOtherEntriesWinWhenMerged")
	public void shouldLetOtherEntriesWinWhenMerged() {
		final Metadata first = Metadata.of("v", "1.0").with("a", "Alice");
		final Metadata second = Metadata.of("v", "2.0").with("d", "2025");

		final Metadata merged = first.withAll(second);

		assertEquals("2.0", merged.getString("v").orElse(null));
		assertEquals("Alice", merged.getString("a").orElse(null));
		assertEquals("2025", merged.getString("d").orElse(null));
	}

	@Test
	@DisplayName("shouldCompareByContent")
	public void shouldCompareByContent() {
		assertEquals(Metadata.of("k", "v"), Metadata.empty().with("k", "v"));
		assertEquals(Metadata.empty(), Metadata.of("k", "v").without("k"));
	}
}
