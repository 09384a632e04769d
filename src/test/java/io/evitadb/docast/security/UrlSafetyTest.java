package io.evitadb.docast.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("UrlSafety should screen link and image URLs")
public class UrlSafetyTest {

	@Test
	@DisplayName("shouldExtractLowercasedScheme")
	public void shouldExtractLowercasedScheme() {
		assertEquals("https", UrlSafety.schemeOf("HTTPS://example.com"));
		assertEquals("mailto", UrlSafety.schemeOf("mailto:someone@example.com"));
		assertNull(UrlSafety.schemeOf("docs/readme.md"));
	}

	@Test
	@DisplayName("shouldDetectSchemeHiddenByWhitespace")
	public void shouldDetectSchemeHiddenByWhitespace() {
		assertTrue(UrlSafety.isDangerous("java\tscript:alert(1)"));
		assertTrue(UrlSafety.isDangerous("  JavaScript:alert(1)"));
		assertFalse(UrlSafety.isDangerous("https://example.com"));
	}

	@Test
	@DisplayName("shouldRecognizeRelativeUrls")
	public void shouldRecognizeRelativeUrls() {
		assertTrue(UrlSafety.isRelative("/absolute/path"));
		assertTrue(UrlSafety.isRelative("#anchor"));
		assertTrue(UrlSafety.isRelative("?page=2"));
		assertTrue(UrlSafety.isRelative("images/logo.png"));
		assertFalse(UrlSafety.isRelative("ftp://example.com/file"));
	}

	@Test
	@DisplayName("shouldAcceptSafeAndEmptyUrls")
	public void shouldAcceptSafeAndEmptyUrls() {
		assertDoesNotThrow(() -> UrlSafety.validate("", "Link"));
		assertDoesNotThrow(() -> UrlSafety.validate("https://example.com", "Link"));
		assertDoesNotThrow(() -> UrlSafety.validate("tel:+420123456789", "Link"));
		assertDoesNotThrow(() -> UrlSafety.validate("../other.md#section", "Link"));
	}

	@Test
	@DisplayName("shouldRejectDangerousScheme")
	public void shouldRejectDangerousScheme() {
		final UnsafeUrlException ex = assertThrows(
			UnsafeUrlException.class,
			() -> UrlSafety.validate("javascript:alert('x')", "Link")
		);
		assertEquals("javascript", ex.getScheme());
		assertEquals("Link URL uses dangerous scheme 'javascript': javascript:alert('x')", ex.getMessage());
	}

	@Test
	@DisplayName("shouldRejectUnknownScheme")
	public void shouldRejectUnknownScheme() {
		final UnsafeUrlException ex = assertThrows(
			UnsafeUrlException.class,
			() -> UrlSafety.validate("gopher://example.com", "Image")
		);
		assertTrue(ex.getMessage().startsWith("Image URL has unrecognized scheme 'gopher'"));
	}

	@Test
	@DisplayName("shouldAllowDataImagesOnlyWhenRequested")
	public void shouldAllowDataImagesOnlyWhenRequested() {
		final String pixel = "data:image/png;base64,iVBORw0KGgo=";
		assertThrows(UnsafeUrlException.class, () -> UrlSafety.validate(pixel, "Image"));
		assertDoesNotThrow(() -> UrlSafety.validate(pixel, "Image", true));
		assertThrows(UnsafeUrlException.class, () -> UrlSafety.validate("data:text/html,<script>", "Image", true));
	}

	@Test
	@DisplayName("shouldTruncateLongUrlInException")
	public void shouldTruncateLongUrlInException() {
		final String url = "vbscript:" + "x".repeat(200);
		final UnsafeUrlException ex = assertThrows(UnsafeUrlException.class, () -> UrlSafety.validate(url, "Link"));
		assertEquals(UnsafeUrlException.MAX_URL_LENGTH, ex.getUrl().length());
	}
}
