package io.evitadb.docast.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RegexSafety should reject patterns prone to catastrophic backtracking")
public class RegexSafetyTest {

	@Test
	@DisplayName("shouldCompileOrdinaryPatterns")
	public void shouldCompileOrdinaryPatterns() {
		final Pattern pattern = RegexSafety.compile("(?i).*\\.md");
		assertTrue(pattern.matcher("README.MD").matches());
		assertDoesNotThrow(() -> RegexSafety.validate("^Page \\d+ of \\d+$"));
		assertDoesNotThrow(() -> RegexSafety.validate("(foo|bar)+"));
	}

	@Test
	@DisplayName("shouldRejectNestedQuantifiers")
	public void shouldRejectNestedQuantifiers() {
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(a+)+"));
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(.*)*x"));
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(\\w+\\s?)+$"));
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(a{1,5})+"));
	}

	@Test
	@DisplayName("shouldRejectOverlappingAlternativesUnderQuantifier")
	public void shouldRejectOverlappingAlternativesUnderQuantifier() {
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(a|a)*"));
		assertThrows(UnsafePatternException.class, () -> RegexSafety.validate("(ab|a)+"));
	}

	@Test
	@DisplayName("shouldRejectOverlongPattern")
	public void shouldRejectOverlongPattern() {
		final String pattern = "a".repeat(RegexSafety.MAX_PATTERN_LENGTH + 1);
		final UnsafePatternException ex = assertThrows(UnsafePatternException.class, () -> RegexSafety.compile(pattern));
		assertTrue(ex.getPattern().endsWith("..."));
	}

	@Test
	@DisplayName("shouldReportSyntaxErrorAsIllegalArgument")
	public void shouldReportSyntaxErrorAsIllegalArgument() {
		final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> RegexSafety.compile("[unclosed"));
		assertTrue(ex.getMessage().startsWith("Invalid regular expression pattern"));
	}
}
