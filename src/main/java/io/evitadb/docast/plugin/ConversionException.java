package io.evitadb.docast.plugin;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown by parsers, renderers and pipelines when a conversion fails. The stage tells
 * which step of a multi-step conversion is responsible.
 */
public final class ConversionException extends Exception {

	@Nonnull
	private final ConversionStage stage;

	/**
	 * Creates a new ConversionException.
	 *
	 * @param stage   the stage that failed
	 * @param message description of the failure
	 */
	public ConversionException(@Nonnull ConversionStage stage, @Nonnull String message) {
		super(formatMessage(stage, message));
		this.stage = Objects.requireNonNull(stage, "stage must not be null");
	}

	/**
	 * Creates a new ConversionException with a cause.
	 *
	 * @param stage   the stage that failed
	 * @param message description of the failure
	 * @param cause   the underlying cause
	 */
	public ConversionException(@Nonnull ConversionStage stage, @Nonnull String message, @Nonnull Throwable cause) {
		super(formatMessage(stage, message), cause);
		this.stage = Objects.requireNonNull(stage, "stage must not be null");
	}

	@Nonnull
	private static String formatMessage(@Nonnull ConversionStage stage, @Nonnull String message) {
		return "[" + stage.getName() + "] " + message;
	}

	/**
	 * Returns the stage in which the conversion failed.
	 *
	 * @return failed stage
	 */
	@Nonnull
	public ConversionStage getStage() {
		return this.stage;
	}
}
