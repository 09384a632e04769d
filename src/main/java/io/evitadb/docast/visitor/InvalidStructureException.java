package io.evitadb.docast.visitor;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Exception thrown by a strict {@link StructureValidator} when a tree violates an invariant that
 * the node types cannot express on their own.
 */
public final class InvalidStructureException extends RuntimeException {

	@Nonnull
	private final List<String> problems;

	/**
	 * Creates a new InvalidStructureException.
	 *
	 * @param problems problems found so far, the last one caused the failure
	 */
	public InvalidStructureException(@Nonnull List<String> problems) {
		super(buildMessage(problems));
		this.problems = List.copyOf(Objects.requireNonNull(problems, "problems must not be null"));
	}

	@Nonnull
	private static String buildMessage(@Nonnull List<String> problems) {
		if (problems.isEmpty()) {
			return "Invalid document structure";
		}
		return "Invalid document structure: " + problems.get(problems.size() - 1);
	}

	/**
	 * Returns all problems recorded before the validation was aborted.
	 *
	 * @return unmodifiable list of problem descriptions
	 */
	@Nonnull
	public List<String> getProblems() {
		return this.problems;
	}
}
