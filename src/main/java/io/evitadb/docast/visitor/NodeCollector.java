package io.evitadb.docast.visitor;

import io.evitadb.docast.node.Node;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Walks a tree and collects every node the predicate accepts, the starting node included. Nodes
 * are collected in pre-order: a parent always precedes its descendants.
 *
 * A collector accumulates across {@link Node#accept(NodeVisitor)} calls; create a new instance
 * for each independent walk.
 */
public class NodeCollector extends AbstractVisitor {

	@Nonnull
	private final Predicate<? super Node> predicate;
	@Nonnull
	private final List<Node> collected = new ArrayList<>();

	public NodeCollector(@Nonnull Predicate<? super Node> predicate) {
		this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
	}

	/**
	 * Creates a collector accepting every node.
	 *
	 * @return new collector
	 */
	@Nonnull
	public static NodeCollector all() {
		return new NodeCollector(node -> true);
	}

	/**
	 * Creates a collector accepting instances of the given type.
	 *
	 * @param type node class or marker interface
	 * @return new collector
	 */
	@Nonnull
	public static NodeCollector ofType(@Nonnull Class<? extends Node> type) {
		Objects.requireNonNull(type, "type must not be null");
		return new NodeCollector(type::isInstance);
	}

	@Override
	protected void visitNode(@Nonnull Node node) {
		if (this.predicate.test(node)) {
			this.collected.add(node);
		}
		visitChildren(node);
	}

	/**
	 * Returns the nodes collected so far in pre-order.
	 *
	 * @return unmodifiable view of collected nodes
	 */
	@Nonnull
	public List<Node> getCollected() {
		return Collections.unmodifiableList(this.collected);
	}
}
