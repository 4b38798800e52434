package io.jumpstarter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of identifier to node bindings, in declaration order.
 *
 * <p>
 * Built once by a single validation pass and published only when that pass
 * finds no violations. Thread-safe: the backing map is copied and
 * unmodifiable, so concurrent readers may share one instance.
 */
public final class IdentifierMap {

    private static final IdentifierMap EMPTY = new IdentifierMap(Map.of());

    private final Map<String, QuestionNode> nodes;

    /**
     * Creates a map from the given bindings. The bindings are copied; later
     * changes to the argument are not visible through this map.
     *
     * @param nodes identifier to node bindings
     */
    public IdentifierMap(Map<String, QuestionNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /** Returns the shared empty map. */
    public static IdentifierMap empty() {
        return EMPTY;
    }

    /**
     * Looks up the node bound to the given identifier.
     *
     * @param identifier a question or switch identifier
     * @return the node, or empty if nothing declares that identifier
     */
    public Optional<QuestionNode> getNode(String identifier) {
        return Optional.ofNullable(nodes.get(identifier));
    }

    /**
     * Looks up a question by identifier. Returns empty if the identifier is
     * unbound or bound to a switch.
     */
    public Optional<Question> getQuestion(String identifier) {
        QuestionNode node = nodes.get(identifier);
        return node instanceof Question question ? Optional.of(question) : Optional.empty();
    }

    public boolean contains(String identifier) {
        return nodes.containsKey(identifier);
    }

    /** Returns all identifiers in declaration order. */
    public Set<String> ids() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    /** Returns an unmodifiable view of the bindings. */
    public Map<String, QuestionNode> asMap() {
        return nodes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IdentifierMap other && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "IdentifierMap" + nodes.keySet();
    }
}
