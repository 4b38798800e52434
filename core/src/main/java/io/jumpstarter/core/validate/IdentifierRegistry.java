package io.jumpstarter.core.validate;

import io.jumpstarter.core.model.IdentifierMap;
import io.jumpstarter.core.model.QuestionNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates identifier bindings during one walk. The first node to declare
 * an identifier keeps it; every later declaration of the same identifier is a
 * {@link ViolationKind#DUPLICATE_ID} violation.
 *
 * <p>
 * Not thread-safe. Owned by a single validation run and frozen into an
 * {@link IdentifierMap} once the walk completes.
 */
public final class IdentifierRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(IdentifierRegistry.class);

    private final Map<String, QuestionNode> bindings = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Binds the declared identifier unless it is already taken.
     *
     * @param declaration the declaration to record
     * @return a duplicate-id violation at the declaration's location, or empty
     *         if the identifier was newly bound
     * @throws IllegalStateException if the registry has been frozen
     */
    public Optional<Violation> declare(IdDeclaration declaration) {
        if (frozen) {
            throw new IllegalStateException("Identifier registry is frozen");
        }
        String identifier = declaration.identifier();
        if (bindings.containsKey(identifier)) {
            LOG.debug("Duplicate id: id={}, location={}", identifier, declaration.location());
            return Optional.of(Violation.duplicateId(declaration.location(), identifier));
        }
        bindings.put(identifier, declaration.node());
        return Optional.empty();
    }

    /** Stops accepting declarations and returns the immutable map. */
    public IdentifierMap freeze() {
        frozen = true;
        return new IdentifierMap(bindings);
    }
}
