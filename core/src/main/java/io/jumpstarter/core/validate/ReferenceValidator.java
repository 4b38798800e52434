package io.jumpstarter.core.validate;

import io.jumpstarter.core.model.IdentifierMap;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks collected references against a complete {@link IdentifierMap}.
 * Runs after the walk, so a reference to a node declared later in the
 * document or in another switch branch resolves.
 */
public final class ReferenceValidator {

    /**
     * Returns one {@link ViolationKind#INVALID_REFERENCE} violation per
     * unresolved reference, in the order the references were collected.
     */
    public List<Violation> check(List<ReferenceEvent> references, IdentifierMap identifiers) {
        List<Violation> violations = new ArrayList<>();
        for (ReferenceEvent reference : references) {
            if (!identifiers.contains(reference.target())) {
                violations.add(Violation.invalidReference(reference.location(), reference.target()));
            }
        }
        return violations;
    }
}
