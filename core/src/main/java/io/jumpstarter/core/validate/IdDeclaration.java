package io.jumpstarter.core.validate;

import io.jumpstarter.core.model.QuestionNode;
import java.util.Objects;

/**
 * A node declaring an identifier, as seen by the {@link TreeWalker}.
 *
 * @param location   location of the node's {@code id} field
 * @param identifier the declared identifier
 * @param node       the declaring question or switch
 */
public record IdDeclaration(Location location, String identifier, QuestionNode node) {

    public IdDeclaration {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(node, "node must not be null");
    }
}
