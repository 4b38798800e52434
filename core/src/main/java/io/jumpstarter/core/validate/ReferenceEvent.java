package io.jumpstarter.core.validate;

import java.util.Objects;

/**
 * A pending cross-reference ({@code next_question} or {@code goto}) collected
 * during the walk and checked once all identifiers are known.
 *
 * @param location location of the referencing field
 * @param target   the referenced identifier
 */
public record ReferenceEvent(Location location, String target) {

    public ReferenceEvent {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
