package io.jumpstarter.core.model;

import java.util.Objects;

/**
 * Code template attached to an {@link Answer}: when the answer is chosen,
 * {@code replacement} is substituted with {@code code}.
 *
 * @param replacement placeholder text to replace
 * @param code        code to insert in its place
 */
public record Template(String replacement, String code) {

    public Template {
        Objects.requireNonNull(replacement, "replacement must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }
}
