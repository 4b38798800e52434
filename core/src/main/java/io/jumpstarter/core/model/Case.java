package io.jumpstarter.core.model;

import java.util.List;

/**
 * One branch of a {@link Switch}. Cases carry no identifier.
 *
 * @param value     discriminant value this case matches, or {@code null}
 * @param questions nodes of this branch, in document order
 */
public record Case(Integer value, List<QuestionNode> questions) {

    public Case {
        questions = questions != null ? List.copyOf(questions) : List.of();
    }
}
