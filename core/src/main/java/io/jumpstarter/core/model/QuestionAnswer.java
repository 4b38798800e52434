package io.jumpstarter.core.model;

import java.util.Objects;

/**
 * A user's recorded answer to one question.
 *
 * @param question identifier of the answered question
 * @param answer   chosen answer label
 * @param value    numeric value associated with the choice
 */
public record QuestionAnswer(String question, String answer, int value) {

    public QuestionAnswer {
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(answer, "answer must not be null");
    }
}
