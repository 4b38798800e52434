package io.jumpstarter.core.model;

import io.jumpstarter.core.error.UnknownQuestionException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Answers collected in one questionnaire session. Immutable: {@link #record}
 * returns a new instance.
 *
 * @param answers   answers in the order they were given
 * @param timestamp when the session started
 */
public record QuestionAnswers(List<QuestionAnswer> answers, Instant timestamp) {

    public QuestionAnswers {
        answers = answers != null ? List.copyOf(answers) : List.of();
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /** Starts an empty session stamped with the current time. */
    public static QuestionAnswers empty() {
        return new QuestionAnswers(List.of(), Instant.now());
    }

    /**
     * Records an answer to the question bound to {@code questionId}.
     *
     * @param questionnaire validated questionnaire the session runs against
     * @param questionId    identifier of the answered question
     * @param answer        chosen answer label
     * @param value         numeric value of the choice
     * @return a new session with the answer appended
     * @throws UnknownQuestionException if {@code questionId} is not bound to a
     *                                  question
     */
    public QuestionAnswers record(ValidatedQuestionnaire questionnaire, String questionId, String answer, int value) {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");
        if (questionnaire.identifierMap().getQuestion(questionId).isEmpty()) {
            throw new UnknownQuestionException(
                    "No question with id '" + questionId + "'", questionId, null);
        }
        List<QuestionAnswer> next = new ArrayList<>(answers);
        next.add(new QuestionAnswer(questionId, answer, value));
        return new QuestionAnswers(next, timestamp);
    }
}
