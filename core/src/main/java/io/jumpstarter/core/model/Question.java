package io.jumpstarter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A question with its answers.
 *
 * <p>
 * When {@code id} is absent the question text itself is the node's
 * identifier, so two id-less questions with the same text collide.
 *
 * @param question     prompt text
 * @param id           explicit identifier, or {@code null}
 * @param variable     variable the chosen answer is bound to, or {@code null}
 * @param answers      ordered answers
 * @param nextQuestion identifier of the node that follows, or {@code null}
 */
public record Question(String question, String id, String variable, List<Answer> answers, String nextQuestion)
        implements QuestionNode {

    public Question {
        Objects.requireNonNull(question, "question must not be null");
        answers = answers != null ? List.copyOf(answers) : List.of();
    }

    /** Creates a question without id, variable or next question. */
    public static Question of(String question, List<Answer> answers) {
        return new Question(question, null, null, answers, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.QUESTION;
    }

    /** Returns {@link #effectiveId()}; a question always declares an identifier. */
    @Override
    public String declaredId() {
        return effectiveId();
    }

    /** The explicit {@code id} when non-empty, otherwise the question text. */
    public String effectiveId() {
        return id != null && !id.isEmpty() ? id : question;
    }

    /** Returns {@code true} if a non-empty {@code next_question} is set. */
    public boolean hasNextQuestion() {
        return nextQuestion != null && !nextQuestion.isEmpty();
    }
}
