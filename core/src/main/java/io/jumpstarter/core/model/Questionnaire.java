package io.jumpstarter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An unvalidated questionnaire document as produced by the parser. Becomes a
 * {@link ValidatedQuestionnaire} once the structural check passes.
 *
 * @param initialTemplate   template the generated output starts from
 * @param initialCommentary commentary shown before the first question
 * @param feedbackUrl       where users can send feedback, or {@code null}
 * @param questions         root question list
 */
public record Questionnaire(
        String initialTemplate, String initialCommentary, String feedbackUrl, List<QuestionNode> questions) {

    public Questionnaire {
        Objects.requireNonNull(initialTemplate, "initialTemplate must not be null");
        initialCommentary = initialCommentary != null ? initialCommentary : "";
        questions = questions != null ? List.copyOf(questions) : List.of();
    }

    /** Creates a questionnaire with only a template and root questions. */
    public static Questionnaire of(String initialTemplate, List<QuestionNode> questions) {
        return new Questionnaire(initialTemplate, "", null, questions);
    }
}
