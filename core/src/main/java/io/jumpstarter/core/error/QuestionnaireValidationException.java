package io.jumpstarter.core.error;

import io.jumpstarter.core.validate.Violation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown at the loading boundary when a questionnaire is rejected. Carries
 * every violation found in the run, in the order they were reported.
 */
public final class QuestionnaireValidationException extends QuestionnaireException {

    private static final long serialVersionUID = 1L;

    /** Maximum number of violations spelled out in the exception message. */
    private static final int MESSAGE_LIMIT = 5;

    private final transient List<Violation> violations;

    public QuestionnaireValidationException(List<Violation> violations, String source) {
        super(summarize(violations), source, Phase.VALIDATION);
        this.violations = List.copyOf(violations);
    }

    /** All violations, never empty. */
    public List<Violation> violations() {
        return violations;
    }

    private static String summarize(List<Violation> violations) {
        String listed = violations.stream()
                .limit(MESSAGE_LIMIT)
                .map(Violation::toString)
                .collect(Collectors.joining("; "));
        int more = violations.size() - MESSAGE_LIMIT;
        return violations.size() + " validation error" + (violations.size() == 1 ? "" : "s")
                + " for Questionnaire: " + listed
                + (more > 0 ? " (and " + more + " more)" : "");
    }
}
