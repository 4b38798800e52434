package io.jumpstarter.core.validate;

import io.jumpstarter.core.error.QuestionnaireValidationException;
import io.jumpstarter.core.model.ValidatedQuestionnaire;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a questionnaire. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#VALID}: {@code questionnaire} holds the validated value
 * and its published identifier map.
 * <li>{@link Type#REJECTED}: {@code violations} holds every defect found,
 * duplicate ids first, then unresolved references, each in document order.
 * </ul>
 */
public final class ValidationResult {

    /** The type of validation outcome. */
    public enum Type {
        VALID,
        REJECTED
    }

    private final Type type;
    private final ValidatedQuestionnaire questionnaire;
    private final List<Violation> violations;

    private ValidationResult(Type type, ValidatedQuestionnaire questionnaire, List<Violation> violations) {
        this.type = type;
        this.questionnaire = questionnaire;
        this.violations = violations;
    }

    /** Creates a VALID result. */
    public static ValidationResult valid(ValidatedQuestionnaire questionnaire) {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null for VALID");
        return new ValidationResult(Type.VALID, questionnaire, List.of());
    }

    /** Creates a REJECTED result; {@code violations} must not be empty. */
    public static ValidationResult rejected(List<Violation> violations) {
        Objects.requireNonNull(violations, "violations must not be null for REJECTED");
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("REJECTED result requires at least one violation");
        }
        return new ValidationResult(Type.REJECTED, null, List.copyOf(violations));
    }

    public Type type() {
        return type;
    }

    /** Returns the validated questionnaire. Only valid when {@code type() == VALID}. */
    public ValidatedQuestionnaire questionnaire() {
        return questionnaire;
    }

    /** Returns all violations; empty when {@code type() == VALID}. */
    public List<Violation> violations() {
        return violations;
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    /**
     * Returns the validated questionnaire or throws one exception carrying every
     * violation.
     *
     * @param source where the questionnaire came from, for error context; may be null
     * @throws QuestionnaireValidationException if the result is REJECTED
     */
    public ValidatedQuestionnaire orElseThrow(String source) {
        if (type == Type.REJECTED) {
            throw new QuestionnaireValidationException(violations, source);
        }
        return questionnaire;
    }

    /** Same as {@link #orElseThrow(String)} without a source. */
    public ValidatedQuestionnaire orElseThrow() {
        return orElseThrow(null);
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "ValidationResult[VALID, ids=" + questionnaire.identifierMap().size() + "]";
            case REJECTED -> "ValidationResult[REJECTED, violations=" + violations.size() + "]";
        };
    }
}
