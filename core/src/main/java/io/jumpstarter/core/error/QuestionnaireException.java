package io.jumpstarter.core.error;

/**
 * Abstract base for all questionnaire exceptions. Never thrown directly; use
 * one of the concrete subclasses.
 */
public abstract class QuestionnaireException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        VALIDATION,
        LOOKUP
    }

    private final String source;
    private final Phase phase;

    protected QuestionnaireException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected QuestionnaireException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The file path or resource the questionnaire came from, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
