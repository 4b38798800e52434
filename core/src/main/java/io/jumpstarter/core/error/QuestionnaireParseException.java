package io.jumpstarter.core.error;

/**
 * Thrown when a questionnaire document cannot be read, or when its shape does
 * not match the node model (missing or mistyped fields, a node that is both or
 * neither a question and a switch, unknown keys in strict mode).
 */
public final class QuestionnaireParseException extends QuestionnaireException {

    private static final long serialVersionUID = 1L;

    public QuestionnaireParseException(String message, String source) {
        super(message, source, Phase.PARSE);
    }

    public QuestionnaireParseException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.PARSE);
    }
}
