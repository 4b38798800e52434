package io.jumpstarter.core.error;

/** Thrown when an answer is recorded against an identifier that is not bound to a question. */
public final class UnknownQuestionException extends QuestionnaireException {

    private static final long serialVersionUID = 1L;

    private final String questionId;

    public UnknownQuestionException(String message, String questionId, String source) {
        super(message, source, Phase.LOOKUP);
        this.questionId = questionId;
    }

    /** The identifier that failed to resolve. */
    public String questionId() {
        return questionId;
    }
}
