package io.jumpstarter.core.validate;

/** Kinds of structural violation, each with a stable machine-readable code. */
public enum ViolationKind {
    /** A question or switch declares an identifier already bound by an earlier node. */
    DUPLICATE_ID("duplicate_id"),

    /** A {@code next_question} or {@code goto} names no declared identifier. */
    INVALID_REFERENCE("invalid_reference");

    private final String code;

    ViolationKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
