package io.jumpstarter.core.validate;

/** Receives the facts a {@link TreeWalker} emits, in document order. */
public interface WalkListener {

    /** Called for every question, and for every switch with an explicit id. */
    void onIdDeclared(IdDeclaration declaration);

    /** Called for every non-empty {@code next_question} and answer {@code goto}. */
    void onReference(ReferenceEvent reference);
}
