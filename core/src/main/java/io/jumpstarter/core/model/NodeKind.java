package io.jumpstarter.core.model;

/** Discriminant of a {@link QuestionNode}, decided when the document is parsed. */
public enum NodeKind {
    QUESTION,
    SWITCH
}
