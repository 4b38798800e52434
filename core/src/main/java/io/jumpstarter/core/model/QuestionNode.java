package io.jumpstarter.core.model;

/**
 * A tree node that may appear in a question list: either a {@link Question} or
 * a {@link Switch}. Both share one global identifier namespace.
 */
public sealed interface QuestionNode permits Question, Switch {

    /** The node's discriminant. */
    NodeKind kind();

    /**
     * The identifier this node declares, or {@code null} if it declares none
     * (a switch without an explicit {@code id}).
     */
    String declaredId();
}
