package io.jumpstarter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Multi-way branch on an expression. Cases may nest further switches.
 *
 * @param switchExpression expression or variable being branched on
 * @param id               explicit identifier, or {@code null}; a switch without
 *                         one is not a reference target
 * @param cases            ordered cases
 */
public record Switch(String switchExpression, String id, List<Case> cases) implements QuestionNode {

    public Switch {
        Objects.requireNonNull(switchExpression, "switchExpression must not be null");
        cases = cases != null ? List.copyOf(cases) : List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH;
    }

    @Override
    public String declaredId() {
        return id != null && !id.isEmpty() ? id : null;
    }
}
