package io.jumpstarter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One selectable answer of a {@link Question}. Carries no identifier and is
 * never a reference target.
 *
 * @param answer     answer label shown to the user
 * @param tooltip    optional hover text, {@code ""} when absent
 * @param templates  templates applied when this answer is chosen
 * @param gotoTarget identifier of the node to jump to, or {@code null}
 * @param commentary commentary emitted with this answer, {@code ""} when absent
 */
public record Answer(String answer, String tooltip, List<Template> templates, String gotoTarget, String commentary) {

    public Answer {
        Objects.requireNonNull(answer, "answer must not be null");
        tooltip = tooltip != null ? tooltip : "";
        templates = templates != null ? List.copyOf(templates) : List.of();
        commentary = commentary != null ? commentary : "";
    }

    /** Creates a plain answer with no templates, tooltip or jump. */
    public static Answer of(String answer) {
        return new Answer(answer, "", List.of(), null, "");
    }

    /** Creates an answer that jumps to the node with the given identifier. */
    public static Answer jumpingTo(String answer, String gotoTarget) {
        return new Answer(answer, "", List.of(), gotoTarget, "");
    }

    /** Returns {@code true} if this answer carries a non-empty {@code goto}. */
    public boolean hasGoto() {
        return gotoTarget != null && !gotoTarget.isEmpty();
    }
}
