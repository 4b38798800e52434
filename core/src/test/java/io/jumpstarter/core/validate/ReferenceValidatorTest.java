package io.jumpstarter.core.validate;

import static org.assertj.core.api.Assertions.assertThat;

import io.jumpstarter.core.model.IdentifierMap;
import io.jumpstarter.core.model.Question;
import io.jumpstarter.core.model.QuestionNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link ReferenceValidator}. */
class ReferenceValidatorTest {

    private final ReferenceValidator validator = new ReferenceValidator();

    @Test
    void reportsEveryUnresolvedReferenceInOrder() {
        IdentifierMap ids = new IdentifierMap(Map.<String, QuestionNode>of("known", Question.of("known", List.of())));
        List<ReferenceEvent> refs = List.of(
                new ReferenceEvent(Location.of("questions", 0, "next_question"), "missing-1"),
                new ReferenceEvent(Location.of("questions", 1, "next_question"), "known"),
                new ReferenceEvent(Location.of("questions", 2, "answers", 0, "goto"), "missing-2"));

        List<Violation> violations = validator.check(refs, ids);

        assertThat(violations)
                .containsExactly(
                        Violation.invalidReference(Location.of("questions", 0, "next_question"), "missing-1"),
                        Violation.invalidReference(Location.of("questions", 2, "answers", 0, "goto"), "missing-2"));
    }

    @Test
    void noReferencesNoViolations() {
        assertThat(validator.check(List.of(), IdentifierMap.empty())).isEmpty();
    }
}
