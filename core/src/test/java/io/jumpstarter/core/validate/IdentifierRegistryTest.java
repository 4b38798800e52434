package io.jumpstarter.core.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jumpstarter.core.model.IdentifierMap;
import io.jumpstarter.core.model.Question;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link IdentifierRegistry}. */
class IdentifierRegistryTest {

    private final IdentifierRegistry registry = new IdentifierRegistry();

    @Test
    void firstDeclarationBindsAndLaterOnesAreDuplicates() {
        Question first = Question.of("first", List.of());
        Question second = Question.of("second", List.of());

        assertThat(registry.declare(new IdDeclaration(Location.of("questions", 0, "id"), "x", first)))
                .isEmpty();
        assertThat(registry.declare(new IdDeclaration(Location.of("questions", 1, "id"), "x", second)))
                .contains(Violation.duplicateId(Location.of("questions", 1, "id"), "x"));

        IdentifierMap map = registry.freeze();
        assertThat(map.getNode("x")).containsSame(first);
        assertThat(map.size()).isEqualTo(1);
    }

    @Test
    void freezeReturnsSnapshotAndRejectsFurtherDeclarations() {
        registry.declare(new IdDeclaration(Location.ROOT.append("id"), "a", Question.of("a", List.of())));

        IdentifierMap map = registry.freeze();

        assertThat(map.ids()).containsExactly("a");
        assertThatThrownBy(() -> registry.declare(
                        new IdDeclaration(Location.ROOT.append("id"), "b", Question.of("b", List.of()))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
        assertThat(map.contains("b")).isFalse();
    }
}
