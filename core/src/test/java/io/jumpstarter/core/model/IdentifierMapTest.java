package io.jumpstarter.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IdentifierMapTest {

    private final Question question = Question.of("Q", List.of());
    private final Switch sw = new Switch("x", "s", List.of());

    @Test
    void lookupsByKind() {
        IdentifierMap map = new IdentifierMap(Map.of("Q", question, "s", sw));

        assertThat(map.getNode("s")).containsSame(sw);
        assertThat(map.getQuestion("Q")).containsSame(question);
        assertThat(map.getQuestion("s")).isEmpty();
        assertThat(map.getNode("nope")).isEmpty();
    }

    @Test
    void isDetachedFromSourceMapAndUnmodifiable() {
        Map<String, QuestionNode> source = new LinkedHashMap<>();
        source.put("Q", question);
        IdentifierMap map = new IdentifierMap(source);

        source.put("s", sw);

        assertThat(map.size()).isEqualTo(1);
        assertThatThrownBy(() -> map.asMap().put("s", sw)).isInstanceOf(UnsupportedOperationException.class);
    }
}
