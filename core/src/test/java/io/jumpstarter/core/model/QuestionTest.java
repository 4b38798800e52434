package io.jumpstarter.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class QuestionTest {

    @Test
    void effectiveIdPrefersExplicitId() {
        Question q = new Question("Text", "explicit", null, List.of(), null);

        assertThat(q.effectiveId()).isEqualTo("explicit");
        assertThat(q.declaredId()).isEqualTo("explicit");
        assertThat(q.kind()).isEqualTo(NodeKind.QUESTION);
    }

    @Test
    void effectiveIdFallsBackToTextWhenIdMissingOrEmpty() {
        assertThat(Question.of("Text", List.of()).effectiveId()).isEqualTo("Text");
        assertThat(new Question("Text", "", null, List.of(), null).effectiveId()).isEqualTo("Text");
    }

    @Test
    void answersAreCopied() {
        List<Answer> answers = new ArrayList<>(List.of(Answer.of("a")));
        Question q = Question.of("Text", answers);

        answers.add(Answer.of("b"));

        assertThat(q.answers()).hasSize(1);
        assertThatThrownBy(() -> q.answers().add(Answer.of("c"))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void answerDefaults() {
        Answer answer = new Answer("a", null, null, null, null);

        assertThat(answer.tooltip()).isEmpty();
        assertThat(answer.templates()).isEmpty();
        assertThat(answer.commentary()).isEmpty();
        assertThat(answer.hasGoto()).isFalse();
    }

    @Test
    void switchDeclaresOnlyNonEmptyId() {
        assertThat(new Switch("x", "s", List.of()).declaredId()).isEqualTo("s");
        assertThat(new Switch("x", "", List.of()).declaredId()).isNull();
        assertThat(new Switch("x", null, List.of()).kind()).isEqualTo(NodeKind.SWITCH);
    }
}
