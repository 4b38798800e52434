package io.jumpstarter.core.validate;

import io.jumpstarter.core.model.Answer;
import io.jumpstarter.core.model.Case;
import io.jumpstarter.core.model.Question;
import io.jumpstarter.core.model.QuestionNode;
import io.jumpstarter.core.model.Switch;
import java.util.List;
import java.util.Objects;

/**
 * Depth-first, pre-order walk over a question list and every case nested
 * under its switches.
 *
 * <p>
 * Element {@code i} of a list reached at {@code loc} sits at
 * {@code loc + [questions, i]}; the questions of case {@code k} of a switch at
 * {@code s} are reached at {@code s + [cases, k]}. Every node is visited
 * exactly once and the walk always runs to the end.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class TreeWalker {

    static final String QUESTIONS = "questions";
    static final String ID = "id";
    static final String NEXT_QUESTION = "next_question";
    static final String ANSWERS = "answers";
    static final String GOTO = "goto";
    static final String CASES = "cases";

    /**
     * Walks the given root list, reporting to {@code listener}.
     *
     * @param roots    root question list
     * @param listener receiver of id declarations and references
     */
    public void walk(List<QuestionNode> roots, WalkListener listener) {
        Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        walk(roots, Location.ROOT, listener);
    }

    private void walk(List<QuestionNode> nodes, Location loc, WalkListener listener) {
        for (int i = 0; i < nodes.size(); i++) {
            QuestionNode node = nodes.get(i);
            Location nodeLoc = loc.append(QUESTIONS, i);
            switch (node.kind()) {
                case QUESTION -> visitQuestion((Question) node, nodeLoc, listener);
                case SWITCH -> visitSwitch((Switch) node, nodeLoc, listener);
            }
        }
    }

    private void visitQuestion(Question question, Location loc, WalkListener listener) {
        listener.onIdDeclared(new IdDeclaration(loc.append(ID), question.effectiveId(), question));

        if (question.hasNextQuestion()) {
            listener.onReference(new ReferenceEvent(loc.append(NEXT_QUESTION), question.nextQuestion()));
        }

        List<Answer> answers = question.answers();
        for (int j = 0; j < answers.size(); j++) {
            Answer answer = answers.get(j);
            if (answer.hasGoto()) {
                listener.onReference(new ReferenceEvent(loc.append(ANSWERS, j, GOTO), answer.gotoTarget()));
            }
        }
    }

    private void visitSwitch(Switch node, Location loc, WalkListener listener) {
        String id = node.declaredId();
        if (id != null) {
            listener.onIdDeclared(new IdDeclaration(loc.append(ID), id, node));
        }

        List<Case> cases = node.cases();
        for (int k = 0; k < cases.size(); k++) {
            walk(cases.get(k).questions(), loc.append(CASES, k), listener);
        }
    }
}
