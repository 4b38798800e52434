package io.jumpstarter.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A questionnaire that passed structural validation, together with its
 * published identifier map. Immutable and thread-safe.
 *
 * @param questionnaire the validated document
 * @param identifierMap every declared identifier and its node
 */
public record ValidatedQuestionnaire(Questionnaire questionnaire, IdentifierMap identifierMap) {

    public ValidatedQuestionnaire {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");
        Objects.requireNonNull(identifierMap, "identifierMap must not be null");
    }

    /**
     * Looks up a question or switch by identifier.
     *
     * @param identifier explicit id, or question text for id-less questions
     * @return the node, or empty if no node declares the identifier
     */
    public Optional<QuestionNode> getNode(String identifier) {
        return identifierMap.getNode(identifier);
    }
}
