package io.jumpstarter.core.validate;

import io.jumpstarter.core.model.IdentifierMap;
import io.jumpstarter.core.model.Questionnaire;
import io.jumpstarter.core.model.ValidatedQuestionnaire;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural validator for questionnaires.
 *
 * <p>
 * One call walks the whole tree, binding identifiers in a fresh
 * {@link IdentifierRegistry} and collecting references; once the walk is
 * complete every reference is checked against the final map. All violations
 * are returned together in a {@link ValidationResult}; expected failures are
 * never thrown.
 *
 * <p>
 * Thread-safe: each call owns its registry, and the walker and reference
 * validator are stateless. The questionnaire must not be mutated during the
 * call (the model records are immutable).
 */
public final class QuestionnaireValidator {

    private static final Logger LOG = LoggerFactory.getLogger(QuestionnaireValidator.class);

    private final TreeWalker walker;
    private final ReferenceValidator referenceValidator;

    public QuestionnaireValidator() {
        this(new TreeWalker(), new ReferenceValidator());
    }

    public QuestionnaireValidator(TreeWalker walker, ReferenceValidator referenceValidator) {
        this.walker = Objects.requireNonNull(walker, "walker must not be null");
        this.referenceValidator = Objects.requireNonNull(referenceValidator, "referenceValidator must not be null");
    }

    /**
     * Validates the questionnaire's structure.
     *
     * @param questionnaire the unvalidated document
     * @return VALID with the published identifier map, or REJECTED with every
     *         duplicate id and unresolved reference
     */
    public ValidationResult validate(Questionnaire questionnaire) {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");

        IdentifierRegistry registry = new IdentifierRegistry();
        List<Violation> violations = new ArrayList<>();
        List<ReferenceEvent> references = new ArrayList<>();

        walker.walk(questionnaire.questions(), new WalkListener() {
            @Override
            public void onIdDeclared(IdDeclaration declaration) {
                registry.declare(declaration).ifPresent(violations::add);
            }

            @Override
            public void onReference(ReferenceEvent reference) {
                references.add(reference);
            }
        });

        IdentifierMap identifiers = registry.freeze();
        violations.addAll(referenceValidator.check(references, identifiers));

        if (!violations.isEmpty()) {
            LOG.debug(
                    "Questionnaire rejected: violations={}, ids={}, references={}",
                    violations.size(),
                    identifiers.size(),
                    references.size());
            return ValidationResult.rejected(violations);
        }

        LOG.debug("Questionnaire validated: ids={}, references={}", identifiers.size(), references.size());
        return ValidationResult.valid(new ValidatedQuestionnaire(questionnaire, identifiers));
    }
}
