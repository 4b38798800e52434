package io.jumpstarter.core;

import io.jumpstarter.core.error.QuestionnaireParseException;
import io.jumpstarter.core.error.QuestionnaireValidationException;
import io.jumpstarter.core.model.Questionnaire;
import io.jumpstarter.core.model.ValidatedQuestionnaire;
import io.jumpstarter.core.spec.QuestionnaireParser;
import io.jumpstarter.core.validate.QuestionnaireValidator;
import io.jumpstarter.core.validate.ValidationResult;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses and validates a questionnaire document in one step.
 *
 * <p>
 * The returned {@link ValidatedQuestionnaire} is immutable and may be held and
 * shared for the life of the process. Validation is not re-run afterwards.
 */
public final class QuestionnaireLoader {

    private static final Logger LOG = LoggerFactory.getLogger(QuestionnaireLoader.class);

    private final QuestionnaireParser parser;
    private final QuestionnaireValidator validator;

    /** Creates a loader with a lenient parser and the default validator. */
    public QuestionnaireLoader() {
        this(new QuestionnaireParser(), new QuestionnaireValidator());
    }

    public QuestionnaireLoader(QuestionnaireParser parser, QuestionnaireValidator validator) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Loads the questionnaire file at the given path.
     *
     * @param path path to a YAML or JSON questionnaire document
     * @return the validated questionnaire with its identifier map
     * @throws QuestionnaireParseException      if the file cannot be read or its
     *                                          shape is invalid
     * @throws QuestionnaireValidationException if any structural violation is
     *                                          found
     */
    public ValidatedQuestionnaire load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return validate(parser.parse(path), path.toString());
    }

    /**
     * Loads a questionnaire document held in memory.
     *
     * @param content YAML or JSON text
     * @param source  name used in log lines and error messages, may be null
     * @return the validated questionnaire with its identifier map
     */
    public ValidatedQuestionnaire load(String content, String source) {
        return validate(parser.parse(content, source), source);
    }

    private ValidatedQuestionnaire validate(Questionnaire questionnaire, String source) {
        ValidationResult result = validator.validate(questionnaire);
        if (result.isRejected()) {
            LOG.warn(
                    "Questionnaire rejected: source={}, violations={}, first={}",
                    source,
                    result.violations().size(),
                    result.violations().get(0));
            return result.orElseThrow(source);
        }
        ValidatedQuestionnaire validated = result.questionnaire();
        LOG.info(
                "Questionnaire loaded: source={}, rootNodes={}, ids={}",
                source,
                questionnaire.questions().size(),
                validated.identifierMap().size());
        return validated;
    }
}
