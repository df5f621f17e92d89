package uk.gegc.surveylink.features.survey.infra.handler;

import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.util.List;

/**
 * Checks a submitted answer against the rules of one {@link QuestionType}.
 * Values arrive as Jackson binds untyped JSON: strings, lists and maps.
 */
public abstract class AnswerHandler {

    public abstract QuestionType supportedType();

    /**
     * @param value a non-blank answer value
     * @throws ValidationException if the value does not fit the question
     */
    public abstract void validate(Question question, Object value) throws ValidationException;

    protected static String requireString(Question question, Object value) {
        if (!(value instanceof String s)) {
            throw new ValidationException("Answer to '" + question.getTitle() + "' must be a string");
        }
        return s;
    }

    protected static List<?> requireList(Question question, Object value, String expected) {
        if (!(value instanceof List<?> list)) {
            throw new ValidationException("Answer to '" + question.getTitle() + "' must be " + expected);
        }
        return list;
    }

    protected static void requireOption(Question question, List<String> options, String choice) {
        if (!options.contains(choice)) {
            throw new ValidationException("Answer '" + choice + "' to '" + question.getTitle() + "' is not one of the options");
        }
    }
}
