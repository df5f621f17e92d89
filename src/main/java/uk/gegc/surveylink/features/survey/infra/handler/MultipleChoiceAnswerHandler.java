package uk.gegc.surveylink.features.survey.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.util.List;

@Component
public class MultipleChoiceAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    public void validate(Question question, Object value) throws ValidationException {
        List<?> choices = requireList(question, value, "a list of strings");
        List<String> options = question.getConfig().options();
        for (Object choice : choices) {
            if (!(choice instanceof String s)) {
                throw new ValidationException("Answer to '" + question.getTitle() + "' must be a list of strings");
            }
            requireOption(question, options, s);
        }
    }
}
