package uk.gegc.surveylink.features.survey.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.shared.exception.ValidationException;

@Component
public class SingleChoiceAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SINGLE_CHOICE;
    }

    @Override
    public void validate(Question question, Object value) throws ValidationException {
        String choice = requireString(question, value);
        requireOption(question, question.getConfig().options(), choice);
    }
}
