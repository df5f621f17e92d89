package uk.gegc.surveylink.features.survey.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.shared.exception.ValidationException;

@Component
public class TextAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TEXT;
    }

    @Override
    public void validate(Question question, Object value) throws ValidationException {
        requireString(question, value);
    }
}
