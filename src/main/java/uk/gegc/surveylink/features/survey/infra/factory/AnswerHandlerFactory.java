package uk.gegc.surveylink.features.survey.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.features.survey.infra.handler.AnswerHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class AnswerHandlerFactory {

    private final Map<QuestionType, AnswerHandler> handlers = new EnumMap<>(QuestionType.class);

    public AnswerHandlerFactory(List<AnswerHandler> handlers) {
        handlers.forEach(handler -> this.handlers.put(handler.supportedType(), handler));
        log.info("Answer handlers registered for question types {}", this.handlers.keySet());
    }

    public AnswerHandler getHandler(QuestionType type) {
        AnswerHandler handler = handlers.get(type);
        if (handler == null) {
            throw new UnsupportedOperationException("No answer handler for question type " + type);
        }
        return handler;
    }
}
