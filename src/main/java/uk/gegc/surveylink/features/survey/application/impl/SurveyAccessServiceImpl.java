package uk.gegc.surveylink.features.survey.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.surveylink.features.onelink.application.ConsumedLink;
import uk.gegc.surveylink.features.onelink.application.LinkPreview;
import uk.gegc.surveylink.features.onelink.application.LinkResult;
import uk.gegc.surveylink.features.onelink.application.OneLinkService;
import uk.gegc.surveylink.features.survey.api.dto.AnswerRequest;
import uk.gegc.surveylink.features.survey.api.dto.QuestionWithPrefillDto;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseRequest;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseResponse;
import uk.gegc.surveylink.features.survey.api.dto.SurveyWithPrefillDto;
import uk.gegc.surveylink.features.survey.application.SurveyAccessService;
import uk.gegc.surveylink.features.survey.domain.model.Answer;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.Survey;
import uk.gegc.surveylink.features.survey.domain.model.SurveyResponse;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyRepository;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyResponseRepository;
import uk.gegc.surveylink.features.survey.infra.factory.AnswerHandlerFactory;
import uk.gegc.surveylink.shared.exception.ResourceNotFoundException;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Not transactional: submissions run inside the link consumption transaction,
 * which must commit before the consumption lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyAccessServiceImpl implements SurveyAccessService {

    private static final int MAX_USER_AGENT_LENGTH = 256;

    private final OneLinkService oneLinkService;
    private final SurveyRepository surveyRepository;
    private final SurveyResponseRepository surveyResponseRepository;
    private final AnswerHandlerFactory answerHandlerFactory;
    private final Clock clock;

    @Override
    public LinkResult<SurveyWithPrefillDto> getSurveyByToken(String token) {
        LinkResult<LinkPreview> preview = oneLinkService.previewLink(token);
        if (preview.isFailure()) {
            return LinkResult.failure(preview.error());
        }
        LinkPreview link = preview.value();
        Survey survey = surveyRepository.findByIdWithQuestions(link.surveyId())
                .orElseThrow(() -> new ResourceNotFoundException("Survey " + link.surveyId() + " not found"));
        return LinkResult.success(toDto(survey, link.prefill()));
    }

    @Override
    public LinkResult<SubmitResponseResponse> submitResponse(SubmitResponseRequest request, String ipAddress,
                                                             String userAgent) {
        return oneLinkService.consumeLink(request.token(), link -> saveResponse(link, request.answers(), ipAddress, userAgent));
    }

    private SubmitResponseResponse saveResponse(ConsumedLink link, List<AnswerRequest> answers,
                                                String ipAddress, String userAgent) {
        Survey survey = surveyRepository.findByIdWithQuestions(link.surveyId())
                .orElseThrow(() -> new ResourceNotFoundException("Survey " + link.surveyId() + " not found"));
        if (!survey.isPublished()) {
            throw new ValidationException("Survey " + survey.getId() + " is not published");
        }
        validateAnswers(survey.getQuestions(), answers);

        SurveyResponse response = new SurveyResponse();
        response.setSurveyId(survey.getId());
        response.setOneLinkId(link.linkId());
        response.setAnswers(answers.stream()
                .map(a -> new Answer(a.questionId(), a.value()))
                .toList());
        response.setIpAddress(ipAddress);
        response.setUserAgent(truncate(userAgent));
        response.setSubmittedAt(clock.instant());
        SurveyResponse saved = surveyResponseRepository.save(response);

        log.info("Stored response {} for survey {} via link {}", saved.getId(), survey.getId(), link.linkId());
        return new SubmitResponseResponse(saved.getId(), saved.getSurveyId(), saved.getSubmittedAt(),
                "Response submitted successfully");
    }

    private void validateAnswers(Collection<Question> questions, List<AnswerRequest> answers) {
        Map<Long, Question> byId = questions.stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
        Set<Long> answered = new HashSet<>();
        for (AnswerRequest answer : answers) {
            if (!byId.containsKey(answer.questionId())) {
                throw new ValidationException("Question " + answer.questionId() + " does not belong to this survey");
            }
            if (!answered.add(answer.questionId())) {
                throw new ValidationException("Question " + answer.questionId() + " is answered more than once");
            }
            Question question = byId.get(answer.questionId());
            if (isBlank(answer.value())) {
                if (question.isRequired()) {
                    throw new ValidationException("Question " + answer.questionId() + " is required");
                }
                continue;
            }
            answerHandlerFactory.getHandler(question.getType()).validate(question, answer.value());
        }
        for (Question question : questions) {
            if (question.isRequired() && !answered.contains(question.getId())) {
                throw new ValidationException("Question " + question.getId() + " is required");
            }
        }
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }

    private static String truncate(String userAgent) {
        if (userAgent == null) {
            return null;
        }
        return userAgent.length() > MAX_USER_AGENT_LENGTH ? userAgent.substring(0, MAX_USER_AGENT_LENGTH) : userAgent;
    }

    private static SurveyWithPrefillDto toDto(Survey survey, Map<String, Object> prefill) {
        List<QuestionWithPrefillDto> questions = survey.getQuestions().stream()
                .map(q -> new QuestionWithPrefillDto(
                        q.getId(),
                        q.getType(),
                        q.getTitle(),
                        q.getDescription(),
                        q.isRequired(),
                        q.getDisplayOrder(),
                        q.getPrefillKey(),
                        q.getConfig().isEmpty() ? null : q.getConfig(),
                        q.getPrefillKey() != null ? prefill.get(q.getPrefillKey()) : null
                ))
                .toList();
        return new SurveyWithPrefillDto(survey.getId(), survey.getTitle(), survey.getDescription(), questions, prefill);
    }
}
