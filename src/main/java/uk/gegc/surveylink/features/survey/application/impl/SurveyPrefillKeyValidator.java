package uk.gegc.surveylink.features.survey.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.surveylink.features.onelink.application.PrefillKeyValidator;
import uk.gegc.surveylink.features.survey.domain.repository.QuestionRepository;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyRepository;
import uk.gegc.surveylink.shared.exception.ResourceNotFoundException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A prefill key is valid when a question of the survey declares it as its {@code prefillKey}.
 */
@Component
@RequiredArgsConstructor
public class SurveyPrefillKeyValidator implements PrefillKeyValidator {

    private final SurveyRepository surveyRepository;
    private final QuestionRepository questionRepository;

    @Override
    @Transactional(readOnly = true)
    public Set<String> invalidKeys(Long surveyId, Set<String> keys) {
        if (!surveyRepository.existsById(surveyId)) {
            throw new ResourceNotFoundException("Survey " + surveyId + " not found");
        }
        if (keys == null || keys.isEmpty()) {
            return Set.of();
        }
        Set<String> declared = questionRepository.findPrefillKeysBySurveyId(surveyId);
        Set<String> invalid = new LinkedHashSet<>(keys);
        invalid.removeAll(declared);
        return invalid;
    }
}
