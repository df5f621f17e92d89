package uk.gegc.surveylink.features.survey.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.surveylink.features.survey.domain.repository.QuestionRepository;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyRepository;
import uk.gegc.surveylink.shared.exception.ResourceNotFoundException;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SurveyPrefillKeyValidatorTest {

    @Mock
    private SurveyRepository surveyRepository;

    @Mock
    private QuestionRepository questionRepository;

    @InjectMocks
    private SurveyPrefillKeyValidator validator;

    @Test
    @DisplayName("invalidKeys: keys without a matching question are returned")
    void invalidKeys_unknownKeys() {
        when(surveyRepository.existsById(1L)).thenReturn(true);
        when(questionRepository.findPrefillKeysBySurveyId(1L)).thenReturn(Set.of("name", "email"));

        assertThat(validator.invalidKeys(1L, Set.of("name", "phone"))).containsExactly("phone");
    }

    @Test
    @DisplayName("invalidKeys: all declared keys pass")
    void invalidKeys_allDeclared() {
        when(surveyRepository.existsById(1L)).thenReturn(true);
        when(questionRepository.findPrefillKeysBySurveyId(1L)).thenReturn(Set.of("name", "email"));

        assertThat(validator.invalidKeys(1L, Set.of("name", "email"))).isEmpty();
    }

    @Test
    @DisplayName("invalidKeys: empty key set skips the question lookup")
    void invalidKeys_empty() {
        when(surveyRepository.existsById(1L)).thenReturn(true);

        assertThat(validator.invalidKeys(1L, Set.of())).isEmpty();
        verifyNoInteractions(questionRepository);
    }

    @Test
    @DisplayName("invalidKeys: unknown survey is not found")
    void invalidKeys_unknownSurvey() {
        when(surveyRepository.existsById(9L)).thenReturn(false);

        assertThatThrownBy(() -> validator.invalidKeys(9L, Set.of("name")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("9");
    }
}
