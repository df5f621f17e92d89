package uk.gegc.surveylink.features.survey.domain.model;

/**
 * One answered question inside a {@link SurveyResponse}. {@code value} is a scalar or a list.
 */
public record Answer(Long questionId, Object value) {
}
