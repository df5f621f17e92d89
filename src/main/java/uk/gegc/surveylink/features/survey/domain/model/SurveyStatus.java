package uk.gegc.surveylink.features.survey.domain.model;

public enum SurveyStatus {
    DRAFT,
    PUBLISHED,
    CLOSED
}
