package uk.gegc.surveylink.features.survey.domain.model;

public enum TableColumnType {
    TEXT,
    NUMBER,
    SELECT
}
