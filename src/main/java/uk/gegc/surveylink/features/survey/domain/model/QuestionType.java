package uk.gegc.surveylink.features.survey.domain.model;

/**
 * How a question is answered. Choice and table questions read their options and columns from
 * {@link QuestionConfig}.
 */
public enum QuestionType {
    /** Free text, answered with a string. */
    TEXT,
    /** One string drawn from the options. */
    SINGLE_CHOICE,
    /** A list of strings drawn from the options. */
    MULTIPLE_CHOICE,
    /** Rows of string cells, one cell per configured column. */
    TABLE
}
