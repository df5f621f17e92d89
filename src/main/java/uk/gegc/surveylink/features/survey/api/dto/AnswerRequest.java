package uk.gegc.surveylink.features.survey.api.dto;

import jakarta.validation.constraints.NotNull;

public record AnswerRequest(
        @NotNull(message = "questionId is required")
        Long questionId,
        Object value
) {
}
