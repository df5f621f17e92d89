package uk.gegc.surveylink.features.survey.api.dto;

import java.time.Instant;

public record SubmitResponseResponse(
        Long id,
        Long surveyId,
        Instant submittedAt,
        String message
) {
}
