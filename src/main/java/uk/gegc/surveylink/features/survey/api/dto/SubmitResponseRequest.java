package uk.gegc.surveylink.features.survey.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(name = "SubmitResponseRequest", description = "Answers submitted through a one-time link")
public record SubmitResponseRequest(
        @NotBlank(message = "token is required")
        String token,

        @NotEmpty(message = "answers must not be empty")
        List<@Valid AnswerRequest> answers
) {
}
