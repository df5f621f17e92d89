package uk.gegc.surveylink.features.survey.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(name = "SurveyWithPrefill", description = "Survey opened through a one-time link")
public record SurveyWithPrefillDto(
        Long id,
        String title,
        String description,
        List<QuestionWithPrefillDto> questions,
        Map<String, Object> prefillData
) {
}
