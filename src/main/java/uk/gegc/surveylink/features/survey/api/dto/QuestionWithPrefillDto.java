package uk.gegc.surveylink.features.survey.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.surveylink.features.survey.domain.model.QuestionConfig;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;

@Schema(name = "QuestionWithPrefill", description = "Survey question with the value prefilled by the access link")
public record QuestionWithPrefillDto(
        Long id,
        QuestionType type,
        String title,
        String description,
        boolean required,
        int displayOrder,
        String prefillKey,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        QuestionConfig config,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        Object prefillValue
) {
}
