package uk.gegc.surveylink.features.survey.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class QuestionConfigConverter implements AttributeConverter<QuestionConfig, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(QuestionConfig attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize question config", e);
        }
    }

    @Override
    public QuestionConfig convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return QuestionConfig.empty();
        }
        try {
            QuestionConfig parsed = OBJECT_MAPPER.readValue(dbData, QuestionConfig.class);
            return parsed != null ? parsed : QuestionConfig.empty();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize question config", e);
        }
    }
}
