package uk.gegc.surveylink.features.survey.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param options allowed cell values of a {@link TableColumnType#SELECT} column
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TableColumn(
        String id,
        TableColumnType type,
        String label,
        List<String> options
) {

    public TableColumn {
        type = type == null ? TableColumnType.TEXT : type;
        options = options == null ? List.of() : List.copyOf(options);
    }
}
