package uk.gegc.surveylink.features.survey.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Type-specific settings of a question, stored as JSON.
 *
 * @param options   choices of a single or multiple choice question
 * @param columns   columns of a table question, in cell order
 * @param minRows   fewest rows a table answer may have; null for no bound
 * @param maxRows   most rows a table answer may have; null for no bound
 * @param canAddRow whether respondents may add rows beyond the initial ones
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record QuestionConfig(
        List<String> options,
        List<TableColumn> columns,
        Integer minRows,
        Integer maxRows,
        boolean canAddRow
) {

    public QuestionConfig {
        options = options == null ? List.of() : List.copyOf(options);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static QuestionConfig empty() {
        return new QuestionConfig(null, null, null, null, false);
    }

    public static QuestionConfig choices(List<String> options) {
        return new QuestionConfig(options, null, null, null, false);
    }

    public static QuestionConfig table(List<TableColumn> columns, Integer minRows, Integer maxRows) {
        return new QuestionConfig(null, columns, minRows, maxRows, true);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return options.isEmpty() && columns.isEmpty() && minRows == null && maxRows == null;
    }
}
