package uk.gegc.surveylink.features.survey.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionConfig;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.features.survey.domain.model.TableColumn;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.util.List;

/**
 * A table answer is a list of rows, each a list of string cells in column order.
 * Empty cells are allowed in every column type.
 */
@Component
public class TableAnswerHandler extends AnswerHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TABLE;
    }

    @Override
    public void validate(Question question, Object value) throws ValidationException {
        List<?> rows = requireList(question, value, "a list of rows");
        QuestionConfig config = question.getConfig();

        if (config.minRows() != null && config.minRows() > 0 && rows.size() < config.minRows()) {
            throw new ValidationException("'" + question.getTitle() + "' needs at least " + config.minRows()
                    + " rows, got " + rows.size());
        }
        if (config.maxRows() != null && config.maxRows() > 0 && rows.size() > config.maxRows()) {
            throw new ValidationException("'" + question.getTitle() + "' allows at most " + config.maxRows()
                    + " rows, got " + rows.size());
        }

        List<TableColumn> columns = config.columns();
        for (int r = 0; r < rows.size(); r++) {
            int rowNumber = r + 1;
            if (!(rows.get(r) instanceof List<?> cells)) {
                throw new ValidationException("Row " + rowNumber + " of '" + question.getTitle() + "' must be a list of cells");
            }
            if (cells.size() != columns.size()) {
                throw new ValidationException("Row " + rowNumber + " of '" + question.getTitle() + "' has "
                        + cells.size() + " cells, expected " + columns.size());
            }
            for (int c = 0; c < cells.size(); c++) {
                validateCell(question, rowNumber, columns.get(c), cells.get(c));
            }
        }
    }

    private static void validateCell(Question question, int rowNumber, TableColumn column, Object cell) {
        if (!(cell instanceof String value)) {
            throw new ValidationException("Row " + rowNumber + ", column '" + column.label() + "' of '"
                    + question.getTitle() + "' must be a string");
        }
        if (value.isEmpty()) {
            return;
        }
        switch (column.type()) {
            case NUMBER -> {
                try {
                    Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new ValidationException("Row " + rowNumber + ", column '" + column.label() + "' of '"
                            + question.getTitle() + "' must be a number");
                }
            }
            case SELECT -> {
                if (!column.options().contains(value)) {
                    throw new ValidationException("Row " + rowNumber + ", column '" + column.label() + "' of '"
                            + question.getTitle() + "' has '" + value + "', which is not one of the options");
                }
            }
            case TEXT -> {
            }
        }
    }
}
