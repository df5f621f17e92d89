package uk.gegc.surveylink.features.survey.infra.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionConfig;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.features.survey.domain.model.TableColumn;
import uk.gegc.surveylink.features.survey.domain.model.TableColumnType;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableAnswerHandlerTest {

    private TableAnswerHandler handler;
    private ObjectMapper mapper;
    private Question question;

    @BeforeEach
    void setUp() {
        handler = new TableAnswerHandler();
        mapper = new ObjectMapper();
        question = new Question();
        question.setType(QuestionType.TABLE);
        question.setTitle("Household");
        question.setConfig(QuestionConfig.table(List.of(
                new TableColumn("name", TableColumnType.TEXT, "Name", null),
                new TableColumn("age", TableColumnType.NUMBER, "Age", null),
                new TableColumn("role", TableColumnType.SELECT, "Role", List.of("Parent", "Child"))
        ), 1, 3));
    }

    private Object answer(String json) throws Exception {
        return mapper.readValue(json, Object.class);
    }

    @Test
    void supportsTable() {
        assertEquals(QuestionType.TABLE, handler.supportedType());
    }

    @Test
    void validRows() throws Exception {
        Object value = answer("""
                [["Ann","41","Parent"],["Ben","9.5","Child"]]
                """);
        assertDoesNotThrow(() -> handler.validate(question, value));
    }

    @Test
    void emptyCellsAreAllowedInEveryColumnType() throws Exception {
        Object value = answer("""
                [["","",""]]
                """);
        assertDoesNotThrow(() -> handler.validate(question, value));
    }

    @Test
    void tooFewRows_throws() throws Exception {
        Object value = answer("[]");
        ValidationException ex = assertThrows(ValidationException.class, () -> handler.validate(question, value));
        assertTrue(ex.getMessage().contains("at least 1 rows"));
    }

    @Test
    void tooManyRows_throws() throws Exception {
        Object value = answer("""
                [["a","1","Parent"],["b","2","Parent"],["c","3","Child"],["d","4","Child"]]
                """);
        ValidationException ex = assertThrows(ValidationException.class, () -> handler.validate(question, value));
        assertTrue(ex.getMessage().contains("at most 3 rows"));
    }

    @Test
    void wrongColumnCount_throws() throws Exception {
        Object value = answer("""
                [["Ann","41"]]
                """);
        ValidationException ex = assertThrows(ValidationException.class, () -> handler.validate(question, value));
        assertTrue(ex.getMessage().contains("has 2 cells, expected 3"));
    }

    @Test
    void nonNumericNumberCell_throws() throws Exception {
        Object value = answer("""
                [["Ann","forty","Parent"]]
                """);
        ValidationException ex = assertThrows(ValidationException.class, () -> handler.validate(question, value));
        assertTrue(ex.getMessage().contains("column 'Age'"));
    }

    @Test
    void selectCellOutsideOptions_throws() throws Exception {
        Object value = answer("""
                [["Ann","41","Grandparent"]]
                """);
        ValidationException ex = assertThrows(ValidationException.class, () -> handler.validate(question, value));
        assertTrue(ex.getMessage().contains("'Grandparent'"));
    }

    @Test
    void nonStringCell_throws() throws Exception {
        Object value = answer("""
                [["Ann",41,"Parent"]]
                """);
        assertThrows(ValidationException.class, () -> handler.validate(question, value));
    }

    @Test
    void rowThatIsNotAList_throws() throws Exception {
        Object value = answer("""
                ["Ann"]
                """);
        assertThrows(ValidationException.class, () -> handler.validate(question, value));
    }

    @Test
    void notAList_throws() {
        assertThrows(ValidationException.class, () -> handler.validate(question, "Ann"));
    }

    @Test
    void noRowBoundsWhenUnset() throws Exception {
        question.setConfig(QuestionConfig.table(List.of(new TableColumn("n", TableColumnType.TEXT, "N", null)),
                null, null));
        Object value = answer("[]");
        assertDoesNotThrow(() -> handler.validate(question, value));
    }
}
