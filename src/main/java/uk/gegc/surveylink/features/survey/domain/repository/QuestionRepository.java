package uk.gegc.surveylink.features.survey.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.surveylink.features.survey.domain.model.Question;

import java.util.Set;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {

    @Query("SELECT q.prefillKey FROM Question q WHERE q.survey.id = :surveyId AND q.prefillKey IS NOT NULL")
    Set<String> findPrefillKeysBySurveyId(@Param("surveyId") Long surveyId);
}
