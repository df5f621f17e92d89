package uk.gegc.surveylink.features.survey.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "survey_id", nullable = false)
    private Survey survey;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private QuestionType type;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "required", nullable = false)
    private boolean required;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @Convert(converter = QuestionConfigConverter.class)
    @Column(name = "config", length = 4000)
    private QuestionConfig config = QuestionConfig.empty();

    // Key a one-time link may prefill this question under; null when not prefillable
    @Column(name = "prefill_key", length = 100)
    private String prefillKey;

    public QuestionConfig getConfig() {
        return config == null ? QuestionConfig.empty() : config;
    }
}
