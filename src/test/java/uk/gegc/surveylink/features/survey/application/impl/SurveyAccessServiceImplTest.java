package uk.gegc.surveylink.features.survey.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.surveylink.features.onelink.application.ConsumedLink;
import uk.gegc.surveylink.features.onelink.application.LinkAction;
import uk.gegc.surveylink.features.onelink.application.LinkErrorKind;
import uk.gegc.surveylink.features.onelink.application.LinkPreview;
import uk.gegc.surveylink.features.onelink.application.LinkResult;
import uk.gegc.surveylink.features.onelink.application.OneLinkService;
import uk.gegc.surveylink.features.survey.api.dto.AnswerRequest;
import uk.gegc.surveylink.features.survey.api.dto.QuestionWithPrefillDto;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseRequest;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseResponse;
import uk.gegc.surveylink.features.survey.api.dto.SurveyWithPrefillDto;
import uk.gegc.surveylink.features.survey.domain.model.Question;
import uk.gegc.surveylink.features.survey.domain.model.QuestionConfig;
import uk.gegc.surveylink.features.survey.domain.model.QuestionType;
import uk.gegc.surveylink.features.survey.domain.model.Survey;
import uk.gegc.surveylink.features.survey.domain.model.SurveyResponse;
import uk.gegc.surveylink.features.survey.domain.model.SurveyStatus;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyRepository;
import uk.gegc.surveylink.features.survey.domain.repository.SurveyResponseRepository;
import uk.gegc.surveylink.features.survey.infra.factory.AnswerHandlerFactory;
import uk.gegc.surveylink.features.survey.infra.handler.MultipleChoiceAnswerHandler;
import uk.gegc.surveylink.features.survey.infra.handler.SingleChoiceAnswerHandler;
import uk.gegc.surveylink.features.survey.infra.handler.TableAnswerHandler;
import uk.gegc.surveylink.features.survey.infra.handler.TextAnswerHandler;
import uk.gegc.surveylink.shared.exception.ResourceNotFoundException;
import uk.gegc.surveylink.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SurveyAccessServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String TOKEN = "token-abc";

    @Mock
    private OneLinkService oneLinkService;

    @Mock
    private SurveyRepository surveyRepository;

    @Mock
    private SurveyResponseRepository surveyResponseRepository;

    private SurveyAccessServiceImpl service;
    private Survey survey;

    @BeforeEach
    void setUp() {
        AnswerHandlerFactory handlers = new AnswerHandlerFactory(List.of(new TextAnswerHandler(),
                new SingleChoiceAnswerHandler(), new MultipleChoiceAnswerHandler(), new TableAnswerHandler()));
        service = new SurveyAccessServiceImpl(oneLinkService, surveyRepository, surveyResponseRepository,
                handlers, Clock.fixed(NOW, ZoneOffset.UTC));

        survey = new Survey();
        survey.setId(42L);
        survey.setTitle("Customer feedback");
        survey.setStatus(SurveyStatus.PUBLISHED);
        survey.addQuestion(question(1L, "Your name", true, 1, "name"));
        survey.addQuestion(question(2L, "Comments", false, 2, null));
    }

    private static Question question(Long id, String title, boolean required, int order, String prefillKey) {
        Question q = new Question();
        q.setId(id);
        q.setType(QuestionType.TEXT);
        q.setTitle(title);
        q.setRequired(required);
        q.setDisplayOrder(order);
        q.setPrefillKey(prefillKey);
        return q;
    }

    @SuppressWarnings("unchecked")
    private void consumeRunsAction() {
        ConsumedLink link = new ConsumedLink(7L, 42L, Map.of("name", "Alice"), NOW.plusSeconds(3600));
        when(oneLinkService.consumeLink(eq(TOKEN), any())).thenAnswer(inv -> {
            LinkAction<SubmitResponseResponse> action = inv.getArgument(1);
            return LinkResult.success(action.execute(link));
        });
    }

    @Test
    @DisplayName("getSurveyByToken: survey is returned with prefill values on matching questions")
    void getSurveyByToken_success() {
        when(oneLinkService.previewLink(TOKEN)).thenReturn(LinkResult.success(
                new LinkPreview(7L, 42L, Map.of("name", "Alice"), NOW.plusSeconds(3600))));
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));

        LinkResult<SurveyWithPrefillDto> result = service.getSurveyByToken(TOKEN);

        SurveyWithPrefillDto dto = result.value();
        assertThat(dto.id()).isEqualTo(42L);
        assertThat(dto.prefillData()).containsEntry("name", "Alice");
        assertThat(dto.questions()).extracting(QuestionWithPrefillDto::prefillValue).containsExactly("Alice", null);
    }

    @Test
    @DisplayName("getSurveyByToken: link rejection is passed through")
    void getSurveyByToken_rejected() {
        when(oneLinkService.previewLink(TOKEN)).thenReturn(LinkResult.failure(LinkErrorKind.TOKEN_EXPIRED, "expired"));

        LinkResult<SurveyWithPrefillDto> result = service.getSurveyByToken(TOKEN);

        assertThat(result.errorKind()).isEqualTo(LinkErrorKind.TOKEN_EXPIRED);
        verifyNoInteractions(surveyRepository);
    }

    @Test
    @DisplayName("getSurveyByToken: missing survey is not found")
    void getSurveyByToken_surveyGone() {
        when(oneLinkService.previewLink(TOKEN)).thenReturn(LinkResult.success(
                new LinkPreview(7L, 42L, Map.of(), NOW.plusSeconds(3600))));
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getSurveyByToken(TOKEN)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("submitResponse: answers are stored against the consumed link")
    void submitResponse_success() {
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));
        when(surveyResponseRepository.save(any(SurveyResponse.class))).thenAnswer(inv -> {
            SurveyResponse r = inv.getArgument(0);
            r.setId(100L);
            return r;
        });
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN,
                List.of(new AnswerRequest(1L, "Alice"), new AnswerRequest(2L, "Great service")));

        LinkResult<SubmitResponseResponse> result = service.submitResponse(request, "10.0.0.1", "x".repeat(300));

        assertThat(result.value().id()).isEqualTo(100L);
        assertThat(result.value().surveyId()).isEqualTo(42L);
        assertThat(result.value().submittedAt()).isEqualTo(NOW);

        ArgumentCaptor<SurveyResponse> saved = ArgumentCaptor.forClass(SurveyResponse.class);
        verify(surveyResponseRepository).save(saved.capture());
        assertThat(saved.getValue().getOneLinkId()).isEqualTo(7L);
        assertThat(saved.getValue().getAnswers()).hasSize(2);
        assertThat(saved.getValue().getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(saved.getValue().getUserAgent()).hasSize(256);
    }

    @Test
    @DisplayName("submitResponse: missing required answer fails the action")
    void submitResponse_requiredMissing() {
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN, List.of(new AnswerRequest(2L, "hi")));

        assertThatThrownBy(() -> service.submitResponse(request, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Question 1 is required");
        verify(surveyResponseRepository, never()).save(any());
    }

    @Test
    @DisplayName("submitResponse: blank value for a required question fails")
    void submitResponse_requiredBlank() {
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN, List.of(new AnswerRequest(1L, "  ")));

        assertThatThrownBy(() -> service.submitResponse(request, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("submitResponse: answers are checked against their question type")
    void submitResponse_typeRules() {
        Question plan = question(3L, "Plan", false, 3, null);
        plan.setType(QuestionType.SINGLE_CHOICE);
        plan.setConfig(QuestionConfig.choices(List.of("Basic", "Pro")));
        survey.addQuestion(plan);
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));

        SubmitResponseRequest notAnOption = new SubmitResponseRequest(TOKEN,
                List.of(new AnswerRequest(1L, "Alice"), new AnswerRequest(3L, "Enterprise")));
        SubmitResponseRequest numericText = new SubmitResponseRequest(TOKEN, List.of(new AnswerRequest(1L, 42)));

        assertThatThrownBy(() -> service.submitResponse(notAnOption, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'Enterprise'")
                .hasMessageContaining("not one of the options");
        assertThatThrownBy(() -> service.submitResponse(numericText, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("must be a string");
        verify(surveyResponseRepository, never()).save(any());
    }

    @Test
    @DisplayName("submitResponse: blank optional answers skip the type check")
    void submitResponse_blankOptionalSkipsTypeCheck() {
        Question plan = question(3L, "Plan", false, 3, null);
        plan.setType(QuestionType.SINGLE_CHOICE);
        plan.setConfig(QuestionConfig.choices(List.of("Basic", "Pro")));
        survey.addQuestion(plan);
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));
        when(surveyResponseRepository.save(any(SurveyResponse.class))).thenAnswer(inv -> inv.getArgument(0));
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN,
                List.of(new AnswerRequest(1L, "Alice"), new AnswerRequest(3L, "")));

        assertThat(service.submitResponse(request, null, null).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("submitResponse: foreign or duplicate questions fail")
    void submitResponse_foreignOrDuplicate() {
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));

        SubmitResponseRequest foreign = new SubmitResponseRequest(TOKEN,
                List.of(new AnswerRequest(1L, "Alice"), new AnswerRequest(99L, "x")));
        SubmitResponseRequest duplicate = new SubmitResponseRequest(TOKEN,
                List.of(new AnswerRequest(1L, "Alice"), new AnswerRequest(1L, "Bob")));

        assertThatThrownBy(() -> service.submitResponse(foreign, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("does not belong");
        assertThatThrownBy(() -> service.submitResponse(duplicate, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("submitResponse: unpublished survey does not accept responses")
    void submitResponse_notPublished() {
        survey.setStatus(SurveyStatus.CLOSED);
        consumeRunsAction();
        when(surveyRepository.findByIdWithQuestions(42L)).thenReturn(Optional.of(survey));
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN, List.of(new AnswerRequest(1L, "Alice")));

        assertThatThrownBy(() -> service.submitResponse(request, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not published");
    }

    @Test
    @DisplayName("submitResponse: link rejection is passed through without saving")
    void submitResponse_rejected() {
        when(oneLinkService.consumeLink(eq(TOKEN), any()))
                .thenReturn(LinkResult.failure(LinkErrorKind.LINK_ALREADY_USED, "used"));
        SubmitResponseRequest request = new SubmitResponseRequest(TOKEN, List.of(new AnswerRequest(1L, "Alice")));

        LinkResult<SubmitResponseResponse> result = service.submitResponse(request, null, null);

        assertThat(result.errorKind()).isEqualTo(LinkErrorKind.LINK_ALREADY_USED);
        verifyNoInteractions(surveyResponseRepository);
    }
}
