package uk.gegc.surveylink.features.survey.application;

import uk.gegc.surveylink.features.onelink.application.LinkResult;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseRequest;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseResponse;
import uk.gegc.surveylink.features.survey.api.dto.SurveyWithPrefillDto;

/**
 * Respondent-facing access to surveys through one-time links.
 */
public interface SurveyAccessService {

    /**
     * Opens the survey behind a link with prefilled answers. Does not consume the link.
     */
    LinkResult<SurveyWithPrefillDto> getSurveyByToken(String token);

    /**
     * Stores the answers and consumes the link. Answers are stored at most once per link.
     */
    LinkResult<SubmitResponseResponse> submitResponse(SubmitResponseRequest request, String ipAddress, String userAgent);
}
