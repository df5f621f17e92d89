package uk.gegc.surveylink.features.survey.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.surveylink.features.onelink.api.LinkRejectedException;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseRequest;
import uk.gegc.surveylink.features.survey.api.dto.SubmitResponseResponse;
import uk.gegc.surveylink.features.survey.api.dto.SurveyWithPrefillDto;
import uk.gegc.surveylink.features.survey.application.SurveyAccessService;
import uk.gegc.surveylink.shared.web.ClientIpResolver;

@Validated
@RestController
@RequestMapping("/api/v1/public")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Public Survey Access", description = "Respondent endpoints driven by one-time link tokens")
public class SurveyAccessController {

    private final SurveyAccessService surveyAccessService;
    private final ClientIpResolver clientIpResolver;

    @GetMapping("/surveys")
    @Operation(
            summary = "Load a survey through a one-time link",
            description = "Returns the survey with its questions and any prefilled answers. Does not consume the link."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Survey loaded",
                    content = @Content(schema = @Schema(implementation = SurveyWithPrefillDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid token"),
            @ApiResponse(responseCode = "404", description = "Survey not found"),
            @ApiResponse(responseCode = "410", description = "Link expired or already used")
    })
    public ResponseEntity<SurveyWithPrefillDto> getSurvey(
            @Parameter(description = "Link token") @RequestParam @NotBlank String token) {
        return ResponseEntity.ok(LinkRejectedException.unwrap(surveyAccessService.getSurveyByToken(token)));
    }

    @PostMapping("/responses")
    @Operation(
            summary = "Submit a survey response",
            description = "Stores the answers and consumes the link. A link accepts exactly one submission."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Response stored",
                    content = @Content(schema = @Schema(implementation = SubmitResponseResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid token or answers"),
            @ApiResponse(responseCode = "409", description = "Another submission with this link is in progress"),
            @ApiResponse(responseCode = "410", description = "Link expired or already used")
    })
    public ResponseEntity<SubmitResponseResponse> submitResponse(
            @Valid @RequestBody SubmitResponseRequest request,
            HttpServletRequest httpRequest) {

        String ipAddress = clientIpResolver.resolve(httpRequest);
        String userAgent = httpRequest.getHeader(HttpHeaders.USER_AGENT);
        SubmitResponseResponse response = LinkRejectedException.unwrap(
                surveyAccessService.submitResponse(request, ipAddress, userAgent));

        log.info("Response {} submitted for survey {}", response.id(), response.surveyId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
