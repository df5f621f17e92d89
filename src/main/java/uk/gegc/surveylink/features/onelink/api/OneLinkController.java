package uk.gegc.surveylink.features.onelink.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.surveylink.features.onelink.api.dto.IssueLinkRequest;
import uk.gegc.surveylink.features.onelink.api.dto.IssueLinkResponse;
import uk.gegc.surveylink.features.onelink.api.dto.LinkPreviewDto;
import uk.gegc.surveylink.features.onelink.application.IssuedLink;
import uk.gegc.surveylink.features.onelink.application.LinkPreview;
import uk.gegc.surveylink.features.onelink.application.OneLinkService;

@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "One-Time Links", description = "Issue and inspect single-use survey links")
public class OneLinkController {

    private final OneLinkService oneLinkService;

    @PostMapping("/surveys/{surveyId}/links")
    @Operation(
            summary = "Issue a one-time link",
            description = "Creates an encrypted single-use link for the survey, optionally carrying prefilled answers."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Link issued",
                    content = @Content(schema = @Schema(implementation = IssueLinkResponse.class))),
            @ApiResponse(responseCode = "400", description = "Unknown prefill key or expiry out of range"),
            @ApiResponse(responseCode = "404", description = "Survey not found")
    })
    public ResponseEntity<IssueLinkResponse> issueLink(
            @Parameter(description = "Survey ID") @PathVariable Long surveyId,
            @RequestBody(required = false) IssueLinkRequest request) {

        IssueLinkRequest options = request != null ? request : new IssueLinkRequest(null, null);
        IssuedLink issued = LinkRejectedException.unwrap(
                oneLinkService.issueLink(surveyId, options.prefillData(), options.expiresAt()));

        log.info("Issued link {} for survey {}", issued.linkId(), surveyId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new IssueLinkResponse(issued.linkId(), issued.token(), issued.url(), issued.expiresAt()));
    }

    @GetMapping("/links/{token}/preview")
    @Operation(
            summary = "Preview a one-time link",
            description = "Validates the link without consuming it and returns its survey and prefill data."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Link is valid",
                    content = @Content(schema = @Schema(implementation = LinkPreviewDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid token"),
            @ApiResponse(responseCode = "410", description = "Link expired or already used")
    })
    public ResponseEntity<LinkPreviewDto> previewLink(
            @Parameter(description = "Link token") @PathVariable String token) {

        LinkPreview preview = LinkRejectedException.unwrap(oneLinkService.previewLink(token));
        return ResponseEntity.ok(new LinkPreviewDto(preview.linkId(), preview.surveyId(), preview.prefill(),
                preview.expiresAt()));
    }
}
