package org.jstats.cricketlens_api.modules.match_report.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import org.jstats.cricketlens_api.modules.match_report.ingest.MatchDocumentService;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Cricket Match Reports", description = "Aggregate a ball-by-ball match record into a text report.")
@Validated
@RestController
@RequestMapping("/api/cricket/reports")
public class MatchReportController {

    private static final String FILENAME_PATTERN = "^[A-Za-z0-9._-]{1,128}$";

    private final MatchDocumentService documentService;

    public MatchReportController(MatchDocumentService documentService) {
        this.documentService = documentService;
    }

    /**
     * Example:
     * POST /api/cricket/reports?filename=1254058.json with the match JSON as body
     */
    @Operation(
            summary = "Build a match report",
            description = "Parses a ball-by-ball match record and returns the rendered report, "
                    + "its indexing metadata and any data warnings.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = MatchReportResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "Malformed match record",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "500", description = "Internal Server Error",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public MatchReportResponse report(
            @RequestParam(name = "filename", defaultValue = "match.json")
            @Pattern(regexp = FILENAME_PATTERN, message = "filename may only contain letters, digits, '.', '_' and '-'")
            String filename,
            @RequestBody JsonNode match) {

        return MatchReportResponse.of(documentService.process(filename, match));
    }

    @Operation(
            summary = "Build a match report as plain text",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "422", description = "Malformed match record",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public String reportText(
            @RequestParam(name = "filename", defaultValue = "match.json")
            @Pattern(regexp = FILENAME_PATTERN, message = "filename may only contain letters, digits, '.', '_' and '-'")
            String filename,
            @RequestBody JsonNode match) {

        return documentService.process(filename, match).document().text();
    }
}
