package com.xksgroup.hlsmanifest.controller;

import com.xksgroup.hlsmanifest.model.dto.NormalizeManifestRequest;
import com.xksgroup.hlsmanifest.model.dto.NormalizedManifest;
import com.xksgroup.hlsmanifest.service.ManifestLoaderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@Slf4j
@RestController
@RequestMapping("/hls-manifest/api/v1/manifests")
@RequiredArgsConstructor
@Tag(name = "Manifest normalization", description = "Turns parsed HLS manifests into a resolved playlist graph")
public class ManifestController {

    private final ManifestLoaderService manifestLoaderService;

    @PostMapping("/normalize")
    @Operation(
            summary = "Normalize a parsed manifest",
            description = "Defaults target durations, strips LL-HLS fields when disabled, assigns playlist ids "
                    + "and resolves every playlist uri against the manifest uri. A bare media playlist is "
                    + "wrapped in a synthesized main manifest."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Manifest normalized",
                    content = @Content(schema = @Schema(implementation = NormalizedManifest.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing field or unreadable manifest",
                    content = @Content
            )
    })
    public ResponseEntity<com.xksgroup.hlsmanifest.model.response.ApiResponse> normalize(
            @Parameter(description = "Manifest and the uri it was loaded from", required = true)
            @Valid @RequestBody NormalizeManifestRequest request,
            HttpServletRequest httpRequest) {
        log.debug("Normalize request for {}", request.getUri());
        NormalizedManifest result = manifestLoaderService.load(request.getManifest(), request.getUri(), request.getLlhls());

        return ResponseEntity.ok(new com.xksgroup.hlsmanifest.model.response.ApiResponse(
                true,
                HttpStatus.OK.value(),
                result.getWarnings().isEmpty() ? "Manifest normalized" : "Manifest normalized with warnings",
                result,
                Instant.now().toString(),
                httpRequest.getRequestURI()
        ));
    }
}
