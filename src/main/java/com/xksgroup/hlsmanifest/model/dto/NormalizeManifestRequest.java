package com.xksgroup.hlsmanifest.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "Parsed manifest to normalize")
public class NormalizeManifestRequest {

    @NotBlank(message = "uri is required")
    @Schema(
        description = "Uri the manifest was loaded from. Base for every relative playlist uri.",
        example = "https://cdn.example.com/live/master.m3u8"
    )
    private String uri;

    @NotBlank(message = "manifest is required")
    @Schema(
        description = "Parser output as a JSON object (targetDuration, segments, playlists, mediaGroups...).",
        example = "{\"playlists\":[{\"uri\":\"low/index.m3u8\",\"attributes\":{\"BANDWIDTH\":800000}}],\"segments\":[]}"
    )
    private String manifest;

    @Schema(description = "Keep LL-HLS fields. Falls back to manifest.llhls when absent.", example = "true")
    private Boolean llhls;
}
