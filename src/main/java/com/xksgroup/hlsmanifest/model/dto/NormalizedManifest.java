package com.xksgroup.hlsmanifest.model.dto;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Normalized main manifest with the events raised while building it")
public class NormalizedManifest {

    @Schema(description = "True when the source was a bare media playlist wrapped in a synthesized main manifest")
    private boolean synthesizedMain;

    private ManifestDocument manifest;

    @Schema(description = "Parser and normalization warnings, in the order they were raised")
    private List<String> warnings;

    private List<String> infos;
}
