package com.xksgroup.hlsmanifest.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestProperties {

    // keep LL-HLS fields (parts, preload hints, server control) after parsing
    @Builder.Default
    private boolean llhls = true;

    // base uri of a main manifest synthesized around a bare media playlist
    @Builder.Default
    private String playbackContextUri = "http://localhost/";

    // first nested rendition playlist gets the group id as uri, later ones their playlist id
    @Builder.Default
    private boolean legacyMediaGroupUris = true;
}
