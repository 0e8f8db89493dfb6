package com.xksgroup.hlsmanifest.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed manifest. A main (multivariant) manifest carries
 * {@code playlists} and {@code mediaGroups}; a bare media playlist carries
 * only {@code segments}.
 * <p>
 * Built once per parse, mutated in place by the normalization passes and
 * discarded on the next refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManifestDocument {
    private String uri;
    private String resolvedUri;
    private Double targetDuration;
    private Double partTargetDuration;
    private List<Segment> segments;
    private PlaylistTable playlists;

    // type -> group -> label -> rendition
    private Map<String, Map<String, Map<String, RenditionDescriptor>>> mediaGroups;

    // LL-HLS
    private Map<String, Object> serverControl;
    private Map<String, Object> partInf;
    private Map<String, Object> skip;
    private Segment preloadSegment;
    private List<Map<String, Object>> renditionReports;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @JsonAnySetter
    public void setProperty(String name, Object value) {
        properties.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    @JsonIgnore
    public boolean isMain() {
        return playlists != null;
    }
}
