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
 * One rendition: either a variant stream of a main manifest or a playlist
 * nested under an alternate rendition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MediaPlaylist {
    private String id;              // "{index}-{uri}", see PlaylistIdentityHelper
    private String uri;
    private String resolvedUri;
    private Map<String, Object> attributes; // EXT-X-STREAM-INF attributes (BANDWIDTH, CODECS, AUDIO...)
    private List<Segment> segments;
    private Double targetDuration;
    private Double partTargetDuration;

    @JsonIgnore
    private int errorCount;

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

    public Object getAttribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }
}
