package com.xksgroup.hlsmanifest.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Segment {
    private String uri;
    private Double duration;                      // seconds (EXTINF)
    private List<PartialSegment> parts;           // LL-HLS EXT-X-PART
    private List<Map<String, Object>> preloadHints; // LL-HLS EXT-X-PRELOAD-HINT

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

    public boolean hasParts() {
        return parts != null && !parts.isEmpty();
    }
}
