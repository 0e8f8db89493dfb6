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

/**
 * One alternate audio or subtitle rendition (EXT-X-MEDIA). HLS renditions
 * carry their own uri, DASH-derived ones carry nested playlists instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenditionDescriptor {
    private String uri;
    private String resolvedUri;
    private String language;
    private List<MediaPlaylist> playlists;

    // default, autoselect, characteristics, forced, instreamId...
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

    public boolean hasPlaylists() {
        return playlists != null && !playlists.isEmpty();
    }
}
