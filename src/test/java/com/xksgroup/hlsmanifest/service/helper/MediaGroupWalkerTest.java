package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.RenditionDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MediaGroupWalkerTest {

    private final MediaGroupWalker walker = new MediaGroupWalker();

    @Test
    void visitsAudioThenSubtitlesInInsertionOrder() {
        ManifestDocument document = ManifestDocument.builder().mediaGroups(mediaGroups()).build();
        List<String> visited = new ArrayList<>();

        walker.forEachMediaGroup(document, (rendition, type, group, label) ->
                visited.add(type + "/" + group + "/" + label));

        assertThat(visited).containsExactly(
                "AUDIO/aac/English", "AUDIO/aac/Deutsch", "AUDIO/ac3/English", "SUBTITLES/subs/English");
    }

    @Test
    void noOpWithoutMediaGroups() {
        List<String> visited = new ArrayList<>();
        walker.forEachMediaGroup(new ManifestDocument(), (rendition, type, group, label) -> visited.add(label));
        assertThat(visited).isEmpty();
    }

    @Test
    void someMediaGroupPlaylistMatchesNestedPlaylists() {
        Map<String, Map<String, Map<String, RenditionDescriptor>>> groups = mediaGroups();
        groups.get("AUDIO").get("aac").get("English")
                .setPlaylists(List.of(MediaPlaylist.builder().id("0-audio").build()));
        ManifestDocument document = ManifestDocument.builder().mediaGroups(groups).build();

        assertThat(walker.someMediaGroupPlaylist(document, p -> "0-audio".equals(p.getId()))).isTrue();
        assertThat(walker.someMediaGroupPlaylist(document, p -> "1-audio".equals(p.getId()))).isFalse();
        assertThat(walker.someMediaGroup(document, r -> "cc.m3u8".equals(r.getUri()))).isFalse();
    }

    private static Map<String, Map<String, Map<String, RenditionDescriptor>>> mediaGroups() {
        Map<String, RenditionDescriptor> aac = new LinkedHashMap<>();
        aac.put("English", RenditionDescriptor.builder().language("en").build());
        aac.put("Deutsch", RenditionDescriptor.builder().language("de").build());
        Map<String, Map<String, RenditionDescriptor>> audio = new LinkedHashMap<>();
        audio.put("aac", aac);
        audio.put("ac3", new LinkedHashMap<>(Map.of("English", RenditionDescriptor.builder().build())));

        Map<String, Map<String, Map<String, RenditionDescriptor>>> groups = new LinkedHashMap<>();
        groups.put("CLOSED-CAPTIONS", Map.of("cc", Map.of("English", RenditionDescriptor.builder().uri("cc.m3u8").build())));
        groups.put("SUBTITLES", Map.of("subs", Map.of("English", RenditionDescriptor.builder().build())));
        groups.put("AUDIO", audio);
        groups.put("VIDEO", Map.of());
        return groups;
    }
}
