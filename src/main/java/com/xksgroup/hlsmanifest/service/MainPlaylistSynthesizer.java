package com.xksgroup.hlsmanifest.service;

import com.xksgroup.hlsmanifest.config.ManifestProperties;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.MediaGroupType;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.PlaylistTable;
import com.xksgroup.hlsmanifest.model.RenditionDescriptor;
import com.xksgroup.hlsmanifest.service.helper.PlaylistIdentityHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps a bare media playlist in a main manifest so that downstream code only
 * ever deals with one document shape.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MainPlaylistSynthesizer {

    private final ManifestProperties manifestProperties;
    private final PlaylistIdentityHelper playlistIdentityHelper;

    /**
     * Builds a new main manifest whose only variant is {@code media}.
     * <p>
     * A media playlist has no manifest-level uri, so the main manifest takes
     * the configured playback context uri. The playlist itself is reachable at
     * index 0, at id {@code 0-{uri}} and at {@code uri}.
     */
    public ManifestDocument mainForMedia(MediaPlaylist media, String uri) {
        String id = PlaylistIdentityHelper.createPlaylistId(0, uri);

        playlistIdentityHelper.setupMediaPlaylist(media, uri, id);
        media.setResolvedUri(uri);

        PlaylistTable playlists = new PlaylistTable();
        playlists.add(media);
        playlists.register(media);

        Map<String, Map<String, Map<String, RenditionDescriptor>>> mediaGroups = new LinkedHashMap<>();
        for (MediaGroupType type : MediaGroupType.values()) {
            mediaGroups.put(type.getLabel(), new LinkedHashMap<>());
        }

        log.debug("Wrapped media playlist {} in a synthesized main manifest", uri);
        return ManifestDocument.builder()
                .uri(manifestProperties.getPlaybackContextUri())
                .resolvedUri(manifestProperties.getPlaybackContextUri())
                .playlists(playlists)
                .mediaGroups(mediaGroups)
                .build();
    }

    /**
     * Media playlist view of a parsed bare media playlist document.
     */
    public MediaPlaylist toMediaPlaylist(ManifestDocument document) {
        MediaPlaylist media = MediaPlaylist.builder()
                .uri(document.getUri())
                .resolvedUri(document.getResolvedUri())
                .segments(document.getSegments())
                .targetDuration(document.getTargetDuration())
                .partTargetDuration(document.getPartTargetDuration())
                .build();
        media.getProperties().putAll(document.getProperties());
        putIfPresent(media, "serverControl", document.getServerControl());
        putIfPresent(media, "partInf", document.getPartInf());
        putIfPresent(media, "skip", document.getSkip());
        putIfPresent(media, "preloadSegment", document.getPreloadSegment());
        putIfPresent(media, "renditionReports", document.getRenditionReports());
        return media;
    }

    private static void putIfPresent(MediaPlaylist media, String name, Object value) {
        if (value != null) {
            media.setProperty(name, value);
        }
    }
}
