package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.function.Consumer;

@Slf4j
@Component
@RequiredArgsConstructor
public class PlaylistIdentityHelper {

    private final UriResolver uriResolver;

    /**
     * Stable playlist id. The index is the position inside the list the
     * playlist belongs to: the variant list, or a rendition's nested list.
     */
    public static String createPlaylistId(int index, String uri) {
        return index + "-" + uri;
    }

    /**
     * Gives a playlist the fields every consumer expects: id, a reset error
     * count and an attributes map. The uri is only set when given, playlists
     * nested in a main manifest already have one.
     */
    public void setupMediaPlaylist(MediaPlaylist playlist, String uri, String id) {
        playlist.setId(id);
        playlist.setErrorCount(0);

        if (uri != null) {
            playlist.setUri(uri);
        }
        if (playlist.getAttributes() == null) {
            playlist.setAttributes(new LinkedHashMap<>());
        }
    }

    /**
     * Sets up every variant playlist of a main manifest: id, resolved uri and
     * registration under both id and uri.
     */
    public void setupMediaPlaylists(ManifestDocument main, Consumer<ManifestMessage> onWarn) {
        for (int i = 0; i < main.getPlaylists().size(); i++) {
            MediaPlaylist playlist = main.getPlaylists().get(i);

            setupMediaPlaylist(playlist, null, createPlaylistId(i, playlist.getUri()));
            playlist.setResolvedUri(uriResolver.resolve(main.getUri(), playlist.getUri()));
            main.getPlaylists().register(playlist);

            // EXT-X-STREAM-INF MUST carry BANDWIDTH but the stream still plays without it
            if (missingBandwidth(playlist.getAttribute("BANDWIDTH"))) {
                String message = "Invalid playlist STREAM-INF detected. Missing BANDWIDTH attribute.";
                log.warn("{} playlist={}", message, playlist.getId());
                if (onWarn != null) {
                    onWarn.accept(new ManifestMessage(message));
                }
            }
        }
    }

    private static boolean missingBandwidth(Object bandwidth) {
        if (bandwidth instanceof Number) {
            return ((Number) bandwidth).doubleValue() == 0;
        }
        if (bandwidth instanceof String) {
            return ((String) bandwidth).isBlank();
        }
        return bandwidth == null;
    }
}
