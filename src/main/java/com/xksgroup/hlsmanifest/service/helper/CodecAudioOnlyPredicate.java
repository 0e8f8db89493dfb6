package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Audio-only detection from the variants' CODECS attribute.
 * <p>
 * A manifest without variants is audio only when some rendition can be played
 * (nested playlists or a uri). Otherwise every variant must either list audio
 * codecs only, or be one of the nested audio rendition playlists.
 */
@RequiredArgsConstructor
public class CodecAudioOnlyPredicate implements AudioOnlyPredicate {

    private static final List<String> AUDIO_CODEC_PREFIXES = List.of(
            "mp4a", "ac-3", "ec-3", "ac-4", "opus", "vorbis", "flac", "alac", "mp3", "dtsc", "dtse", "dtsh", "dtsl");

    private final MediaGroupWalker mediaGroupWalker;

    @Override
    public boolean isAudioOnly(ManifestDocument document) {
        if (document == null) {
            return false;
        }
        if (document.getPlaylists() == null || document.getPlaylists().isEmpty()) {
            return mediaGroupWalker.someMediaGroup(document,
                    rendition -> rendition.hasPlaylists() || rendition.getUri() != null);
        }

        for (MediaPlaylist playlist : document.getPlaylists()) {
            Object codecs = playlist.getAttribute("CODECS");
            if (codecs instanceof String && allAudio((String) codecs)) {
                continue;
            }
            if (mediaGroupWalker.someMediaGroupPlaylist(document, nested -> sameRendition(playlist, nested))) {
                continue;
            }
            return false;
        }
        return true;
    }

    static boolean isAudioCodec(String codec) {
        String normalized = codec.trim().toLowerCase(Locale.ROOT);
        return AUDIO_CODEC_PREFIXES.stream().anyMatch(normalized::startsWith);
    }

    private static boolean allAudio(String codecs) {
        String[] entries = codecs.split(",");
        return entries.length > 0 && Arrays.stream(entries).allMatch(CodecAudioOnlyPredicate::isAudioCodec);
    }

    private static boolean sameRendition(MediaPlaylist playlist, MediaPlaylist nested) {
        if (playlist == nested) {
            return true;
        }
        if (playlist.getId() != null && playlist.getId().equals(nested.getId())) {
            return true;
        }
        return playlist.getResolvedUri() != null
                && Objects.equals(playlist.getResolvedUri(), nested.getResolvedUri());
    }
}
