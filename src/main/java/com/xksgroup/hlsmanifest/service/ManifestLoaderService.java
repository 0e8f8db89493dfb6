package com.xksgroup.hlsmanifest.service;

import com.xksgroup.hlsmanifest.config.ManifestProperties;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.dto.NormalizedManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Full normalization of one manifest load: parse and default, then either
 * wrap a bare media playlist or assemble the playlist graph of a main manifest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestLoaderService {

    private final ManifestDefaultingService manifestDefaultingService;
    private final MainPlaylistSynthesizer mainPlaylistSynthesizer;
    private final PlaylistGraphAssembler playlistGraphAssembler;
    private final ManifestProperties manifestProperties;

    /**
     * @param llhls overrides {@code manifest.llhls} when not null
     */
    public NormalizedManifest load(String manifest, String uri, Boolean llhls) {
        List<String> warnings = Collections.synchronizedList(new ArrayList<>());
        List<String> infos = Collections.synchronizedList(new ArrayList<>());
        Consumer<ManifestMessage> onWarn = message -> warnings.add(message.message());
        Consumer<ManifestMessage> onInfo = message -> infos.add(message.message());

        boolean keepLowLatency = llhls != null ? llhls : manifestProperties.isLlhls();
        ManifestDocument parsed = manifestDefaultingService.parseManifest(manifest, keepLowLatency, onWarn, onInfo);

        ManifestDocument main;
        boolean synthesized = !parsed.isMain();
        if (synthesized) {
            MediaPlaylist media = mainPlaylistSynthesizer.toMediaPlaylist(parsed);
            main = mainPlaylistSynthesizer.mainForMedia(media, uri);
        } else {
            playlistGraphAssembler.addPropertiesToMain(parsed, uri, null, onWarn);
            main = parsed;
        }

        log.info("Normalized {} from {} with {} playlists and {} warnings",
                synthesized ? "media playlist" : "main manifest", uri, main.getPlaylists().size(), warnings.size());

        return NormalizedManifest.builder()
                .synthesizedMain(synthesized)
                .manifest(main)
                .warnings(new ArrayList<>(warnings))
                .infos(new ArrayList<>(infos))
                .build();
    }
}
