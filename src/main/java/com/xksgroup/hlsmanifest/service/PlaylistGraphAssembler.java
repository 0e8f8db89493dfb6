package com.xksgroup.hlsmanifest.service;

import com.xksgroup.hlsmanifest.config.ManifestProperties;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.MediaGroupType;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.RenditionDescriptor;
import com.xksgroup.hlsmanifest.service.helper.AudioOnlyPredicate;
import com.xksgroup.hlsmanifest.service.helper.GroupIdFunction;
import com.xksgroup.hlsmanifest.service.helper.MediaGroupWalker;
import com.xksgroup.hlsmanifest.service.helper.PlaylistIdentityHelper;
import com.xksgroup.hlsmanifest.service.helper.UriResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Consumer;

/**
 * Turns a parsed main manifest into the resolved playlist graph used for
 * playback: every variant and every alternate rendition ends up with an id,
 * a uri, a resolved uri and an attributes map, and is registered in the
 * manifest's playlist table under both id and uri.
 * <p>
 * All methods mutate the given document in place and return nothing. Running
 * them again on an already assembled document changes nothing.
 * Malformed input is reported as warnings, never as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaylistGraphAssembler {

    static final String PLACEHOLDER_URI_PREFIX = "placeholder-locator-";

    private final MediaGroupWalker mediaGroupWalker;
    private final PlaylistIdentityHelper playlistIdentityHelper;
    private final UriResolver uriResolver;
    private final AudioOnlyPredicate audioOnlyPredicate;
    private final GroupIdFunction groupIdFunction;
    private final ManifestProperties manifestProperties;

    public void addPropertiesToMain(ManifestDocument main, String uri) {
        addPropertiesToMain(main, uri, groupIdFunction, null);
    }

    public void addPropertiesToMain(ManifestDocument main, String uri, GroupIdFunction createGroupId) {
        addPropertiesToMain(main, uri, createGroupId, null);
    }

    /**
     * @param uri           the uri the manifest was loaded from, base for every relative uri
     * @param createGroupId group id of nested rendition playlists, the configured one if null
     * @param onWarn        receives manifest warnings, may be null
     */
    public void addPropertiesToMain(ManifestDocument main, String uri, GroupIdFunction createGroupId,
                                    Consumer<ManifestMessage> onWarn) {
        GroupIdFunction groupIds = createGroupId != null ? createGroupId : groupIdFunction;
        main.setUri(uri);

        // DASH-derived variants have no uri, but playlists are looked up by uri everywhere
        for (int i = 0; i < main.getPlaylists().size(); i++) {
            MediaPlaylist playlist = main.getPlaylists().get(i);
            if (!hasUri(playlist.getUri())) {
                playlist.setUri(PLACEHOLDER_URI_PREFIX + i);
            }
        }

        boolean audioOnlyMain = audioOnlyPredicate.isAudioOnly(main);

        mediaGroupWalker.forEachMediaGroup(main, (rendition, mediaType, groupKey, labelKey) -> {
            if (rendition == null) {
                return;
            }
            if (!rendition.hasPlaylists()) {
                // In an audio only manifest a uri-less audio group referenced by a
                // variant is that variant itself, not an alternate track.
                if (audioOnlyMain && MediaGroupType.AUDIO.getLabel().equals(mediaType) && !hasUri(rendition.getUri())
                        && referencedAsAudioGroup(main, groupKey)) {
                    log.debug("Audio group {}/{} is played through its variant, not as an alternate", groupKey, labelKey);
                    return;
                }
                List<MediaPlaylist> playlists = new ArrayList<>();
                playlists.add(copyOf(rendition));
                rendition.setPlaylists(playlists);
            }

            List<MediaPlaylist> playlists = rendition.getPlaylists();
            for (int i = 0; i < playlists.size(); i++) {
                setupRenditionPlaylist(main, playlists.get(i), i,
                        groupIds.createGroupId(mediaType, groupKey, labelKey, playlists.get(i)));
            }
        });

        playlistIdentityHelper.setupMediaPlaylists(main, onWarn);
        resolveMediaGroupUris(main);
    }

    /**
     * Resolves the uri of every rendition that references its own playlist.
     */
    public void resolveMediaGroupUris(ManifestDocument main) {
        mediaGroupWalker.forEachMediaGroup(main, (rendition, mediaType, groupKey, labelKey) -> {
            if (rendition != null && hasUri(rendition.getUri())) {
                rendition.setResolvedUri(uriResolver.resolve(main.getUri(), rendition.getUri()));
            }
        });
    }

    private void setupRenditionPlaylist(ManifestDocument main, MediaPlaylist playlist, int index, String groupId) {
        String id = PlaylistIdentityHelper.createPlaylistId(index, groupId);

        if (hasUri(playlist.getUri())) {
            if (playlist.getResolvedUri() == null) {
                playlist.setResolvedUri(uriResolver.resolve(main.getUri(), playlist.getUri()));
            }
        } else {
            playlist.setUri(placeholderUri(index, groupId, id));
            // placeholders are not resolvable
            playlist.setResolvedUri(playlist.getUri());
        }

        if (playlist.getId() == null) {
            playlist.setId(id);
        }
        if (playlist.getAttributes() == null) {
            playlist.setAttributes(new LinkedHashMap<>());
        }

        main.getPlaylists().register(playlist);
    }

    /**
     * Renditions used to have a single playlist whose placeholder was the bare
     * group id. Later playlists get their id so the first keeps its old uri.
     */
    private String placeholderUri(int index, String groupId, String id) {
        if (manifestProperties.isLegacyMediaGroupUris() && index == 0) {
            return groupId;
        }
        return id;
    }

    private static boolean referencedAsAudioGroup(ManifestDocument main, String groupKey) {
        for (MediaPlaylist playlist : main.getPlaylists()) {
            if (groupKey.equals(playlist.getAttribute("AUDIO"))) {
                return true;
            }
        }
        return false;
    }

    // shallow copy of the rendition's own fields as a one-playlist list entry
    private static MediaPlaylist copyOf(RenditionDescriptor rendition) {
        MediaPlaylist playlist = MediaPlaylist.builder()
                .uri(rendition.getUri())
                .resolvedUri(rendition.getResolvedUri())
                .build();
        if (rendition.getLanguage() != null) {
            playlist.setProperty("language", rendition.getLanguage());
        }
        playlist.getProperties().putAll(rendition.getProperties());
        return playlist;
    }

    private static boolean hasUri(String uri) {
        return uri != null && !uri.isEmpty();
    }
}
