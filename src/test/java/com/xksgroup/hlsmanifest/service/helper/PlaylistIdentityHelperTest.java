package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.PlaylistTable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlaylistIdentityHelperTest {

    private final PlaylistIdentityHelper helper = new PlaylistIdentityHelper(new DefaultUriResolver());

    @Test
    void playlistIdIsIndexAndUri() {
        assertThat(PlaylistIdentityHelper.createPlaylistId(0, "a.m3u8")).isEqualTo("0-a.m3u8");
        assertThat(PlaylistIdentityHelper.createPlaylistId(3, "a.m3u8")).isEqualTo("3-a.m3u8");
        assertThat(PlaylistIdentityHelper.createPlaylistId(1, "a.m3u8"))
                .isNotEqualTo(PlaylistIdentityHelper.createPlaylistId(1, "b.m3u8"));
    }

    @Test
    void setupResetsErrorsAndEnsuresAttributes() {
        MediaPlaylist playlist = MediaPlaylist.builder().uri("nested.m3u8").errorCount(4).build();

        helper.setupMediaPlaylist(playlist, null, "0-nested.m3u8");

        assertThat(playlist.getId()).isEqualTo("0-nested.m3u8");
        assertThat(playlist.getUri()).isEqualTo("nested.m3u8");
        assertThat(playlist.getErrorCount()).isZero();
        assertThat(playlist.getAttributes()).isNotNull().isEmpty();
    }

    @Test
    void setupAssignsUriOnlyWhenGiven() {
        MediaPlaylist playlist = MediaPlaylist.builder().attributes(Map.of("BANDWIDTH", 1)).build();

        helper.setupMediaPlaylist(playlist, "https://cdn.example.com/media.m3u8", "0-https://cdn.example.com/media.m3u8");

        assertThat(playlist.getUri()).isEqualTo("https://cdn.example.com/media.m3u8");
        assertThat(playlist.getAttributes()).containsEntry("BANDWIDTH", 1);
    }

    @Test
    void warnsOncePerVariantWithoutBandwidth() {
        ManifestDocument main = ManifestDocument.builder()
                .uri("https://cdn.example.com/live/master.m3u8")
                .playlists(new PlaylistTable(List.of(
                        MediaPlaylist.builder().uri("low.m3u8").build(),
                        MediaPlaylist.builder().uri("high.m3u8").build())))
                .build();
        List<ManifestMessage> warnings = new ArrayList<>();

        helper.setupMediaPlaylists(main, warnings::add);

        assertThat(warnings).hasSize(2);
        MediaPlaylist high = main.getPlaylists().get(1);
        assertThat(high.getId()).isEqualTo("1-high.m3u8");
        assertThat(high.getResolvedUri()).isEqualTo("https://cdn.example.com/live/high.m3u8");
        assertThat(main.getPlaylists().getById("1-high.m3u8")).isSameAs(high);
        assertThat(main.getPlaylists().getByUri("high.m3u8")).isSameAs(high);
    }

    @Test
    void zeroBandwidthCountsAsMissing() {
        ManifestDocument main = ManifestDocument.builder()
                .uri("https://cdn.example.com/live/master.m3u8")
                .playlists(new PlaylistTable(List.of(
                        MediaPlaylist.builder().uri("zero.m3u8").attributes(Map.of("BANDWIDTH", 0)).build(),
                        MediaPlaylist.builder().uri("ok.m3u8").attributes(Map.of("BANDWIDTH", 800000)).build())))
                .build();
        List<ManifestMessage> warnings = new ArrayList<>();

        helper.setupMediaPlaylists(main, warnings::add);

        assertThat(warnings).extracting(ManifestMessage::message)
                .containsExactly("Invalid playlist STREAM-INF detected. Missing BANDWIDTH attribute.");
    }
}
