package com.xksgroup.hlsmanifest.service.helper;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultUriResolverTest {

    private final DefaultUriResolver resolver = new DefaultUriResolver();

    @Test
    void resolvesRelativeAgainstBaseDirectory() {
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8", "v0/index.m3u8"))
                .isEqualTo("https://cdn.example.com/live/v0/index.m3u8");
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8", "../vod/index.m3u8"))
                .isEqualTo("https://cdn.example.com/vod/index.m3u8");
    }

    @Test
    void queryOnlyReferenceKeepsBasePath() {
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8", "?v=2"))
                .isEqualTo("https://cdn.example.com/live/master.m3u8?v=2");
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8?token=a#t=10", "?v=2"))
                .isEqualTo("https://cdn.example.com/live/master.m3u8?v=2");
    }

    @Test
    void emptyReferenceIsBaseWithoutFragment() {
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8?token=a#t=10", ""))
                .isEqualTo("https://cdn.example.com/live/master.m3u8?token=a");
    }

    @Test
    void keepsAbsoluteUris() {
        assertThat(resolver.resolve("https://cdn.example.com/live/master.m3u8", "https://other.example.com/a.m3u8"))
                .isEqualTo("https://other.example.com/a.m3u8");
    }

    @Test
    void returnsRelativeWhenBaseIsMissingOrData() {
        assertThat(resolver.resolve(null, "a.m3u8")).isEqualTo("a.m3u8");
        assertThat(resolver.resolve("data:application/x-mpegurl;base64,I0VYVE0zVQ==", "a.m3u8")).isEqualTo("a.m3u8");
    }

    @Test
    void returnsRelativeUnchangedWhenNotAUri() {
        assertThat(resolver.resolve("https://cdn.example.com/master.m3u8", "bad uri|with pipe"))
                .isEqualTo("bad uri|with pipe");
        assertThat(resolver.resolve("https://cdn.example.com/master.m3u8", null)).isNull();
    }
}
