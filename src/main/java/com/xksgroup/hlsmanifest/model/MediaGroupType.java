package com.xksgroup.hlsmanifest.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Categories of the media-group mapping, keyed by their manifest label.
 */
@Getter
@RequiredArgsConstructor
public enum MediaGroupType {
    AUDIO("AUDIO"),
    VIDEO("VIDEO"),
    SUBTITLES("SUBTITLES"),
    CLOSED_CAPTIONS("CLOSED-CAPTIONS");

    private final String label;
}
