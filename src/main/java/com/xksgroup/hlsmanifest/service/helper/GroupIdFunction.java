package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.MediaPlaylist;

/**
 * Builds the group id of a playlist nested under a media-group rendition.
 * The group id doubles as the placeholder uri of renditions without one.
 */
@FunctionalInterface
public interface GroupIdFunction {

    GroupIdFunction DEFAULT = GroupIdFunction::defaultGroupId;

    String createGroupId(String mediaType, String groupKey, String labelKey, MediaPlaylist playlist);

    /**
     * {@code placeholder-locator-{type}-{group}-{label}}; the playlist is ignored.
     */
    static String defaultGroupId(String mediaType, String groupKey, String labelKey, MediaPlaylist playlist) {
        return "placeholder-locator-" + mediaType + "-" + groupKey + "-" + labelKey;
    }
}
