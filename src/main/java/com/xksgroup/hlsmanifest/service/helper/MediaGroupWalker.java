package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.MediaGroupType;
import com.xksgroup.hlsmanifest.model.MediaPlaylist;
import com.xksgroup.hlsmanifest.model.RenditionDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Traverses the alternate renditions of a main manifest.
 * <p>
 * Only AUDIO and SUBTITLES are walked, VIDEO and CLOSED-CAPTIONS groups never
 * carry playlists of their own. Within a type, groups and labels are visited
 * in the order the parser produced them.
 */
@Component
public class MediaGroupWalker {

    static final List<MediaGroupType> WALKED_TYPES = List.of(MediaGroupType.AUDIO, MediaGroupType.SUBTITLES);

    @FunctionalInterface
    public interface Visitor {
        void visit(RenditionDescriptor rendition, String mediaType, String groupKey, String labelKey);
    }

    public void forEachMediaGroup(ManifestDocument document, Visitor visitor) {
        if (document.getMediaGroups() == null) {
            return;
        }
        for (MediaGroupType type : WALKED_TYPES) {
            Map<String, Map<String, RenditionDescriptor>> groups = document.getMediaGroups().get(type.getLabel());
            if (groups == null) {
                continue;
            }
            for (Map.Entry<String, Map<String, RenditionDescriptor>> group : groups.entrySet()) {
                if (group.getValue() == null) {
                    continue;
                }
                for (Map.Entry<String, RenditionDescriptor> label : group.getValue().entrySet()) {
                    visitor.visit(label.getValue(), type.getLabel(), group.getKey(), label.getKey());
                }
            }
        }
    }

    /**
     * Returns true as soon as one rendition matches; later renditions are not visited.
     */
    public boolean someMediaGroup(ManifestDocument document, Predicate<RenditionDescriptor> predicate) {
        if (document.getMediaGroups() == null) {
            return false;
        }
        for (MediaGroupType type : WALKED_TYPES) {
            Map<String, Map<String, RenditionDescriptor>> groups = document.getMediaGroups().get(type.getLabel());
            if (groups == null) {
                continue;
            }
            for (Map<String, RenditionDescriptor> labels : groups.values()) {
                if (labels == null) {
                    continue;
                }
                for (RenditionDescriptor rendition : labels.values()) {
                    if (rendition != null && predicate.test(rendition)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Same as {@link #someMediaGroup} but matched against every nested playlist.
     */
    public boolean someMediaGroupPlaylist(ManifestDocument document, Predicate<MediaPlaylist> predicate) {
        return someMediaGroup(document, rendition ->
                rendition.hasPlaylists() && rendition.getPlaylists().stream().anyMatch(predicate));
    }
}
