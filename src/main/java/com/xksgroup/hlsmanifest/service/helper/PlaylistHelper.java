package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.PartialSegment;
import com.xksgroup.hlsmanifest.model.Segment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class PlaylistHelper {

    static final double DEFAULT_TARGET_DURATION = 10;

    /**
     * Parts of the trailing run of segments that carry EXT-X-PART records, in
     * playlist order. Segments before the first gap in that run are ignored.
     */
    public List<PartialSegment> getLastParts(ManifestDocument document) {
        List<Segment> segments = document.getSegments();
        if (segments == null || segments.isEmpty()) {
            return Collections.emptyList();
        }

        int start = segments.size();
        while (start > 0 && segments.get(start - 1) != null && segments.get(start - 1).hasParts()) {
            start--;
        }

        List<PartialSegment> parts = new ArrayList<>();
        for (Segment segment : segments.subList(start, segments.size())) {
            parts.addAll(segment.getParts());
        }
        return parts;
    }

    /**
     * Longest segment duration, or 10 seconds when there are no segments.
     */
    public double maxSegmentDuration(List<Segment> segments) {
        if (segments == null || segments.isEmpty()) {
            return DEFAULT_TARGET_DURATION;
        }
        double max = 0;
        for (Segment segment : segments) {
            if (segment != null && segment.getDuration() != null) {
                max = Math.max(max, segment.getDuration());
            }
        }
        return max;
    }

    public double maxPartDuration(List<PartialSegment> parts) {
        double max = 0;
        for (PartialSegment part : parts) {
            if (part != null && part.getDuration() != null) {
                max = Math.max(max, part.getDuration());
            }
        }
        return max;
    }
}
