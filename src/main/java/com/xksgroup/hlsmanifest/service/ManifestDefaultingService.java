package com.xksgroup.hlsmanifest.service;

import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.PartialSegment;
import com.xksgroup.hlsmanifest.model.Segment;
import com.xksgroup.hlsmanifest.parser.ManifestParser;
import com.xksgroup.hlsmanifest.service.helper.PlaylistHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

/**
 * First pass over a freshly parsed manifest: strips LL-HLS fields when they
 * are not wanted and fills in the target durations the player relies on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestDefaultingService {

    private final ManifestParser manifestParser;
    private final PlaylistHelper playlistHelper;

    /**
     * Parse a manifest and apply {@link #normalizeDocument}.
     *
     * @param llhls whether LL-HLS features survive parsing
     */
    public ManifestDocument parseManifest(String manifest, boolean llhls,
                                          Consumer<ManifestMessage> onWarn, Consumer<ManifestMessage> onInfo) {
        ManifestDocument document = manifestParser.parse(manifest, onWarn, onInfo);
        return normalizeDocument(document, llhls, onWarn);
    }

    /**
     * Mutates the document in place and returns it. Explicit durations are
     * never overwritten.
     */
    public ManifestDocument normalizeDocument(ManifestDocument document, boolean llhls, Consumer<ManifestMessage> onWarn) {
        if (!llhls) {
            stripLowLatencyFields(document);
        }

        if (document.getTargetDuration() == null || document.getTargetDuration() == 0) {
            double targetDuration = playlistHelper.maxSegmentDuration(document.getSegments());
            warn(onWarn, "manifest has no targetDuration defaulting to " + formatSeconds(targetDuration));
            document.setTargetDuration(targetDuration);
        }

        List<PartialSegment> parts = playlistHelper.getLastParts(document);
        if (!parts.isEmpty() && (document.getPartTargetDuration() == null || document.getPartTargetDuration() == 0)) {
            double partTargetDuration = playlistHelper.maxPartDuration(parts);
            warn(onWarn, "manifest has no partTargetDuration defaulting to " + formatSeconds(partTargetDuration));
            log.error("LL-HLS manifest has parts but lacks required #EXT-X-PART-INF:PART-TARGET value. "
                    + "See https://datatracker.ietf.org/doc/html/draft-pantos-hls-rfc8216bis-09#section-4.4.3.7. "
                    + "Playback is not guaranteed.");
            document.setPartTargetDuration(partTargetDuration);
        }

        return document;
    }

    private void stripLowLatencyFields(ManifestDocument document) {
        document.setPreloadSegment(null);
        document.setSkip(null);
        document.setServerControl(null);
        document.setRenditionReports(null);
        document.setPartInf(null);
        document.setPartTargetDuration(null);

        if (document.getSegments() != null) {
            for (Segment segment : document.getSegments()) {
                segment.setParts(null);
                segment.setPreloadHints(null);
            }
        }
    }

    private void warn(Consumer<ManifestMessage> onWarn, String message) {
        log.warn(message);
        if (onWarn != null) {
            onWarn.accept(new ManifestMessage(message));
        }
    }

    // 10.0 -> "10", 4.004 -> "4.004"
    static String formatSeconds(double seconds) {
        if (seconds == Math.rint(seconds) && !Double.isInfinite(seconds)) {
            return String.valueOf((long) seconds);
        }
        return String.valueOf(seconds);
    }
}
