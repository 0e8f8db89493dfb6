package com.xksgroup.hlsmanifest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.PartialSegment;
import com.xksgroup.hlsmanifest.model.Segment;
import com.xksgroup.hlsmanifest.parser.JsonManifestParser;
import com.xksgroup.hlsmanifest.service.helper.PlaylistHelper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.xksgroup.hlsmanifest.ManifestFixtures.fixture;
import static org.assertj.core.api.Assertions.assertThat;

class ManifestDefaultingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ManifestDefaultingService service =
            new ManifestDefaultingService(new JsonManifestParser(objectMapper), new PlaylistHelper());
    private final List<ManifestMessage> warnings = new ArrayList<>();

    @Test
    void defaultsTargetDurationToLongestSegment() {
        ManifestDocument document = ManifestDocument.builder()
                .segments(List.of(segment(4.0), segment(6.006), segment(5.5)))
                .build();

        service.normalizeDocument(document, true, warnings::add);

        assertThat(document.getTargetDuration()).isEqualTo(6.006);
        assertThat(warnings).extracting(ManifestMessage::message)
                .containsExactly("manifest has no targetDuration defaulting to 6.006");
    }

    @Test
    void defaultsTargetDurationToTenWithoutSegments() {
        ManifestDocument document = ManifestDocument.builder().segments(new ArrayList<>()).build();

        service.normalizeDocument(document, true, warnings::add);

        assertThat(document.getTargetDuration()).isEqualTo(10.0);
        assertThat(warnings).extracting(ManifestMessage::message)
                .containsExactly("manifest has no targetDuration defaulting to 10");
    }

    @Test
    void keepsExplicitDurations() {
        Segment withParts = segment(6.0);
        withParts.setParts(List.of(PartialSegment.builder().duration(2.5).build()));
        ManifestDocument document = ManifestDocument.builder()
                .targetDuration(8.0)
                .partTargetDuration(1.0)
                .segments(List.of(withParts))
                .build();

        service.normalizeDocument(document, true, warnings::add);

        assertThat(document.getTargetDuration()).isEqualTo(8.0);
        assertThat(document.getPartTargetDuration()).isEqualTo(1.0);
        assertThat(warnings).isEmpty();
    }

    @Test
    void worksWithoutWarningSink() {
        ManifestDocument document = ManifestDocument.builder().segments(List.of(segment(3.0))).build();

        service.normalizeDocument(document, true, null);

        assertThat(document.getTargetDuration()).isEqualTo(3.0);
    }

    @Test
    void defaultsPartTargetDurationFromLastParts() throws IOException {
        ManifestDocument document = service.parseManifest(fixture("media-llhls.json"), true, warnings::add, null);

        assertThat(document.getTargetDuration()).isEqualTo(4.00008);
        assertThat(document.getPartTargetDuration()).isEqualTo(1.00001);
        assertThat(warnings).extracting(ManifestMessage::message).containsExactly(
                "manifest has no targetDuration defaulting to 4.00008",
                "manifest has no partTargetDuration defaulting to 1.00001");
        assertThat(document.getServerControl()).containsEntry("canBlockReload", true);
    }

    @Test
    void stripsLowLatencyFieldsWhenDisabled() throws IOException {
        ManifestDocument document = service.parseManifest(fixture("media-llhls.json"), false, warnings::add, null);

        assertThat(document.getServerControl()).isNull();
        assertThat(document.getPartInf()).isNull();
        assertThat(document.getSkip()).isNull();
        assertThat(document.getPreloadSegment()).isNull();
        assertThat(document.getRenditionReports()).isNull();
        assertThat(document.getPartTargetDuration()).isNull();
        assertThat(document.getSegments()).allSatisfy(segment -> {
            assertThat(segment.getParts()).isNull();
            assertThat(segment.getPreloadHints()).isNull();
        });
        // only the target duration is defaulted, parts are gone
        assertThat(warnings).hasSize(1);

        String json = objectMapper.writeValueAsString(document);
        assertThat(json).doesNotContain("serverControl", "partInf", "renditionReports", "preloadSegment",
                "partTargetDuration", "\"parts\"", "preloadHints", "\"skip\"");
    }

    @Test
    void strippingAlsoRemovesFieldsSetProgrammatically() {
        Segment segment = segment(2.0);
        segment.setParts(List.of(PartialSegment.builder().duration(1.0).build()));
        segment.setPreloadHints(List.of(Map.of("type", "PART")));
        ManifestDocument document = ManifestDocument.builder()
                .targetDuration(2.0)
                .skip(Map.of("skippedSegments", 3))
                .segments(List.of(segment))
                .build();

        service.normalizeDocument(document, false, warnings::add);

        assertThat(document.getSkip()).isNull();
        assertThat(segment.getParts()).isNull();
        assertThat(segment.getPreloadHints()).isNull();
        assertThat(warnings).isEmpty();
    }

    @Test
    void formatsWholeSecondsWithoutFraction() {
        assertThat(ManifestDefaultingService.formatSeconds(10.0)).isEqualTo("10");
        assertThat(ManifestDefaultingService.formatSeconds(9.5)).isEqualTo("9.5");
    }

    private static Segment segment(double duration) {
        return Segment.builder().duration(duration).build();
    }
}
