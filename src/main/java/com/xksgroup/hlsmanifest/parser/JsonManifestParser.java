package com.xksgroup.hlsmanifest.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.hlsmanifest.exception.ManifestParseException;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;
import com.xksgroup.hlsmanifest.model.Segment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Reads the JSON object form produced by an m3u8 grammar parser
 * ({@code {"targetDuration":..,"segments":[..],"playlists":[..],"mediaGroups":{..}}}).
 * Fields it does not model are kept in the documents' property bags.
 */
@Slf4j
public class JsonManifestParser implements ManifestParser {

    private final ObjectMapper objectMapper;

    public JsonManifestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public ManifestDocument parse(String manifest, Consumer<ManifestMessage> onWarn, Consumer<ManifestMessage> onInfo) {
        if (manifest == null || manifest.isBlank()) {
            throw new ManifestParseException("Manifest is empty");
        }

        ManifestDocument document;
        try {
            document = objectMapper.readValue(manifest, ManifestDocument.class);
        } catch (JsonProcessingException e) {
            throw new ManifestParseException("Manifest is not a parsed manifest object: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new ManifestParseException("Manifest is null");
        }

        if (document.getSegments() == null) {
            document.setSegments(new ArrayList<>());
        }
        dropNullSegments(document.getSegments(), onWarn);

        if (onInfo != null) {
            onInfo.accept(new ManifestMessage(document.isMain()
                    ? "parsed main manifest with " + document.getPlaylists().size() + " playlists"
                    : "parsed media playlist with " + document.getSegments().size() + " segments"));
        }
        return document;
    }

    private void dropNullSegments(List<Segment> segments, Consumer<ManifestMessage> onWarn) {
        int before = segments.size();
        segments.removeIf(segment -> segment == null);
        if (segments.size() != before && onWarn != null) {
            onWarn.accept(new ManifestMessage("ignoring " + (before - segments.size()) + " empty segment entries"));
        }
    }
}
