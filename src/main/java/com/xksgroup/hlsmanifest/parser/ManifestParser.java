package com.xksgroup.hlsmanifest.parser;

import com.xksgroup.hlsmanifest.exception.ManifestParseException;
import com.xksgroup.hlsmanifest.model.ManifestDocument;
import com.xksgroup.hlsmanifest.model.ManifestMessage;

import java.util.function.Consumer;

/**
 * Grammar-level manifest parser.
 * <p>
 * Implementations guarantee a non-null {@code segments} list on the returned
 * document, and a non-null {@code playlists} table when the source is a main
 * manifest. They do not default or resolve anything.
 */
public interface ManifestParser {

    /**
     * @param onWarn receives parser warnings, may be null
     * @param onInfo receives parser info events, may be null
     * @throws ManifestParseException when the input cannot be parsed at all
     */
    ManifestDocument parse(String manifest, Consumer<ManifestMessage> onWarn, Consumer<ManifestMessage> onInfo);
}
