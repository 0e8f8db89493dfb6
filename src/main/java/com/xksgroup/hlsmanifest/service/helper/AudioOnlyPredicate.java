package com.xksgroup.hlsmanifest.service.helper;

import com.xksgroup.hlsmanifest.model.ManifestDocument;

/**
 * Decides whether a main manifest carries no video at all.
 */
@FunctionalInterface
public interface AudioOnlyPredicate {

    boolean isAudioOnly(ManifestDocument document);
}
