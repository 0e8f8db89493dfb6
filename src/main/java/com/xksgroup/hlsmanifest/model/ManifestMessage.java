package com.xksgroup.hlsmanifest.model;

/**
 * A warning or info event raised while parsing or normalizing a manifest.
 */
public record ManifestMessage(String message) {
}
