package com.xksgroup.hlsmanifest.service.helper;

/**
 * Resolves a possibly relative uri against a base uri.
 */
@FunctionalInterface
public interface UriResolver {

    String resolve(String baseUri, String relativeUri);
}
