package com.xksgroup.hlsmanifest.service.helper;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * {@link UriResolver} backed by {@link URI#resolve(URI)}.
 * <p>
 * Input that is not a valid uri is returned unchanged rather than failing the
 * whole manifest.
 */
@Slf4j
public class DefaultUriResolver implements UriResolver {

    @Override
    public String resolve(String baseUri, String relativeUri) {
        if (relativeUri == null) {
            return null;
        }
        // data: uris have no hierarchy to resolve against
        if (baseUri == null || baseUri.isBlank() || baseUri.startsWith("data:")) {
            return relativeUri;
        }

        // URI.resolve drops the last path segment of the base for these
        if (relativeUri.isEmpty() || relativeUri.startsWith("?")) {
            return resolveSameDocument(baseUri, relativeUri);
        }

        try {
            URI relative = new URI(relativeUri);
            if (relative.isAbsolute()) {
                return relative.toString();
            }
            return new URI(baseUri).resolve(relative).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.warn("Could not resolve '{}' against '{}': {}", relativeUri, baseUri, e.getMessage());
            return relativeUri;
        }
    }

    private static String resolveSameDocument(String baseUri, String relativeUri) {
        String base = baseUri;
        int fragment = base.indexOf('#');
        if (fragment >= 0) {
            base = base.substring(0, fragment);
        }
        if (relativeUri.isEmpty()) {
            return base;
        }
        int query = base.indexOf('?');
        if (query >= 0) {
            base = base.substring(0, query);
        }
        return base + relativeUri;
    }
}
