package com.xksgroup.hlsmanifest.model.response;

/**
 * Standard body of every HTTP error response.
 */
public record ApiError(
        boolean success,
        int status,
        String error,
        String message,
        Object details,
        String timestamp,
        String path
) {}
