package com.xksgroup.hlsmanifest.model.response;

/**
 * Standard body of every successful HTTP response.
 */
public record ApiResponse(
        boolean success,
        int status,
        String message,
        Object data,
        String timestamp,
        String path
) {}
