package com.lockbox.web;

/**
 * Reads the session id from {@code Authorization: Bearer <session_id>}.
 */
final class AuthorizationHeader {

    private static final String BEARER = "Bearer ";

    private AuthorizationHeader() {
    }

    /** A bare value without the scheme is accepted as the id itself. */
    static String sessionId(String authorization) {
        if (authorization == null) {
            return null;
        }
        String value = authorization.startsWith(BEARER) ? authorization.substring(BEARER.length()) : authorization;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}
