package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.UnauthorizedTriggerException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the Authorization header of a trigger request against the configured token.
 * The header must equal {@code Bearer <token>} byte for byte. With no token configured
 * every request is accepted.
 */
@Component
@RequiredArgsConstructor
public class TriggerAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final RefresherConfig config;

    public void authenticate(String authorizationHeader) {
        if (!config.isTriggerAuthEnabled()) {
            return;
        }
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new UnauthorizedTriggerException("Missing Authorization header");
        }

        byte[] expected = (BEARER_PREFIX + config.getTriggerToken()).getBytes(StandardCharsets.UTF_8);
        byte[] presented = authorizationHeader.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            throw new UnauthorizedTriggerException("Authorization header does not match the configured token");
        }
    }
}
