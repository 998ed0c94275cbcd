package com.hvacops.copilot.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts exactly one shared bearer token and authenticates it as the copilot client principal.
 */
public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    static final String PRINCIPAL = "copilot-client";

    private final byte[] expectedToken;

    public StaticTokenAuthenticationManager(String expectedToken) {
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }

        String token = bearer.getToken();
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Invalid bearer token"));
        }

        return Mono.just(new UsernamePasswordAuthenticationToken(PRINCIPAL, null, AuthorityUtils.NO_AUTHORITIES));
    }
}
