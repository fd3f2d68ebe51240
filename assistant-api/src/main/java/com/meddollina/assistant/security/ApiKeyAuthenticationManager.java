package com.meddollina.assistant.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public class ApiKeyAuthenticationManager implements ReactiveAuthenticationManager {

    static final String PRINCIPAL = "api-key";

    private final byte[] expectedKey;

    public ApiKeyAuthenticationManager(String expectedKey) {
        this.expectedKey = expectedKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof UsernamePasswordAuthenticationToken token)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }

        Object credentials = token.getCredentials();
        if (!(credentials instanceof String key)
                || !MessageDigest.isEqual(expectedKey, key.getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Invalid API key"));
        }

        return Mono.just(UsernamePasswordAuthenticationToken.authenticated(PRINCIPAL, null, AuthorityUtils.NO_AUTHORITIES));
    }
}
