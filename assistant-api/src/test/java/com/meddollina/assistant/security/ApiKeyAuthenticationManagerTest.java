package com.meddollina.assistant.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyAuthenticationManagerTest {

    private final ApiKeyAuthenticationManager manager = new ApiKeyAuthenticationManager("secret");

    @Test
    void matchingKeyAuthenticates() {
        StepVerifier.create(manager.authenticate(UsernamePasswordAuthenticationToken.unauthenticated("api-key", "secret")))
                .assertNext(authentication -> {
                    assertThat(authentication.isAuthenticated()).isTrue();
                    assertThat(authentication.getName()).isEqualTo("api-key");
                })
                .verifyComplete();
    }

    @Test
    void otherKeysAndTokenTypesAreRejected() {
        StepVerifier.create(manager.authenticate(UsernamePasswordAuthenticationToken.unauthenticated("api-key", "secreT")))
                .expectError(BadCredentialsException.class)
                .verify();
        StepVerifier.create(manager.authenticate(new TestingAuthenticationToken("user", "secret")))
                .expectError(BadCredentialsException.class)
                .verify();
    }
}
