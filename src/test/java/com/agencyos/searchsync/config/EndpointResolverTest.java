package com.agencyos.searchsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EndpointResolver Tests")
class EndpointResolverTest {

    @Test
    @DisplayName("Canonical key wins")
    void canonicalKey() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("searchsync.url", "redis://localhost:6379")
                .withProperty("searchsync.fallback-url-keys[0]", "REDIS_CONNECTION_STRING")
                .withProperty("REDIS_CONNECTION_STRING", "redis://other:6379");

        Optional<EndpointResolver.Resolved> r = EndpointResolver.resolve(env);

        assertThat(r).contains(new EndpointResolver.Resolved("redis://localhost:6379", "searchsync.url"));
    }

    @Test
    @DisplayName("Missing or blank endpoint resolves to empty")
    void absent() {
        assertThat(EndpointResolver.resolve(new MockEnvironment())).isEmpty();
        assertThat(EndpointResolver.resolve(new MockEnvironment().withProperty("searchsync.url", "   "))).isEmpty();
    }

    @Test
    @DisplayName("Fallback keys are consulted in order when the canonical key is blank")
    void fallbackOrder() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("searchsync.url", "")
                .withProperty("searchsync.fallback-url-keys", "REDIS_CONNECTION_STRING,CACHE_URL")
                .withProperty("REDIS_CONNECTION_STRING", " ")
                .withProperty("CACHE_URL", " rediss://cache:6380 ");

        Optional<EndpointResolver.Resolved> r = EndpointResolver.resolve(env);

        assertThat(r).contains(new EndpointResolver.Resolved("rediss://cache:6380", "CACHE_URL"));
    }

    @Test
    @DisplayName("Fallback keys are ignored unless configured")
    void noImplicitFallback() {
        MockEnvironment env = new MockEnvironment().withProperty("REDIS_CONNECTION_STRING", "redis://other:6379");

        assertThat(EndpointResolver.resolve(env)).isEmpty();
    }

    @Test
    @DisplayName("Reporting a missing endpoint never throws")
    void logMissing() {
        MockEnvironment env = new MockEnvironment().withProperty(EndpointResolver.LOG_KEYS_KEY, "true");

        EndpointResolver.logMissing(env);

        assertThat(EndpointResolver.fallbackKeys(env)).isEmpty();
    }
}
