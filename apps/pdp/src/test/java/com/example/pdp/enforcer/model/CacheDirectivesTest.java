package com.example.pdp.enforcer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheDirectives")
class CacheDirectivesTest {

    @Test
    @DisplayName("should read and write without a header")
    void shouldDefaultWithoutHeader() {
        assertThat(CacheDirectives.fromHeader(null)).isEqualTo(CacheDirectives.DEFAULT);
        assertThat(CacheDirectives.fromHeader(" ")).isEqualTo(CacheDirectives.DEFAULT);
    }

    @Test
    @DisplayName("should skip the lookup for no-cache")
    void shouldSkipLookupForNoCache() {
        CacheDirectives directives = CacheDirectives.fromHeader("no-cache");

        assertThat(directives.read()).isFalse();
        assertThat(directives.write()).isTrue();
    }

    @Test
    @DisplayName("should skip lookup and write for no-store")
    void shouldSkipBothForNoStore() {
        CacheDirectives directives = CacheDirectives.fromHeader("max-age=0, No-Store");

        assertThat(directives.read()).isFalse();
        assertThat(directives.write()).isFalse();
    }

    @Test
    @DisplayName("should ignore unrelated directives")
    void shouldIgnoreUnrelated() {
        assertThat(CacheDirectives.fromHeader("max-age=60, private")).isEqualTo(CacheDirectives.DEFAULT);
    }
}
