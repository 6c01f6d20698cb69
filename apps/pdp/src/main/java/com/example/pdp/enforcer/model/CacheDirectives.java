package com.example.pdp.enforcer.model;

import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Client cache directives taken from {@code Cache-Control}: {@code no-cache} skips the lookup,
 * {@code no-store} skips both the lookup and the write.
 */
public record CacheDirectives(boolean read, boolean write) {

    public static final CacheDirectives DEFAULT = new CacheDirectives(true, true);

    public static CacheDirectives fromHeader(@Nullable String cacheControl) {
        if (cacheControl == null || cacheControl.isBlank()) {
            return DEFAULT;
        }
        boolean noCache = false;
        boolean noStore = false;
        for (String directive : cacheControl.split(",")) {
            String normalized = directive.trim().toLowerCase(Locale.ROOT);
            noCache |= normalized.equals("no-cache");
            noStore |= normalized.equals("no-store");
        }
        return new CacheDirectives(!noCache && !noStore, !noStore);
    }
}
