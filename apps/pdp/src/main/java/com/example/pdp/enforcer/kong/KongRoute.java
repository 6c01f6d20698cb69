package com.example.pdp.enforcer.kong;

import org.springframework.lang.Nullable;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A route pattern and where its resource type comes from: either a literal type or the text of a
 * capture group.
 */
public record KongRoute(Pattern pattern, @Nullable String resource, @Nullable Integer group) {

    public KongRoute {
        if ((resource == null) == (group == null)) {
            throw new IllegalArgumentException("Kong route needs exactly one of a resource or a group index");
        }
    }

    public static KongRoute literal(String regex, String resource) {
        return new KongRoute(Pattern.compile(regex), resource, null);
    }

    public static KongRoute group(String regex, int group) {
        return new KongRoute(Pattern.compile(regex), null, group);
    }

    /**
     * Matches from the start of the path. Returns the resource type on a match.
     */
    public Optional<String> resolve(String path) {
        Matcher matcher = pattern.matcher(path);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        if (resource != null) {
            return Optional.of(resource);
        }
        if (group > matcher.groupCount()) {
            return Optional.empty();
        }
        return Optional.ofNullable(matcher.group(group));
    }
}
