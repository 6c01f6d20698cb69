package com.example.pdp.enforcer.mapping;

import com.example.pdp.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Resolves an HTTP method and URL to the mapping rule that governs it.
 *
 * <p>Template rules match segment by segment, with {@code {name}} matching any single segment.
 * When the rule has a query string, every rule parameter must be present in the request and
 * literal values must be equal. Absolute rule URLs must also match the request's scheme and host.
 * Regex rules match the full request path.</p>
 *
 * <p>Among all matching rules the highest priority wins; ties keep catalog order.</p>
 */
@Slf4j
@Component
public class MappingRuleMatcher {

    private static final Comparator<MappingRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(MappingRule::effectivePriority).reversed();

    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    @NonNull
    public Optional<MappingRule> match(@NonNull String method, @NonNull String url, @NonNull List<MappingRule> rules) {
        UriComponents request = parse(url);

        return rules.stream()
                .filter(rule -> rule.httpMethod() != null && rule.httpMethod().equalsIgnoreCase(method))
                .filter(rule -> matches(rule, request))
                .sorted(BY_PRIORITY_DESC)
                .findFirst();
    }

    /**
     * Values bound by every {@code {name}} placeholder of the rule, from both path and query.
     * Regex rules bind nothing.
     */
    @NonNull
    public Map<String, String> extractAttributes(@NonNull MappingRule rule, @NonNull String url) {
        if (rule.urlType() == UrlType.REGEX) {
            return Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>(extractAttributesFromUrl(rule.url(), url));
        attributes.putAll(extractAttributesFromQueryParams(rule.url(), url));
        return attributes;
    }

    @NonNull
    public Map<String, String> extractAttributesFromUrl(@NonNull String ruleUrl, @NonNull String requestUrl) {
        String[] ruleParts = pathSegments(parse(ruleUrl).getPath());
        String[] requestParts = pathSegments(parse(requestUrl).getPath());
        if (ruleParts.length != requestParts.length) {
            return Map.of();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < ruleParts.length; i++) {
            if (isPlaceholder(ruleParts[i])) {
                attributes.put(placeholderName(ruleParts[i]), requestParts[i]);
            }
        }
        return attributes;
    }

    @NonNull
    public Map<String, String> extractAttributesFromQueryParams(@NonNull String ruleUrl, @NonNull String requestUrl) {
        UriComponents rule = parse(ruleUrl);
        UriComponents request = parse(requestUrl);
        if (rule.getQuery() == null || request.getQuery() == null) {
            return Map.of();
        }
        MultiValueMap<String, String> requestParams = request.getQueryParams();
        Map<String, String> attributes = new LinkedHashMap<>();
        rule.getQueryParams().forEach((key, values) -> {
            String ruleValue = firstValue(values);
            if (isPlaceholder(ruleValue) && requestParams.containsKey(key)) {
                attributes.put(placeholderName(ruleValue), firstValue(requestParams.get(key)));
            }
        });
        return attributes;
    }

    private boolean matches(MappingRule rule, UriComponents request) {
        if (rule.url() == null) {
            return false;
        }
        if (rule.urlType() == UrlType.REGEX) {
            return compile(rule.url())
                    .map(pattern -> pattern.matcher(nullToEmpty(request.getPath())).matches())
                    .orElse(false);
        }
        UriComponents ruleUrl = parse(rule.url());
        if (ruleUrl.getHost() != null) {
            if (!Objects.equals(lower(ruleUrl.getScheme()), lower(request.getScheme()))
                    || !Objects.equals(lower(ruleUrl.getHost()), lower(request.getHost()))) {
                return false;
            }
        }
        return comparePath(ruleUrl.getPath(), request.getPath())
                && compareQueryParams(ruleUrl, request);
    }

    private boolean comparePath(@Nullable String rulePath, @Nullable String requestPath) {
        String[] ruleParts = pathSegments(rulePath);
        String[] requestParts = pathSegments(requestPath);
        if (ruleParts.length != requestParts.length) {
            return false;
        }
        for (int i = 0; i < ruleParts.length; i++) {
            if (!isPlaceholder(ruleParts[i]) && !ruleParts[i].equals(requestParts[i])) {
                return false;
            }
        }
        return true;
    }

    private boolean compareQueryParams(UriComponents rule, UriComponents request) {
        if (rule.getQuery() == null) {
            // the request may carry more data than the rule asks for
            return true;
        }
        if (request.getQuery() == null) {
            return false;
        }
        MultiValueMap<String, String> requestParams = request.getQueryParams();
        for (Map.Entry<String, List<String>> entry : rule.getQueryParams().entrySet()) {
            if (!requestParams.containsKey(entry.getKey())) {
                return false;
            }
            String ruleValue = firstValue(entry.getValue());
            if (isPlaceholder(ruleValue)) {
                continue;
            }
            if (!ruleValue.equals(firstValue(requestParams.get(entry.getKey())))) {
                return false;
            }
        }
        return true;
    }

    private Optional<Pattern> compile(String regex) {
        return patterns.computeIfAbsent(regex, r -> {
            try {
                return Optional.of(Pattern.compile(r));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring mapping rule with invalid regex {}: {}",
                        StringSanitizer.forLog(r, 256), e.getDescription());
                return Optional.empty();
            }
        });
    }

    private static UriComponents parse(String url) {
        return UriComponentsBuilder.fromUriString(url).build();
    }

    private static String[] pathSegments(@Nullable String path) {
        return nullToEmpty(path).split("/", -1);
    }

    private static boolean isPlaceholder(@Nullable String value) {
        return value != null && value.length() >= 2 && value.startsWith("{") && value.endsWith("}");
    }

    private static String placeholderName(String placeholder) {
        return placeholder.substring(1, placeholder.length() - 1);
    }

    private static String firstValue(@Nullable List<String> values) {
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return "";
        }
        return values.get(0);
    }

    private static String nullToEmpty(@Nullable String value) {
        return value != null ? value : "";
    }

    @Nullable
    private static String lower(@Nullable String value) {
        return value != null ? value.toLowerCase() : null;
    }
}
