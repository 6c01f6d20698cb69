package com.example.pdp.enforcer.mapping;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Binds an HTTP method and URL shape to a policy resource type and action.
 *
 * @param url        path template such as {@code /files/{id}?owner={owner}}, an absolute URL, or a regex
 * @param httpMethod HTTP method, compared ignoring case
 * @param resource   resource type of the synthesized check
 * @param action     action of the synthesized check; the lowercased method when absent
 * @param priority   higher wins among matching rules; null counts as 0
 * @param urlType    how {@code url} is interpreted
 */
public record MappingRule(
        String url,
        @JsonProperty("http_method") @JsonAlias("httpMethod") String httpMethod,
        String resource,
        String action,
        Integer priority,
        @JsonProperty("url_type") @JsonAlias("urlType") UrlType urlType
) {
    public MappingRule {
        if (urlType == null) {
            urlType = UrlType.TEMPLATE;
        }
    }

    public static MappingRule template(String url, String httpMethod, String resource, String action, Integer priority) {
        return new MappingRule(url, httpMethod, resource, action, priority, UrlType.TEMPLATE);
    }

    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    public String resourceAction() {
        return action != null && !action.isBlank() ? action : httpMethod.toLowerCase();
    }
}
