package com.example.pdp.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param debugInfo include the full query and the engine debug payload in decision log lines
 */
@ConfigurationProperties(prefix = "pdp.decision-log")
public record DecisionLogProperties(
        @DefaultValue("true") boolean debugInfo
) {
}
