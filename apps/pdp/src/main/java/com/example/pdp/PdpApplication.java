package com.example.pdp;

import com.example.pdp.config.properties.DecisionCacheProperties;
import com.example.pdp.config.properties.DecisionLogProperties;
import com.example.pdp.config.properties.KongProperties;
import com.example.pdp.config.properties.MappingRulesProperties;
import com.example.pdp.config.properties.PdpSecurityProperties;
import com.example.pdp.config.properties.PolicyEngineProperties;
import com.example.pdp.config.properties.StatisticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PolicyEngineProperties.class,
        PdpSecurityProperties.class,
        DecisionCacheProperties.class,
        StatisticsProperties.class,
        DecisionLogProperties.class,
        MappingRulesProperties.class,
        KongProperties.class
})
public class PdpApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdpApplication.class, args);
    }

}
