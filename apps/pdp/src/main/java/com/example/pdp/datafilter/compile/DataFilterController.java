package com.example.pdp.datafilter.compile;

import com.example.pdp.datafilter.expression.ResidualPolicy;
import com.example.pdp.enforcer.controller.EnforcerRequestReader;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class DataFilterController {

    private final DataFilterService dataFilterService;
    private final EnforcerRequestReader reader;

    @PostMapping("/filter_resources")
    public Mono<ResidualPolicy> filterResources(@RequestBody JsonNode body) {
        return Mono.fromCallable(() -> reader.read(body, FilterResourcesRequest.class))
                .flatMap(dataFilterService::filterResources);
    }
}
