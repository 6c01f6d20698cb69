package com.example.pdp.enforcer.mapping;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of URL mapping rules, in catalog order.
 */
public interface MappingRuleCatalog {

    Mono<List<MappingRule>> rules();
}
