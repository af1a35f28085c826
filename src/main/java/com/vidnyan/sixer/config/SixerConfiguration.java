package com.vidnyan.sixer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.sixer.adapter.out.rewrite.BuiltInRules;
import com.vidnyan.sixer.domain.rule.RewriteEngine;
import com.vidnyan.sixer.domain.rule.RuleCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for sixer components.
 * Wires the domain objects, which carry no Spring annotations.
 */
@Slf4j
@Configuration
public class SixerConfiguration {

    /**
     * ObjectMapper for the JSON report.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Built-in rules, in engine order.
     */
    @Bean
    public RuleCatalog ruleCatalog() {
        RuleCatalog catalog = new RuleCatalog(BuiltInRules.all());
        log.debug("Registered {} rewrite rules:", catalog.names().size());
        catalog.rules().forEach(rule -> log.debug("  - {}: {}", rule.name(), rule.description()));
        return catalog;
    }

    @Bean
    public RewriteEngine rewriteEngine() {
        return new RewriteEngine();
    }
}
