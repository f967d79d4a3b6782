package com.spanql.service.core.autoconfigure;

import com.spanql.service.core.config.ClockConfig;
import com.spanql.service.core.config.SearchProperties;
import com.spanql.service.core.engine.TraceQLEngine;
import com.spanql.service.core.search.TraceSearchService;
import com.spanql.service.core.spi.TraceSource;
import com.spanql.service.core.storage.InMemoryCandidateIndex;
import com.spanql.service.core.storage.InMemoryTraceSource;
import com.spanql.service.core.tags.TagValuesService;
import com.spanql.service.core.telemetry.SearchTelemetryRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the search engine for Spring Boot applications. Applications supply their own {@link TraceSource}
 * bean; without one, an empty in-memory source and its candidate index are registered.
 */
@AutoConfiguration
@ComponentScan(
        basePackageClasses = {
            ClockConfig.class,
            TraceQLEngine.class,
            TraceSearchService.class,
            TagValuesService.class,
            SearchTelemetryRegistry.class
        })
public class SpanqlAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(TraceSource.class)
    static class InMemoryStoreConfiguration {

        @Bean
        public InMemoryTraceSource inMemoryTraceSource(SearchProperties properties) {
            return new InMemoryTraceSource(properties.getStore().getShardWidth());
        }

        @Bean
        @ConditionalOnMissingBean
        public InMemoryCandidateIndex inMemoryCandidateIndex(InMemoryTraceSource source) {
            return new InMemoryCandidateIndex(source);
        }
    }
}
