package com.wflint.adapter.spring;

import com.wflint.availability.AvailabilityLoader;
import com.wflint.availability.ContextAvailabilityTable;
import com.wflint.availability.SpecialFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration exposing the context availability table and
 * the special function registry as beans.
 */
@Configuration
@ConditionalOnProperty(prefix = "wflint.expression", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ExpressionLintProperties.class)
public class ExpressionLintAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExpressionLintAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ContextAvailabilityTable contextAvailabilityTable(ExpressionLintProperties properties) {
        String path = properties.getAvailabilityPath();
        if (ContextAvailabilityTable.DEFAULT_PATH.equals(path)) {
            return ContextAvailabilityTable.defaultTable();
        }
        log.info("Using custom context availability: {}", path);
        return AvailabilityLoader.load(path);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpecialFunctionRegistry specialFunctionRegistry(ContextAvailabilityTable table) {
        return new SpecialFunctionRegistry(table);
    }
}
