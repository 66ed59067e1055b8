package com.spel.adapter.spring;

import com.spel.config.ConfigLoader;
import com.spel.config.ParserConfiguration;
import com.spel.expression.SpelExpressionParser;
import com.spel.variable.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the expression parser.
 */
@Configuration
@ConditionalOnProperty(prefix = "spel", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ExpressionProperties.class)
public class ExpressionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExpressionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ParserConfiguration parserConfiguration(ExpressionProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpelExpressionParser spelExpressionParser(ParserConfiguration configuration) {
        log.info("Creating SpelExpressionParser: maximum expression length {}",
                configuration.maximumExpressionLength());
        return new SpelExpressionParser(configuration);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReferenceResolver referenceResolver(BeanFactory beanFactory) {
        return new BeanFactoryReferenceResolver(beanFactory);
    }
}
