package com.spel.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the expression parser.
 */
@ConfigurationProperties(prefix = "spel")
public class ExpressionProperties {

    /**
     * Whether the expression parser beans are contributed.
     */
    private boolean enabled = true;

    /**
     * Path to the parser configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:spel-parser.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
