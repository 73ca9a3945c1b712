package com.wflint.adapter.spring;

import com.wflint.availability.ContextAvailabilityTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the expression front end.
 */
@ConfigurationProperties(prefix = "wflint.expression")
public class ExpressionLintProperties {

    /**
     * Whether the expression beans are registered.
     */
    private boolean enabled = true;

    /**
     * Path to the context availability YAML.
     * Supports classpath: prefix for classpath resources.
     */
    private String availabilityPath = ContextAvailabilityTable.DEFAULT_PATH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAvailabilityPath() {
        return availabilityPath;
    }

    public void setAvailabilityPath(String availabilityPath) {
        this.availabilityPath = availabilityPath;
    }
}
