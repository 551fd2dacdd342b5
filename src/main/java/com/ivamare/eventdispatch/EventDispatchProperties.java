package com.ivamare.eventdispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Event Dispatch.
 *
 * <p>Example configuration:
 * <pre>
 * eventdispatch:
 *   enabled: true
 *   scan-annotations: true
 *   log-failures: true
 * </pre>
 */
@ConfigurationProperties(prefix = "eventdispatch")
public class EventDispatchProperties {

    /**
     * Enable/disable Event Dispatch auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Discover @EventHandler methods on beans as they are created.
     */
    private boolean scanAnnotations = true;

    /**
     * Log dispatches with failed handlers at WARN.
     */
    private boolean logFailures = true;

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isScanAnnotations() {
        return scanAnnotations;
    }

    public void setScanAnnotations(boolean scanAnnotations) {
        this.scanAnnotations = scanAnnotations;
    }

    public boolean isLogFailures() {
        return logFailures;
    }

    public void setLogFailures(boolean logFailures) {
        this.logFailures = logFailures;
    }
}
