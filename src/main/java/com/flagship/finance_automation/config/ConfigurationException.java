package com.flagship.finance_automation.config;

/**
 * Thrown when the finance configuration is inconsistent. Aborts startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
