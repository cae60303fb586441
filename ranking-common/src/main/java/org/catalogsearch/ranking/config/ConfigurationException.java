package org.catalogsearch.ranking.config;

/**
 * Invalid ranking configuration. Raised while the configuration is built at startup, never
 * while handling a request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
