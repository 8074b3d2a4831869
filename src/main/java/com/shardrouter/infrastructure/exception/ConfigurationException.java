package com.shardrouter.infrastructure.exception;

/**
 * Invalid or conflicting topology registration. Fatal during startup.
 */
public class ConfigurationException extends RoutingException {

    public ConfigurationException(String message) {
        super("ROUTING_CONFIGURATION_INVALID", message);
    }
}
