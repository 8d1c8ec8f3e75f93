package com.shardindex.router.error;

/**
 * Router configuration that cannot be started safely.
 */
public class ConfigException extends RouterException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
