package com.shardindex.router.error;

/**
 * The router is shutting down and no longer hands out workers.
 */
public class RouterShutdownException extends RouterException {
    public RouterShutdownException(String message) {
        super(message);
    }
}
