package com.shardindex.router.error;

/**
 * Base of the router's failures.
 */
public class RouterException extends RuntimeException {
    public RouterException(String message) {
        super(message);
    }

    public RouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
