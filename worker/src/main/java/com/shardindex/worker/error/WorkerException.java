package com.shardindex.worker.error;

/**
 * Base of all worker failures; the worker exits non-zero when one escapes.
 */
public class WorkerException extends RuntimeException {
    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
