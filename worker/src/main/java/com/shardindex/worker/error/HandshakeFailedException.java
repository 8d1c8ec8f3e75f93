package com.shardindex.worker.error;

/**
 * The router refused the hello or answered with a hello the worker cannot accept.
 */
public class HandshakeFailedException extends WorkerException {
    public HandshakeFailedException(String message) {
        super(message);
    }
}
