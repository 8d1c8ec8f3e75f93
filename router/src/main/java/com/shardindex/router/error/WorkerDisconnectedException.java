package com.shardindex.router.error;

public class WorkerDisconnectedException extends RouterException {
    public WorkerDisconnectedException(String message) {
        super(message);
    }

    public WorkerDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
