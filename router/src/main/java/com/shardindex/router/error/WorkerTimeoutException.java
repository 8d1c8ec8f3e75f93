package com.shardindex.router.error;

public class WorkerTimeoutException extends RouterException {
    public WorkerTimeoutException(String message) {
        super(message);
    }
}
