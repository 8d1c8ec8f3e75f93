package com.shardindex.router.error;

import lombok.Getter;

/**
 * A worker hello that was refused. The message is sent back to the worker verbatim.
 */
@Getter
public class HandshakeRejectedException extends RouterException {
    private final String reason;

    public HandshakeRejectedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }
}
