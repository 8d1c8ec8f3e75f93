package com.shardindex.core.codec;

/**
 * Malformed frame or payload, or a message that is not valid at this point of the conversation.
 */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
