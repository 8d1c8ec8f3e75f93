package com.shardindex.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.util.JsonUtils;

import java.io.IOException;

/**
 * Encodes one {@link RpcMessage} to a frame payload and back.
 */
public final class MessageCodec {
    private MessageCodec() {
    }

    public static byte[] encode(RpcMessage message) {
        try {
            return JsonUtils.mapper().writeValueAsBytes(message);
        } catch (IOException e) {
            throw new ProtocolException("failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    public static RpcMessage decode(byte[] payload) {
        try {
            RpcMessage message = JsonUtils.mapper().readValue(payload, RpcMessage.class);
            if (message == null) {
                throw new ProtocolException("empty message payload");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("failed to decode message (" + payload.length + " bytes): "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProtocolException("failed to decode message (" + payload.length + " bytes): "
                    + e.getMessage(), e);
        }
    }
}
