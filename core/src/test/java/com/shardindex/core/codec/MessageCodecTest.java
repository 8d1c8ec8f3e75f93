package com.shardindex.core.codec;

import com.shardindex.core.model.FileText;
import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.model.Symbol;
import com.shardindex.core.msg.RpcMessage;
import com.shardindex.core.msg.RpcMessages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageCodecTest {

    @Test
    @DisplayName("Messages carry a snake_case type discriminator")
    void testTypeDiscriminator() {
        String json = utf8(MessageCodec.encode(new RpcMessages.IndexShard(4,
                List.of(new FileText("/ws/A.java", "class A {}")))));

        assertTrue(json.contains("\"type\":\"index_shard\""), json);
        assertTrue(json.contains("\"revision\":4"), json);
    }

    @Test
    @DisplayName("Hello with a cached index decodes to an equal value")
    void testHelloWithCachedIndex() {
        ShardIndex cached = ShardIndex.builder()
                .shardId(1)
                .revision(7)
                .indexGeneration(3)
                .symbols(List.of(new Symbol("Foo", "/ws/Foo.java")))
                .build();
        RpcMessages.WorkerHello hello = new RpcMessages.WorkerHello(1, "secret", cached);

        RpcMessage decoded = MessageCodec.decode(MessageCodec.encode(hello));

        assertEquals(hello, decoded);
    }

    @Test
    @DisplayName("Absent token and cache are left out of the hello")
    void testHelloOmitsNulls() {
        String json = utf8(MessageCodec.encode(new RpcMessages.WorkerHello(0, null, null)));

        assertFalse(json.contains("authToken"), json);
        assertFalse(json.contains("cachedIndex"), json);
    }

    @Test
    @DisplayName("Field-less messages decode from their type alone")
    void testEmptyMessages() {
        assertInstanceOf(RpcMessages.Shutdown.class, MessageCodec.decode(utf8("{\"type\":\"shutdown\"}")));
        assertInstanceOf(RpcMessages.Ack.class, MessageCodec.decode(utf8("{\"type\":\"ack\"}")));
    }

    @Test
    @DisplayName("Unknown type and garbage are protocol errors")
    void testInvalidPayloads() {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(utf8("{\"type\":\"cancel\"}")));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(utf8("not json")));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(utf8("{\"revision\":1}")));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(new byte[0]));
    }

    @Test
    @DisplayName("A symbol without a name or path is rejected at decode time")
    void testIncompleteSymbolRejected() {
        String missingName = "{\"type\":\"shard_index\",\"index\":{\"shardId\":0,\"revision\":1,"
                + "\"indexGeneration\":1,\"symbols\":[{\"path\":\"/ws/X.java\"}]}}";
        String missingPath = "{\"type\":\"shard_index\",\"index\":{\"shardId\":0,\"revision\":1,"
                + "\"indexGeneration\":1,\"symbols\":[{\"name\":\"X\"}]}}";

        ProtocolException error = assertThrows(ProtocolException.class, () -> MessageCodec.decode(utf8(missingName)));
        assertTrue(error.getMessage().startsWith("failed to decode message"), error.getMessage());
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(utf8(missingPath)));
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
