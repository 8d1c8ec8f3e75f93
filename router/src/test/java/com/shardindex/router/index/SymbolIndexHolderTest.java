package com.shardindex.router.index;

import com.shardindex.core.model.Symbol;
import com.shardindex.router.metrics.RouterMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolIndexHolderTest {

    private SimpleMeterRegistry registry;
    private SymbolIndexHolder holder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        holder = new SymbolIndexHolder(new RouterMetrics(registry));
    }

    @Test
    @DisplayName("A newer update replaces the index")
    void testNewerUpdateWins() {
        GlobalSymbolIndex first = GlobalSymbolIndex.of(List.of(new Symbol("One", "1.java")));
        GlobalSymbolIndex second = GlobalSymbolIndex.of(List.of(new Symbol("Two", "2.java")));

        assertTrue(holder.write(1, first));
        assertTrue(holder.write(2, second));

        assertSame(second, holder.current());
        assertEquals(2, holder.updateId());
    }

    @Test
    @DisplayName("An update older than the installed one is ignored")
    void testStaleUpdateIgnored() {
        GlobalSymbolIndex newer = GlobalSymbolIndex.of(List.of(new Symbol("New", "n.java")));
        GlobalSymbolIndex older = GlobalSymbolIndex.of(List.of(new Symbol("Old", "o.java")));

        holder.write(5, newer);

        assertFalse(holder.write(4, older));
        assertEquals(List.of(new Symbol("New", "n.java")), holder.search("", 10));
    }

    @Test
    @DisplayName("Search latency and symbol count are recorded")
    void testMetrics() {
        holder.write(1, GlobalSymbolIndex.of(List.of(new Symbol("A", "a.java"), new Symbol("B", "b.java"))));
        holder.search("A", 10);

        assertEquals(2.0, registry.get("shardindex.router.symbols").gauge().value());
        assertEquals(1, registry.get("shardindex.router.symbol.search.latency").timer().count());
    }
}
