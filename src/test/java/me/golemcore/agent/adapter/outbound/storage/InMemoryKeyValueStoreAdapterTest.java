package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.port.outbound.KeyValueStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKeyValueStoreAdapterTest {

    private InMemoryKeyValueStoreAdapter store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStoreAdapter();
    }

    @Test
    void shouldMergeHashFieldsAndIncrement() {
        store.hset("h", Map.of("a", "1"));
        store.hset("h", Map.of("b", "x"));

        assertEquals(Map.of("a", "1", "b", "x"), store.hgetAll("h"));
        assertEquals(6, store.hincrBy("h", "a", 5));
        assertEquals(1.5, store.hincrByFloat("h", "f", 1.5));
        assertEquals("1.5", store.hget("h", "f"));
        assertEquals(Map.of(), store.hgetAll("missing"));
    }

    @Test
    void shouldStoreWholeFloatsWithoutFraction() {
        store.hincrByFloat("h", "sum", 120.0);

        assertEquals("120", store.hget("h", "sum"));
    }

    @Test
    void shouldRejectIncrementOfNonNumericField() {
        store.hset("h", Map.of("a", "text"));

        assertThrows(IllegalStateException.class, () -> store.hincrBy("h", "a", 1));
    }

    @Test
    void shouldOrderSortedSetsByScoreThenMember() {
        store.zadd("z", 2, "b");
        store.zadd("z", 1, "c");
        store.zadd("z", 2, "a");

        assertEquals(List.of("c", "a", "b"), store.zrangeByScore("z", Double.NEGATIVE_INFINITY,
                Double.POSITIVE_INFINITY));
        assertEquals(List.of("b", "a"), store.zrevrangeByScore("z", 2, 2, 0, -1));
        assertEquals(List.of("a"), store.zrevrangeByScore("z", 10, 0, 1, 1));
        assertEquals(3, store.zcard("z"));
        assertEquals(1.0, store.zscore("z", "c"));
    }

    @Test
    void shouldReturnRankRangeWithScores() {
        store.zadd("z", 1, "x");
        store.zadd("z", 3, "y");
        store.zadd("z", 2, "w");

        List<KeyValueStorePort.ScoredMember> top = store.zrevrange("z", 0, 1);

        assertEquals(List.of(new KeyValueStorePort.ScoredMember("y", 3), new KeyValueStorePort.ScoredMember("w", 2)),
                top);
        assertEquals(3, store.zrevrange("z", 0, -1).size());
    }

    @Test
    void shouldRemoveEmptySortedSet() {
        store.zadd("z", 1, "x");
        store.zrem("z", "x");

        assertFalse(store.exists("z"));
        assertNull(store.zscore("z", "x"));
    }

    @Test
    void shouldSliceListsWithNegativeIndices() {
        store.rpush("l", "a", "b", "c", "d");

        assertEquals(List.of("c", "d"), store.lrange("l", -2, -1));
        assertEquals(List.of("a", "b", "c", "d"), store.lrange("l", 0, -1));
        assertEquals(List.of(), store.lrange("l", 5, 10));
        assertEquals(4, store.llen("l"));
    }

    @Test
    void shouldApplyTransactionWritesTogether() {
        store.hset("h", Map.of("keep", "1", "drop", "2"));

        store.transaction(tx -> tx
                .hset("h", Map.of("new", "3"))
                .hdel("h", "drop")
                .hincrBy("h", "count", 2)
                .zadd("z", 5, "m")
                .sadd("s", "x", "y")
                .rpush("l", "v"));

        assertEquals(Map.of("keep", "1", "new", "3", "count", "2"), store.hgetAll("h"));
        assertEquals(5.0, store.zscore("z", "m"));
        assertEquals(Set.of("x", "y"), store.smembers("s"));
        assertEquals(List.of("v"), store.lrange("l", 0, -1));
    }

    @Test
    void shouldDeleteEveryStructureUnderKey() {
        store.hset("k", Map.of("a", "1"));
        store.transaction(tx -> tx.delete("k"));

        assertFalse(store.exists("k"));
        store.rpush("k", "x");
        assertTrue(store.exists("k"));
        store.delete("k");
        assertFalse(store.exists("k"));
    }
}
