package me.golemcore.agent.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Port for the keyed store backing the ledgers: hash records, sorted-set
 * indices, sets, lists and atomic write groups.
 *
 * <p>
 * Reads never observe a partially applied {@link #transaction(Consumer)}. Keys
 * are opaque strings; callers are responsible for namespacing.
 */
public interface KeyValueStorePort {

    // ==================== Hashes ====================

    /**
     * Returns all fields of a hash, or an empty map if the key does not exist.
     */
    Map<String, String> hgetAll(String key);

    String hget(String key, String field);

    void hset(String key, Map<String, String> fields);

    long hincrBy(String key, String field, long delta);

    double hincrByFloat(String key, String field, double delta);

    // ==================== Sorted sets ====================

    void zadd(String key, double score, String member);

    void zrem(String key, String member);

    Double zscore(String key, String member);

    long zcard(String key);

    /**
     * Members with {@code min <= score <= max}, ascending.
     */
    List<String> zrangeByScore(String key, double min, double max);

    /**
     * Members with {@code min <= score <= max}, descending, after skipping
     * {@code offset} and returning at most {@code count} (negative means all).
     */
    List<String> zrevrangeByScore(String key, double max, double min, int offset, int count);

    /**
     * Rank range over the descending order. Negative indices count from the end.
     */
    List<ScoredMember> zrevrange(String key, long start, long stop);

    // ==================== Sets ====================

    void sadd(String key, String... members);

    Set<String> smembers(String key);

    // ==================== Lists ====================

    long rpush(String key, String... values);

    /**
     * Inclusive index range; negative indices count from the tail.
     */
    List<String> lrange(String key, long start, long stop);

    long llen(String key);

    // ==================== Keys ====================

    boolean exists(String key);

    void delete(String key);

    /**
     * Applies every write queued on the transaction as one atomic group.
     */
    void transaction(Consumer<Transaction> writes);

    /**
     * Write operations that can be grouped into a single atomic unit.
     */
    interface Transaction {

        Transaction hset(String key, Map<String, String> fields);

        Transaction hincrBy(String key, String field, long delta);

        Transaction hincrByFloat(String key, String field, double delta);

        Transaction hdel(String key, String... fields);

        Transaction zadd(String key, double score, String member);

        Transaction zrem(String key, String member);

        Transaction sadd(String key, String... members);

        Transaction rpush(String key, String... values);

        Transaction delete(String key);
    }

    record ScoredMember(String member, double score) {
    }
}
