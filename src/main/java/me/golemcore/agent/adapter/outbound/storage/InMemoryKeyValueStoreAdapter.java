package me.golemcore.agent.adapter.outbound.storage;

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

import me.golemcore.agent.port.outbound.KeyValueStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Process-local implementation of {@link KeyValueStorePort}.
 *
 * <p>
 * Data lives in plain maps guarded by a single read/write lock, so every
 * operation and every {@link #transaction(Consumer)} group is atomic with
 * respect to readers. Sorted sets order by score, then member, the way Redis
 * does.
 *
 * <p>
 * Contents are lost on restart unless a subclass persists them through
 * {@link #afterWrite()}; see {@link FileSnapshotKeyValueStoreAdapter}. Active
 * when {@code agent.storage.type} is {@code memory} or unset.
 *
 * @see KeyValueStorePort
 */
@Component
@ConditionalOnProperty(prefix = "agent.storage", name = "type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryKeyValueStoreAdapter implements KeyValueStorePort {

    private static final Comparator<ScoredMember> ASCENDING = Comparator
            .comparingDouble(ScoredMember::score)
            .thenComparing(ScoredMember::member);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, List<String>> lists = new HashMap<>();

    // ==================== Hashes ====================

    @Override
    public Map<String, String> hgetAll(String key) {
        lock.readLock().lock();
        try {
            Map<String, String> hash = hashes.get(key);
            return hash == null ? Collections.emptyMap() : new LinkedHashMap<>(hash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String hget(String key, String field) {
        lock.readLock().lock();
        try {
            Map<String, String> hash = hashes.get(key);
            return hash == null ? null : hash.get(field);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        write(() -> doHset(key, fields));
    }

    @Override
    public long hincrBy(String key, String field, long delta) {
        long next;
        lock.writeLock().lock();
        try {
            next = doHincrBy(key, field, delta);
        } finally {
            lock.writeLock().unlock();
        }
        afterWrite();
        return next;
    }

    @Override
    public double hincrByFloat(String key, String field, double delta) {
        double next;
        lock.writeLock().lock();
        try {
            next = doHincrByFloat(key, field, delta);
        } finally {
            lock.writeLock().unlock();
        }
        afterWrite();
        return next;
    }

    // ==================== Sorted sets ====================

    @Override
    public void zadd(String key, double score, String member) {
        write(() -> doZadd(key, score, member));
    }

    @Override
    public void zrem(String key, String member) {
        write(() -> doZrem(key, member));
    }

    @Override
    public Double zscore(String key, String member) {
        lock.readLock().lock();
        try {
            Map<String, Double> zset = sortedSets.get(key);
            return zset == null ? null : zset.get(member);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long zcard(String key) {
        lock.readLock().lock();
        try {
            Map<String, Double> zset = sortedSets.get(key);
            return zset == null ? 0 : zset.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> zrangeByScore(String key, double min, double max) {
        List<String> result = new ArrayList<>();
        for (ScoredMember entry : sorted(key, false)) {
            if (entry.score() >= min && entry.score() <= max) {
                result.add(entry.member());
            }
        }
        return result;
    }

    @Override
    public List<String> zrevrangeByScore(String key, double max, double min, int offset, int count) {
        List<String> result = new ArrayList<>();
        int skipped = 0;
        for (ScoredMember entry : sorted(key, true)) {
            if (entry.score() > max || entry.score() < min) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            if (count >= 0 && result.size() >= count) {
                break;
            }
            result.add(entry.member());
        }
        return result;
    }

    @Override
    public List<ScoredMember> zrevrange(String key, long start, long stop) {
        List<ScoredMember> all = sorted(key, true);
        return slice(all, start, stop);
    }

    // ==================== Sets ====================

    @Override
    public void sadd(String key, String... members) {
        write(() -> doSadd(key, members));
    }

    @Override
    public Set<String> smembers(String key) {
        lock.readLock().lock();
        try {
            Set<String> set = sets.get(key);
            return set == null ? Collections.emptySet() : new LinkedHashSet<>(set);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Lists ====================

    @Override
    public long rpush(String key, String... values) {
        long length;
        lock.writeLock().lock();
        try {
            length = doRpush(key, values);
        } finally {
            lock.writeLock().unlock();
        }
        afterWrite();
        return length;
    }

    @Override
    public List<String> lrange(String key, long start, long stop) {
        lock.readLock().lock();
        try {
            List<String> list = lists.get(key);
            if (list == null) {
                return Collections.emptyList();
            }
            return slice(list, start, stop);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long llen(String key) {
        lock.readLock().lock();
        try {
            List<String> list = lists.get(key);
            return list == null ? 0 : list.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Keys ====================

    @Override
    public boolean exists(String key) {
        lock.readLock().lock();
        try {
            return hashes.containsKey(key) || sortedSets.containsKey(key)
                    || sets.containsKey(key) || lists.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(String key) {
        write(() -> doDelete(key));
    }

    @Override
    public void transaction(Consumer<Transaction> writes) {
        QueuedTransaction queued = new QueuedTransaction();
        writes.accept(queued);
        lock.writeLock().lock();
        try {
            for (Runnable op : queued.operations) {
                op.run();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.trace("[Store] Applied transaction with {} operations", queued.operations.size());
        afterWrite();
    }

    // ==================== Snapshots ====================

    /**
     * Called after every write and transaction, outside the lock. No-op here.
     */
    protected void afterWrite() {
    }

    /**
     * Deep copy of the whole store, consistent with respect to writers.
     */
    protected StoreSnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Map<String, String>> hashCopy = new HashMap<>();
            hashes.forEach((key, hash) -> hashCopy.put(key, new LinkedHashMap<>(hash)));
            Map<String, Map<String, Double>> zsetCopy = new HashMap<>();
            sortedSets.forEach((key, zset) -> zsetCopy.put(key, new HashMap<>(zset)));
            Map<String, Set<String>> setCopy = new HashMap<>();
            sets.forEach((key, set) -> setCopy.put(key, new LinkedHashSet<>(set)));
            Map<String, List<String>> listCopy = new HashMap<>();
            lists.forEach((key, list) -> listCopy.put(key, new ArrayList<>(list)));
            return new StoreSnapshot(hashCopy, zsetCopy, setCopy, listCopy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole store with {@code snapshot}.
     */
    protected void restore(StoreSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            hashes.clear();
            sortedSets.clear();
            sets.clear();
            lists.clear();
            if (snapshot.hashes() != null) {
                snapshot.hashes().forEach((key, hash) -> hashes.put(key, new LinkedHashMap<>(hash)));
            }
            if (snapshot.sortedSets() != null) {
                snapshot.sortedSets().forEach((key, zset) -> sortedSets.put(key, new HashMap<>(zset)));
            }
            if (snapshot.sets() != null) {
                snapshot.sets().forEach((key, set) -> sets.put(key, new LinkedHashSet<>(set)));
            }
            if (snapshot.lists() != null) {
                snapshot.lists().forEach((key, list) -> lists.put(key, new ArrayList<>(list)));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Internals (caller holds the write lock) ====================

    private void write(Runnable op) {
        lock.writeLock().lock();
        try {
            op.run();
        } finally {
            lock.writeLock().unlock();
        }
        afterWrite();
    }

    private void doHset(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(fields);
    }

    private void doHdel(String key, String... fields) {
        Map<String, String> hash = hashes.get(key);
        if (hash == null) {
            return;
        }
        for (String field : fields) {
            hash.remove(field);
        }
        if (hash.isEmpty()) {
            hashes.remove(key);
        }
    }

    private long doHincrBy(String key, String field, long delta) {
        Map<String, String> hash = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
        String current = hash.get(field);
        long value;
        try {
            value = current == null ? 0L : Long.parseLong(current);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Hash field is not an integer: " + key + "." + field, e);
        }
        long next = value + delta;
        hash.put(field, Long.toString(next));
        return next;
    }

    private double doHincrByFloat(String key, String field, double delta) {
        Map<String, String> hash = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
        String current = hash.get(field);
        double value;
        try {
            value = current == null ? 0d : Double.parseDouble(current);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Hash field is not a number: " + key + "." + field, e);
        }
        double next = value + delta;
        hash.put(field, formatDouble(next));
        return next;
    }

    private void doZadd(String key, double score, String member) {
        sortedSets.computeIfAbsent(key, k -> new HashMap<>()).put(member, score);
    }

    private void doZrem(String key, String member) {
        Map<String, Double> zset = sortedSets.get(key);
        if (zset == null) {
            return;
        }
        zset.remove(member);
        if (zset.isEmpty()) {
            sortedSets.remove(key);
        }
    }

    private void doSadd(String key, String... members) {
        Set<String> set = sets.computeIfAbsent(key, k -> new LinkedHashSet<>());
        Collections.addAll(set, members);
    }

    private long doRpush(String key, String... values) {
        List<String> list = lists.computeIfAbsent(key, k -> new ArrayList<>());
        Collections.addAll(list, values);
        return list.size();
    }

    private void doDelete(String key) {
        hashes.remove(key);
        sortedSets.remove(key);
        sets.remove(key);
        lists.remove(key);
    }

    private List<ScoredMember> sorted(String key, boolean descending) {
        lock.readLock().lock();
        try {
            Map<String, Double> zset = sortedSets.get(key);
            if (zset == null) {
                return Collections.emptyList();
            }
            List<ScoredMember> entries = new ArrayList<>(zset.size());
            zset.forEach((member, score) -> entries.add(new ScoredMember(member, score)));
            entries.sort(descending ? ASCENDING.reversed() : ASCENDING);
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static <T> List<T> slice(List<T> source, long start, long stop) {
        int size = source.size();
        long from = start < 0 ? Math.max(size + start, 0) : start;
        long to = stop < 0 ? size + stop : Math.min(stop, size - 1L);
        if (from > to || from >= size) {
            return Collections.emptyList();
        }
        return new ArrayList<>(source.subList((int) from, (int) to + 1));
    }

    private static String formatDouble(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Serializable copy of every key space of the store.
     */
    public record StoreSnapshot(Map<String, Map<String, String>> hashes,
            Map<String, Map<String, Double>> sortedSets,
            Map<String, Set<String>> sets,
            Map<String, List<String>> lists) {
    }

    private final class QueuedTransaction implements Transaction {

        private final List<Runnable> operations = new ArrayList<>();

        @Override
        public Transaction hset(String key, Map<String, String> fields) {
            Map<String, String> copy = new LinkedHashMap<>(fields);
            operations.add(() -> doHset(key, copy));
            return this;
        }

        @Override
        public Transaction hincrBy(String key, String field, long delta) {
            operations.add(() -> doHincrBy(key, field, delta));
            return this;
        }

        @Override
        public Transaction hincrByFloat(String key, String field, double delta) {
            operations.add(() -> doHincrByFloat(key, field, delta));
            return this;
        }

        @Override
        public Transaction hdel(String key, String... fields) {
            operations.add(() -> doHdel(key, fields));
            return this;
        }

        @Override
        public Transaction zadd(String key, double score, String member) {
            operations.add(() -> doZadd(key, score, member));
            return this;
        }

        @Override
        public Transaction zrem(String key, String member) {
            operations.add(() -> doZrem(key, member));
            return this;
        }

        @Override
        public Transaction sadd(String key, String... members) {
            operations.add(() -> doSadd(key, members));
            return this;
        }

        @Override
        public Transaction rpush(String key, String... values) {
            operations.add(() -> doRpush(key, values));
            return this;
        }

        @Override
        public Transaction delete(String key) {
            operations.add(() -> doDelete(key));
            return this;
        }
    }
}
