package com.taskledger.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.MemoryItem;
import com.taskledger.core.model.Namespace;
import com.taskledger.core.model.PutOptions;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local {@link KeyValueStore}. Contents are lost when the JVM exits and are
 * not visible to other workers.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Slot(Namespace namespace, String key) {}

    private record Entry(MemoryItem item, long sequence) {}

    private final Map<Slot, Entry> items = new HashMap<>();
    private final Clock clock;
    private long sequence;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void put(Namespace namespace, String key, JsonNode value, PutOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        PutOptions opts = options != null ? options : PutOptions.none();
        Instant now = clock.instant();
        Instant expiresAt = opts.expiresIn() != null ? now.plus(opts.expiresIn()) : null;
        var item = new MemoryItem(namespace, key, value.deepCopy(), opts.metadata().deepCopy(), expiresAt, now);
        items.put(new Slot(namespace, key), new Entry(item, ++sequence));
    }

    @Override
    public synchronized Optional<MemoryItem> get(Namespace namespace, String key) {
        Entry entry = items.get(new Slot(namespace, key));
        if (entry == null || entry.item().isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(detached(entry.item()));
    }

    @Override
    public synchronized List<MemoryItem> list(Namespace namespace, String prefix, Integer limit, Integer offset) {
        Instant now = clock.instant();
        return items.values().stream()
                .filter(e -> e.item().namespace().equals(namespace))
                .filter(e -> !e.item().isExpiredAt(now))
                .filter(e -> prefix == null || e.item().key().startsWith(prefix))
                .sorted(Comparator.comparingLong(Entry::sequence).reversed())
                .skip(offset != null ? offset : 0)
                .limit(limit != null ? limit : Long.MAX_VALUE)
                .map(e -> detached(e.item()))
                .toList();
    }

    @Override
    public synchronized boolean delete(Namespace namespace, String key) {
        return items.remove(new Slot(namespace, key)) != null;
    }

    @Override
    public synchronized int deleteExpired() {
        Instant now = clock.instant();
        int before = items.size();
        items.values().removeIf(e -> e.item().isExpiredAt(now));
        return before - items.size();
    }

    @Override
    public StoreDurability durability() {
        return StoreDurability.EPHEMERAL;
    }

    private static MemoryItem detached(MemoryItem item) {
        return new MemoryItem(item.namespace(), item.key(), item.value().deepCopy(),
                item.metadata().deepCopy(), item.expiresAt(), item.updatedAt());
    }
}
