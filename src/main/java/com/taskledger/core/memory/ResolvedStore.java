package com.taskledger.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.MemoryItem;
import com.taskledger.core.model.Namespace;
import com.taskledger.core.model.PutOptions;

import java.util.List;
import java.util.Optional;

/**
 * Store chosen by {@link DualStoreResolver}. Reads hit only the authoritative store;
 * writes also go to the mirror when there is one.
 */
public final class ResolvedStore implements KeyValueStore {

    private final KeyValueStore authoritative;
    private final KeyValueStore mirror;

    ResolvedStore(KeyValueStore authoritative, KeyValueStore mirror) {
        this.authoritative = authoritative;
        this.mirror = mirror;
    }

    public KeyValueStore authoritative() {
        return authoritative;
    }

    public Optional<KeyValueStore> mirror() {
        return Optional.ofNullable(mirror);
    }

    @Override
    public void put(Namespace namespace, String key, JsonNode value, PutOptions options) {
        authoritative.put(namespace, key, value, options);
        if (mirror != null) {
            mirror.put(namespace, key, value, options);
        }
    }

    @Override
    public Optional<MemoryItem> get(Namespace namespace, String key) {
        return authoritative.get(namespace, key);
    }

    @Override
    public List<MemoryItem> list(Namespace namespace, String prefix, Integer limit, Integer offset) {
        return authoritative.list(namespace, prefix, limit, offset);
    }

    @Override
    public boolean delete(Namespace namespace, String key) {
        boolean deleted = authoritative.delete(namespace, key);
        if (mirror != null) {
            deleted |= mirror.delete(namespace, key);
        }
        return deleted;
    }

    @Override
    public int deleteExpired() {
        int deleted = authoritative.deleteExpired();
        if (mirror != null) {
            deleted += mirror.deleteExpired();
        }
        return deleted;
    }

    @Override
    public StoreDurability durability() {
        if (mirror != null) {
            return mirror.durability();
        }
        return authoritative.durability();
    }
}
