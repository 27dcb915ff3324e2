package com.taskledger.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskledger.core.model.MemoryItem;
import com.taskledger.core.model.Namespace;
import com.taskledger.core.model.PutOptions;

import java.util.List;
import java.util.Optional;

/**
 * Namespaced JSON key-value store shared by cooperating workers.
 * <p>
 * {@code (namespace, key)} identifies an item; writes upsert and the last write wins.
 * Items past their expiry are invisible to reads and are physically removed by
 * {@link #deleteExpired()}.
 */
public interface KeyValueStore {

    void put(Namespace namespace, String key, JsonNode value, PutOptions options);

    default void put(Namespace namespace, String key, JsonNode value) {
        put(namespace, key, value, PutOptions.none());
    }

    /**
     * @return the item, or empty if it is absent or expired
     */
    Optional<MemoryItem> get(Namespace namespace, String key);

    /**
     * Lists non-expired items of a namespace, most recently updated first.
     *
     * @param prefix optional key prefix filter
     * @param limit  optional maximum number of items
     * @param offset optional number of items to skip
     */
    List<MemoryItem> list(Namespace namespace, String prefix, Integer limit, Integer offset);

    default List<MemoryItem> list(Namespace namespace) {
        return list(namespace, null, null, null);
    }

    /**
     * @return {@code true} if an item was removed
     */
    boolean delete(Namespace namespace, String key);

    /**
     * Physically removes every expired item.
     *
     * @return number of items removed
     */
    int deleteExpired();

    StoreDurability durability();
}
