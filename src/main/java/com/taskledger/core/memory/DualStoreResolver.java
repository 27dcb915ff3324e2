package com.taskledger.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides which key-value store a worker step reads from and writes to.
 * <p>
 * A caller-supplied store is authoritative unless it is ephemeral or the durable store
 * is forced by configuration. When the caller store wins, writes are mirrored to the
 * durable store so that other processes observe them.
 */
public class DualStoreResolver {

    private static final Logger log = LoggerFactory.getLogger(DualStoreResolver.class);

    private final KeyValueStore durableStore;
    private final boolean forceDurable;

    public DualStoreResolver(KeyValueStore durableStore, boolean forceDurable) {
        this.durableStore = Objects.requireNonNull(durableStore, "durableStore must not be null");
        this.forceDurable = forceDurable;
    }

    /**
     * @param callerStore store supplied by the runtime for this step, may be {@code null}
     */
    public ResolvedStore resolve(KeyValueStore callerStore) {
        if (callerStore == null) {
            return new ResolvedStore(durableStore, null);
        }
        if (callerStore instanceof ResolvedStore resolved) {
            return resolved;
        }
        if (callerStore == durableStore) {
            return new ResolvedStore(durableStore, null);
        }
        if (forceDurable) {
            log.debug("Durable store forced by configuration; ignoring caller store {}",
                    callerStore.getClass().getSimpleName());
            return new ResolvedStore(durableStore, null);
        }
        if (callerStore.durability() == StoreDurability.EPHEMERAL) {
            log.debug("Caller store {} is ephemeral; using the durable store",
                    callerStore.getClass().getSimpleName());
            return new ResolvedStore(durableStore, null);
        }
        return new ResolvedStore(callerStore, durableStore);
    }

    public KeyValueStore durableStore() {
        return durableStore;
    }

    public boolean isForceDurable() {
        return forceDurable;
    }
}
