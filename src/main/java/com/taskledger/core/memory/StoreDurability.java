package com.taskledger.core.memory;

/**
 * Whether a store survives process restarts and is visible to other processes.
 */
public enum StoreDurability {
    DURABLE,
    EPHEMERAL
}
