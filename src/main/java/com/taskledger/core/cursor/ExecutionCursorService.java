package com.taskledger.core.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskledger.core.memory.KeyValueStore;
import com.taskledger.core.memory.LedgerNamespaces;
import com.taskledger.core.model.ExecutionCursor;
import com.taskledger.core.model.MemoryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads and writes the per-plan pointer to the next task to execute.
 * <p>
 * The cursor is stored under {@code executeProgress} in the plan's namespace of whichever
 * store the caller passes in. It never moves between batches by itself: the caller advances
 * batch progress and then calls {@link #reset}.
 */
@Service
public class ExecutionCursorService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCursorService.class);

    private final LedgerNamespaces namespaces;
    private final ObjectMapper objectMapper;

    public ExecutionCursorService(LedgerNamespaces namespaces, ObjectMapper objectMapper) {
        this.namespaces = namespaces;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the cursor for {@code batchIndex}. A missing cursor, or one written for a
     * different batch, is replaced by a fresh cursor at task 0 and persisted.
     */
    public ExecutionCursor load(KeyValueStore store, String planId, int batchIndex) {
        Optional<ExecutionCursor> stored = find(store, planId);
        if (stored.isPresent() && stored.get().batchIndex() == batchIndex) {
            return stored.get();
        }
        stored.ifPresent(stale -> log.info("Cursor of plan '{}' was for batch {}, resetting to batch {}",
                planId, stale.batchIndex(), batchIndex));
        return reset(store, planId, batchIndex);
    }

    /**
     * Moves to the next task and clears the in-flight test id.
     *
     * @throws IllegalStateException if the plan has no cursor
     */
    public ExecutionCursor advance(KeyValueStore store, String planId) {
        ExecutionCursor next = require(store, planId).advanced();
        write(store, next);
        log.debug("Cursor of plan '{}' advanced to task {} of batch {}", planId, next.taskIndex(), next.batchIndex());
        return next;
    }

    /**
     * @throws IllegalStateException if the plan has no cursor
     */
    public ExecutionCursor bindTestId(KeyValueStore store, String planId, String testId) {
        ExecutionCursor bound = require(store, planId).withTestId(testId);
        write(store, bound);
        return bound;
    }

    public ExecutionCursor reset(KeyValueStore store, String planId, int batchIndex) {
        ExecutionCursor fresh = ExecutionCursor.fresh(planId, batchIndex);
        write(store, fresh);
        return fresh;
    }

    public boolean exists(KeyValueStore store, String planId) {
        return store.get(namespaces.plans(planId), LedgerNamespaces.EXECUTE_PROGRESS_KEY).isPresent();
    }

    public Optional<ExecutionCursor> find(KeyValueStore store, String planId) {
        Optional<MemoryItem> item = store.get(namespaces.plans(planId), LedgerNamespaces.EXECUTE_PROGRESS_KEY);
        if (item.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(item.get().value(), ExecutionCursor.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable cursor for plan '{}', treating it as missing: {}", planId, e.getMessage());
            return Optional.empty();
        }
    }

    private ExecutionCursor require(KeyValueStore store, String planId) {
        return find(store, planId)
                .orElseThrow(() -> new IllegalStateException("No execution cursor for plan '" + planId + "'"));
    }

    private void write(KeyValueStore store, ExecutionCursor cursor) {
        store.put(namespaces.plans(cursor.planId()), LedgerNamespaces.EXECUTE_PROGRESS_KEY,
                objectMapper.valueToTree(cursor));
    }
}
